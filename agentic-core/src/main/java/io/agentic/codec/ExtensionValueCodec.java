/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.codec;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.agentic.json.AgenticJsonMapper;
import io.agentic.registry.ExtensionType;
import io.agentic.registry.ExtensionTypeRegistry;
import io.agentic.schema.CorruptPayloadException;
import io.agentic.schema.ExtensionEncodingException;
import io.agentic.schema.UnknownExtensionTypeException;
import io.agentic.schema.UnregisteredExtensionValueException;
import io.agentic.util.Assert;

/**
 * Converts the values of an {@code extra} map to and from typed envelopes of the form
 * {@code {"type": <typeId>, "value": <payload>}}.
 * <p>
 * Strings, booleans, the boxed numeric types, {@link BigInteger}, {@link BigDecimal},
 * lists and string-keyed maps have built-in type ids and need no registration. List
 * elements and map values are envelopes themselves, so registered types may be nested
 * inside collections. A type registered for one of the built-in Java types takes
 * precedence over the built-in encoding.
 */
public class ExtensionValueCodec {

	static final String TYPE_KEY = "type";

	static final String VALUE_KEY = "value";

	private final ExtensionTypeRegistry registry;

	private final AgenticJsonMapper jsonMapper;

	public ExtensionValueCodec(ExtensionTypeRegistry registry, AgenticJsonMapper jsonMapper) {
		Assert.notNull(registry, "registry must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.registry = registry;
		this.jsonMapper = jsonMapper;
	}

	/**
	 * Encodes every value of an extension map.
	 * @param extra the extension map, may be {@code null}
	 * @return a map of the same keys to envelopes, or {@code null} for a {@code null}
	 * input
	 * @throws UnregisteredExtensionValueException if a key is {@code null} or a value has
	 * no registered or built-in type id
	 * @throws ExtensionEncodingException if a registered type fails to encode its value
	 */
	public Map<String, Object> encodeExtra(Map<String, Object> extra) {
		if (extra == null) {
			return null;
		}
		Map<String, Object> encoded = new LinkedHashMap<>();
		extra.forEach((key, value) -> {
			if (key == null) {
				throw UnregisteredExtensionValueException.nullKey(value);
			}
			encoded.put(key, encodeValue(key, value));
		});
		return encoded;
	}

	/**
	 * Decodes an extension map read from the wire.
	 * @param extra the map of envelopes, may be {@code null}
	 * @return the map of decoded values, or {@code null} for a {@code null} input
	 * @throws UnknownExtensionTypeException if an envelope names an unregistered type id
	 * @throws CorruptPayloadException if an envelope is malformed
	 */
	public Map<String, Object> decodeExtra(Map<String, Object> extra) {
		if (extra == null) {
			return null;
		}
		Map<String, Object> decoded = new LinkedHashMap<>();
		extra.forEach((key, envelope) -> decoded.put(key, decodeValue(key, envelope)));
		return decoded;
	}

	Map<String, Object> encodeValue(String key, Object value) {
		if (value == null) {
			return envelope("null", null);
		}

		Optional<ExtensionType<?>> registered = this.registry.findByJavaType(value.getClass());
		if (registered.isPresent()) {
			return encodeRegistered(registered.get(), value);
		}

		if (value instanceof String) {
			return envelope("string", value);
		}
		else if (value instanceof Boolean) {
			return envelope("boolean", value);
		}
		else if (value instanceof Integer) {
			return envelope("int", value);
		}
		else if (value instanceof Long) {
			return envelope("long", value);
		}
		else if (value instanceof Short) {
			return envelope("short", value);
		}
		else if (value instanceof Byte) {
			return envelope("byte", value);
		}
		else if (value instanceof Float) {
			return envelope("float", value);
		}
		else if (value instanceof Double) {
			return envelope("double", value);
		}
		else if (value instanceof BigInteger bigInteger) {
			return envelope("big_integer", bigInteger.toString());
		}
		else if (value instanceof BigDecimal bigDecimal) {
			return envelope("big_decimal", bigDecimal.toString());
		}
		else if (value instanceof List<?> list) {
			List<Object> elements = new ArrayList<>(list.size());
			for (Object element : list) {
				elements.add(encodeValue(key, element));
			}
			return envelope("list", elements);
		}
		else if (value instanceof Map<?, ?> map) {
			Map<String, Object> entries = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				if (entry.getKey() == null) {
					throw UnregisteredExtensionValueException.nullKey(entry.getValue());
				}
				if (!(entry.getKey() instanceof String entryKey)) {
					throw new UnregisteredExtensionValueException(key, map.getClass());
				}
				entries.put(entryKey, encodeValue(key, entry.getValue()));
			}
			return envelope("map", entries);
		}

		throw new UnregisteredExtensionValueException(key, value.getClass());
	}

	@SuppressWarnings("unchecked")
	private <T> Map<String, Object> encodeRegistered(ExtensionType<T> type, Object value) {
		try {
			return envelope(type.id(), type.encode((T) value, this.jsonMapper));
		}
		catch (IOException | RuntimeException e) {
			throw new ExtensionEncodingException(type.id(), e);
		}
	}

	Object decodeValue(String key, Object envelope) {
		if (!(envelope instanceof Map<?, ?> map)) {
			throw new CorruptPayloadException("Extension value '" + key + "' is not a typed envelope");
		}
		if (!(map.get(TYPE_KEY) instanceof String typeId)) {
			throw new CorruptPayloadException("Extension value '" + key + "' has no type id");
		}
		Object payload = map.get(VALUE_KEY);

		return switch (typeId) {
			case "null" -> null;
			case "string" -> payloadAs(key, typeId, payload, String.class);
			case "boolean" -> payloadAs(key, typeId, payload, Boolean.class);
			case "int" -> payloadAs(key, typeId, payload, Number.class).intValue();
			case "long" -> payloadAs(key, typeId, payload, Number.class).longValue();
			case "short" -> payloadAs(key, typeId, payload, Number.class).shortValue();
			case "byte" -> payloadAs(key, typeId, payload, Number.class).byteValue();
			case "float" -> (payload instanceof String text) ? parseFloat(key, text)
					: payloadAs(key, typeId, payload, Number.class).floatValue();
			case "double" -> (payload instanceof String text) ? parseDouble(key, text)
					: payloadAs(key, typeId, payload, Number.class).doubleValue();
			case "big_integer" -> parseBigInteger(key, payloadAs(key, typeId, payload, String.class));
			case "big_decimal" -> parseBigDecimal(key, payloadAs(key, typeId, payload, String.class));
			case "list" -> {
				List<Object> elements = new ArrayList<>();
				for (Object element : payloadAs(key, typeId, payload, List.class)) {
					elements.add(decodeValue(key, element));
				}
				yield elements;
			}
			case "map" -> {
				Map<String, Object> entries = new LinkedHashMap<>();
				for (Object entry : payloadAs(key, typeId, payload, Map.class).entrySet()) {
					Map.Entry<?, ?> mapEntry = (Map.Entry<?, ?>) entry;
					entries.put(String.valueOf(mapEntry.getKey()), decodeValue(key, mapEntry.getValue()));
				}
				yield entries;
			}
			default -> decodeRegistered(key, this.registry.lookup(typeId), payload);
		};
	}

	private Object decodeRegistered(String key, ExtensionType<?> type, Object payload) {
		try {
			return type.decode(payload, this.jsonMapper);
		}
		catch (RuntimeException e) {
			throw new CorruptPayloadException(
					"Extension value '" + key + "' is not a valid payload for type '" + type.id() + "'", e);
		}
	}

	private static <T> T payloadAs(String key, String typeId, Object payload, Class<T> expected) {
		if (!expected.isInstance(payload)) {
			throw new CorruptPayloadException("Extension value '" + key + "' of type '" + typeId + "' has a "
					+ (payload == null ? "missing" : payload.getClass().getSimpleName()) + " payload");
		}
		return expected.cast(payload);
	}

	private static Float parseFloat(String key, String text) {
		try {
			return Float.valueOf(text);
		}
		catch (NumberFormatException e) {
			throw new CorruptPayloadException("Extension value '" + key + "' is not a float: " + text, e);
		}
	}

	private static Double parseDouble(String key, String text) {
		try {
			return Double.valueOf(text);
		}
		catch (NumberFormatException e) {
			throw new CorruptPayloadException("Extension value '" + key + "' is not a double: " + text, e);
		}
	}

	private static BigInteger parseBigInteger(String key, String text) {
		try {
			return new BigInteger(text);
		}
		catch (NumberFormatException e) {
			throw new CorruptPayloadException("Extension value '" + key + "' is not an integer: " + text, e);
		}
	}

	private static BigDecimal parseBigDecimal(String key, String text) {
		try {
			return new BigDecimal(text);
		}
		catch (NumberFormatException e) {
			throw new CorruptPayloadException("Extension value '" + key + "' is not a decimal: " + text, e);
		}
	}

	private static Map<String, Object> envelope(String typeId, Object payload) {
		Map<String, Object> envelope = new LinkedHashMap<>();
		envelope.put(TYPE_KEY, typeId);
		if (payload != null) {
			envelope.put(VALUE_KEY, payload);
		}
		return envelope;
	}

}
