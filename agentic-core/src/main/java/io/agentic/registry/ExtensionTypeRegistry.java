/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.registry;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.agentic.schema.RegistrationConflictException;
import io.agentic.schema.UnknownExtensionTypeException;
import io.agentic.util.Assert;

/**
 * Maps stable type ids to the {@link ExtensionType descriptors} used to encode and
 * decode values found in {@code extra} maps.
 * <p>
 * A registry is an explicit instance held by a codec, so codecs with different type sets
 * can coexist in one process. Registration is serialized by a lock and is expected to
 * happen during start-up, before any payload that uses the type is decoded. Lookups
 * read concurrent maps and never block.
 */
public class ExtensionTypeRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ExtensionTypeRegistry.class);

	/**
	 * Ids of the built-in encodings for primitives and collections. Registered types may
	 * not use them.
	 */
	public static final Set<String> RESERVED_TYPE_IDS = Set.of("null", "string", "boolean", "int", "long", "short",
			"byte", "float", "double", "big_integer", "big_decimal", "list", "map");

	private final Map<String, ExtensionType<?>> typesById = new ConcurrentHashMap<>();

	private final Map<Class<?>, ExtensionType<?>> typesByJavaType = new ConcurrentHashMap<>();

	private final Lock registrationLock = new ReentrantLock();

	/**
	 * Registers a Java type under a stable id, mapped by the codec's JSON mapper.
	 * @param typeId the stable type id
	 * @param javaType the Java type
	 * @return this registry
	 * @param <T> the Java type
	 * @throws RegistrationConflictException if the id or the Java type is already bound
	 * differently, or the id is reserved
	 */
	public <T> ExtensionTypeRegistry register(String typeId, Class<T> javaType) {
		return register(ExtensionType.of(typeId, javaType));
	}

	/**
	 * Registers a descriptor. Registering the same id for the same Java type again is a
	 * no-op.
	 * @param type the descriptor
	 * @return this registry
	 * @throws RegistrationConflictException if the id or the Java type is already bound
	 * differently, or the id is reserved
	 */
	public ExtensionTypeRegistry register(ExtensionType<?> type) {
		Assert.notNull(type, "type must not be null");
		Assert.hasText(type.id(), "type id must not be empty");
		Assert.notNull(type.javaType(), "java type must not be null");

		String typeId = type.id();
		if (RESERVED_TYPE_IDS.contains(typeId)) {
			throw new RegistrationConflictException(typeId, "Type id '" + typeId + "' is reserved");
		}

		this.registrationLock.lock();
		try {
			ExtensionType<?> existing = this.typesById.get(typeId);
			if (existing != null) {
				if (existing.javaType().equals(type.javaType())) {
					logger.debug("Extension type '{}' already registered for {}", typeId, type.javaType().getName());
					return this;
				}
				throw new RegistrationConflictException(typeId, "Type id '" + typeId + "' is already bound to "
						+ existing.javaType().getName() + ", cannot rebind to " + type.javaType().getName());
			}
			ExtensionType<?> sameJavaType = this.typesByJavaType.get(type.javaType());
			if (sameJavaType != null) {
				throw new RegistrationConflictException(typeId, type.javaType().getName()
						+ " is already registered as '" + sameJavaType.id() + "', cannot register as '" + typeId + "'");
			}
			this.typesByJavaType.put(type.javaType(), type);
			this.typesById.put(typeId, type);
			logger.debug("Registered extension type '{}' for {}", typeId, type.javaType().getName());
		}
		finally {
			this.registrationLock.unlock();
		}
		return this;
	}

	/**
	 * Returns the descriptor registered under an id.
	 * @param typeId the type id
	 * @return the descriptor
	 * @throws UnknownExtensionTypeException if nothing is registered under the id
	 */
	public ExtensionType<?> lookup(String typeId) {
		ExtensionType<?> type = (typeId != null) ? this.typesById.get(typeId) : null;
		if (type == null) {
			throw new UnknownExtensionTypeException(typeId);
		}
		return type;
	}

	/**
	 * Returns the descriptor registered for the Java type of a value. Constants of enums
	 * with constant-specific bodies resolve through their declaring enum.
	 * @param javaType the runtime class of the value
	 * @return the descriptor, or empty if the type is not registered
	 */
	public Optional<ExtensionType<?>> findByJavaType(Class<?> javaType) {
		if (javaType == null) {
			return Optional.empty();
		}
		ExtensionType<?> type = this.typesByJavaType.get(javaType);
		if (type == null && !javaType.isEnum() && Enum.class.isAssignableFrom(javaType)) {
			type = this.typesByJavaType.get(javaType.getSuperclass());
		}
		return Optional.ofNullable(type);
	}

	public boolean contains(String typeId) {
		return typeId != null && this.typesById.containsKey(typeId);
	}

	public Set<String> typeIds() {
		return Set.copyOf(this.typesById.keySet());
	}

	public int size() {
		return this.typesById.size();
	}

}
