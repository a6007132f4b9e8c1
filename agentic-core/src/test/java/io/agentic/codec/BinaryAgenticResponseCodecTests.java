/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.agentic.json.AgenticJsonMapper;
import io.agentic.json.jackson2.JacksonAgenticJsonMapperSupplier;
import io.agentic.registry.ExtensionType;
import io.agentic.registry.ExtensionTypeRegistry;
import io.agentic.schema.AgenticSchema.AgenticResponse;
import io.agentic.schema.AgenticSchema.ContentBlockMcpListTools;
import io.agentic.schema.AgenticSchema.ContentBlockMcpToolApprovalRequest;
import io.agentic.schema.AgenticSchema.ContentBlockMcpToolApprovalResponse;
import io.agentic.schema.AgenticSchema.ContentBlockMessage;
import io.agentic.schema.AgenticSchema.ContentBlockReasoning;
import io.agentic.schema.AgenticSchema.ContentBlockToolCall;
import io.agentic.schema.AgenticSchema.ContentBlockToolCallOutput;
import io.agentic.schema.AgenticSchema.ContentBlockType;
import io.agentic.schema.AgenticSchema.FinishReason;
import io.agentic.schema.AgenticSchema.FinishStatus;
import io.agentic.schema.AgenticSchema.ImageDetail;
import io.agentic.schema.AgenticSchema.InputAudio;
import io.agentic.schema.AgenticSchema.InputFile;
import io.agentic.schema.AgenticSchema.InputImage;
import io.agentic.schema.AgenticSchema.InputText;
import io.agentic.schema.AgenticSchema.InputTokensDetails;
import io.agentic.schema.AgenticSchema.InputVideo;
import io.agentic.schema.AgenticSchema.McpListToolsItem;
import io.agentic.schema.AgenticSchema.McpToolCallStatus;
import io.agentic.schema.AgenticSchema.OutputAudio;
import io.agentic.schema.AgenticSchema.OutputImage;
import io.agentic.schema.AgenticSchema.OutputPart;
import io.agentic.schema.AgenticSchema.OutputText;
import io.agentic.schema.AgenticSchema.OutputTokensDetails;
import io.agentic.schema.AgenticSchema.OutputVideo;
import io.agentic.schema.AgenticSchema.ReasoningSummary;
import io.agentic.schema.AgenticSchema.Role;
import io.agentic.schema.AgenticSchema.TokenUsageMeta;
import io.agentic.schema.AgenticSchema.ToolCallOutputMcp;
import io.agentic.schema.AgenticSchema.ToolCallOutputType;
import io.agentic.schema.AgenticSchema.ToolCallType;
import io.agentic.schema.AgenticSchemaException;
import io.agentic.schema.CorruptPayloadException;
import io.agentic.schema.ErrorKind;
import io.agentic.schema.ExtensionEncodingException;
import io.agentic.schema.UnknownExtensionTypeException;
import io.agentic.schema.UnregisteredExtensionValueException;
import io.agentic.schema.UnsupportedVersionException;
import io.agentic.schema.VariantMismatchException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BinaryAgenticResponseCodecTests {

	// Extension types must be public for the JPMS-compatible mapper to access them
	public record GeoPoint(double lat, double lon) {
	}

	public record Citation(String source, int page) {
	}

	public enum Priority {

		LOW, HIGH, URGENT {
			@Override
			public String toString() {
				return "urgent!";
			}
		}

	}

	private AgenticJsonMapper jsonMapper;

	private ExtensionTypeRegistry registry;

	private BinaryAgenticResponseCodec codec;

	@BeforeEach
	void setUp() {
		jsonMapper = new JacksonAgenticJsonMapperSupplier().get();
		registry = new ExtensionTypeRegistry().register("geo_point", GeoPoint.class)
			.register("citation", Citation.class)
			.register("priority", Priority.class);
		codec = BinaryAgenticResponseCodec.builder().jsonMapper(jsonMapper).registry(registry).build();
	}

	@Test
	@DisplayName("Every block type round-trips with registered extension values")
	void roundTripAllBlockTypes() {
		AgenticResponse response = fullResponse();

		byte[] bytes = codec.encode(response);
		AgenticResponse decoded = codec.decode(bytes);

		assertThat(decoded).isEqualTo(response);
		assertThat(decoded.blocks()).extracting(block -> block.type())
			.containsExactly(ContentBlockType.MESSAGE, ContentBlockType.MESSAGE, ContentBlockType.MESSAGE,
					ContentBlockType.REASONING, ContentBlockType.TOOL_CALL, ContentBlockType.TOOL_CALL_OUTPUT,
					ContentBlockType.TOOL_CALL_OUTPUT, ContentBlockType.MCP_LIST_TOOLS,
					ContentBlockType.MCP_TOOL_APPROVAL_REQUEST, ContentBlockType.MCP_TOOL_APPROVAL_RESPONSE);

		ContentBlockMessage assistant = (ContentBlockMessage) decoded.blocks().get(2);
		assertThat(assistant.extra().get("location")).isInstanceOf(GeoPoint.class);
		assertThat(assistant.extra().get("priority")).isSameAs(Priority.URGENT);
		assertThat((List<?>) assistant.extra().get("citations")).first().isInstanceOf(Citation.class);
	}

	@Test
	@DisplayName("Encoding the same response twice yields identical bytes")
	void encodingIsDeterministic() {
		assertThat(codec.encode(fullResponse())).isEqualTo(codec.encode(fullResponse()));
	}

	@Test
	@DisplayName("Built-in extras round-trip with an empty registry and keep their Java types")
	void primitiveExtrasRoundTripWithEmptyRegistry() {
		Map<String, Object> nested = new LinkedHashMap<>();
		nested.put("depth", 2);
		nested.put("tags", List.of("a", "b"));
		nested.put("missing", null);

		Map<String, Object> extra = new LinkedHashMap<>();
		extra.put("int", 7);
		extra.put("long", 7L);
		extra.put("bigLong", Long.MAX_VALUE);
		extra.put("short", (short) 3);
		extra.put("byte", (byte) -1);
		extra.put("float", 1.5f);
		extra.put("double", 0.1d);
		extra.put("nan", Double.NaN);
		extra.put("bool", true);
		extra.put("text", "hello");
		extra.put("bigInteger", new BigInteger("123456789012345678901234567890"));
		extra.put("bigDecimal", new BigDecimal("1.10"));
		extra.put("list", List.of(1, 2L, "three"));
		extra.put("map", nested);
		extra.put("null", null);

		AgenticResponse response = AgenticResponse.builder()
			.id("r-primitives")
			.block(ContentBlockMessage.ofText(Role.USER, "hi", extra))
			.build();

		BinaryAgenticResponseCodec plain = BinaryAgenticResponseCodec.builder().build();
		AgenticResponse decoded = plain.decode(plain.encode(response));

		Map<String, Object> decodedExtra = ((ContentBlockMessage) decoded.blocks().get(0)).extra();
		assertThat(decodedExtra).isEqualTo(extra);
		assertThat(decodedExtra.get("int")).isInstanceOf(Integer.class);
		assertThat(decodedExtra.get("long")).isInstanceOf(Long.class);
		assertThat(decodedExtra.get("short")).isInstanceOf(Short.class);
		assertThat(decodedExtra.get("byte")).isInstanceOf(Byte.class);
		assertThat(decodedExtra.get("float")).isInstanceOf(Float.class);
		@SuppressWarnings("unchecked")
		List<Object> decodedList = (List<Object>) decodedExtra.get("list");
		assertThat(decodedList).containsExactly(1, 2L, "three");
		assertThat(decodedExtra).containsKey("null");
		assertThat(decodedExtra.keySet()).containsExactlyElementsOf(extra.keySet());
	}

	@Test
	void unregisteredExtensionValueFailsOnEncode() {
		AgenticResponse response = AgenticResponse.builder()
			.id("r1")
			.block(ContentBlockMessage.ofText(Role.USER, "hi", Map.of("point", new GeoPoint(1, 2))))
			.build();

		BinaryAgenticResponseCodec plain = BinaryAgenticResponseCodec.builder().jsonMapper(jsonMapper).build();

		assertThatThrownBy(() -> plain.encode(response)).isInstanceOf(UnregisteredExtensionValueException.class)
			.hasMessageContaining("point")
			.satisfies(e -> assertThat(((UnregisteredExtensionValueException) e).getValueType())
				.isEqualTo(GeoPoint.class));
	}

	@Test
	void nonStringMapKeysAreRejectedOnEncode() {
		AgenticResponse response = AgenticResponse.builder()
			.id("r1")
			.block(ContentBlockMessage.ofText(Role.USER, "hi", Map.of("lookup", Map.of(1, "one"))))
			.build();

		assertThatThrownBy(() -> codec.encode(response)).isInstanceOf(UnregisteredExtensionValueException.class);
	}

	@Test
	void nullExtraKeyIsRejectedOnEncode() {
		Map<String, Object> extra = new LinkedHashMap<>();
		extra.put(null, "orphan");
		AgenticResponse response = AgenticResponse.builder()
			.id("r1")
			.block(ContentBlockMessage.ofText(Role.USER, "hi", extra))
			.build();

		assertThatThrownBy(() -> codec.encode(response)).isInstanceOf(UnregisteredExtensionValueException.class)
			.hasMessageContaining("null key")
			.satisfies(e -> assertThat(((AgenticSchemaException) e).getErrorKind())
				.isEqualTo(ErrorKind.UNREGISTERED_EXTENSION_VALUE));
	}

	@Test
	void nullKeyInNestedExtraMapIsRejectedOnEncode() {
		Map<String, Object> nested = new LinkedHashMap<>();
		nested.put(null, 1);
		AgenticResponse response = AgenticResponse.builder()
			.id("r1")
			.block(ContentBlockMessage.ofText(Role.USER, "hi", Map.of("nested", nested)))
			.build();

		assertThatThrownBy(() -> codec.encode(response)).isInstanceOf(UnregisteredExtensionValueException.class)
			.hasMessageContaining("null key");
	}

	@Test
	@DisplayName("Tool input schemas keep the Java types of their values")
	void toolInputSchemaKeepsValueTypes() {
		Map<String, Object> inputSchema = new LinkedHashMap<>();
		inputSchema.put("type", "string");
		inputSchema.put("maxLength", 10L);
		inputSchema.put("minimum", new BigDecimal("1.50"));
		inputSchema.put("enum", List.of("a", "b"));
		AgenticResponse response = AgenticResponse.builder()
			.id("r-schema")
			.block(new ContentBlockMcpListTools("docs",
					List.of(new McpListToolsItem("search", "Full-text search", inputSchema)), null))
			.build();

		AgenticResponse decoded = codec.decode(codec.encode(response));

		assertThat(decoded).isEqualTo(response);
		Map<String, Object> decodedSchema = ((ContentBlockMcpListTools) decoded.blocks().get(0)).tools()
			.get(0)
			.inputSchema();
		assertThat(decodedSchema.get("maxLength")).isInstanceOf(Long.class);
		assertThat(decodedSchema.get("minimum")).isEqualTo(new BigDecimal("1.50"));
	}

	@Test
	void toolWithoutInputSchemaRoundTrips() {
		AgenticResponse response = AgenticResponse.builder()
			.id("r-schema")
			.block(new ContentBlockMcpListTools("docs", List.of(new McpListToolsItem("ping", null, null)),
					"partial listing"))
			.build();

		assertThat(codec.decode(codec.encode(response))).isEqualTo(response);
	}

	@Test
	@DisplayName("Decoding with a registry that lacks a type id fails")
	void unknownExtensionTypeOnDecode() {
		byte[] bytes = codec.encode(fullResponse());

		BinaryAgenticResponseCodec fresh = BinaryAgenticResponseCodec.builder().jsonMapper(jsonMapper).build();

		assertThatThrownBy(() -> fresh.decode(bytes)).isInstanceOf(UnknownExtensionTypeException.class)
			.satisfies(e -> assertThat(((UnknownExtensionTypeException) e).getErrorKind())
				.isEqualTo(ErrorKind.UNKNOWN_EXTENSION_TYPE));
	}

	@Test
	void registeredTypeTakesPrecedenceOverBuiltIn() {
		ExtensionTypeRegistry upperCase = new ExtensionTypeRegistry().register(new ExtensionType<String>() {

			@Override
			public String id() {
				return "upper";
			}

			@Override
			public Class<String> javaType() {
				return String.class;
			}

			@Override
			public Object encode(String value, AgenticJsonMapper mapper) {
				return value.toUpperCase();
			}

			@Override
			public String decode(Object payload, AgenticJsonMapper mapper) {
				return ((String) payload).toLowerCase();
			}
		});
		BinaryAgenticResponseCodec upperCodec = BinaryAgenticResponseCodec.builder()
			.jsonMapper(jsonMapper)
			.registry(upperCase)
			.build();

		byte[] bytes = upperCodec.encode(AgenticResponse.builder()
			.id("r1")
			.block(ContentBlockMessage.ofText(Role.USER, "hi", Map.of("note", "quiet")))
			.build());

		assertThat(new String(bytes, StandardCharsets.UTF_8)).contains("\"upper\"").contains("QUIET");
		ContentBlockMessage decoded = (ContentBlockMessage) upperCodec.decode(bytes).blocks().get(0);
		assertThat(decoded.extra()).containsEntry("note", "quiet");
	}

	@Test
	void failingDescriptorRaisesExtensionEncodingError() {
		ExtensionTypeRegistry failing = new ExtensionTypeRegistry().register(new ExtensionType<Citation>() {

			@Override
			public String id() {
				return "citation";
			}

			@Override
			public Class<Citation> javaType() {
				return Citation.class;
			}

			@Override
			public Object encode(Citation value, AgenticJsonMapper mapper) {
				throw new IllegalStateException("no pages");
			}

			@Override
			public Citation decode(Object payload, AgenticJsonMapper mapper) {
				return null;
			}
		});
		BinaryAgenticResponseCodec failingCodec = BinaryAgenticResponseCodec.builder()
			.jsonMapper(jsonMapper)
			.registry(failing)
			.build();
		AgenticResponse response = AgenticResponse.builder()
			.id("r1")
			.block(ContentBlockMessage.ofText(Role.USER, "hi", Map.of("cite", new Citation("doc", 1))))
			.build();

		assertThatThrownBy(() -> failingCodec.encode(response)).isInstanceOf(ExtensionEncodingException.class)
			.hasRootCauseMessage("no pages")
			.satisfies(e -> assertThat(((AgenticSchemaException) e).getErrorKind())
				.isEqualTo(ErrorKind.EXTENSION_ENCODING));
	}

	@Test
	void invalidResponseIsRejectedOnEncode() {
		AgenticResponse response = new AgenticResponse("r1", null, null,
				List.of(new ContentBlockToolCallOutput(null, ToolCallOutputType.CUSTOM, "c1", "t", null, null)));

		assertThatThrownBy(() -> codec.encode(response)).isInstanceOf(VariantMismatchException.class);
	}

	@Test
	@DisplayName("Every proper prefix of an encoding fails as a corrupt payload")
	void truncationAtEveryOffsetFails() {
		byte[] bytes = codec.encode(fullResponse());

		for (int length = 0; length < bytes.length; length++) {
			byte[] truncated = Arrays.copyOf(bytes, length);
			assertThatThrownBy(() -> codec.decode(truncated)).as("prefix of %d bytes", length)
				.isInstanceOf(CorruptPayloadException.class);
		}
	}

	@Test
	void trailingBytesAreRejected() {
		byte[] bytes = codec.encode(fullResponse());

		assertThatThrownBy(() -> codec.decode(Arrays.copyOf(bytes, bytes.length + 1)))
			.isInstanceOf(CorruptPayloadException.class);
	}

	@Test
	void unsupportedVersionIsRejected() {
		byte[] bytes = codec.encode(fullResponse());
		bytes[BinaryFrame.MAGIC.length] = 2;

		assertThatThrownBy(() -> codec.decode(bytes)).isInstanceOf(UnsupportedVersionException.class)
			.satisfies(e -> {
				UnsupportedVersionException unsupported = (UnsupportedVersionException) e;
				assertThat(unsupported.getVersion()).isEqualTo(2);
				assertThat(unsupported.getErrorKind()).isEqualTo(ErrorKind.UNSUPPORTED_VERSION);
			});
	}

	@Test
	void missingFormatMarkerIsRejected() {
		byte[] bytes = codec.encode(fullResponse());
		bytes[0] = 'X';

		assertThatThrownBy(() -> codec.decode(bytes)).isInstanceOf(CorruptPayloadException.class)
			.hasMessageContaining("marker");
	}

	@Test
	void oversizedBodyIsRejected() {
		byte[] bytes = codec.encode(fullResponse());
		BinaryAgenticResponseCodec small = BinaryAgenticResponseCodec.builder()
			.jsonMapper(jsonMapper)
			.registry(registry)
			.maxPayloadSize(16)
			.build();

		assertThat(small.getMaxPayloadSize()).isEqualTo(16);
		assertThatThrownBy(() -> small.decode(bytes)).isInstanceOf(CorruptPayloadException.class)
			.hasMessageContaining("body length");
	}

	@Test
	void defaultMaxPayloadSize() {
		assertThat(BinaryAgenticResponseCodec.builder().build().getMaxPayloadSize())
			.isEqualTo(Integer.getInteger(BinaryAgenticResponseCodec.MAX_PAYLOAD_SIZE_PROPERTY,
					BinaryAgenticResponseCodec.DEFAULT_MAX_PAYLOAD_SIZE));
	}

	@Test
	@DisplayName("Assistant output and a tool call survive a round trip; a flipped byte does not")
	void assistantMessageWithToolCallScenario() {
		AgenticResponse response = AgenticResponse.builder()
			.id("resp-1")
			.block(ContentBlockMessage.ofAssistantOutput(
					List.of(new OutputText("Hello"), OutputImage.ofUrl("https://example.com/cat.png", "image/png"))))
			.block(ContentBlockToolCall.custom("call-1", "lookup", "{\"q\":\"x\"}"))
			.build();

		byte[] bytes = codec.encode(response);
		AgenticResponse decoded = codec.decode(bytes);

		assertThat(decoded).isEqualTo(response);
		ContentBlockMessage message = (ContentBlockMessage) decoded.blocks().get(0);
		assertThat(message.assistantGenMultiContent()).containsExactly(new OutputText("Hello"),
				OutputImage.ofUrl("https://example.com/cat.png", "image/png"));
		ContentBlockToolCall toolCall = (ContentBlockToolCall) decoded.blocks().get(1);
		assertThat(toolCall.name()).isEqualTo("lookup");
		assertThat(toolCall.arguments()).isEqualTo("{\"q\":\"x\"}");

		int argumentsOffset = new String(bytes, StandardCharsets.ISO_8859_1).indexOf("\\\"q\\\"");
		assertThat(argumentsOffset).isPositive();
		byte[] corrupted = bytes.clone();
		corrupted[argumentsOffset + 2] = 'z';

		assertThatThrownBy(() -> codec.decode(corrupted)).isInstanceOf(CorruptPayloadException.class)
			.hasMessageContaining("checksum");
	}

	@Test
	@DisplayName("Unknown fields written by a newer producer are skipped")
	void unknownFieldsAreIgnored() {
		String body = """
				{
					"id": "r-future",
					"servedBy": {"region": "eu"},
					"blocks": [
						{"type": "message", "role": "assistant", "inputText": "hi", "sentiment": "positive"},
						{"type": "tool_call", "callType": "custom_tool_call", "id": "c1", "name": "lookup",
						 "arguments": "{}", "retries": 2}
					]
				}
				""";

		AgenticResponse decoded = codec.decode(frame(body));

		assertThat(decoded.id()).isEqualTo("r-future");
		assertThat(decoded.blocks()).containsExactly(
				new ContentBlockMessage(null, Role.ASSISTANT, "hi", null, null, null),
				ContentBlockToolCall.custom("c1", "lookup", "{}"));
	}

	@Test
	void unknownBlockTypeIsCorrupt() {
		String body = """
				{"id": "r1", "blocks": [{"type": "hologram", "frames": 3}]}
				""";

		assertThatThrownBy(() -> codec.decode(frame(body))).isInstanceOf(CorruptPayloadException.class);
	}

	@Test
	void malformedEnvelopesAreCorrupt() {
		String rawValue = """
				{"id": "r1", "blocks": [{"type": "message", "role": "user", "inputText": "hi",
					"extra": {"k": "raw"}}]}
				""";
		String wrongPayload = """
				{"id": "r1", "blocks": [{"type": "message", "role": "user", "inputText": "hi",
					"extra": {"k": {"type": "int", "value": "seven"}}}]}
				""";
		String missingType = """
				{"id": "r1", "blocks": [{"type": "message", "role": "user", "inputText": "hi",
					"extra": {"k": {"value": 1}}}]}
				""";
		String badRegisteredPayload = """
				{"id": "r1", "blocks": [{"type": "message", "role": "user", "inputText": "hi",
					"extra": {"k": {"type": "priority", "value": "MEDIUM"}}}]}
				""";

		assertThatThrownBy(() -> codec.decode(frame(rawValue))).isInstanceOf(CorruptPayloadException.class);
		assertThatThrownBy(() -> codec.decode(frame(wrongPayload))).isInstanceOf(CorruptPayloadException.class);
		assertThatThrownBy(() -> codec.decode(frame(missingType))).isInstanceOf(CorruptPayloadException.class);
		assertThatThrownBy(() -> codec.decode(frame(badRegisteredPayload)))
			.isInstanceOf(CorruptPayloadException.class)
			.hasMessageContaining("priority");
	}

	@Test
	void decodedInvariantViolationIsRejected() {
		String body = """
				{"id": "r1", "blocks": [{"type": "tool_call_output", "outputType": "mcp_tool_call_output",
					"toolCallId": "c1", "customTool": {"content": "x"}, "mcpTool": {"content": "y"}}]}
				""";

		assertThatThrownBy(() -> codec.decode(frame(body))).isInstanceOf(VariantMismatchException.class);
	}

	@Test
	void negativeTokenCountIsCorrupt() {
		String body = """
				{"id": "r1", "usage": {"inputTokens": -1, "outputTokens": 0, "totalTokens": 0}}
				""";

		assertThatThrownBy(() -> codec.decode(frame(body))).isInstanceOf(CorruptPayloadException.class);
	}

	private static byte[] frame(String json) {
		return BinaryFrame.wrap(BinaryAgenticResponseCodec.FORMAT_VERSION, json.getBytes(StandardCharsets.UTF_8));
	}

	private static AgenticResponse fullResponse() {
		Map<String, Object> assistantExtra = new LinkedHashMap<>();
		assistantExtra.put("location", new GeoPoint(48.85, 2.35));
		assistantExtra.put("priority", Priority.URGENT);
		assistantExtra.put("citations", List.of(new Citation("rfc2397", 2), new Citation("rfc9110", 14)));
		assistantExtra.put("provider", Map.of("messageId", "msg_1", "latencyMs", 412L));

		List<OutputPart> output = List.of(new OutputText("Here you go", Map.of("logprob", -0.25d)),
				new OutputImage(null, "iVBORw0KGgo=", "image/png", Map.of("seed", 42)),
				new OutputAudio("https://example.com/a.wav", null, "audio/wav", null),
				new OutputVideo("https://example.com/v.mp4", null, "video/mp4", null));

		// @formatter:off
		return AgenticResponse.builder()
			.id("resp-full")
			.finishReason(new FinishReason(FinishStatus.COMPLETED, "stop"))
			.usage(new TokenUsageMeta(120, new InputTokensDetails(20), 80, new OutputTokensDetails(30), 200))
			.block(ContentBlockMessage.ofText(Role.SYSTEM, "You are terse."))
			.block(ContentBlockMessage.ofUserInput(List.of(
					new InputText("Describe these"),
					new InputImage("https://example.com/cat.png", null, "image/png", ImageDetail.HIGH,
							Map.of("origin", "upload")),
					new InputAudio(null, "UklGRg==", "audio/wav", null),
					new InputVideo("https://example.com/clip.mp4", null, "video/mp4", null),
					new InputFile(null, "notes.pdf", "JVBERi0=", "application/pdf", Map.of("pages", 3))),
					Map.of("locale", "fr-FR")))
			.block(ContentBlockMessage.ofAssistantOutput(output, assistantExtra).withIndex(2))
			.block(new ContentBlockReasoning(3, 0,
					List.of(new ReasoningSummary("Checked both sources", Map.of("step", 1)),
							new ReasoningSummary("Picked the newer one")),
					"gAAAAABencrypted", Map.of("effort", "high")))
			.block(new ContentBlockToolCall(4, ToolCallType.CUSTOM, "call-1", "lookup",
					"{\"q\":\"paris\"}", Map.of("near", new GeoPoint(48.8, 2.3))))
			.block(ContentBlockToolCallOutput.custom("call-1", "lookup", "{\"hits\":2}"))
			.block(ContentBlockToolCallOutput.mcp("call-2", "search",
					new ToolCallOutputMcp("3 results", "apr-1", McpToolCallStatus.SUCCESS, null,
							Map.of("attempts", 2L, "priority", Priority.LOW))))
			.block(new ContentBlockMcpListTools("docs", List.of(
					new McpListToolsItem("search", "Full-text search",
							Map.of("type", "object", "properties", Map.of("q", Map.of("type", "string")),
									"required", List.of("q")))),
					null))
			.block(new ContentBlockMcpToolApprovalRequest("apr-1", "search", "{\"q\":\"paris\"}", "docs"))
			.block(new ContentBlockMcpToolApprovalResponse("apr-1", true, null))
			.build();
		// @formatter:on
	}

}
