/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.agentic.json.AgenticJsonMapper;
import io.agentic.json.jackson2.JacksonAgenticJsonMapperSupplier;
import io.agentic.schema.AgenticSchema.ContentBlock;
import io.agentic.schema.AgenticSchema.ContentBlockMcpListTools;
import io.agentic.schema.AgenticSchema.ContentBlockMcpToolApprovalRequest;
import io.agentic.schema.AgenticSchema.ContentBlockMcpToolApprovalResponse;
import io.agentic.schema.AgenticSchema.ContentBlockMessage;
import io.agentic.schema.AgenticSchema.ContentBlockReasoning;
import io.agentic.schema.AgenticSchema.ContentBlockToolCall;
import io.agentic.schema.AgenticSchema.ContentBlockToolCallOutput;
import io.agentic.schema.AgenticSchema.ContentBlockType;
import io.agentic.schema.AgenticSchema.InputFile;
import io.agentic.schema.AgenticSchema.InputImage;
import io.agentic.schema.AgenticSchema.InputPart;
import io.agentic.schema.AgenticSchema.InputText;
import io.agentic.schema.AgenticSchema.MessagePartType;
import io.agentic.schema.AgenticSchema.OutputAudio;
import io.agentic.schema.AgenticSchema.OutputPart;
import io.agentic.schema.AgenticSchema.OutputText;
import io.agentic.schema.AgenticSchema.ReasoningSummary;
import io.agentic.schema.AgenticSchema.Role;
import io.agentic.schema.AgenticSchema.ToolCallOutputMcp;

import static org.assertj.core.api.Assertions.assertThat;

class AgenticSchemaTests {

	private AgenticJsonMapper jsonMapper;

	@BeforeEach
	void setUp() {
		jsonMapper = new JacksonAgenticJsonMapperSupplier().get();
	}

	@Test
	void blockTypeNamesMatchWrittenTags() throws IOException {
		List<ContentBlock> blocks = List.of(ContentBlockMessage.ofText(Role.USER, "hi"),
				ContentBlockReasoning.ofSummary(List.of(new ReasoningSummary("thinking")), null),
				ContentBlockToolCall.mcp("c1", "search", "{}"),
				ContentBlockToolCallOutput.mcp("c1", "search", ToolCallOutputMcp.failure("timeout")),
				new ContentBlockMcpListTools("docs", List.of(), null),
				new ContentBlockMcpToolApprovalRequest("apr-1", "search", "{}", "docs"),
				new ContentBlockMcpToolApprovalResponse("apr-1", false, "not allowed"));

		assertThat(blocks).extracting(ContentBlock::type).containsExactly(ContentBlockType.values());
		for (ContentBlock block : blocks) {
			assertThat(writtenTag(block)).isEqualTo(jsonName(block.type()));
		}
	}

	@Test
	void partTypeNamesMatchWrittenTags() throws IOException {
		List<InputPart> inputs = List.of(new InputText("hi"), InputImage.ofUrl("https://example.com/a.png", null),
				new InputFile(null, "a.txt", "YQ==", "text/plain", null));
		List<OutputPart> outputs = List.of(new OutputText("hi"),
				new OutputAudio("https://example.com/a.wav", null, "audio/wav", null));

		for (InputPart part : inputs) {
			assertThat(writtenTag(part)).isEqualTo(jsonName(part.type()));
		}
		for (OutputPart part : outputs) {
			assertThat(writtenTag(part)).isEqualTo(jsonName(part.type()));
		}
		assertThat(jsonName(MessagePartType.FILE)).isEqualTo("file");
	}

	private String writtenTag(Object value) throws IOException {
		Map<?, ?> tree = (Map<?, ?>) jsonMapper.toTree(value);
		return (String) tree.get("type");
	}

	private String jsonName(Enum<?> constant) throws IOException {
		return (String) jsonMapper.toTree(constant);
	}

}
