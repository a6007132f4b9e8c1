/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import io.agentic.schema.AgenticSchema.AgenticResponse;
import io.agentic.schema.AgenticSchema.ContentBlock;
import io.agentic.schema.AgenticSchema.ContentBlockMcpListTools;
import io.agentic.schema.AgenticSchema.ContentBlockMessage;
import io.agentic.schema.AgenticSchema.ContentBlockReasoning;
import io.agentic.schema.AgenticSchema.ContentBlockToolCall;
import io.agentic.schema.AgenticSchema.ContentBlockToolCallOutput;
import io.agentic.schema.AgenticSchema.InputAudio;
import io.agentic.schema.AgenticSchema.InputFile;
import io.agentic.schema.AgenticSchema.InputImage;
import io.agentic.schema.AgenticSchema.InputPart;
import io.agentic.schema.AgenticSchema.InputVideo;
import io.agentic.schema.AgenticSchema.McpListToolsItem;
import io.agentic.schema.AgenticSchema.OutputAudio;
import io.agentic.schema.AgenticSchema.OutputImage;
import io.agentic.schema.AgenticSchema.OutputPart;
import io.agentic.schema.AgenticSchema.OutputText;
import io.agentic.schema.AgenticSchema.OutputVideo;
import io.agentic.schema.AgenticSchema.ReasoningSummary;
import io.agentic.schema.AgenticSchema.ToolCallOutputMcp;

/**
 * Rebuilds a response tree with every open map replaced by the result of a function: the
 * {@code extra} maps and the input schemas of listed MCP tools. Entities without such a
 * map are returned as they are.
 */
final class ExtraMapRewriter {

	private final UnaryOperator<Map<String, Object>> rewrite;

	ExtraMapRewriter(UnaryOperator<Map<String, Object>> rewrite) {
		this.rewrite = rewrite;
	}

	AgenticResponse rewrite(AgenticResponse response) {
		return new AgenticResponse(response.id(), response.finishReason(), response.usage(),
				mapList(response.blocks(), this::rewriteBlock));
	}

	private ContentBlock rewriteBlock(ContentBlock block) {
		if (block instanceof ContentBlockMessage message) {
			return new ContentBlockMessage(message.index(), message.role(), message.inputText(),
					mapList(message.userInputMultiContent(), this::rewriteInput),
					mapList(message.assistantGenMultiContent(), this::rewriteOutput), extra(message.extra()));
		}
		else if (block instanceof ContentBlockReasoning reasoning) {
			return new ContentBlockReasoning(reasoning.index(), reasoning.summaryIndex(),
					mapList(reasoning.summary(), this::rewriteSummary), reasoning.encryptedContent(),
					extra(reasoning.extra()));
		}
		else if (block instanceof ContentBlockToolCall toolCall) {
			return new ContentBlockToolCall(toolCall.index(), toolCall.callType(), toolCall.id(), toolCall.name(),
					toolCall.arguments(), extra(toolCall.extra()));
		}
		else if (block instanceof ContentBlockToolCallOutput output && output.mcpTool() != null) {
			ToolCallOutputMcp mcp = output.mcpTool();
			return new ContentBlockToolCallOutput(output.index(), output.outputType(), output.toolCallId(),
					output.toolName(), output.customTool(), new ToolCallOutputMcp(mcp.content(),
							mcp.approvalRequestId(), mcp.status(), mcp.error(), extra(mcp.extra())));
		}
		else if (block instanceof ContentBlockMcpListTools listTools) {
			return new ContentBlockMcpListTools(listTools.serverLabel(),
					mapList(listTools.tools(), this::rewriteTool), listTools.error());
		}
		return block;
	}

	private ReasoningSummary rewriteSummary(ReasoningSummary summary) {
		return new ReasoningSummary(summary.text(), extra(summary.extra()));
	}

	private McpListToolsItem rewriteTool(McpListToolsItem tool) {
		return new McpListToolsItem(tool.name(), tool.description(), extra(tool.inputSchema()));
	}

	private InputPart rewriteInput(InputPart part) {
		if (part instanceof InputImage image) {
			return new InputImage(image.url(), image.base64Data(), image.mimeType(), image.detail(),
					extra(image.extra()));
		}
		else if (part instanceof InputAudio audio) {
			return new InputAudio(audio.url(), audio.base64Data(), audio.mimeType(), extra(audio.extra()));
		}
		else if (part instanceof InputVideo video) {
			return new InputVideo(video.url(), video.base64Data(), video.mimeType(), extra(video.extra()));
		}
		else if (part instanceof InputFile file) {
			return new InputFile(file.url(), file.name(), file.base64Data(), file.mimeType(), extra(file.extra()));
		}
		return part;
	}

	private OutputPart rewriteOutput(OutputPart part) {
		if (part instanceof OutputText text) {
			return new OutputText(text.content(), extra(text.extra()));
		}
		else if (part instanceof OutputImage image) {
			return new OutputImage(image.url(), image.base64Data(), image.mimeType(), extra(image.extra()));
		}
		else if (part instanceof OutputAudio audio) {
			return new OutputAudio(audio.url(), audio.base64Data(), audio.mimeType(), extra(audio.extra()));
		}
		else if (part instanceof OutputVideo video) {
			return new OutputVideo(video.url(), video.base64Data(), video.mimeType(), extra(video.extra()));
		}
		return part;
	}

	private Map<String, Object> extra(Map<String, Object> extra) {
		return (extra != null) ? this.rewrite.apply(extra) : null;
	}

	private static <T> List<T> mapList(List<T> source, Function<T, T> mapper) {
		if (source == null) {
			return null;
		}
		List<T> mapped = new ArrayList<>(source.size());
		for (T element : source) {
			mapped.add((element != null) ? mapper.apply(element) : null);
		}
		return mapped;
	}

}
