/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

import java.util.List;

import io.agentic.schema.AgenticSchema.AgenticResponse;
import io.agentic.schema.AgenticSchema.ContentBlock;
import io.agentic.schema.AgenticSchema.ContentBlockMessage;
import io.agentic.schema.AgenticSchema.ContentBlockReasoning;
import io.agentic.schema.AgenticSchema.ContentBlockToolCall;
import io.agentic.schema.AgenticSchema.ContentBlockToolCallOutput;
import io.agentic.schema.AgenticSchema.MediaSource;
import io.agentic.schema.AgenticSchema.ToolCallOutputType;

/**
 * Checks the union invariants of the agentic schema.
 *
 * <p>
 * The following rules are enforced:
 * <ul>
 * <li>Content blocks, message parts and reasoning summaries are never {@code null}</li>
 * <li>A message has a role and exactly one of input text, user input parts and assistant
 * output parts</li>
 * <li>A tool call has a call type</li>
 * <li>A tool call output carries exactly one of its custom and MCP outputs, the one
 * named by its output type</li>
 * <li>A media part has a URL, inline base64 data, or both</li>
 * </ul>
 * Token totals and the exclusivity of URL and base64 data are not checked. Every
 * violation raises {@link VariantMismatchException}.
 */
public final class AgenticSchemaValidator {

	private AgenticSchemaValidator() {
	}

	/**
	 * Validates every block of a response.
	 * @param response the response to check
	 * @throws VariantMismatchException if any block violates its union invariant
	 */
	public static void validate(AgenticResponse response) {
		if (response == null) {
			throw new VariantMismatchException("Response must not be null");
		}
		if (response.blocks() == null) {
			return;
		}
		for (int i = 0; i < response.blocks().size(); i++) {
			ContentBlock block = response.blocks().get(i);
			if (block == null) {
				throw new VariantMismatchException("Content block at position " + i + " carries no payload");
			}
			validate(block);
		}
	}

	/**
	 * Validates a single content block.
	 * @param block the block to check
	 * @throws VariantMismatchException if the block violates its union invariant
	 */
	public static void validate(ContentBlock block) {
		if (block == null) {
			throw new VariantMismatchException("Content block carries no payload");
		}
		if (block instanceof ContentBlockMessage message) {
			validateMessage(message);
		}
		else if (block instanceof ContentBlockReasoning reasoning) {
			requireNoNullEntries(reasoning.summary(), "reasoning summary");
		}
		else if (block instanceof ContentBlockToolCall toolCall) {
			if (toolCall.callType() == null) {
				throw new VariantMismatchException("Tool call '" + toolCall.id() + "' has no call type");
			}
		}
		else if (block instanceof ContentBlockToolCallOutput output) {
			validate(output);
		}
	}

	/**
	 * Validates that a tool call output carries exactly the output its type names.
	 * @param output the tool call output to check
	 * @throws VariantMismatchException if no output, both outputs, or the wrong output is
	 * set
	 */
	public static void validate(ContentBlockToolCallOutput output) {
		if (output == null) {
			throw new VariantMismatchException("Tool call output carries no payload");
		}
		boolean custom = output.customTool() != null;
		boolean mcp = output.mcpTool() != null;
		if (custom && mcp) {
			throw new VariantMismatchException(
					"Tool call output '" + output.toolCallId() + "' carries both a custom and an MCP output");
		}
		if (!custom && !mcp) {
			throw new VariantMismatchException("Tool call output '" + output.toolCallId() + "' carries no output");
		}
		ToolCallOutputType populated = custom ? ToolCallOutputType.CUSTOM : ToolCallOutputType.MCP;
		if (output.outputType() != populated) {
			throw new VariantMismatchException("Tool call output '" + output.toolCallId() + "' is typed "
					+ output.outputType() + " but carries a " + populated + " output");
		}
	}

	private static void validateMessage(ContentBlockMessage message) {
		if (message.role() == null) {
			throw new VariantMismatchException("Message has no role");
		}
		int populated = 0;
		if (message.inputText() != null) {
			populated++;
		}
		if (message.userInputMultiContent() != null) {
			populated++;
		}
		if (message.assistantGenMultiContent() != null) {
			populated++;
		}
		if (populated != 1) {
			throw new VariantMismatchException(
					"Message must carry exactly one content representation but carries " + populated);
		}
		if (message.userInputMultiContent() != null) {
			requireNoNullEntries(message.userInputMultiContent(), "user input part");
			message.userInputMultiContent().forEach(AgenticSchemaValidator::validateMedia);
		}
		if (message.assistantGenMultiContent() != null) {
			requireNoNullEntries(message.assistantGenMultiContent(), "assistant output part");
			message.assistantGenMultiContent().forEach(AgenticSchemaValidator::validateMedia);
		}
	}

	private static void validateMedia(Object part) {
		if (part instanceof MediaSource media && media.url() == null && media.base64Data() == null) {
			throw new VariantMismatchException(
					"Media part " + part.getClass().getSimpleName() + " has neither a URL nor base64 data");
		}
	}

	private static void requireNoNullEntries(List<?> entries, String description) {
		if (entries == null) {
			return;
		}
		for (int i = 0; i < entries.size(); i++) {
			if (entries.get(i) == null) {
				throw new VariantMismatchException("Null " + description + " at position " + i);
			}
		}
	}

}
