/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import io.agentic.util.Assert;

/**
 * Response model for multi-modal, multi-turn agent interactions: messages, reasoning,
 * tool calls and their outputs, and the MCP tool listing and approval workflow.
 * <p>
 * Several entities carry an {@code extra} map for provider-specific metadata. Values in
 * those maps may be of any type registered with an
 * {@link io.agentic.registry.ExtensionTypeRegistry}; the binary codec keeps their
 * concrete type across an encode/decode round trip.
 */
public final class AgenticSchema {

	private AgenticSchema() {
	}

	// ---------------------------
	// Response
	// ---------------------------

	/**
	 * The top-level unit produced by an agent turn.
	 *
	 * @param id The response identifier
	 * @param finishReason Why generation stopped, if known
	 * @param usage Token accounting, if reported by the model
	 * @param blocks The ordered content blocks of the response
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record AgenticResponse( // @formatter:off
		@JsonProperty("id") String id,
		@JsonProperty("finishReason") FinishReason finishReason,
		@JsonProperty("usage") TokenUsageMeta usage,
		@JsonProperty("blocks") List<ContentBlock> blocks) { // @formatter:on

		public static Builder builder() {
			return new Builder();
		}

		public static class Builder {

			private String id;

			private FinishReason finishReason;

			private TokenUsageMeta usage;

			private final List<ContentBlock> blocks = new ArrayList<>();

			public Builder id(String id) {
				this.id = id;
				return this;
			}

			public Builder finishReason(FinishReason finishReason) {
				this.finishReason = finishReason;
				return this;
			}

			public Builder usage(TokenUsageMeta usage) {
				this.usage = usage;
				return this;
			}

			public Builder block(ContentBlock block) {
				Assert.notNull(block, "block must not be null");
				this.blocks.add(block);
				return this;
			}

			public Builder blocks(List<ContentBlock> blocks) {
				Assert.notNull(blocks, "blocks must not be null");
				blocks.forEach(this::block);
				return this;
			}

			public AgenticResponse build() {
				AgenticResponse response = new AgenticResponse(id, finishReason, usage, List.copyOf(blocks));
				AgenticSchemaValidator.validate(response);
				return response;
			}

		}
	}

	public enum FinishStatus {

	// @formatter:off
		@JsonProperty("completed") COMPLETED,
		@JsonProperty("incomplete") INCOMPLETE
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record FinishReason( // @formatter:off
		@JsonProperty("status") FinishStatus status,
		@JsonProperty("reason") String reason) { // @formatter:on
	}

	/**
	 * Token accounting for one response. The total is reported by the producer and is
	 * not required to equal input plus output.
	 *
	 * @param inputTokens Tokens consumed by the prompt
	 * @param inputTokensDetails Breakdown of the input tokens
	 * @param outputTokens Tokens generated by the model
	 * @param outputTokensDetails Breakdown of the output tokens
	 * @param totalTokens Total tokens billed for the response
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record TokenUsageMeta( // @formatter:off
		@JsonProperty("inputTokens") long inputTokens,
		@JsonProperty("inputTokensDetails") InputTokensDetails inputTokensDetails,
		@JsonProperty("outputTokens") long outputTokens,
		@JsonProperty("outputTokensDetails") OutputTokensDetails outputTokensDetails,
		@JsonProperty("totalTokens") long totalTokens) { // @formatter:on

		public TokenUsageMeta {
			Assert.isTrue(inputTokens >= 0, "inputTokens must not be negative");
			Assert.isTrue(outputTokens >= 0, "outputTokens must not be negative");
			Assert.isTrue(totalTokens >= 0, "totalTokens must not be negative");
		}

		public TokenUsageMeta(long inputTokens, long outputTokens, long totalTokens) {
			this(inputTokens, null, outputTokens, null, totalTokens);
		}
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record InputTokensDetails(@JsonProperty("cachedTokens") long cachedTokens) {

		public InputTokensDetails {
			Assert.isTrue(cachedTokens >= 0, "cachedTokens must not be negative");
		}
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record OutputTokensDetails(@JsonProperty("reasoningTokens") long reasoningTokens) {

		public OutputTokensDetails {
			Assert.isTrue(reasoningTokens >= 0, "reasoningTokens must not be negative");
		}
	}

	// ---------------------------
	// Content Blocks
	// ---------------------------

	public enum ContentBlockType {

	// @formatter:off
		@JsonProperty("message") MESSAGE,
		@JsonProperty("reasoning") REASONING,
		@JsonProperty("tool_call") TOOL_CALL,
		@JsonProperty("tool_call_output") TOOL_CALL_OUTPUT,
		@JsonProperty("mcp_list_tools") MCP_LIST_TOOLS,
		@JsonProperty("mcp_tool_approval_request") MCP_TOOL_APPROVAL_REQUEST,
		@JsonProperty("mcp_tool_approval_response") MCP_TOOL_APPROVAL_RESPONSE
	} // @formatter:on

	/**
	 * One discriminated unit of an agent response. Each variant is its own record, so a
	 * block always carries exactly the payload its type names.
	 */
	@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
	@JsonSubTypes({ @JsonSubTypes.Type(value = ContentBlockMessage.class, name = "message"),
			@JsonSubTypes.Type(value = ContentBlockReasoning.class, name = "reasoning"),
			@JsonSubTypes.Type(value = ContentBlockToolCall.class, name = "tool_call"),
			@JsonSubTypes.Type(value = ContentBlockToolCallOutput.class, name = "tool_call_output"),
			@JsonSubTypes.Type(value = ContentBlockMcpListTools.class, name = "mcp_list_tools"),
			@JsonSubTypes.Type(value = ContentBlockMcpToolApprovalRequest.class, name = "mcp_tool_approval_request"),
			@JsonSubTypes.Type(value = ContentBlockMcpToolApprovalResponse.class,
					name = "mcp_tool_approval_response") })
	public sealed interface ContentBlock permits ContentBlockMessage, ContentBlockReasoning, ContentBlockToolCall,
			ContentBlockToolCallOutput, ContentBlockMcpListTools, ContentBlockMcpToolApprovalRequest,
			ContentBlockMcpToolApprovalResponse {

		default ContentBlockType type() {
			if (this instanceof ContentBlockMessage) {
				return ContentBlockType.MESSAGE;
			}
			else if (this instanceof ContentBlockReasoning) {
				return ContentBlockType.REASONING;
			}
			else if (this instanceof ContentBlockToolCall) {
				return ContentBlockType.TOOL_CALL;
			}
			else if (this instanceof ContentBlockToolCallOutput) {
				return ContentBlockType.TOOL_CALL_OUTPUT;
			}
			else if (this instanceof ContentBlockMcpListTools) {
				return ContentBlockType.MCP_LIST_TOOLS;
			}
			else if (this instanceof ContentBlockMcpToolApprovalRequest) {
				return ContentBlockType.MCP_TOOL_APPROVAL_REQUEST;
			}
			else if (this instanceof ContentBlockMcpToolApprovalResponse) {
				return ContentBlockType.MCP_TOOL_APPROVAL_RESPONSE;
			}
			throw new IllegalArgumentException("Unknown content block type: " + this);
		}

	}

	// ---------------------------
	// Messages
	// ---------------------------

	/**
	 * Roles a message block can be authored by. Tool results are carried by
	 * {@link ContentBlockToolCallOutput}, never by a message.
	 */
	public enum Role {

	// @formatter:off
		@JsonProperty("system") SYSTEM,
		@JsonProperty("user") USER,
		@JsonProperty("assistant") ASSISTANT
	} // @formatter:on

	/**
	 * A system, user or assistant message. Exactly one of {@code inputText},
	 * {@code userInputMultiContent} and {@code assistantGenMultiContent} is set.
	 *
	 * @param index Position of the message in a streamed response
	 * @param role The author of the message
	 * @param inputText Plain text content
	 * @param userInputMultiContent Multi-modal content authored by the user
	 * @param assistantGenMultiContent Multi-modal content generated by the assistant
	 * @param extra Model-specific metadata, such as a provider message id or status
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ContentBlockMessage( // @formatter:off
		@JsonProperty("index") Integer index,
		@JsonProperty("role") Role role,
		@JsonProperty("inputText") String inputText,
		@JsonProperty("userInputMultiContent") List<InputPart> userInputMultiContent,
		@JsonProperty("assistantGenMultiContent") List<OutputPart> assistantGenMultiContent,
		@JsonProperty("extra") Map<String, Object> extra) implements ContentBlock { // @formatter:on

		public static ContentBlockMessage ofText(Role role, String text) {
			return ofText(role, text, null);
		}

		public static ContentBlockMessage ofText(Role role, String text, Map<String, Object> extra) {
			Assert.notNull(text, "text must not be null");
			return validated(new ContentBlockMessage(null, role, text, null, null, extra));
		}

		public static ContentBlockMessage ofUserInput(List<InputPart> parts) {
			return ofUserInput(parts, null);
		}

		public static ContentBlockMessage ofUserInput(List<InputPart> parts, Map<String, Object> extra) {
			Assert.notNull(parts, "parts must not be null");
			return validated(new ContentBlockMessage(null, Role.USER, null, parts, null, extra));
		}

		public static ContentBlockMessage ofAssistantOutput(List<OutputPart> parts) {
			return ofAssistantOutput(parts, null);
		}

		public static ContentBlockMessage ofAssistantOutput(List<OutputPart> parts, Map<String, Object> extra) {
			Assert.notNull(parts, "parts must not be null");
			return validated(new ContentBlockMessage(null, Role.ASSISTANT, null, null, parts, extra));
		}

		public ContentBlockMessage withIndex(Integer index) {
			return new ContentBlockMessage(index, role, inputText, userInputMultiContent, assistantGenMultiContent,
					extra);
		}

		private static ContentBlockMessage validated(ContentBlockMessage message) {
			AgenticSchemaValidator.validate(message);
			return message;
		}
	}

	public enum MessagePartType {

	// @formatter:off
		@JsonProperty("text") TEXT,
		@JsonProperty("image") IMAGE,
		@JsonProperty("audio") AUDIO,
		@JsonProperty("video") VIDEO,
		@JsonProperty("file") FILE
	} // @formatter:on

	/**
	 * Quality hint for an input image.
	 */
	public enum ImageDetail {

	// @formatter:off
		@JsonProperty("high") HIGH,
		@JsonProperty("low") LOW,
		@JsonProperty("auto") AUTO
	} // @formatter:on

	/**
	 * A media part located either by URL or by inline base64 data. At least one of the
	 * two is set; both may be set when the producer wants a fallback.
	 */
	public interface MediaSource {

		String url();

		String base64Data();

		String mimeType();

	}

	@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
	@JsonSubTypes({ @JsonSubTypes.Type(value = InputText.class, name = "text"),
			@JsonSubTypes.Type(value = InputImage.class, name = "image"),
			@JsonSubTypes.Type(value = InputAudio.class, name = "audio"),
			@JsonSubTypes.Type(value = InputVideo.class, name = "video"),
			@JsonSubTypes.Type(value = InputFile.class, name = "file") })
	public sealed interface InputPart permits InputText, InputImage, InputAudio, InputVideo, InputFile {

		default MessagePartType type() {
			if (this instanceof InputText) {
				return MessagePartType.TEXT;
			}
			else if (this instanceof InputImage) {
				return MessagePartType.IMAGE;
			}
			else if (this instanceof InputAudio) {
				return MessagePartType.AUDIO;
			}
			else if (this instanceof InputVideo) {
				return MessagePartType.VIDEO;
			}
			else if (this instanceof InputFile) {
				return MessagePartType.FILE;
			}
			throw new IllegalArgumentException("Unknown input part type: " + this);
		}

	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record InputText(@JsonProperty("content") String content) implements InputPart {
	}

	/**
	 * An image supplied by the user.
	 *
	 * @param url A traditional URL or an RFC-2397 data URL
	 * @param base64Data The image bytes in base64
	 * @param mimeType The MIME type, e.g. "image/png"
	 * @param detail The requested quality of the image
	 * @param extra Model-specific metadata
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record InputImage( // @formatter:off
		@JsonProperty("url") String url,
		@JsonProperty("base64Data") String base64Data,
		@JsonProperty("mimeType") String mimeType,
		@JsonProperty("detail") ImageDetail detail,
		@JsonProperty("extra") Map<String, Object> extra) implements InputPart, MediaSource { // @formatter:on

		public static InputImage ofUrl(String url, String mimeType) {
			return new InputImage(url, null, mimeType, null, null);
		}

		public static InputImage ofBase64(String base64Data, String mimeType) {
			return new InputImage(null, base64Data, mimeType, null, null);
		}
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record InputAudio( // @formatter:off
		@JsonProperty("url") String url,
		@JsonProperty("base64Data") String base64Data,
		@JsonProperty("mimeType") String mimeType,
		@JsonProperty("extra") Map<String, Object> extra) implements InputPart, MediaSource { // @formatter:on
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record InputVideo( // @formatter:off
		@JsonProperty("url") String url,
		@JsonProperty("base64Data") String base64Data,
		@JsonProperty("mimeType") String mimeType,
		@JsonProperty("extra") Map<String, Object> extra) implements InputPart, MediaSource { // @formatter:on
	}

	/**
	 * A file supplied by the user.
	 *
	 * @param url A traditional URL or an RFC-2397 data URL
	 * @param name The file name, used when the file is passed to the model as a string
	 * @param base64Data The file bytes in base64
	 * @param mimeType The MIME type, e.g. "application/pdf"
	 * @param extra Model-specific metadata
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record InputFile( // @formatter:off
		@JsonProperty("url") String url,
		@JsonProperty("name") String name,
		@JsonProperty("base64Data") String base64Data,
		@JsonProperty("mimeType") String mimeType,
		@JsonProperty("extra") Map<String, Object> extra) implements InputPart, MediaSource { // @formatter:on
	}

	@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
	@JsonSubTypes({ @JsonSubTypes.Type(value = OutputText.class, name = "text"),
			@JsonSubTypes.Type(value = OutputImage.class, name = "image"),
			@JsonSubTypes.Type(value = OutputAudio.class, name = "audio"),
			@JsonSubTypes.Type(value = OutputVideo.class, name = "video") })
	public sealed interface OutputPart permits OutputText, OutputImage, OutputAudio, OutputVideo {

		default MessagePartType type() {
			if (this instanceof OutputText) {
				return MessagePartType.TEXT;
			}
			else if (this instanceof OutputImage) {
				return MessagePartType.IMAGE;
			}
			else if (this instanceof OutputAudio) {
				return MessagePartType.AUDIO;
			}
			else if (this instanceof OutputVideo) {
				return MessagePartType.VIDEO;
			}
			throw new IllegalArgumentException("Unknown output part type: " + this);
		}

	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record OutputText( // @formatter:off
		@JsonProperty("content") String content,
		@JsonProperty("extra") Map<String, Object> extra) implements OutputPart { // @formatter:on

		public OutputText(String content) {
			this(content, null);
		}
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record OutputImage( // @formatter:off
		@JsonProperty("url") String url,
		@JsonProperty("base64Data") String base64Data,
		@JsonProperty("mimeType") String mimeType,
		@JsonProperty("extra") Map<String, Object> extra) implements OutputPart, MediaSource { // @formatter:on

		public static OutputImage ofUrl(String url, String mimeType) {
			return new OutputImage(url, null, mimeType, null);
		}
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record OutputAudio( // @formatter:off
		@JsonProperty("url") String url,
		@JsonProperty("base64Data") String base64Data,
		@JsonProperty("mimeType") String mimeType,
		@JsonProperty("extra") Map<String, Object> extra) implements OutputPart, MediaSource { // @formatter:on
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record OutputVideo( // @formatter:off
		@JsonProperty("url") String url,
		@JsonProperty("base64Data") String base64Data,
		@JsonProperty("mimeType") String mimeType,
		@JsonProperty("extra") Map<String, Object> extra) implements OutputPart, MediaSource { // @formatter:on
	}

	// ---------------------------
	// Reasoning
	// ---------------------------

	/**
	 * A reasoning step of the model.
	 *
	 * @param index Position of the block in a streamed response
	 * @param summaryIndex Position of the summary fragment being streamed
	 * @param summary Human-readable summary fragments of the reasoning
	 * @param encryptedContent Provider-specific encrypted reasoning, opaque to this schema
	 * @param extra Model-specific metadata
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ContentBlockReasoning( // @formatter:off
		@JsonProperty("index") Integer index,
		@JsonProperty("summaryIndex") Integer summaryIndex,
		@JsonProperty("summary") List<ReasoningSummary> summary,
		@JsonProperty("encryptedContent") String encryptedContent,
		@JsonProperty("extra") Map<String, Object> extra) implements ContentBlock { // @formatter:on

		public static ContentBlockReasoning ofSummary(List<ReasoningSummary> summary, String encryptedContent) {
			Assert.notNull(summary, "summary must not be null");
			ContentBlockReasoning reasoning = new ContentBlockReasoning(null, null, summary, encryptedContent, null);
			AgenticSchemaValidator.validate(reasoning);
			return reasoning;
		}
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ReasoningSummary( // @formatter:off
		@JsonProperty("text") String text,
		@JsonProperty("extra") Map<String, Object> extra) { // @formatter:on

		public ReasoningSummary(String text) {
			this(text, null);
		}
	}

	// ---------------------------
	// Tool Calls
	// ---------------------------

	public enum ToolCallType {

	// @formatter:off
		@JsonProperty("custom_tool_call") CUSTOM,
		@JsonProperty("mcp_tool_call") MCP
	} // @formatter:on

	/**
	 * A request from the model to run a tool.
	 *
	 * @param index Position of the block in a streamed response
	 * @param callType Whether the tool is a caller-defined tool or served over MCP
	 * @param id The call id, echoed back by the matching output
	 * @param name The tool name
	 * @param arguments The arguments as JSON text; not parsed by this schema
	 * @param extra Model-specific metadata
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ContentBlockToolCall( // @formatter:off
		@JsonProperty("index") Integer index,
		@JsonProperty("callType") ToolCallType callType,
		@JsonProperty("id") String id,
		@JsonProperty("name") String name,
		@JsonProperty("arguments") String arguments,
		@JsonProperty("extra") Map<String, Object> extra) implements ContentBlock { // @formatter:on

		public static ContentBlockToolCall custom(String id, String name, String arguments) {
			return new ContentBlockToolCall(null, ToolCallType.CUSTOM, id, name, arguments, null);
		}

		public static ContentBlockToolCall mcp(String id, String name, String arguments) {
			return new ContentBlockToolCall(null, ToolCallType.MCP, id, name, arguments, null);
		}
	}

	public enum ToolCallOutputType {

	// @formatter:off
		@JsonProperty("custom_tool_call_output") CUSTOM,
		@JsonProperty("mcp_tool_call_output") MCP
	} // @formatter:on

	/**
	 * The result of a tool call. Exactly one of {@code customTool} and {@code mcpTool} is
	 * set, and it is the one named by {@code outputType}.
	 *
	 * @param index Position of the block in a streamed response
	 * @param outputType Which of the two outputs is carried
	 * @param toolCallId The id of the originating tool call
	 * @param toolName The name of the tool that ran
	 * @param customTool Output of a caller-defined tool
	 * @param mcpTool Output of a tool served over MCP
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ContentBlockToolCallOutput( // @formatter:off
		@JsonProperty("index") Integer index,
		@JsonProperty("outputType") ToolCallOutputType outputType,
		@JsonProperty("toolCallId") String toolCallId,
		@JsonProperty("toolName") String toolName,
		@JsonProperty("customTool") ToolCallOutputCustom customTool,
		@JsonProperty("mcpTool") ToolCallOutputMcp mcpTool) implements ContentBlock { // @formatter:on

		public static ContentBlockToolCallOutput custom(String toolCallId, String toolName, String content) {
			ContentBlockToolCallOutput output = new ContentBlockToolCallOutput(null, ToolCallOutputType.CUSTOM,
					toolCallId, toolName, new ToolCallOutputCustom(content), null);
			AgenticSchemaValidator.validate(output);
			return output;
		}

		public static ContentBlockToolCallOutput mcp(String toolCallId, String toolName, ToolCallOutputMcp mcpTool) {
			ContentBlockToolCallOutput output = new ContentBlockToolCallOutput(null, ToolCallOutputType.MCP,
					toolCallId, toolName, null, mcpTool);
			AgenticSchemaValidator.validate(output);
			return output;
		}
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ToolCallOutputCustom(@JsonProperty("content") String content) {
	}

	public enum McpToolCallStatus {

	// @formatter:off
		@JsonProperty("success") SUCCESS,
		@JsonProperty("error") ERROR
	} // @formatter:on

	/**
	 * Output of a tool served over MCP.
	 *
	 * @param content The tool output
	 * @param approvalRequestId The approval request this call answers, if any
	 * @param status Whether the call succeeded
	 * @param error The error text when the call failed
	 * @param extra Model-specific metadata
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ToolCallOutputMcp( // @formatter:off
		@JsonProperty("content") String content,
		@JsonProperty("approvalRequestId") String approvalRequestId,
		@JsonProperty("status") McpToolCallStatus status,
		@JsonProperty("error") String error,
		@JsonProperty("extra") Map<String, Object> extra) { // @formatter:on

		public static ToolCallOutputMcp success(String content) {
			return new ToolCallOutputMcp(content, null, McpToolCallStatus.SUCCESS, null, null);
		}

		public static ToolCallOutputMcp failure(String error) {
			return new ToolCallOutputMcp(null, null, McpToolCallStatus.ERROR, error, null);
		}
	}

	// ---------------------------
	// MCP
	// ---------------------------

	/**
	 * The tools an MCP server exposes.
	 *
	 * @param serverLabel The label of the MCP server
	 * @param tools The tools available on the server
	 * @param error Error message if the server could not list tools
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ContentBlockMcpListTools( // @formatter:off
		@JsonProperty("serverLabel") String serverLabel,
		@JsonProperty("tools") List<McpListToolsItem> tools,
		@JsonProperty("error") String error) implements ContentBlock { // @formatter:on
	}

	/**
	 * A tool listed by an MCP server.
	 *
	 * @param name The name of the tool
	 * @param description The description of the tool
	 * @param inputSchema The JSON schema of the tool input, never interpreted. Its values
	 * follow the same typing rules as {@code extra} values
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record McpListToolsItem( // @formatter:off
		@JsonProperty("name") String name,
		@JsonProperty("description") String description,
		@JsonProperty("inputSchema") Map<String, Object> inputSchema) { // @formatter:on
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ContentBlockMcpToolApprovalRequest( // @formatter:off
		@JsonProperty("id") String id,
		@JsonProperty("name") String name,
		@JsonProperty("arguments") String arguments,
		@JsonProperty("serverLabel") String serverLabel) implements ContentBlock { // @formatter:on
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ContentBlockMcpToolApprovalResponse( // @formatter:off
		@JsonProperty("approvalRequestId") String approvalRequestId,
		@JsonProperty("approve") boolean approve,
		@JsonProperty("reason") String reason) implements ContentBlock { // @formatter:on
	}

}
