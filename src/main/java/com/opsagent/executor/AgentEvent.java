package com.opsagent.executor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.util.StringUtils;

/**
 * One event from the agent's {@code --json} output stream.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentEvent(
        String type,
        String message,
        JsonNode error,
        @JsonProperty("thread_id") String threadId,
        Item item,
        Usage usage
) {

    public static final String TYPE_ERROR = "error";
    public static final String TYPE_ITEM_COMPLETED = "item.completed";
    public static final String TYPE_TURN_COMPLETED = "turn.completed";
    public static final String TYPE_THREAD_STARTED = "thread.started";

    public static final String ITEM_REASONING = "reasoning";
    public static final String ITEM_COMMAND_EXECUTION = "command_execution";
    public static final String ITEM_AGENT_MESSAGE = "agent_message";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
            String id,
            String type,
            String text,
            String command,
            @JsonProperty("aggregated_output") String aggregatedOutput,
            @JsonProperty("exit_code") Integer exitCode,
            String status
    ) {

        public boolean isCompletedCommand() {
            return "completed".equals(status);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usage(
            @JsonProperty("input_tokens") int inputTokens,
            @JsonProperty("cached_input_tokens") int cachedInputTokens,
            @JsonProperty("output_tokens") int outputTokens
    ) {

        public int total() {
            return inputTokens + outputTokens;
        }
    }

    /**
     * Error text for an error event: the top-level message, else a string error field, else the
     * error object's message.
     */
    public String errorMessage() {
        if (StringUtils.hasText(message)) {
            return message;
        }
        if (error == null || error.isNull()) {
            return null;
        }
        if (error.isTextual()) {
            return error.asText();
        }
        JsonNode nested = error.get("message");
        return nested != null && nested.isTextual() ? nested.asText() : null;
    }
}
