package com.opsagent.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds decoded agent events into the primary output, the progress log, the error list and the
 * token count. Not thread-safe: owned by the single stdout reader until the stream ends.
 */
@Slf4j
public class AgentEventAccumulator {

    static final String REASONING_PREFIX = "🤔 ";
    static final String RAN_PREFIX = "✅ Ran: ";
    static final String FAILED_PREFIX = "❌ Failed: ";
    static final String ERROR_PREFIX = "❌ Error: ";

    private final StringBuilder output = new StringBuilder();
    private final List<String> progressLines = new ArrayList<>();
    private final List<String> errorMessages = new ArrayList<>();
    private String lastReasoning = "";
    private String threadId;
    private int tokensUsed;
    private int eventCount;

    /**
     * @return true when the progress log changed in response to a completed item
     */
    public boolean fold(AgentEvent event) {
        eventCount++;
        if (event.type() == null) {
            return false;
        }
        switch (event.type()) {
            case AgentEvent.TYPE_ERROR -> foldError(event);
            case AgentEvent.TYPE_THREAD_STARTED -> {
                if (StringUtils.hasText(event.threadId())) {
                    threadId = event.threadId();
                }
            }
            case AgentEvent.TYPE_TURN_COMPLETED -> {
                if (event.usage() != null) {
                    tokensUsed = event.usage().total();
                    log.debug("Turn completed: input={}, cached={}, output={}", event.usage().inputTokens(),
                            event.usage().cachedInputTokens(), event.usage().outputTokens());
                }
            }
            case AgentEvent.TYPE_ITEM_COMPLETED -> {
                return foldItem(event.item());
            }
            default -> log.trace("Ignoring agent event type {}", event.type());
        }
        return false;
    }

    private void foldError(AgentEvent event) {
        String message = event.errorMessage();
        if (!StringUtils.hasText(message)) {
            return;
        }
        log.debug("Agent reported error: {}", message);
        errorMessages.add(message);
        progressLines.add(ERROR_PREFIX + message);
    }

    private boolean foldItem(AgentEvent.Item item) {
        if (item == null || item.type() == null) {
            return false;
        }
        String line = switch (item.type()) {
            case AgentEvent.ITEM_AGENT_MESSAGE -> {
                String text = item.text() != null ? item.text() : "";
                if (!output.isEmpty()) {
                    output.append('\n');
                }
                output.append(text);
                yield "📝 Response ready (" + text.length() + " chars)";
            }
            case AgentEvent.ITEM_REASONING -> {
                lastReasoning = item.text() != null ? item.text() : "";
                yield REASONING_PREFIX + lastReasoning;
            }
            case AgentEvent.ITEM_COMMAND_EXECUTION -> commandLine(item);
            default -> null;
        };
        if (line == null) {
            return false;
        }
        progressLines.add(line);
        return true;
    }

    private String commandLine(AgentEvent.Item item) {
        String prefix = item.isCompletedCommand() ? RAN_PREFIX : FAILED_PREFIX;
        String line = prefix + (item.command() != null ? item.command() : "");
        if (StringUtils.hasText(item.aggregatedOutput())) {
            line += "\nOutput:\n" + item.aggregatedOutput();
        }
        return line;
    }

    public String progressLog() {
        return String.join("\n", progressLines);
    }

    /**
     * Primary output, falling back to the last reasoning fragment when the agent produced no
     * final message.
     */
    public String finalOutput() {
        String text = output.toString().trim();
        if (text.isEmpty() && StringUtils.hasText(lastReasoning)) {
            log.info("No agent message produced, using last reasoning as output ({} chars)", lastReasoning.length());
            return lastReasoning;
        }
        return text;
    }

    public List<String> errorMessages() {
        return List.copyOf(errorMessages);
    }

    public String threadId() {
        return threadId;
    }

    public int tokensUsed() {
        return tokensUsed;
    }

    public int eventCount() {
        return eventCount;
    }
}
