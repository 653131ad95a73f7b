package com.opsagent.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.opsagent.model.AgentLlmConfig;
import com.opsagent.model.ProxyConfig;
import lombok.Builder;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Envelope exchanged with the worker in both directions. Empty fields are left off the wire.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkerMessage(
        @JsonProperty("type") String type,
        @JsonProperty("incident_id") String incidentId,
        @JsonProperty("task") String task,
        @JsonProperty("message") String message,
        @JsonProperty("output") String output,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("error") String error,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("provider") String provider,
        @JsonProperty("openai_api_key") String apiKey,
        @JsonProperty("model") String model,
        @JsonProperty("reasoning_effort") String reasoningEffort,
        @JsonProperty("base_url") String baseUrl,
        @JsonProperty("proxy_config") ProxyConfig proxyConfig,
        @JsonProperty("enabled_skills") List<String> enabledSkills,
        @JsonProperty("tokens_used") Integer tokensUsed,
        @JsonProperty("execution_time_ms") Long executionTimeMs
) {

    public static WorkerMessage newIncident(String incidentId, String task, @Nullable AgentLlmConfig llm,
                                            @Nullable ProxyConfig proxy, @Nullable List<String> enabledSkills) {
        return withLlm(builder(), llm)
                .type(WorkerMessageType.NEW_INCIDENT.wireName())
                .incidentId(incidentId)
                .task(task)
                .proxyConfig(proxy)
                .enabledSkills(enabledSkills)
                .build();
    }

    public static WorkerMessage continueIncident(String incidentId, String sessionId, String message,
                                                 @Nullable AgentLlmConfig llm, @Nullable ProxyConfig proxy,
                                                 @Nullable List<String> enabledSkills) {
        return withLlm(builder(), llm)
                .type(WorkerMessageType.CONTINUE_INCIDENT.wireName())
                .incidentId(incidentId)
                .sessionId(sessionId)
                .message(message)
                .proxyConfig(proxy)
                .enabledSkills(enabledSkills)
                .build();
    }

    public static WorkerMessage cancelIncident(String incidentId) {
        return builder().type(WorkerMessageType.CANCEL_INCIDENT.wireName()).incidentId(incidentId).build();
    }

    public static WorkerMessage proxyConfigUpdate(ProxyConfig proxy) {
        return builder().type(WorkerMessageType.PROXY_CONFIG_UPDATE.wireName()).proxyConfig(proxy).build();
    }

    public static WorkerMessage output(String incidentId, String output) {
        return builder().type(WorkerMessageType.AGENT_OUTPUT.wireName()).incidentId(incidentId).output(output).build();
    }

    public static WorkerMessage completed(String incidentId, String sessionId, String response,
                                          int tokensUsed, long executionTimeMs) {
        return builder()
                .type(WorkerMessageType.AGENT_COMPLETED.wireName())
                .incidentId(incidentId)
                .sessionId(sessionId)
                .output(response)
                .tokensUsed(tokensUsed)
                .executionTimeMs(executionTimeMs)
                .build();
    }

    public static WorkerMessage error(String incidentId, String error) {
        return builder().type(WorkerMessageType.AGENT_ERROR.wireName()).incidentId(incidentId).error(error).build();
    }

    public static WorkerMessage heartbeat() {
        return builder().type(WorkerMessageType.HEARTBEAT.wireName()).build();
    }

    public static WorkerMessage status(String status) {
        return builder().type(WorkerMessageType.STATUS.wireName()).data(Map.of("status", status)).build();
    }

    private static WorkerMessageBuilder withLlm(WorkerMessageBuilder builder, @Nullable AgentLlmConfig llm) {
        if (llm == null) {
            return builder;
        }
        return builder
                .provider(llm.provider())
                .apiKey(llm.apiKey())
                .model(llm.model())
                .reasoningEffort(llm.reasoningEffort())
                .baseUrl(llm.baseUrl());
    }

    @JsonIgnore
    public Optional<WorkerMessageType> messageType() {
        return WorkerMessageType.fromWire(type);
    }

    /**
     * Provider settings carried by the message, empty when neither a provider nor a key was sent.
     */
    @JsonIgnore
    public Optional<AgentLlmConfig> llmConfig() {
        if (!StringUtils.hasText(provider) && !StringUtils.hasText(apiKey)) {
            return Optional.empty();
        }
        return Optional.of(new AgentLlmConfig(provider, apiKey, model, reasoningEffort, baseUrl));
    }

    public int tokensUsedOrZero() {
        return tokensUsed != null ? tokensUsed : 0;
    }

    public long executionTimeMsOrZero() {
        return executionTimeMs != null ? executionTimeMs : 0L;
    }
}
