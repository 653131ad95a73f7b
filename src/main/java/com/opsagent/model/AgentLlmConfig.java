package com.opsagent.model;

import org.springframework.util.StringUtils;

/**
 * LLM provider settings handed to the agent binary for one task.
 *
 * @param provider        provider name, e.g. {@code openai}
 * @param apiKey          provider credential, never read from the ambient environment
 * @param model           model name, blank for the binary's default
 * @param reasoningEffort reasoning effort hint, blank for the default
 * @param baseUrl         custom API base URL (Azure OpenAI, local gateways)
 */
public record AgentLlmConfig(
        String provider,
        String apiKey,
        String model,
        String reasoningEffort,
        String baseUrl
) {

    public boolean hasCredentials() {
        return StringUtils.hasText(apiKey);
    }
}
