package com.opsagent.executor;

import com.opsagent.model.AgentLlmConfig;
import com.opsagent.model.ProxyConfig;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the child environment for the agent binary. Only allow-listed variables and the
 * agent's own prefixed namespace are inherited, so secrets such as database URLs never reach
 * the child. Credentials are added from the supplied settings only.
 */
public final class SafeEnvironment {

    static final Set<String> ALLOWED_VARIABLES = Set.of(
            "HOME", "USER", "PATH", "SHELL", "TERM", "LANG", "LC_ALL", "TZ", "TMPDIR",
            "XDG_CONFIG_HOME", "XDG_DATA_HOME", "XDG_CACHE_HOME",
            "NODE_PATH", "NPM_CONFIG_PREFIX",
            "GIT_AUTHOR_NAME", "GIT_AUTHOR_EMAIL", "GIT_COMMITTER_NAME", "GIT_COMMITTER_EMAIL",
            "PYTHONPATH", "PYTHONDONTWRITEBYTECODE",
            "EDITOR", "VISUAL",
            "CLICOLOR", "FORCE_COLOR", "NO_COLOR", "COLORTERM", "TERM_PROGRAM"
    );

    private static final Map<String, String> PROVIDER_KEY_VARIABLES = Map.of(
            "openai", "OPENAI_API_KEY",
            "anthropic", "ANTHROPIC_API_KEY",
            "google", "GOOGLE_API_KEY",
            "openrouter", "OPENROUTER_API_KEY"
    );

    private SafeEnvironment() {
    }

    public static Map<String, String> allowListed(Map<String, String> ambient, @Nullable String agentPrefix) {
        Map<String, String> env = new LinkedHashMap<>();
        ambient.forEach((key, value) -> {
            if (ALLOWED_VARIABLES.contains(key)
                    || (StringUtils.hasText(agentPrefix) && key.startsWith(agentPrefix))) {
                env.put(key, value);
            }
        });
        return env;
    }

    public static Map<String, String> forRequest(ExecutionRequest request,
                                                 Map<String, String> ambient,
                                                 @Nullable String agentPrefix,
                                                 @Nullable String mcpGatewayUrl) {
        Map<String, String> env = allowListed(ambient, agentPrefix);
        env.put("INCIDENT_ID", request.incidentId());
        if (StringUtils.hasText(mcpGatewayUrl)) {
            env.put("MCP_GATEWAY_URL", mcpGatewayUrl);
        }
        applyLlmConfig(env, request.llmConfig());
        applyProxyConfig(env, request.proxyConfig());
        return env;
    }

    static String providerKeyVariable(@Nullable String provider) {
        if (!StringUtils.hasText(provider)) {
            return "OPENAI_API_KEY";
        }
        return PROVIDER_KEY_VARIABLES.getOrDefault(provider.toLowerCase(Locale.ROOT), "OPENAI_API_KEY");
    }

    private static void applyLlmConfig(Map<String, String> env, @Nullable AgentLlmConfig config) {
        if (config == null) {
            return;
        }
        if (config.hasCredentials()) {
            env.put(providerKeyVariable(config.provider()), config.apiKey());
        }
        putIfText(env, "CODEX_MODEL", config.model());
        putIfText(env, "CODEX_REASONING_EFFORT", config.reasoningEffort());
        putIfText(env, "OPENAI_BASE_URL", config.baseUrl());
    }

    private static void applyProxyConfig(Map<String, String> env, @Nullable ProxyConfig proxy) {
        if (proxy == null) {
            return;
        }
        if (proxy.appliesToLlm()) {
            env.put("HTTP_PROXY", proxy.url());
            env.put("HTTPS_PROXY", proxy.url());
        }
        putIfText(env, "NO_PROXY", proxy.noProxy());
    }

    private static void putIfText(Map<String, String> env, String key, @Nullable String value) {
        if (StringUtils.hasText(value)) {
            env.put(key, value);
        }
    }
}
