package com.opsagent.dispatch;

import com.opsagent.model.AgentLlmConfig;
import com.opsagent.model.ProxyConfig;

import java.util.List;
import java.util.Optional;

/**
 * Provider, proxy and skill settings attached to outgoing tasks.
 */
public interface AgentSettingsLookup {

    Optional<AgentLlmConfig> llmConfig();

    Optional<ProxyConfig> proxyConfig();

    List<String> enabledSkills();
}
