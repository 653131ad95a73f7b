package com.opsagent.incident;

import com.opsagent.config.DispatchProperties;
import com.opsagent.dispatch.AgentSettingsLookup;
import com.opsagent.entity.LlmSettings;
import com.opsagent.entity.ProxySettings;
import com.opsagent.model.AgentLlmConfig;
import com.opsagent.model.ProxyConfig;
import com.opsagent.repository.LlmSettingsRepository;
import com.opsagent.repository.ProxySettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class AgentSettingsService implements AgentSettingsLookup {

    private final LlmSettingsRepository llmSettingsRepository;
    private final ProxySettingsRepository proxySettingsRepository;
    private final DispatchProperties properties;

    public AgentSettingsService(LlmSettingsRepository llmSettingsRepository,
                                ProxySettingsRepository proxySettingsRepository,
                                DispatchProperties properties) {
        this.llmSettingsRepository = llmSettingsRepository;
        this.proxySettingsRepository = proxySettingsRepository;
        this.properties = properties;
    }

    /**
     * The enabled provider settings, empty when none are enabled or the key is missing.
     */
    @Override
    public Optional<AgentLlmConfig> llmConfig() {
        try {
            return llmSettingsRepository.findFirstByEnabledTrueOrderByUpdatedAtDesc()
                    .filter(LlmSettings::isActive)
                    .map(AgentSettingsService::toLlmConfig);
        } catch (RuntimeException ex) {
            log.warn("Failed to load LLM settings: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<ProxyConfig> proxyConfig() {
        try {
            return proxySettingsRepository.findFirstByOrderByCreatedAtAsc()
                    .map(AgentSettingsService::toProxyConfig);
        } catch (RuntimeException ex) {
            log.warn("Failed to load proxy settings: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<String> enabledSkills() {
        return List.copyOf(properties.getEnabledSkills());
    }

    static AgentLlmConfig toLlmConfig(LlmSettings settings) {
        return new AgentLlmConfig(settings.getProvider(), settings.getApiKey(), settings.getModel(),
                settings.getReasoningEffort(), settings.getBaseUrl());
    }

    static ProxyConfig toProxyConfig(ProxySettings settings) {
        return new ProxyConfig(settings.getProxyUrl(), settings.getNoProxy(), settings.isOpenaiEnabled(),
                settings.isSlackEnabled(), settings.isZabbixEnabled());
    }
}
