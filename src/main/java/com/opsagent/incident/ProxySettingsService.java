package com.opsagent.incident;

import com.opsagent.dispatch.DispatchException;
import com.opsagent.dispatch.WorkerConnectionManager;
import com.opsagent.entity.ProxySettings;
import com.opsagent.model.ProxyConfig;
import com.opsagent.repository.ProxySettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Saves proxy settings and pushes them to the connected worker.
 */
@Slf4j
@Service
public class ProxySettingsService {

    private final ProxySettingsRepository proxySettingsRepository;
    private final WorkerConnectionManager connectionManager;

    public ProxySettingsService(ProxySettingsRepository proxySettingsRepository,
                                WorkerConnectionManager connectionManager) {
        this.proxySettingsRepository = proxySettingsRepository;
        this.connectionManager = connectionManager;
    }

    public ProxyConfig current() {
        return proxySettingsRepository.findFirstByOrderByCreatedAtAsc()
                .map(AgentSettingsService::toProxyConfig)
                .orElseGet(() -> new ProxyConfig(null, null, false, false, false));
    }

    /**
     * @return true when the update also reached the worker
     */
    public boolean update(ProxyConfig config) {
        ProxySettings settings = proxySettingsRepository.findFirstByOrderByCreatedAtAsc()
                .orElseGet(ProxySettings::new);
        settings.setProxyUrl(config.url());
        settings.setNoProxy(config.noProxy());
        settings.setOpenaiEnabled(config.openaiEnabled());
        settings.setSlackEnabled(config.slackEnabled());
        settings.setZabbixEnabled(config.zabbixEnabled());
        proxySettingsRepository.save(settings);

        if (!connectionManager.isConnected()) {
            log.info("Proxy settings saved, no worker connected to notify");
            return false;
        }
        try {
            connectionManager.broadcastProxyConfig(config);
            return true;
        } catch (DispatchException ex) {
            log.warn("Proxy settings saved but the worker could not be notified: {}", ex.getMessage());
            return false;
        }
    }
}
