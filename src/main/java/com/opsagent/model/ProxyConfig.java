package com.opsagent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.util.StringUtils;

public record ProxyConfig(
        @JsonProperty("url") String url,
        @JsonProperty("no_proxy") String noProxy,
        @JsonProperty("openai_enabled") boolean openaiEnabled,
        @JsonProperty("slack_enabled") boolean slackEnabled,
        @JsonProperty("zabbix_enabled") boolean zabbixEnabled
) {

    public boolean appliesToLlm() {
        return StringUtils.hasText(url) && openaiEnabled;
    }
}
