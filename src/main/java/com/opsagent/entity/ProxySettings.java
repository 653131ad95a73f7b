package com.opsagent.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "proxy_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProxySettings {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "proxy_url", length = 500)
    private String proxyUrl;

    @Column(name = "no_proxy", length = 1000)
    private String noProxy;

    @Column(name = "openai_enabled", nullable = false)
    private boolean openaiEnabled;

    @Column(name = "slack_enabled", nullable = false)
    private boolean slackEnabled;

    @Column(name = "zabbix_enabled", nullable = false)
    private boolean zabbixEnabled;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
