package com.opsagent.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "incident")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Incident {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source", length = 50)
    private String source;

    @Column(name = "title", length = 255)
    private String title;

    @Column(name = "task", nullable = false, columnDefinition = "TEXT")
    private String task;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private IncidentStatus status;

    @Column(name = "session_id", length = 100)
    private String sessionId;

    @Column(name = "working_dir", length = 500)
    private String workingDir;

    @Column(name = "full_log", columnDefinition = "TEXT")
    private String fullLog;

    @Column(name = "response", columnDefinition = "TEXT")
    private String response;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
