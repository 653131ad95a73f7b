package com.opsagent.repository;

import com.opsagent.entity.LlmSettings;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link LlmSettings} entities.
 */
public interface LlmSettingsRepository extends JpaRepository<LlmSettings, UUID> {

    Optional<LlmSettings> findFirstByEnabledTrueOrderByUpdatedAtDesc();
}
