package com.opsagent.repository;

import com.opsagent.entity.ProxySettings;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link ProxySettings} entities.
 */
public interface ProxySettingsRepository extends JpaRepository<ProxySettings, UUID> {

    Optional<ProxySettings> findFirstByOrderByCreatedAtAsc();
}
