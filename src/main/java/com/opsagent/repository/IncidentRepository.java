package com.opsagent.repository;

import com.opsagent.entity.Incident;
import com.opsagent.entity.IncidentStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link Incident} entities.
 */
public interface IncidentRepository extends JpaRepository<Incident, UUID> {

    List<Incident> findTop50ByOrderByCreatedAtDesc();

    long countByStatus(IncidentStatus status);
}
