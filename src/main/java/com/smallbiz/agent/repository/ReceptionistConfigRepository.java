package com.smallbiz.agent.repository;

import com.smallbiz.agent.entity.ReceptionistConfig;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ReceptionistConfigRepository extends JpaRepository<ReceptionistConfig, Long> {

    Optional<ReceptionistConfig> findByBusinessId(Long businessId);
}
