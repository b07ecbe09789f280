package com.smallbiz.agent.repository;

import com.smallbiz.agent.entity.ServiceOffering;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ServiceOfferingRepository extends JpaRepository<ServiceOffering, Long> {

    List<ServiceOffering> findByBusinessIdAndActiveTrueOrderByName(Long businessId);

    Optional<ServiceOffering> findByIdAndBusinessIdAndActiveTrue(Long id, Long businessId);
}
