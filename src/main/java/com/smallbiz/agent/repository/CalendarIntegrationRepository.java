package com.smallbiz.agent.repository;

import com.smallbiz.agent.calendar.CalendarProvider;
import com.smallbiz.agent.entity.CalendarIntegration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface CalendarIntegrationRepository extends JpaRepository<CalendarIntegration, Long> {

    Optional<CalendarIntegration> findByBusinessIdAndProvider(Long businessId, CalendarProvider provider);

    List<CalendarIntegration> findByBusinessId(Long businessId);

    @Transactional
    @Modifying
    @Query("DELETE FROM CalendarIntegration c WHERE c.businessId = :businessId AND c.provider = :provider")
    int deleteByBusinessIdAndProvider(@Param("businessId") Long businessId, @Param("provider") CalendarProvider provider);
}
