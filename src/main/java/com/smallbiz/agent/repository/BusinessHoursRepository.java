package com.smallbiz.agent.repository;

import com.smallbiz.agent.entity.BusinessHours;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BusinessHoursRepository extends JpaRepository<BusinessHours, Long> {

    List<BusinessHours> findByBusinessIdOrderByDayOfWeekAsc(Long businessId);

    Optional<BusinessHours> findByBusinessIdAndDayOfWeek(Long businessId, int dayOfWeek);
}
