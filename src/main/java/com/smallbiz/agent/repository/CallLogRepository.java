package com.smallbiz.agent.repository;

import com.smallbiz.agent.entity.CallLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CallLogRepository extends JpaRepository<CallLog, Long> {

    List<CallLog> findByBusinessIdOrderByCallTimeDesc(Long businessId);
}
