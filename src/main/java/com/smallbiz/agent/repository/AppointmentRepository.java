package com.smallbiz.agent.repository;

import com.smallbiz.agent.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    List<Appointment> findByBusinessIdAndStatusIn(Long businessId, Collection<Appointment.Status> statuses);

    List<Appointment> findByBusinessIdAndStaffIdAndStatusIn(Long businessId, Long staffId, Collection<Appointment.Status> statuses);

    List<Appointment> findByBusinessIdOrderByStartTimeAsc(Long businessId);
}
