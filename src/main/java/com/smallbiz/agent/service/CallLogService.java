package com.smallbiz.agent.service;

import com.smallbiz.agent.conversation.CallIntent;
import com.smallbiz.agent.conversation.CallSession;
import com.smallbiz.agent.conversation.TriageAction;
import com.smallbiz.agent.dto.TriageResult;
import com.smallbiz.agent.entity.CallLog;
import com.smallbiz.agent.repository.CallLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Call history. Writing a log entry is best effort and never fails the call it describes.
 */
@Service
public class CallLogService {

    private static final Logger log = LoggerFactory.getLogger(CallLogService.class);

    private final CallLogRepository callLogRepository;
    private final Clock clock;

    public CallLogService(CallLogRepository callLogRepository, Clock clock) {
        this.callLogRepository = callLogRepository;
        this.clock = clock;
    }

    public void recordTriage(CallSession session, TriageResult result) {
        CallLog.Status status = CallLog.Status.ANSWERED;
        if (result.action().isTransfer()) {
            status = CallLog.Status.TRANSFERRED;
        } else if (result.action() == TriageAction.TAKE_VOICEMAIL) {
            status = CallLog.Status.VOICEMAIL;
        }
        save(CallLog.builder()
                .businessId(session.request().businessId())
                .callerId(session.request().callerId())
                .callerName(session.request().callerName())
                .transcript(session.request().text())
                .intentDetected(result.intent().code())
                .emergency(session.emergency())
                .status(status)
                .callTime(clock.instant())
                .build());
    }

    public void recordBooking(Long businessId, Long appointmentId, String transcript) {
        save(CallLog.builder()
                .businessId(businessId)
                .transcript(transcript != null ? transcript : "Appointment scheduling conversation (appointment " + appointmentId + ")")
                .intentDetected(CallIntent.APPOINTMENT.code())
                .emergency(false)
                .status(CallLog.Status.ANSWERED)
                .callTime(clock.instant())
                .build());
    }

    public List<CallLog> recentCalls(Long businessId) {
        return callLogRepository.findByBusinessIdOrderByCallTimeDesc(businessId);
    }

    private void save(CallLog entry) {
        try {
            callLogRepository.save(entry);
        } catch (DataAccessException e) {
            log.warn("Could not write call log for business {}: {}", entry.getBusinessId(), e.getMessage());
        }
    }
}
