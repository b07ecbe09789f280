package com.smallbiz.agent.controller;

import com.smallbiz.agent.dto.AppointmentRequestForm;
import com.smallbiz.agent.dto.AppointmentRequestResult;
import com.smallbiz.agent.dto.TextMessageRequest;
import com.smallbiz.agent.dto.TriageResult;
import com.smallbiz.agent.entity.CallLog;
import com.smallbiz.agent.exception.ValidationException;
import com.smallbiz.agent.service.CallLogService;
import com.smallbiz.agent.service.CallTriageService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/receptionist")
public class ReceptionistController {

    private final CallTriageService callTriageService;
    private final CallLogService callLogService;

    public ReceptionistController(CallTriageService callTriageService, CallLogService callLogService) {
        this.callTriageService = callTriageService;
        this.callLogService = callLogService;
    }

    /** Text intake (SMS, web chat). */
    @PostMapping("/calls")
    public TriageResult processCall(@RequestBody TextMessageRequest request) {
        if (request.businessId() == null) {
            throw new ValidationException("Business is required");
        }
        return callTriageService.processCall(request);
    }

    @GetMapping("/calls")
    public List<CallLog> recentCalls(@RequestParam Long businessId) {
        return callLogService.recentCalls(businessId);
    }

    @PostMapping("/appointments")
    public AppointmentRequestResult requestAppointment(@Valid @RequestBody AppointmentRequestForm form) {
        return callTriageService.processAppointmentRequest(form.businessId(), form.customerId(), form.toDraft());
    }
}
