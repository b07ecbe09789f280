package com.smallbiz.agent.conversation;

import com.smallbiz.agent.dto.CallRequest;

/**
 * Context of one triage evaluation. Never persisted; reduced to a CallLog row afterwards.
 */
public record CallSession(
        CallRequest request,
        IntentMatch intent,
        boolean emergency,
        int emergencySeverity,
        boolean businessHours
) {
}
