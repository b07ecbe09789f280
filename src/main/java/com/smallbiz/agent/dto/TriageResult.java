package com.smallbiz.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.smallbiz.agent.conversation.CallIntent;
import com.smallbiz.agent.conversation.TriageAction;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriageResult(
        TriageAction action,
        String response,
        CallIntent intent,
        double confidence,
        boolean emergency,
        int emergencySeverity,
        boolean businessHours,
        List<String> matchedKeywords,
        String transferNumber
) {

    public static TriageResult fallback(String response) {
        return new TriageResult(TriageAction.HANDLE_ERROR, response, CallIntent.ERROR, 1.0,
                false, 0, true, List.of(), null);
    }
}
