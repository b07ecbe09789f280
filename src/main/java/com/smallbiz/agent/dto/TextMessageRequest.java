package com.smallbiz.agent.dto;

/**
 * SMS or web chat message.
 */
public record TextMessageRequest(Long businessId, String callerId, String text, String callerName, String email)
        implements CallRequest {

    @Override
    public String channel() {
        return "text";
    }
}
