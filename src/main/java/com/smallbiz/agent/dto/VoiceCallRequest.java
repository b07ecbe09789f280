package com.smallbiz.agent.dto;

/**
 * Speech transcribed by Twilio during a phone call.
 */
public record VoiceCallRequest(Long businessId, String callSid, String callerId, String text, String callerName)
        implements CallRequest {

    @Override
    public String channel() {
        return "voice";
    }
}
