package com.smallbiz.agent.dto;

/**
 * One inbound caller turn, typed per intake channel.
 */
public sealed interface CallRequest permits VoiceCallRequest, TextMessageRequest {

    Long businessId();

    /** Phone number or channel handle of the caller. */
    String callerId();

    String text();

    /** Caller's name when already known, otherwise null. */
    String callerName();

    String channel();
}
