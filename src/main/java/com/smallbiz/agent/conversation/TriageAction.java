package com.smallbiz.agent.conversation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TriageAction {
    TRANSFER_EMERGENCY,
    SCHEDULE_APPOINTMENT,
    TAKE_VOICEMAIL,
    PROVIDE_INFO,
    CHECK_STATUS,
    TRANSFER_TO_MANAGER,
    PAYMENT_OPTIONS,
    PROVIDE_LOCATION,
    PROVIDE_HOURS,
    LIST_SERVICES,
    CONTINUE_CONVERSATION,
    HANDLE_ERROR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTransfer() {
        return this == TRANSFER_EMERGENCY || this == TRANSFER_TO_MANAGER;
    }
}
