package com.smallbiz.agent.calendar;

public record IntegrationStatus(boolean google, boolean microsoft, boolean apple) {

    public boolean isConnected(CalendarProvider provider) {
        switch (provider) {
            case GOOGLE:
                return google;
            case MICROSOFT:
                return microsoft;
            default:
                return apple;
        }
    }
}
