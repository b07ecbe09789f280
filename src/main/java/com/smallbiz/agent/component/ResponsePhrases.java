package com.smallbiz.agent.component;

import com.smallbiz.agent.entity.BusinessHours;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Component
public class ResponsePhrases {

    private static final DateTimeFormatter TWELVE_HOUR = DateTimeFormatter.ofPattern("h:mm a", Locale.US);
    private static final DateTimeFormatter BOOKED_AT = DateTimeFormatter.ofPattern("EEEE, MMMM d 'at' h:mm a", Locale.US);

    public static final String TECHNICAL_ISSUE =
            "I apologize, but I am experiencing a technical issue. Please try again later or leave a message.";

    public String personalise(String callerName, String text) {
        return StringUtils.isNotBlank(callerName) ? "Hello " + callerName.trim() + ". " + text : text;
    }

    public String emergencyTransfer() {
        return "I understand this is an emergency situation. I'll connect you with our on-call staff immediately.";
    }

    public String afterHoursScheduling(String afterHoursMessage) {
        return closed(afterHoursMessage) + " I can help you schedule an appointment for when we're open.";
    }

    public String afterHoursVoicemail(String afterHoursMessage) {
        return closed(afterHoursMessage) + " Would you like to leave a voicemail?";
    }

    public String afterHoursInfo(String afterHoursMessage) {
        return closed(afterHoursMessage) + " I'd be happy to provide information about our services or take a message.";
    }

    public String scheduleAppointment() {
        return "I'd be happy to help you schedule an appointment. What day and time works best for you?";
    }

    public String provideInfo() {
        return "I'd be happy to provide information about our services and pricing. What specific service are you interested in?";
    }

    public String checkStatus() {
        return "I can help you check the status of your service. Could you please provide your name or phone number so I can look that up for you?";
    }

    public String transferToManager() {
        return "I'm sorry to hear you're experiencing an issue. Let me connect you with our customer service manager who can help resolve this for you.";
    }

    public String paymentOptions() {
        return "I can help you with payment options or questions about your invoice. What specifically do you need assistance with?";
    }

    public String provideLocation() {
        return "I'd be happy to provide our location and directions. Let me share our address with you.";
    }

    /** Lists the week Monday first, e.g. {@code Monday: 9:00 AM to 5:00 PM, Sunday: Closed}. */
    public String businessHours(List<BusinessHours> week) {
        if (week.isEmpty()) {
            return "Our business hours are not available right now.";
        }
        return "Our business hours are: " + week.stream()
                .map(h -> dayName(h.getDayOfWeek()) + ": "
                        + (h.isOpenDay() ? twelveHour(h.getOpenTime()) + " to " + twelveHour(h.getCloseTime()) : "Closed"))
                .collect(Collectors.joining(", "));
    }

    public String listServices(List<String> serviceNames) {
        if (serviceNames.isEmpty()) {
            return "We offer a variety of services. Is there a specific service you're interested in?";
        }
        return "We offer a variety of services including " + String.join(", ", serviceNames)
                + ". Is there a specific service you're interested in?";
    }

    public String continueConversation(String configuredGreeting) {
        return StringUtils.defaultIfBlank(configuredGreeting, "How can I assist you today?");
    }

    public String alternativesOffered() {
        return "The requested time is not available. Here are some alternative times that are available.";
    }

    public String slotTaken() {
        return "Requested time slot is already booked.";
    }

    public String bookingConfirmed(LocalDateTime start) {
        return "Appointment successfully scheduled for " + start.format(BOOKED_AT) + ".";
    }

    public String availableTimes() {
        return "Here are the available appointment slots in the next 7 days.";
    }

    public String noAvailableTimes() {
        return "No available appointment slots in the next 7 days. Would you like to check availability further in the future?";
    }

    public String bookingFailed() {
        return "Unable to schedule appointment";
    }

    public String schedulingError() {
        return "Sorry, I encountered an error while scheduling your appointment.";
    }

    public String voicemailPrompt() {
        return "Please leave your message after the tone. Press any key or hang up when you are done.";
    }

    public String goodbye() {
        return "Thank you for calling. Goodbye!";
    }

    public String didNotCatch() {
        return "Sorry, I didn't catch that. Could you say it again?";
    }

    static String twelveHour(LocalTime time) {
        return time.format(TWELVE_HOUR);
    }

    private static String dayName(int dayOfWeek) {
        return DayOfWeek.of(dayOfWeek).getDisplayName(TextStyle.FULL, Locale.US);
    }

    private static String closed(String afterHoursMessage) {
        return StringUtils.defaultIfBlank(afterHoursMessage, "Our office is currently closed.");
    }
}
