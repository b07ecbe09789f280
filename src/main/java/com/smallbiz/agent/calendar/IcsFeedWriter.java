package com.smallbiz.agent.calendar;

import com.smallbiz.agent.entity.Appointment;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders iCalendar documents for the Apple subscription feed.
 */
@Component
public class IcsFeedWriter {

    static final String CRLF = "\r\n";
    private static final DateTimeFormatter ICS_DT_FMT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");
    private static final Pattern VEVENT = Pattern.compile("BEGIN:VEVENT[\\s\\S]*?END:VEVENT");

    public String eventDocument(String uid, Appointment appointment, ZoneId zone, Instant now) {
        StringBuilder sb = new StringBuilder();
        appendHeader(sb);
        sb.append("BEGIN:VEVENT").append(CRLF);
        sb.append("UID:").append(uid).append(CRLF);
        sb.append("DTSTAMP:").append(ICS_DT_FMT.format(now.atOffset(ZoneOffset.UTC))).append(CRLF);
        sb.append("DTSTART:").append(utc(appointment.getStartTime(), zone)).append(CRLF);
        sb.append("DTEND:").append(utc(appointment.getEndTime(), zone)).append(CRLF);
        sb.append("SUMMARY:").append(summary(appointment)).append(CRLF);
        sb.append("DESCRIPTION:").append(escapeIcs(appointment.getNotes())).append(CRLF);
        sb.append("END:VEVENT").append(CRLF);
        sb.append("END:VCALENDAR");
        return sb.toString();
    }

    public String emptyFeed(Long businessId) {
        return feed(businessId, List.of());
    }

    /**
     * Builds the subscription feed from already rendered event documents, keeping only their VEVENT blocks.
     */
    public String feed(Long businessId, List<String> eventDocuments) {
        StringBuilder sb = new StringBuilder();
        appendHeader(sb);
        sb.append("X-WR-CALNAME:Business Calendar ").append(businessId).append(CRLF);
        sb.append("X-WR-TIMEZONE:UTC").append(CRLF);
        sb.append("X-WR-CALDESC:Appointment calendar for business ").append(businessId).append(CRLF);
        for (String document : eventDocuments) {
            Matcher m = VEVENT.matcher(document);
            if (m.find()) {
                sb.append(m.group()).append(CRLF);
            }
        }
        sb.append("END:VCALENDAR");
        return sb.toString();
    }

    static String summary(Appointment appointment) {
        return appointment.getServiceId() != null ? "Appointment #" + appointment.getId() : "Appointment";
    }

    private static void appendHeader(StringBuilder sb) {
        sb.append("BEGIN:VCALENDAR").append(CRLF);
        sb.append("VERSION:2.0").append(CRLF);
        sb.append("PRODID:-//SmallBizAgent//Calendar//EN").append(CRLF);
        sb.append("CALSCALE:GREGORIAN").append(CRLF);
        sb.append("METHOD:PUBLISH").append(CRLF);
    }

    private static String utc(LocalDateTime time, ZoneId zone) {
        return time.atZone(zone).withZoneSameInstant(ZoneOffset.UTC).format(ICS_DT_FMT);
    }

    private static String escapeIcs(String value) {
        if (value == null) {
            return "";
        }
        return value
                .replace("\\", "\\\\")
                .replace(";", "\\;")
                .replace(",", "\\,")
                .replace("\r\n", "\\n")
                .replace("\n", "\\n");
    }
}
