package com.smallbiz.agent.service;

import com.smallbiz.agent.conversation.CallIntent;
import com.smallbiz.agent.conversation.IntentMatch;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword based classifier. Categories are tried in a fixed order and the first one with a hit wins;
 * more hits within that category raise the confidence.
 */
@Service
public class IntentClassifier {

    static final double BASE_CONFIDENCE = 0.7;
    static final double PER_EXTRA_KEYWORD = 0.1;
    static final double MAX_CONFIDENCE = 0.95;

    private static final Map<CallIntent, List<String>> KEYWORDS;

    static {
        Map<CallIntent, List<String>> m = new LinkedHashMap<>();
        m.put(CallIntent.APPOINTMENT, List.of("schedule", "appointment", "book", "reserve", "set up a time", "make an appointment"));
        m.put(CallIntent.INQUIRY, List.of("price", "cost", "estimate", "how much", "information", "details", "question"));
        m.put(CallIntent.STATUS, List.of("status", "update", "progress", "how is", "when will", "completion"));
        m.put(CallIntent.COMPLAINT, List.of("problem", "issue", "unhappy", "dissatisfied", "poor", "bad", "complaint"));
        m.put(CallIntent.PAYMENT, List.of("pay", "payment", "invoice", "bill", "receipt", "charge", "credit card"));
        m.put(CallIntent.LOCATION, List.of("address", "where", "location", "directions", "how to get", "find you"));
        m.put(CallIntent.HOURS, List.of("hours", "open", "close", "time", "schedule", "when are you open"));
        m.put(CallIntent.SERVICES, List.of("service", "offer", "provide", "do you", "can you", "available"));
        KEYWORDS = Collections.unmodifiableMap(m);
    }

    public IntentMatch classify(String text) {
        if (StringUtils.isBlank(text)) {
            return IntentMatch.general();
        }
        for (Map.Entry<CallIntent, List<String>> category : KEYWORDS.entrySet()) {
            List<String> hits = matches(text, category.getValue());
            if (!hits.isEmpty()) {
                double confidence = Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + PER_EXTRA_KEYWORD * (hits.size() - 1));
                return new IntentMatch(category.getKey(), round(confidence), hits);
            }
        }
        return IntentMatch.general();
    }

    /**
     * Matches the business's own emergency keywords. Severity is the number of hits, at most 3.
     *
     * @return an EMERGENCY match, or null when nothing matched
     */
    public IntentMatch detectEmergency(String text, List<String> emergencyKeywords) {
        if (StringUtils.isBlank(text) || emergencyKeywords == null || emergencyKeywords.isEmpty()) {
            return null;
        }
        List<String> hits = matches(text, emergencyKeywords);
        if (hits.isEmpty()) {
            return null;
        }
        return new IntentMatch(CallIntent.EMERGENCY, emergencyConfidence(severity(hits)), hits);
    }

    public static int severity(List<String> emergencyHits) {
        return Math.min(3, emergencyHits.size());
    }

    static double emergencyConfidence(int severity) {
        return round(0.90 + 0.03 * severity);
    }

    private static List<String> matches(String text, List<String> keywords) {
        List<String> hits = new ArrayList<>();
        for (String keyword : keywords) {
            if (StringUtils.isNotBlank(keyword) && StringUtils.containsIgnoreCase(text, keyword.trim())) {
                hits.add(keyword.trim());
            }
        }
        return hits;
    }

    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
