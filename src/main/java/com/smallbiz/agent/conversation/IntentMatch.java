package com.smallbiz.agent.conversation;

import java.util.Collections;
import java.util.List;

/**
 * Result of keyword classification: the winning intent, its confidence and the keywords that fired.
 */
public final class IntentMatch {

    private final CallIntent intent;
    private final double confidence;
    private final List<String> matchedKeywords;

    public IntentMatch(CallIntent intent, double confidence, List<String> matchedKeywords) {
        this.intent = intent;
        this.confidence = confidence;
        this.matchedKeywords = matchedKeywords != null ? List.copyOf(matchedKeywords) : Collections.emptyList();
    }

    public CallIntent getIntent() {
        return intent;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<String> getMatchedKeywords() {
        return matchedKeywords;
    }

    public boolean is(CallIntent other) {
        return intent == other;
    }

    public static IntentMatch general() {
        return new IntentMatch(CallIntent.GENERAL, 0.0, List.of());
    }
}
