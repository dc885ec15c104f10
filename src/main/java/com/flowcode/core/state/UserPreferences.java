package com.flowcode.core.state;

import com.flowcode.core.model.RiskLevel;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view over the user's key/value preferences. Unknown keys are kept as-is.
 */
public record UserPreferences(Map<String, String> values) {

    public static final String AUTO_APPROVAL_LEVEL = "autoApprovalLevel";
    public static final String NOTIFICATION_LEVEL = "notificationLevel";
    public static final String APPROVAL_TIMEOUT = "approvalTimeout";
    public static final String LEARNING_ENABLED = "learningEnabled";
    public static final String ADAPTIVE_BEHAVIOR = "adaptiveBehavior";
    public static final String RISK_TOLERANCE = "riskTolerance";

    private static final List<String> APPROVAL_LEVELS = List.of("none", "low", "medium", "high");
    private static final List<String> NOTIFICATION_LEVELS = List.of("minimal", "normal", "verbose");
    private static final List<String> RISK_TOLERANCES = List.of("conservative", "balanced", "aggressive");

    public UserPreferences {
        values = Map.copyOf(values);
    }

    public static Map<String, String> defaults() {
        var defaults = new LinkedHashMap<String, String>();
        defaults.put(AUTO_APPROVAL_LEVEL, "none");
        defaults.put(NOTIFICATION_LEVEL, "normal");
        defaults.put(APPROVAL_TIMEOUT, "PT5M");
        defaults.put(LEARNING_ENABLED, "true");
        defaults.put(ADAPTIVE_BEHAVIOR, "true");
        defaults.put(RISK_TOLERANCE, "balanced");
        return defaults;
    }

    /**
     * Highest risk level that may be approved without asking, empty when nothing is.
     */
    public Optional<RiskLevel> autoApprovalLevel() {
        String level = values.getOrDefault(AUTO_APPROVAL_LEVEL, "none").toLowerCase(Locale.ROOT);
        if ("none".equals(level)) {
            return Optional.empty();
        }
        return Optional.of(RiskLevel.valueOf(level.toUpperCase(Locale.ROOT)));
    }

    public String notificationLevel() {
        return values.getOrDefault(NOTIFICATION_LEVEL, "normal");
    }

    public Duration approvalTimeout() {
        return Duration.parse(values.getOrDefault(APPROVAL_TIMEOUT, "PT5M"));
    }

    public boolean learningEnabled() {
        return Boolean.parseBoolean(values.getOrDefault(LEARNING_ENABLED, "true"));
    }

    public boolean adaptiveBehavior() {
        return Boolean.parseBoolean(values.getOrDefault(ADAPTIVE_BEHAVIOR, "true"));
    }

    public String riskTolerance() {
        return values.getOrDefault(RISK_TOLERANCE, "balanced");
    }

    /**
     * Rejects malformed values for the known keys.
     */
    static void validate(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Preference " + key + " must not be null");
        }
        String lower = value.toLowerCase(Locale.ROOT);
        switch (key) {
            case AUTO_APPROVAL_LEVEL -> requireOneOf(key, lower, APPROVAL_LEVELS);
            case NOTIFICATION_LEVEL -> requireOneOf(key, lower, NOTIFICATION_LEVELS);
            case RISK_TOLERANCE -> requireOneOf(key, lower, RISK_TOLERANCES);
            case LEARNING_ENABLED, ADAPTIVE_BEHAVIOR -> requireOneOf(key, lower, List.of("true", "false"));
            case APPROVAL_TIMEOUT -> {
                try {
                    if (Duration.parse(value).isNegative()) {
                        throw new IllegalArgumentException("Preference " + key + " must not be negative");
                    }
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Preference " + key + " must be an ISO-8601 duration, got " + value, e);
                }
            }
            default -> { }
        }
    }

    private static void requireOneOf(String key, String value, List<String> allowed) {
        if (!allowed.contains(value)) {
            throw new IllegalArgumentException("Preference " + key + " must be one of " + allowed + ", got " + value);
        }
    }
}
