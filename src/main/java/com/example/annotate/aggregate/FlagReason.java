package com.example.annotate.aggregate;

import java.util.Optional;

/**
 * Why a website was flagged, with the severity weight used when no weight is configured.
 */
public enum FlagReason {
    SPAM(1.0),
    MISLEADING(2.0),
    INAPPROPRIATE(2.0),
    HARASSMENT(3.0),
    HATE_SPEECH(4.0),
    VIOLENCE(4.0),
    SCAM(5.0),
    MALWARE(5.0);

    private final double defaultWeight;

    FlagReason(double defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    public static Optional<FlagReason> parse(String name) {
        if (name == null) return Optional.empty();
        for (FlagReason r : values()) {
            if (r.name().equals(name)) return Optional.of(r);
        }
        return Optional.empty();
    }
}
