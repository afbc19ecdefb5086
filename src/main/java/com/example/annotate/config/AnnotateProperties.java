package com.example.annotate.config;

import com.example.annotate.aggregate.FlagReason;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

@ConfigurationProperties(prefix = "annotate")
public record AnnotateProperties(
        StoreProperties store,
        FlagProperties flags
) implements AnnotateProps {

    public AnnotateProperties {
        if (store == null) store = new StoreProperties(0, 0);
        if (flags == null) flags = new FlagProperties(Map.of());
    }

    public record StoreProperties(long timeoutMs, int readRetries) implements Store {
        public StoreProperties {
            if (timeoutMs <= 0) timeoutMs = 5_000;
            if (readRetries < 0) readRetries = 0;
        }
    }

    public record FlagProperties(Map<FlagReason, Double> weights) implements Flags {
        public FlagProperties {
            weights = weights == null ? Map.of() : Map.copyOf(weights);
        }
    }
}
