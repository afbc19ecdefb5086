package com.example.annotate.config;

import com.example.annotate.aggregate.FlagReason;

import java.util.Map;

public interface AnnotateProps {
    Store store();

    Flags flags();

    interface Store {
        long timeoutMs();

        int readRetries();
    }

    interface Flags {
        Map<FlagReason, Double> weights();
    }
}
