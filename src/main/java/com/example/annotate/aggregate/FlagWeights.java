package com.example.annotate.aggregate;

import com.example.annotate.config.AnnotateProps;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Component
public class FlagWeights {

    private final Map<FlagReason, Double> weights;

    public FlagWeights(AnnotateProps props) {
        Map<FlagReason, Double> configured = props.flags().weights();
        EnumMap<FlagReason, Double> table = new EnumMap<>(FlagReason.class);
        for (FlagReason reason : FlagReason.values()) {
            Double w = configured.get(reason);
            if (w != null && w < 0) {
                throw new IllegalArgumentException("flag weight must be >= 0: " + reason + "=" + w);
            }
            table.put(reason, w != null ? w : reason.defaultWeight());
        }
        this.weights = Collections.unmodifiableMap(table);
    }

    public double weightOf(FlagReason reason) {
        return weights.get(reason);
    }

    public Map<FlagReason, Double> table() {
        return weights;
    }
}
