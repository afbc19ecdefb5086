package com.example.annotate.aggregate;

/**
 * Redis layout of the aggregate store.
 * <pre>
 * websites:{hash}                  hash: impressions, commentCount, flagCount, flagsCumulativeWeight
 * websites:{hash}:flagDistribution hash: {reason} -> count
 * users:{uid}                      hash: username
 * </pre>
 */
public final class AggregateKeys {
    private AggregateKeys() {}

    public static final String IMPRESSIONS = "impressions";
    public static final String COMMENT_COUNT = "commentCount";
    public static final String FLAG_COUNT = "flagCount";
    public static final String FLAGS_CUMULATIVE_WEIGHT = "flagsCumulativeWeight";
    public static final String USERNAME = "username";

    public static String website(String urlHash) {
        return "websites:" + urlHash;
    }

    public static String flagDistribution(String urlHash) {
        return "websites:" + urlHash + ":flagDistribution";
    }

    public static String user(String uid) {
        return "users:" + uid;
    }
}
