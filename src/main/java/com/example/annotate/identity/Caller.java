package com.example.annotate.identity;

/**
 * The session principal as handed over by the authenticating gateway. Both fields may be null.
 */
public record Caller(String uid, String displayName) {

    public static Caller anonymous() {
        return new Caller(null, null);
    }
}
