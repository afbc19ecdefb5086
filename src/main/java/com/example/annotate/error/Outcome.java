package com.example.annotate.error;

/**
 * What a caller receives from every operation: either {@code status=true} with the payload
 * (null for writes) or {@code status=false} with a caller-safe reason.
 */
public record Outcome<T>(
        boolean status,
        T payload,
        ErrorKind error,
        String reason
) {
    public static <T> Outcome<T> success(T payload) {
        return new Outcome<>(true, payload, null, null);
    }

    public static <T> Outcome<T> fail(ErrorKind kind) {
        return new Outcome<>(false, null, kind, kind.publicMessage());
    }
}
