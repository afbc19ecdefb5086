package com.example.annotate.mutation;

import com.example.annotate.error.AnnotateException;
import com.example.annotate.error.ErrorKind;

final class Payloads {
    private Payloads() {}

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new AnnotateException(ErrorKind.INVALID_PAYLOAD, field + " is required");
        }
        return value;
    }

    static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw new AnnotateException(ErrorKind.INVALID_PAYLOAD, field + " is required");
        }
        return value;
    }
}
