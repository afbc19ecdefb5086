package com.example.annotate.mutation;

public enum Toggle {
    ADDED,
    FLIPPED,
    REMOVED
}
