package com.example.annotate.mutation;

public enum VoteDirection {
    UP,
    DOWN
}
