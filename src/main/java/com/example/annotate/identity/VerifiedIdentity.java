package com.example.annotate.identity;

public record VerifiedIdentity(String uid, String displayName, String username) {
}
