package com.example.annotate.mutation.dto;

import jakarta.validation.constraints.NotBlank;

public record EditCommentRequest(
        @NotBlank String url,
        @NotBlank String urlHash,
        @NotBlank String commentId,
        @NotBlank String body
) {}
