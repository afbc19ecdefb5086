package com.example.annotate.mutation.dto;

import jakarta.validation.constraints.NotBlank;

public record CommentRef(
        @NotBlank String url,
        @NotBlank String urlHash,
        @NotBlank String commentId
) {}
