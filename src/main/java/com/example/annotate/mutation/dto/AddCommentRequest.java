package com.example.annotate.mutation.dto;

import com.example.annotate.persistence.entity.WebsiteMetadata;
import jakarta.validation.constraints.NotBlank;

/**
 * New comment. {@code commentId} is generated by the client with collision-resistant randomness.
 * The creation time is always stamped by the server.
 */
public record AddCommentRequest(
        @NotBlank String commentId,
        @NotBlank String url,
        @NotBlank String urlHash,
        String domain,
        @NotBlank String body,
        WebsiteMetadata website
) {}
