package com.example.annotate.mutation.dto;

import com.example.annotate.persistence.entity.WebsiteMetadata;
import jakarta.validation.constraints.NotBlank;

/**
 * Vote on a website. The metadata is used to index the page when nobody has indexed it yet.
 */
public record VoteWebsiteRequest(
        @NotBlank String url,
        @NotBlank String urlHash,
        WebsiteMetadata website
) {}
