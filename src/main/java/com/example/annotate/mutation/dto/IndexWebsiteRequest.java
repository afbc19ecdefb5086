package com.example.annotate.mutation.dto;

import com.example.annotate.persistence.entity.WebsiteMetadata;
import jakarta.validation.constraints.NotBlank;

public record IndexWebsiteRequest(
        @NotBlank String url,
        @NotBlank String urlHash,
        WebsiteMetadata website
) {}
