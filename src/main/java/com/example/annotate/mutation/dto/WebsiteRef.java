package com.example.annotate.mutation.dto;

import jakarta.validation.constraints.NotBlank;

public record WebsiteRef(
        @NotBlank String url,
        @NotBlank String urlHash
) {}
