package com.example.annotate.mutation.dto;

import com.example.annotate.aggregate.FlagReason;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record FlagWebsiteRequest(
        @NotBlank String url,
        @NotBlank String urlHash,
        @NotNull FlagReason reason
) {}
