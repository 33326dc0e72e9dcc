package com.example.cronpurge.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record RetentionFilterHttpRequest(
        @JsonProperty("column") @NotBlank String column,
        @JsonProperty("days") int days
) {}
