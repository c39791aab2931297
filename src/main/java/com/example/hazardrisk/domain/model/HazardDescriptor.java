package com.example.hazardrisk.domain.model;

import jakarta.validation.constraints.NotBlank;

public record HazardDescriptor(@NotBlank String label, String category) {
}
