package com.example.hazardrisk.domain.model;

public record ValueCount(String value, long count) {
}
