package com.example.hazardrisk.domain.dto;

import com.example.hazardrisk.domain.model.CategoryStats;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class CategoryStatsResponse {
    private String category;
    private String headline;
    private CategoryStats stats;
}
