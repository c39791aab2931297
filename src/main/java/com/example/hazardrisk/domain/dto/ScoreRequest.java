package com.example.hazardrisk.domain.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreRequest {
    @NotNull
    @PositiveOrZero
    private Long frequency;

    @NotNull
    @PositiveOrZero
    private Long fatalCount;

    @NotNull
    @PositiveOrZero
    private Double avgDaysAway;

    @NotNull
    @PositiveOrZero
    private Long severeCount;
}
