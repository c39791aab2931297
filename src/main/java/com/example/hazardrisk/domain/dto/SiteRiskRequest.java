package com.example.hazardrisk.domain.dto;

import com.example.hazardrisk.domain.model.HazardDescriptor;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
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
public class SiteRiskRequest {
    // hazard id -> descriptor, in registry order
    @Builder.Default
    private Map<String, @Valid HazardDescriptor> hazards = new LinkedHashMap<>();
}
