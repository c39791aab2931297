package com.example.hazardrisk.domain.model;

public record EvidenceResult(
        long incidentId,
        String whatHappened,
        String snippet,
        String injuryDescription,
        String objectInvolved,
        String location,
        String outcome,
        int daysAway,
        String eventType,
        String source,
        String natureOfInjury,
        String bodyPart,
        Integer year,
        boolean fatal,
        double confidence
) {
}
