package com.example.hazardrisk.domain.model;

/**
 * One row of the incident corpus. Written once at ingestion and never updated.
 */
public record IncidentRecord(
        long id,
        String establishmentName,
        String city,
        String state,
        String naicsCode,
        Integer year,
        String dateOfIncident,
        OutcomeCode outcome,
        int daysAway,
        int jobTransferDays,
        String jobDescription,
        String whatHappened,
        String beforeIncident,
        String location,
        String injuryIllness,
        String objectSubstance,
        String description,
        String eventType,
        String source,
        String secondarySource,
        String natureOfInjury,
        String bodyPart
) {

    public IncidentRecord {
        outcome = outcome == null ? OutcomeCode.UNKNOWN : outcome;
        daysAway = Math.max(0, daysAway);
        jobTransferDays = Math.max(0, jobTransferDays);
    }

    public boolean fatal() {
        return outcome == OutcomeCode.FATAL;
    }

    public String outcomeLabel() {
        return outcome.label(daysAway, jobTransferDays);
    }

    public String valueOf(IncidentField field) {
        return switch (field) {
            case WHAT_HAPPENED -> whatHappened;
            case BEFORE_INCIDENT -> beforeIncident;
            case LOCATION -> location;
            case INJURY_ILLNESS -> injuryIllness;
            case OBJECT_SUBSTANCE -> objectSubstance;
            case DESCRIPTION -> description;
            case EVENT_TYPE -> eventType;
            case SOURCE -> source;
            case SECONDARY_SOURCE -> secondarySource;
            case NATURE_OF_INJURY -> natureOfInjury;
            case BODY_PART -> bodyPart;
        };
    }
}
