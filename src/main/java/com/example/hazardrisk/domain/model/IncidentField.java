package com.example.hazardrisk.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Searchable text columns of an incident, with the SQL column and the
 * Elasticsearch field each one is stored under.
 */
public enum IncidentField {

    WHAT_HAPPENED("nar_what_happened", "whatHappened"),
    BEFORE_INCIDENT("nar_before_incident", "beforeIncident"),
    LOCATION("incident_location", "location"),
    INJURY_ILLNESS("nar_injury_illness", "injuryIllness"),
    OBJECT_SUBSTANCE("nar_object_substance", "objectSubstance"),
    DESCRIPTION("incident_description", "description"),
    EVENT_TYPE("event_title_pred", "eventType"),
    SOURCE("source_title_pred", "source"),
    SECONDARY_SOURCE("sec_source_title_pred", "secondarySource"),
    NATURE_OF_INJURY("nature_title_pred", "natureOfInjury"),
    BODY_PART("part_title_pred", "bodyPart");

    /**
     * Fields covered by lexical search and by its substring fallback.
     */
    public static final Set<IncidentField> NARRATIVE_FIELDS = EnumSet.of(
            WHAT_HAPPENED, BEFORE_INCIDENT, LOCATION, INJURY_ILLNESS, OBJECT_SUBSTANCE, DESCRIPTION,
            EVENT_TYPE, SOURCE, NATURE_OF_INJURY
    );

    public static final Set<IncidentField> CLASSIFICATION_FIELDS = EnumSet.of(EVENT_TYPE, SOURCE);

    private final String column;
    private final String indexField;

    IncidentField(String column, String indexField) {
        this.column = column;
        this.indexField = indexField;
    }

    public String column() {
        return column;
    }

    public String indexField() {
        return indexField;
    }
}
