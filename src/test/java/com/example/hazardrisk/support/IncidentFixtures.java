package com.example.hazardrisk.support;

import com.example.hazardrisk.domain.model.IncidentRecord;
import com.example.hazardrisk.domain.model.OutcomeCode;

public final class IncidentFixtures {

    private IncidentFixtures() {
    }

    public static Builder incident(long id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final long id;
        private Integer year = 2023;
        private OutcomeCode outcome = OutcomeCode.OTHER_RECORDABLE;
        private int daysAway;
        private int jobTransferDays;
        private String whatHappened;
        private String location;
        private String injuryIllness;
        private String objectSubstance;
        private String eventType;
        private String source;
        private String natureOfInjury;
        private String bodyPart;

        private Builder(long id) {
            this.id = id;
        }

        public Builder year(Integer year) {
            this.year = year;
            return this;
        }

        public Builder fatal() {
            this.outcome = OutcomeCode.FATAL;
            return this;
        }

        public Builder outcome(OutcomeCode outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder daysAway(int daysAway) {
            this.daysAway = daysAway;
            if (outcome == OutcomeCode.OTHER_RECORDABLE && daysAway > 0) {
                this.outcome = OutcomeCode.DAYS_AWAY;
            }
            return this;
        }

        public Builder jobTransferDays(int days) {
            this.jobTransferDays = days;
            return this;
        }

        public Builder whatHappened(String text) {
            this.whatHappened = text;
            return this;
        }

        public Builder location(String text) {
            this.location = text;
            return this;
        }

        public Builder injury(String text) {
            this.injuryIllness = text;
            return this;
        }

        public Builder object(String text) {
            this.objectSubstance = text;
            return this;
        }

        public Builder event(String text) {
            this.eventType = text;
            return this;
        }

        public Builder source(String text) {
            this.source = text;
            return this;
        }

        public Builder nature(String text) {
            this.natureOfInjury = text;
            return this;
        }

        public Builder bodyPart(String text) {
            this.bodyPart = text;
            return this;
        }

        public IncidentRecord build() {
            return new IncidentRecord(
                    id, "Acme Builders", "Denver", "CO", "236220",
                    year, "2023-05-01", outcome, daysAway, jobTransferDays, "Laborer",
                    whatHappened, null, location, injuryIllness, objectSubstance, null,
                    eventType, source, null, natureOfInjury, bodyPart
            );
        }
    }
}
