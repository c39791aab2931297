package com.example.hazardrisk.domain.model;

/**
 * OSHA {@code incident_outcome} codes. Anything outside 1..4 (including a missing
 * value) is {@link #UNKNOWN}.
 */
public enum OutcomeCode {

    FATAL(1),
    DAYS_AWAY(2),
    JOB_TRANSFER_RESTRICTION(3),
    OTHER_RECORDABLE(4),
    UNKNOWN(0);

    private final int code;

    OutcomeCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static OutcomeCode fromCode(Integer code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (OutcomeCode oc : values()) {
            if (oc != UNKNOWN && oc.code == code) {
                return oc;
            }
        }
        return UNKNOWN;
    }

    public String label(int daysAway, int jobTransferDays) {
        return switch (this) {
            case FATAL -> "FATAL";
            case DAYS_AWAY -> daysAway > 0 ? daysAway + " days away from work" : "Days away from work";
            case JOB_TRANSFER_RESTRICTION -> jobTransferDays > 0
                    ? jobTransferDays + " days job transfer/restriction"
                    : "Job transfer/restriction";
            case OTHER_RECORDABLE -> "Other recordable case";
            case UNKNOWN -> "Unknown";
        };
    }
}
