package com.example.hazardrisk.infrastructure.corpus;

import com.example.hazardrisk.domain.model.IncidentRecord;
import com.example.hazardrisk.domain.model.OutcomeCode;
import java.sql.ResultSet;
import java.sql.SQLException;
import org.springframework.jdbc.core.RowMapper;

class IncidentRowMapper implements RowMapper<IncidentRecord> {

    static final String COLUMNS = String.join(", ",
            "id", "establishment_name", "city", "state", "naics_code",
            "year_filing_for", "date_of_incident", "incident_outcome",
            "dafw_num_away", "djtr_num_tr", "job_description",
            "nar_what_happened", "nar_before_incident", "incident_location",
            "nar_injury_illness", "nar_object_substance", "incident_description",
            "event_title_pred", "source_title_pred", "sec_source_title_pred",
            "nature_title_pred", "part_title_pred");

    @Override
    public IncidentRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new IncidentRecord(
                rs.getLong("id"),
                rs.getString("establishment_name"),
                rs.getString("city"),
                rs.getString("state"),
                rs.getString("naics_code"),
                nullableInt(rs, "year_filing_for"),
                rs.getString("date_of_incident"),
                OutcomeCode.fromCode(nullableInt(rs, "incident_outcome")),
                rs.getInt("dafw_num_away"),
                rs.getInt("djtr_num_tr"),
                rs.getString("job_description"),
                rs.getString("nar_what_happened"),
                rs.getString("nar_before_incident"),
                rs.getString("incident_location"),
                rs.getString("nar_injury_illness"),
                rs.getString("nar_object_substance"),
                rs.getString("incident_description"),
                rs.getString("event_title_pred"),
                rs.getString("source_title_pred"),
                rs.getString("sec_source_title_pred"),
                rs.getString("nature_title_pred"),
                rs.getString("part_title_pred")
        );
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }
}
