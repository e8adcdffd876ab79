package com.ospicorp.tsanalysis.series.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisSummary(
    @JsonProperty("analysis_id") String analysisId,
    String name,
    String description,
    @JsonProperty("time_column") String timeColumn,
    @JsonProperty("value_columns") List<String> valueColumns,
    @JsonProperty("point_count") int pointCount,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {}
