package com.ospicorp.tsanalysis.series.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResult(
    @JsonProperty("analysis_id") String analysisId,
    List<String> columns,
    @JsonProperty("time_column") String timeColumn,
    @JsonProperty("value_columns") List<String> valueColumns,
    @JsonProperty("time_domain") TimeDomainData timeDomain,
    @JsonProperty("frequency_domain") FrequencyDomainData frequencyDomain
) {}
