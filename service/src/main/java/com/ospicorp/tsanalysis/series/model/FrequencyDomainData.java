package com.ospicorp.tsanalysis.series.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record FrequencyDomainData(
    Map<String, List<Double>> frequencies,
    Map<String, List<Double>> amplitudes,
    @JsonProperty("sample_spacing") double sampleSpacing,
    @JsonProperty("spacing_estimated") boolean spacingEstimated
) {}
