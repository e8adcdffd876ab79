package com.ospicorp.tsanalysis.series.model;

import java.util.List;
import java.util.Map;

public record TimeDomainData(List<TimeValue> time, Map<String, List<Double>> series) {}
