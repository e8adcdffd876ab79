package com.ospicorp.tsanalysis.series.repository;

public record DataPointRow(
    String timeSeriesId,
    int rowIndex,
    String timestamp,
    String columnName,
    Double value
) {}
