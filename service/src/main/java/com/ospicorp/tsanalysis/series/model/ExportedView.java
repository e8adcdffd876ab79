package com.ospicorp.tsanalysis.series.model;

public record ExportedView(String filename, String mediaType, Object content) {}
