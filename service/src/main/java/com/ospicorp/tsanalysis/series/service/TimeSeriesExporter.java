package com.ospicorp.tsanalysis.series.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.tsanalysis.series.model.AnalysisResult;
import com.ospicorp.tsanalysis.series.model.FrequencyDomainData;
import com.ospicorp.tsanalysis.series.model.TimeDomainData;
import com.ospicorp.tsanalysis.series.model.TimeValue;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TimeSeriesExporter {
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final CsvMapper csvMapper = new CsvMapper();
  private final ObjectMapper objectMapper;

  public TimeSeriesExporter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    csvMapper.findAndRegisterModules();
  }

  public String timeDomainCsv(String timeColumn, List<String> valueColumns, TimeDomainData data) {
    CsvSchema.Builder builder = CsvSchema.builder().addColumn(timeColumn);
    valueColumns.forEach(builder::addColumn);
    CsvSchema schema = builder.setUseHeader(true).build();

    List<Map<String, Object>> rows = new ArrayList<>(data.time().size());
    for (int i = 0; i < data.time().size(); i++) {
      Map<String, Object> row = new LinkedHashMap<>();
      TimeValue time = data.time().get(i);
      row.put(timeColumn, time.render());
      for (String column : valueColumns) {
        row.put(column, data.series().get(column).get(i));
      }
      rows.add(row);
    }
    return write(schema, rows);
  }

  /**
   * One block per value column: a {@code <col>_frequency,<col>_amplitude} header, its bins, then a
   * blank line before the next block.
   */
  public String frequencyDomainCsv(List<String> valueColumns, FrequencyDomainData data) {
    StringBuilder out = new StringBuilder();
    for (String column : valueColumns) {
      String frequencyHeader = column + "_frequency";
      String amplitudeHeader = column + "_amplitude";
      CsvSchema schema = CsvSchema.builder()
          .addColumn(frequencyHeader)
          .addColumn(amplitudeHeader)
          .setUseHeader(true)
          .build();

      List<Double> frequencies = data.frequencies().getOrDefault(column, List.of());
      List<Double> amplitudes = data.amplitudes().getOrDefault(column, List.of());
      List<Map<String, Object>> rows = new ArrayList<>(frequencies.size());
      for (int i = 0; i < frequencies.size(); i++) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(frequencyHeader, frequencies.get(i));
        row.put(amplitudeHeader, amplitudes.get(i));
        rows.add(row);
      }
      out.append(write(schema, rows)).append('\n');
    }
    return out.toString();
  }

  public Map<String, Object> toJson(AnalysisResult result) {
    return objectMapper.convertValue(result, MAP_TYPE);
  }

  private String write(CsvSchema schema, List<Map<String, Object>> rows) {
    try {
      if (rows.isEmpty()) {
        // the sequence writer only emits the header together with the first row
        return String.join(",", headerNames(schema)) + "\n";
      }
      return csvMapper.writer(schema).writeValueAsString(rows);
    } catch (JsonProcessingException ex) {
      throw new UncheckedIOException("Unable to render CSV export", ex);
    }
  }

  private List<String> headerNames(CsvSchema schema) {
    List<String> names = new ArrayList<>(schema.size());
    for (CsvSchema.Column column : schema) {
      names.add(column.getName());
    }
    return names;
  }
}
