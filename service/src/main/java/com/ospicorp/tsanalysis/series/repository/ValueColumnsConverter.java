package com.ospicorp.tsanalysis.series.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.List;

@Converter
public class ValueColumnsConverter implements AttributeConverter<List<String>, String> {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<String> columns) {
    try {
      return MAPPER.writeValueAsString(columns == null ? List.of() : columns);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Unable to encode value columns " + columns, ex);
    }
  }

  @Override
  public List<String> convertToEntityAttribute(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return MAPPER.readValue(json, LIST_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Corrupt value_columns entry: " + json, ex);
    }
  }
}
