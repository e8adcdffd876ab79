package com.ospicorp.tsanalysis.series.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "time_series_metadata")
public class TimeSeriesMetadata {

  @Id
  private String id;
  private String name;
  private String description;

  @Column(name = "time_column", nullable = false)
  private String timeColumn;

  @Convert(converter = ValueColumnsConverter.class)
  @Column(name = "value_columns", nullable = false)
  private List<String> valueColumns = new ArrayList<>();

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TimeSeriesMetadata() {
    // JPA default constructor
  }

  public TimeSeriesMetadata(String id, Instant createdAt) {
    this.id = id;
    this.createdAt = createdAt;
  }

  public void replace(String name, String description, String timeColumn,
      List<String> valueColumns, Instant updatedAt) {
    this.name = name;
    this.description = description;
    this.timeColumn = timeColumn;
    this.valueColumns = new ArrayList<>(valueColumns);
    this.updatedAt = updatedAt;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public String getTimeColumn() {
    return timeColumn;
  }

  public List<String> getValueColumns() {
    return valueColumns;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
