package com.ospicorp.tsanalysis.series.repository;

import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

public class DataPointDao {
  static final int BATCH_SIZE = 1_000;

  private static final RowMapper<DataPointRow> ROW_MAPPER = (rs, i) -> new DataPointRow(
      rs.getString("time_series_id"),
      rs.getInt("row_index"),
      rs.getString("timestamp"),
      rs.getString("column_name"),
      rs.getObject("value", Double.class));

  private final JdbcTemplate jdbc;

  public DataPointDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  public int deleteBySeriesId(String timeSeriesId) {
    return jdbc.update("DELETE FROM time_series_data_points WHERE time_series_id = ?",
        timeSeriesId);
  }

  public void insertAll(List<DataPointRow> rows) {
    String sql = """
      INSERT INTO time_series_data_points
        (time_series_id, row_index, "timestamp", column_name, "value")
      VALUES (?, ?, ?, ?, ?)
    """;
    jdbc.batchUpdate(sql, rows, BATCH_SIZE, (ps, row) -> {
      ps.setString(1, row.timeSeriesId());
      ps.setInt(2, row.rowIndex());
      ps.setString(3, row.timestamp());
      ps.setString(4, row.columnName());
      if (row.value() == null) {
        ps.setNull(5, Types.DOUBLE);
      } else {
        ps.setDouble(5, row.value());
      }
    });
  }

  public List<DataPointRow> findBySeriesId(String timeSeriesId) {
    String sql = """
      SELECT time_series_id, row_index, "timestamp", column_name, "value"
      FROM time_series_data_points
      WHERE time_series_id = ?
      ORDER BY row_index, column_name
    """;
    return jdbc.query(sql, ROW_MAPPER, timeSeriesId);
  }

  public Map<String, List<DataPointRow>> findAllGroupedBySeries() {
    String sql = """
      SELECT time_series_id, row_index, "timestamp", column_name, "value"
      FROM time_series_data_points
      ORDER BY time_series_id, row_index, column_name
    """;
    Map<String, List<DataPointRow>> grouped = new LinkedHashMap<>();
    jdbc.query(sql, ROW_MAPPER).forEach(row ->
        grouped.computeIfAbsent(row.timeSeriesId(), k -> new ArrayList<>()).add(row));
    return grouped;
  }

  public int countBySeriesId(String timeSeriesId) {
    Integer count = jdbc.queryForObject(
        "SELECT COUNT(*) FROM time_series_data_points WHERE time_series_id = ?",
        Integer.class, timeSeriesId);
    return count == null ? 0 : count;
  }
}
