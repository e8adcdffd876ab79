package com.ospicorp.tsanalysis.series.repository;

import com.ospicorp.tsanalysis.series.model.TimeSeries;
import java.util.List;

/**
 * Storage contract shared by the file and database backends. Saves replace any previously stored
 * data for the same id; they never merge. {@code findById} and {@code delete} throw
 * {@code TimeSeriesNotFoundException} for an unknown id, {@code findAll} lists oldest first.
 */
public interface TimeSeriesRepository {

  TimeSeries save(TimeSeries series);

  TimeSeries findById(String id);

  List<TimeSeries> findAll();

  void delete(String id);

  boolean exists(String id);
}
