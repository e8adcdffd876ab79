package com.ospicorp.tsanalysis.series.repository;

import com.ospicorp.tsanalysis.series.StorageException;
import com.ospicorp.tsanalysis.series.TimeSeriesNotFoundException;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.TimeValue;
import io.github.resilience4j.retry.Retry;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Relational backend: one metadata row per series plus one data-point row per (row, value column)
 * cell.
 *
 * <p>{@link #save} deletes the existing data points, upserts the metadata and inserts the new
 * points inside a single transaction, so a failure at any step leaves the previous version intact.
 * Reads load the metadata and every data point inside one read-only transaction; nothing is
 * fetched lazily afterwards. There is no optimistic locking: two concurrent saves of the same id
 * are each atomic, and the later commit wins.
 */
public class DatabaseTimeSeriesRepository implements TimeSeriesRepository {
  private static final Logger log = LoggerFactory.getLogger(DatabaseTimeSeriesRepository.class);

  private final TimeSeriesMetadataRepository metadataRepository;
  private final DataPointDao dataPointDao;
  private final TransactionTemplate writeTx;
  private final TransactionTemplate readTx;
  private final Retry retry;
  private final Clock clock;

  public DatabaseTimeSeriesRepository(TimeSeriesMetadataRepository metadataRepository,
      DataPointDao dataPointDao, PlatformTransactionManager transactionManager, Retry retry,
      Clock clock) {
    this.metadataRepository = metadataRepository;
    this.dataPointDao = dataPointDao;
    this.writeTx = new TransactionTemplate(transactionManager);
    this.readTx = new TransactionTemplate(transactionManager);
    this.readTx.setReadOnly(true);
    this.retry = retry;
    this.clock = clock;
  }

  @Override
  public TimeSeries save(TimeSeries series) {
    String id = StringUtils.hasText(series.id()) ? series.id() : UUID.randomUUID().toString();
    TimeSeries saved = execute("save " + id, () -> writeTx.execute(status -> replace(id, series)));
    log.info("Saved time series {} ({} rows, columns {})", id, saved.size(),
        saved.valueColumns());
    return saved;
  }

  private TimeSeries replace(String id, TimeSeries series) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
    TimeSeriesMetadata metadata = metadataRepository.findById(id)
        .orElseGet(() -> new TimeSeriesMetadata(id, now));
    int removed = dataPointDao.deleteBySeriesId(id);
    metadata.replace(series.name(), series.description(), series.timeColumn(),
        series.valueColumns(), now);
    metadataRepository.saveAndFlush(metadata);
    List<DataPointRow> rows = toRows(id, series);
    dataPointDao.insertAll(rows);
    log.debug("Replaced {} data points of time series {} with {}", removed, id, rows.size());
    return series.withId(id).withTimestamps(metadata.getCreatedAt(), now);
  }

  @Override
  public TimeSeries findById(String id) {
    requireId(id);
    return execute("find " + id, () -> readTx.execute(status -> {
      TimeSeriesMetadata metadata = metadataRepository.findById(id)
          .orElseThrow(() -> new TimeSeriesNotFoundException(id));
      return toTimeSeries(metadata, dataPointDao.findBySeriesId(id));
    }));
  }

  @Override
  public List<TimeSeries> findAll() {
    return execute("find all", () -> readTx.execute(status -> {
      List<TimeSeriesMetadata> all = metadataRepository.findAllByOrderByCreatedAtAscIdAsc();
      Map<String, List<DataPointRow>> points = dataPointDao.findAllGroupedBySeries();
      List<TimeSeries> result = new ArrayList<>(all.size());
      for (TimeSeriesMetadata metadata : all) {
        result.add(toTimeSeries(metadata, points.getOrDefault(metadata.getId(), List.of())));
      }
      return result;
    }));
  }

  @Override
  public void delete(String id) {
    requireId(id);
    execute("delete " + id, () -> writeTx.execute(status -> {
      int removed = metadataRepository.deleteMetadataById(id);
      if (removed == 0) {
        throw new TimeSeriesNotFoundException(id);
      }
      return removed;
    }));
    log.info("Deleted time series {}", id);
  }

  @Override
  public boolean exists(String id) {
    if (!StringUtils.hasText(id)) {
      return false;
    }
    return execute("exists " + id, () -> metadataRepository.existsById(id));
  }

  static List<DataPointRow> toRows(String id, TimeSeries series) {
    List<DataPointRow> rows = new ArrayList<>(series.size() * series.valueColumns().size());
    for (int i = 0; i < series.size(); i++) {
      String timestamp = series.times().get(i).render();
      for (String column : series.valueColumns()) {
        rows.add(new DataPointRow(id, i, timestamp, column, series.column(column).get(i)));
      }
    }
    return rows;
  }

  static TimeSeries toTimeSeries(TimeSeriesMetadata metadata, List<DataPointRow> rows) {
    Map<Integer, TimeValue> times = new TreeMap<>();
    Map<String, Map<Integer, Double>> byColumn = new HashMap<>();
    for (String column : metadata.getValueColumns()) {
      byColumn.put(column, new HashMap<>());
    }
    for (DataPointRow row : rows) {
      times.computeIfAbsent(row.rowIndex(), i -> TimeValue.of(row.timestamp()));
      Map<Integer, Double> cells = byColumn.get(row.columnName());
      if (cells == null) {
        log.warn("Ignoring data point for unknown column {} of time series {}",
            row.columnName(), metadata.getId());
        continue;
      }
      cells.put(row.rowIndex(), row.value());
    }

    Map<String, List<Double>> values = new LinkedHashMap<>();
    for (String column : metadata.getValueColumns()) {
      Map<Integer, Double> cells = byColumn.get(column);
      List<Double> columnValues = new ArrayList<>(times.size());
      for (Integer rowIndex : times.keySet()) {
        columnValues.add(cells.get(rowIndex));
      }
      values.put(column, columnValues);
    }
    return new TimeSeries(metadata.getId(), metadata.getName(), metadata.getDescription(),
        metadata.getTimeColumn(), metadata.getValueColumns(), new ArrayList<>(times.values()),
        values, metadata.getCreatedAt(), metadata.getUpdatedAt());
  }

  private <T> T execute(String operation, Supplier<T> action) {
    Supplier<T> translated = () -> {
      try {
        return action.get();
      } catch (DataAccessException | TransactionException ex) {
        throw translate(operation, ex);
      }
    };
    return Retry.decorateSupplier(retry, translated).get();
  }

  private StorageException translate(String operation, RuntimeException ex) {
    boolean transientFailure = ex instanceof TransientDataAccessException
        || ex instanceof RecoverableDataAccessException
        || ex instanceof DataAccessResourceFailureException
        || ex instanceof CannotCreateTransactionException;
    if (transientFailure) {
      log.warn("Database {} failed, may be retried: {}", operation, ex.getMessage());
    } else {
      log.error("Database {} failed: {}", operation, ex.getMessage(), ex);
    }
    return new StorageException("Database " + operation + " failed", ex, transientFailure);
  }

  private static void requireId(String id) {
    if (!StringUtils.hasText(id)) {
      throw new IllegalArgumentException("id must be provided");
    }
  }
}
