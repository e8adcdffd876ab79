package com.ospicorp.tsanalysis.series.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.tsanalysis.series.StorageException;
import com.ospicorp.tsanalysis.series.TimeSeriesNotFoundException;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Keeps every series in memory and mirrors the whole corpus to one JSON file after each mutation.
 * The file is never rewritten in place: content goes to {@code <file>.tmp}, the current file is
 * copied to {@code <file>.bak}, then the temp file is moved over the primary.
 *
 * <p>Single process, single writer. Nothing coordinates two processes sharing the same file, and
 * concurrent saves of the same id are last-writer-wins.
 */
public class FileTimeSeriesRepository implements TimeSeriesRepository {
  private static final Logger log = LoggerFactory.getLogger(FileTimeSeriesRepository.class);
  private static final TypeReference<LinkedHashMap<String, TimeSeries>> STORE_TYPE =
      new TypeReference<>() {};
  static final Comparator<TimeSeries> CREATION_ORDER = Comparator
      .comparing(TimeSeries::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
      .thenComparing(TimeSeries::id);

  private final Path file;
  private final Path tempFile;
  private final Path backupFile;
  private final ObjectMapper mapper;
  private final Clock clock;
  private final Map<String, TimeSeries> store = new ConcurrentHashMap<>();
  private final Object writeLock = new Object();

  public FileTimeSeriesRepository(Path file, ObjectMapper mapper, Clock clock) {
    this.file = file.toAbsolutePath();
    this.tempFile = this.file.resolveSibling(this.file.getFileName() + ".tmp");
    this.backupFile = this.file.resolveSibling(this.file.getFileName() + ".bak");
    this.mapper = mapper;
    this.clock = clock;
    load();
  }

  @Override
  public TimeSeries save(TimeSeries series) {
    String id = StringUtils.hasText(series.id()) ? series.id() : UUID.randomUUID().toString();
    synchronized (writeLock) {
      TimeSeries previous = store.get(id);
      Instant now = clock.instant();
      Instant createdAt = previous != null && previous.createdAt() != null
          ? previous.createdAt()
          : now;
      TimeSeries stored = series.withId(id).withTimestamps(createdAt, now);
      store.put(id, stored);
      try {
        persist();
      } catch (StorageException ex) {
        restore(id, previous);
        throw ex;
      }
      log.info("Saved time series {} ({} rows, columns {})", id, stored.size(),
          stored.valueColumns());
      return stored;
    }
  }

  @Override
  public TimeSeries findById(String id) {
    requireId(id);
    TimeSeries series = store.get(id);
    if (series == null) {
      throw new TimeSeriesNotFoundException(id);
    }
    return series;
  }

  @Override
  public List<TimeSeries> findAll() {
    return store.values().stream().sorted(CREATION_ORDER).toList();
  }

  @Override
  public void delete(String id) {
    requireId(id);
    synchronized (writeLock) {
      TimeSeries removed = store.remove(id);
      if (removed == null) {
        throw new TimeSeriesNotFoundException(id);
      }
      try {
        persist();
      } catch (StorageException ex) {
        store.put(id, removed);
        throw ex;
      }
    }
    log.info("Deleted time series {}", id);
  }

  @Override
  public boolean exists(String id) {
    return id != null && store.containsKey(id);
  }

  Path file() {
    return file;
  }

  Path backupFile() {
    return backupFile;
  }

  private void restore(String id, TimeSeries previous) {
    if (previous == null) {
      store.remove(id);
    } else {
      store.put(id, previous);
    }
  }

  private void persist() {
    Map<String, TimeSeries> snapshot = new LinkedHashMap<>();
    store.values().stream().sorted(CREATION_ORDER).forEach(s -> snapshot.put(s.id(), s));
    try {
      Path parent = file.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      mapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), snapshot);
      if (Files.exists(file)) {
        Files.copy(file, backupFile, StandardCopyOption.REPLACE_EXISTING);
      }
      try {
        Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException ex) {
      log.error("Unable to write time series store {}: {}", file, ex.getMessage(), ex);
      throw new StorageException("Unable to write time series store " + file, ex);
    }
  }

  private void load() {
    if (!Files.exists(file) && !Files.exists(backupFile)) {
      log.info("No time series store at {}; starting empty", file);
      return;
    }
    try {
      store.putAll(read(file));
    } catch (IOException primaryFailure) {
      if (!Files.exists(backupFile)) {
        throw new StorageException("Unable to read time series store " + file, primaryFailure);
      }
      log.warn("Time series store {} is unreadable ({}); recovering from backup {}",
          file, primaryFailure.getMessage(), backupFile);
      try {
        store.putAll(read(backupFile));
      } catch (IOException backupFailure) {
        backupFailure.addSuppressed(primaryFailure);
        throw new StorageException("Unable to read time series store " + file
            + " or its backup", backupFailure);
      }
    }
    log.info("Loaded {} time series from {}", store.size(), file);
  }

  private Map<String, TimeSeries> read(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IOException("missing file " + path);
    }
    Map<String, TimeSeries> loaded = mapper.readValue(path.toFile(), STORE_TYPE);
    return loaded == null ? Map.of() : loaded;
  }

  private static void requireId(String id) {
    if (!StringUtils.hasText(id)) {
      throw new IllegalArgumentException("id must be provided");
    }
  }
}
