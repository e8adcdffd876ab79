package com.ospicorp.tsanalysis.series.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;

import com.ospicorp.tsanalysis.series.StorageException;
import com.ospicorp.tsanalysis.series.TimeSeriesNotFoundException;
import com.ospicorp.tsanalysis.series.model.RawTable;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.TimeValue;
import com.ospicorp.tsanalysis.series.service.TimeSeriesFactory;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class DatabaseTimeSeriesRepositoryTest {

  @Autowired
  @Qualifier("databaseTimeSeriesRepository")
  private TimeSeriesRepository repository;

  @SpyBean
  private DataPointDao dataPointDao;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void clean() {
    jdbcTemplate.update("DELETE FROM time_series_data_points");
    jdbcTemplate.update("DELETE FROM time_series_metadata");
  }

  private static TimeSeries daily(String... values) {
    Object[][] rows = new Object[values.length][];
    for (int i = 0; i < values.length; i++) {
      rows[i] = new Object[] {"2023-01-0" + (i + 1), values[i], "x" + i};
    }
    RawTable table = RawTable.of(List.of("timestamp", "value", "other"), rows);
    return TimeSeriesFactory.create(table, "timestamp", List.of("value"), "daily", "test");
  }

  private int pointCount(String id) {
    return dataPointDao.countBySeriesId(id);
  }

  @Test
  void roundTripsValuesTimesAndLabels() {
    TimeSeries saved = repository.save(daily("10", "", "30"));

    TimeSeries loaded = repository.findById(saved.id());

    assertThat(loaded.hasSameData(saved)).isTrue();
    assertThat(loaded.times()).allMatch(TimeValue::isInstant);
    assertThat(loaded.column("value")).containsExactly(10d, null, 30d);
    assertThat(loaded.name()).isEqualTo("daily");
    assertThat(loaded.description()).isEqualTo("test");
    assertThat(loaded.createdAt()).isNotNull();
    assertThat(pointCount(saved.id())).isEqualTo(3);
  }

  @Test
  void numericAndTextTimesKeepTheirKind() {
    TimeSeries numeric = TimeSeriesFactory.create(RawTable.of(List.of("t", "v"),
        new Object[] {"0.5", "1"}, new Object[] {"1.5", "2"}), "t", null);
    TimeSeries labels = TimeSeriesFactory.create(RawTable.of(List.of("t", "v"),
        new Object[] {"mon", "1"}, new Object[] {"tue", "2"}), "t", null);

    assertThat(repository.findById(repository.save(numeric).id()).times())
        .containsExactly(TimeValue.ofNumber(0.5), TimeValue.ofNumber(1.5));
    assertThat(repository.findById(repository.save(labels).id()).times())
        .containsExactly(TimeValue.ofText("mon"), TimeValue.ofText("tue"));
  }

  @Test
  void saveReplacesEveryDataPoint() {
    TimeSeries original = repository.save(daily("10", "20", "30"));

    repository.save(daily("1", "2").withId(original.id()));

    TimeSeries loaded = repository.findById(original.id());
    assertThat(loaded.size()).isEqualTo(2);
    assertThat(loaded.column("value")).containsExactly(1d, 2d);
    assertThat(loaded.createdAt()).isEqualTo(original.createdAt());
    assertThat(pointCount(original.id())).isEqualTo(2);
  }

  @Test
  void deleteCascadesToDataPoints() {
    TimeSeries saved = repository.save(daily("10", "20", "30"));

    repository.delete(saved.id());

    assertThat(pointCount(saved.id())).isZero();
    assertThat(repository.exists(saved.id())).isFalse();
    assertThatThrownBy(() -> repository.findById(saved.id()))
        .isInstanceOf(TimeSeriesNotFoundException.class);
  }

  @Test
  void deleteOfUnknownIdReportsNotFound() {
    assertThatThrownBy(() -> repository.delete("missing"))
        .isInstanceOf(TimeSeriesNotFoundException.class)
        .satisfies(ex -> assertThat(((TimeSeriesNotFoundException) ex).timeSeriesId())
            .isEqualTo("missing"));
  }

  @Test
  void failedInsertKeepsThePreviousVersion() {
    TimeSeries original = repository.save(daily("10", "20", "30"));
    doThrow(new DataIntegrityViolationException("insert failed"))
        .when(dataPointDao).insertAll(anyList());

    assertThatThrownBy(() -> repository.save(daily("1").withId(original.id())))
        .isInstanceOf(StorageException.class)
        .matches(ex -> !((StorageException) ex).isTransientFailure());

    TimeSeries loaded = repository.findById(original.id());
    assertThat(loaded.column("value")).containsExactly(10d, 20d, 30d);
    assertThat(pointCount(original.id())).isEqualTo(3);
  }

  @Test
  void findAllReturnsOldestFirst() {
    TimeSeries first = repository.save(daily("1"));
    TimeSeries second = repository.save(daily("2"));

    List<TimeSeries> all = repository.findAll();

    assertThat(all).hasSize(2);
    assertThat(all.get(0).createdAt()).isBeforeOrEqualTo(all.get(1).createdAt());
    assertThat(all).extracting(TimeSeries::id).containsExactlyInAnyOrder(first.id(), second.id());
    assertThat(all).allMatch(s -> s.size() == 1);
  }
}
