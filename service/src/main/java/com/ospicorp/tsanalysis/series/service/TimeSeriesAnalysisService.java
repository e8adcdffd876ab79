package com.ospicorp.tsanalysis.series.service;

import com.ospicorp.tsanalysis.series.cache.CachingTimeSeriesRepository;
import com.ospicorp.tsanalysis.series.model.AnalysisResult;
import com.ospicorp.tsanalysis.series.model.AnalysisSummary;
import com.ospicorp.tsanalysis.series.model.ExportedView;
import com.ospicorp.tsanalysis.series.model.FrequencyDomainData;
import com.ospicorp.tsanalysis.series.model.RawTable;
import com.ospicorp.tsanalysis.series.model.TimeDomainData;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.enums.AnalysisDomain;
import com.ospicorp.tsanalysis.series.model.enums.ExportFormat;
import com.ospicorp.tsanalysis.series.model.enums.FillPolicy;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class TimeSeriesAnalysisService {
  private static final Logger log = LoggerFactory.getLogger(TimeSeriesAnalysisService.class);

  private final CachingTimeSeriesRepository repository;
  private final TimeSeriesExporter exporter;

  public TimeSeriesAnalysisService(CachingTimeSeriesRepository repository,
      TimeSeriesExporter exporter) {
    this.repository = repository;
    this.exporter = exporter;
  }

  public AnalysisResult upload(RawTable table, String timeColumn, List<String> valueColumns,
      String name, String description, FillPolicy fillPolicy) {
    List<PreprocessingStep> steps = fillPolicy == null || fillPolicy == FillPolicy.NONE
        ? List.of()
        : List.of(new PreprocessingStep.FillMissing(fillPolicy, null, null, null));
    return upload(table, timeColumn, valueColumns, name, description, steps);
  }

  public AnalysisResult upload(RawTable table, String timeColumn, List<String> valueColumns,
      String name, String description, List<? extends PreprocessingStep> steps) {
    TimeSeries series = TimeSeriesFactory.create(table, timeColumn, valueColumns, name,
        description);
    TimeSeries saved = repository.save(TimeSeriesPreprocessor.process(series, steps));
    log.info("Stored analysis {} ({} rows, time column {}, value columns {})", saved.id(),
        saved.size(), saved.timeColumn(), saved.valueColumns());
    return toResult(saved);
  }

  public AnalysisResult preprocess(String id, List<? extends PreprocessingStep> steps) {
    requireId(id);
    TimeSeries processed = TimeSeriesPreprocessor.process(repository.findById(id), steps);
    TimeSeries saved = repository.save(processed);
    log.info("Preprocessed analysis {} with {} step(s), {} rows remain", id,
        steps == null ? 0 : steps.size(), saved.size());
    return toResult(saved);
  }

  private static AnalysisResult toResult(TimeSeries saved) {
    return new AnalysisResult(saved.id(), saved.columns(), saved.timeColumn(),
        saved.valueColumns(), TimeSeriesTransformer.timeDomain(saved), null);
  }

  public AnalysisResult getAnalysis(String id, AnalysisDomain domain) {
    requireId(id);
    TimeSeries series = repository.findById(id);
    FrequencyDomainData frequencyDomain = null;
    if (domain == AnalysisDomain.FREQUENCY) {
      frequencyDomain = repository.getFrequencyDomainData(id);
      TimeSeries current = repository.findById(id);
      if (!sameVersion(series, current)) {
        // replaced while the views were being read; derive both from the newer copy
        log.debug("Analysis {} changed during read, recomputing its views", id);
        series = current;
        frequencyDomain = TimeSeriesTransformer.frequencyDomain(current);
      }
    }
    TimeDomainData timeDomain = TimeSeriesTransformer.timeDomain(series);
    return new AnalysisResult(series.id(), series.columns(), series.timeColumn(),
        series.valueColumns(), timeDomain, frequencyDomain);
  }

  private static boolean sameVersion(TimeSeries a, TimeSeries b) {
    return Objects.equals(a.updatedAt(), b.updatedAt()) && a.hasSameData(b);
  }

  public List<AnalysisSummary> listAnalyses() {
    return repository.findAll().stream()
        .map(s -> new AnalysisSummary(s.id(), s.name(), s.description(), s.timeColumn(),
            s.valueColumns(), s.size(), s.createdAt(), s.updatedAt()))
        .toList();
  }

  public void deleteAnalysis(String id) {
    requireId(id);
    repository.delete(id);
  }

  public ExportedView export(String id, ExportFormat format, AnalysisDomain domain) {
    AnalysisResult result = getAnalysis(id, domain);
    String filename = "time_series_analysis_" + id + "_" + domain.code() + "."
        + format.extension();
    Object content = switch (format) {
      case JSON -> exporter.toJson(result);
      case CSV -> domain == AnalysisDomain.FREQUENCY
          ? exporter.frequencyDomainCsv(result.valueColumns(), result.frequencyDomain())
          : exporter.timeDomainCsv(result.timeColumn(), result.valueColumns(),
              result.timeDomain());
    };
    return new ExportedView(filename, format.mediaType(), content);
  }

  @Async
  public CompletableFuture<FrequencyDomainData> frequencyDomainAsync(String id) {
    requireId(id);
    return CompletableFuture.completedFuture(repository.getFrequencyDomainData(id));
  }

  private static void requireId(String id) {
    if (!StringUtils.hasText(id)) {
      throw new IllegalArgumentException("id must be provided");
    }
  }
}
