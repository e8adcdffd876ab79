package com.ospicorp.tsanalysis.series.service;

import com.ospicorp.tsanalysis.series.model.FrequencyDomainData;
import com.ospicorp.tsanalysis.series.model.TimeDomainData;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.TimeValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TimeSeriesTransformer {
  private static final Logger log = LoggerFactory.getLogger(TimeSeriesTransformer.class);

  public static final double FALLBACK_SAMPLE_SPACING = 1.0;
  static final double MIN_SAMPLE_SPACING = 1e-10;
  static final double IRREGULAR_SPACING_TOLERANCE = 0.01;

  private TimeSeriesTransformer() {
  }

  public static TimeDomainData timeDomain(TimeSeries series) {
    Map<String, List<Double>> columns = new LinkedHashMap<>();
    for (String column : series.valueColumns()) {
      columns.put(column, series.column(column));
    }
    return new TimeDomainData(series.times(), columns);
  }

  public static FrequencyDomainData frequencyDomain(TimeSeries series) {
    SampleSpacing spacing = sampleSpacing(series.times());
    if (spacing.estimated()) {
      log.debug("Time series {} uses approximate sample spacing {}", series.id(), spacing.value());
    }

    Map<String, List<Double>> frequencies = new LinkedHashMap<>();
    Map<String, List<Double>> amplitudes = new LinkedHashMap<>();
    for (String column : series.valueColumns()) {
      double[] samples = series.column(column).stream()
          .filter(v -> v != null && Double.isFinite(v))
          .mapToDouble(Double::doubleValue)
          .toArray();
      SpectrumAnalyzer.Spectrum spectrum =
          SpectrumAnalyzer.magnitudeSpectrum(samples, spacing.value());
      frequencies.put(column, spectrum.frequencies());
      amplitudes.put(column, spectrum.amplitudes());
    }
    return new FrequencyDomainData(frequencies, amplitudes, spacing.value(),
        spacing.estimated());
  }

  record SampleSpacing(double value, boolean estimated) {}

  /**
   * {@code (t_last - t_first) / (n - 1)} over numeric times or instants (epoch seconds). The result
   * is flagged as estimated when it falls back to {@link #FALLBACK_SAMPLE_SPACING} or when the
   * individual steps deviate from it by more than 1%.
   */
  static SampleSpacing sampleSpacing(List<TimeValue> times) {
    int n = times.size();
    if (n < 2) {
      return new SampleSpacing(FALLBACK_SAMPLE_SPACING, true);
    }
    double[] axis = new double[n];
    for (int i = 0; i < n; i++) {
      Double position = times.get(i).axisValue();
      if (position == null) {
        return new SampleSpacing(FALLBACK_SAMPLE_SPACING, true);
      }
      axis[i] = position;
    }
    double dt = (axis[n - 1] - axis[0]) / (n - 1);
    if (!Double.isFinite(dt) || Math.abs(dt) < MIN_SAMPLE_SPACING) {
      return new SampleSpacing(FALLBACK_SAMPLE_SPACING, true);
    }
    // descending axes give the same spectrum as ascending ones
    dt = Math.abs(dt);
    double maxDeviation = 0;
    for (int i = 1; i < n; i++) {
      maxDeviation = Math.max(maxDeviation, Math.abs(Math.abs(axis[i] - axis[i - 1]) - dt));
    }
    return new SampleSpacing(dt, maxDeviation > dt * IRREGULAR_SPACING_TOLERANCE);
  }
}
