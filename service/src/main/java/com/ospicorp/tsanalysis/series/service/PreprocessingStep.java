package com.ospicorp.tsanalysis.series.service;

import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.enums.Aggregation;
import com.ospicorp.tsanalysis.series.model.enums.FillPolicy;
import com.ospicorp.tsanalysis.series.model.enums.NormalizationMethod;
import com.ospicorp.tsanalysis.series.model.enums.OutlierMethod;
import com.ospicorp.tsanalysis.series.model.enums.ResampleFrequency;
import java.util.List;

public interface PreprocessingStep {

  TimeSeries apply(TimeSeries series);

  record FillMissing(FillPolicy policy, List<String> columns, Integer limit, Double value)
      implements PreprocessingStep {
    @Override
    public TimeSeries apply(TimeSeries series) {
      return MissingValueFiller.fill(series, policy, columns, limit, value);
    }
  }

  record RemoveOutliers(OutlierMethod method, double threshold, List<String> columns)
      implements PreprocessingStep {
    @Override
    public TimeSeries apply(TimeSeries series) {
      return OutlierFilter.remove(series, method, threshold, columns);
    }
  }

  record Normalize(NormalizationMethod method, List<String> columns)
      implements PreprocessingStep {
    @Override
    public TimeSeries apply(TimeSeries series) {
      return Normalizer.normalize(series, method, columns);
    }
  }

  record Resample(ResampleFrequency frequency, Aggregation aggregation)
      implements PreprocessingStep {
    @Override
    public TimeSeries apply(TimeSeries series) {
      return TimeSeriesResampler.resample(series, frequency, aggregation);
    }
  }
}
