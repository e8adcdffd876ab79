package com.ospicorp.tsanalysis;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.tsanalysis.series.model.AnalysisResult;
import com.ospicorp.tsanalysis.series.model.RawTable;
import com.ospicorp.tsanalysis.series.model.enums.AnalysisDomain;
import com.ospicorp.tsanalysis.series.model.enums.FillPolicy;
import com.ospicorp.tsanalysis.series.repository.FileTimeSeriesRepository;
import com.ospicorp.tsanalysis.series.repository.TimeSeriesRepository;
import com.ospicorp.tsanalysis.series.service.TimeSeriesAnalysisService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest
@ActiveProfiles("file")
class FileBackendApplicationTest {

  @TempDir
  static Path dir;

  @DynamicPropertySource
  static void configureStore(DynamicPropertyRegistry registry) {
    registry.add("tsanalysis.repository.backend", () -> "file");
    registry.add("tsanalysis.repository.file.path",
        () -> dir.resolve("time_series.json").toString());
  }

  @Autowired
  @Qualifier("fileTimeSeriesRepository")
  private TimeSeriesRepository backend;

  @Autowired
  private TimeSeriesAnalysisService service;

  @Test
  void runsWithoutADatabase() {
    RawTable table = RawTable.of(List.of("t", "v"),
        new Object[] {"0", "1"}, new Object[] {"1", "3"});

    AnalysisResult uploaded = service.upload(table, "t", null, "file", null, FillPolicy.NONE);
    AnalysisResult analysis = service.getAnalysis(uploaded.analysisId(), AnalysisDomain.FREQUENCY);

    assertThat(backend).isInstanceOf(FileTimeSeriesRepository.class);
    assertThat(analysis.frequencyDomain().amplitudes().get("v")).containsExactly(4.0, 2.0);
    assertThat(Files.exists(dir.resolve("time_series.json"))).isTrue();
  }
}
