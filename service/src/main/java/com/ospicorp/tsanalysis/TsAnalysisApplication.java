package com.ospicorp.tsanalysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class TsAnalysisApplication {

  public static void main(String[] args) {
    SpringApplication.run(TsAnalysisApplication.class, args);
  }
}
