package com.mk.fx.qa.load.runner.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.load.runner.output.SummaryPrinter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OutputCfg {

  @Bean
  public SummaryPrinter summaryPrinter(ObjectMapper objectMapper) {
    return new SummaryPrinter(objectMapper, System.out);
  }
}
