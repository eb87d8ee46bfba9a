package com.pileupbuster.backend;

import com.pileupbuster.backend.config.PileupProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot entrypoint for the pileup backend.
 *
 * <p>Serves the public queue API, the admin API and the live event stream.
 */
@SpringBootApplication
@EnableConfigurationProperties(PileupProperties.class)
public class PileupBackendApplication {
  public static void main(String[] args) {
    SpringApplication.run(PileupBackendApplication.class, args);
  }

  @Configuration(proxyBeanMethods = false)
  @EnableScheduling
  @ConditionalOnProperty(
      prefix = "pileup.scheduling",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  static class SchedulingConfiguration {}
}
