package com.pileupbuster.bridge.config;

import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(BridgeProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(Math.max(300L, properties.backend().timeoutMs())))
        .build();
  }
}
