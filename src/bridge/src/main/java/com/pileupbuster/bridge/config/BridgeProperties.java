package com.pileupbuster.bridge.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bridge")
public record BridgeProperties(Udp udp, Backend backend, Duration dedupeWindow) {
  public record Udp(boolean enabled, String bindAddress, int port, int bufferSize) {}

  public record Backend(String baseUrl, String username, String password, long timeoutMs) {}
}
