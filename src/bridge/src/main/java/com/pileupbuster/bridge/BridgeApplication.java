package com.pileupbuster.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BridgeApplication {
  // Main entrypoint: boots Spring and starts the UDP receive loop.
  public static void main(String[] args) {
    SpringApplication.run(BridgeApplication.class, args);
  }
}
