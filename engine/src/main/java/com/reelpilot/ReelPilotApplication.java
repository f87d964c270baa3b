package com.reelpilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ReelPilotApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReelPilotApplication.class, args);
  }
}
