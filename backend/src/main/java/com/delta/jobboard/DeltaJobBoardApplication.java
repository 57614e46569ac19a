package com.delta.jobboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaJobBoardApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeltaJobBoardApplication.class, args);
  }
}
