package com.tradefeed.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IngestWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(IngestWorkerApplication.class, args);
  }
}
