package com.soldexhub.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IngestWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(IngestWorkerApplication.class, args);
  }
}
