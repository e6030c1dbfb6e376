package com.storagegateway.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StorageWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(StorageWorkerApplication.class, args);
  }
}
