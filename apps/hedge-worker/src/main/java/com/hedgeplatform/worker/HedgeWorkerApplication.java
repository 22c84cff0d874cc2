package com.hedgeplatform.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HedgeWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(HedgeWorkerApplication.class, args);
  }
}
