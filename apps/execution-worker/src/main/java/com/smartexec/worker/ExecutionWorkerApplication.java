package com.smartexec.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ExecutionWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(ExecutionWorkerApplication.class, args);
  }
}
