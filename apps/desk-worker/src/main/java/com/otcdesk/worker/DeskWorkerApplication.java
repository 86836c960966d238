package com.otcdesk.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DeskWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(DeskWorkerApplication.class, args);
  }
}
