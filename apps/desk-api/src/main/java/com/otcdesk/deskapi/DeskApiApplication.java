package com.otcdesk.deskapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DeskApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(DeskApiApplication.class, args);
  }
}
