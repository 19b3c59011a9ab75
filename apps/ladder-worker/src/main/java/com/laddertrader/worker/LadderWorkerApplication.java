package com.laddertrader.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LadderWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(LadderWorkerApplication.class, args);
  }
}
