package com.scholary.meetings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MeetingWorkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(MeetingWorkerApplication.class, args);
  }
}
