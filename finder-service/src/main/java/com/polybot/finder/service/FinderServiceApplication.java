package com.polybot.finder.service;

import com.polybot.finder.config.FinderConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(FinderConfiguration.class)
public class FinderServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(FinderServiceApplication.class, args);
  }
}
