package com.flamingo.ai.wikistructure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WikiStructureApplication {

  public static void main(String[] args) {
    SpringApplication.run(WikiStructureApplication.class, args);
  }
}
