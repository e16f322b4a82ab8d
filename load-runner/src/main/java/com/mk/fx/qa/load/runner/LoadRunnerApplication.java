package com.mk.fx.qa.load.runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoadRunnerApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(LoadRunnerApplication.class, args)));
  }
}
