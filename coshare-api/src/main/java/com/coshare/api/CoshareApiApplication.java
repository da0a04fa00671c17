package com.coshare.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.coshare.api")
public class CoshareApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(CoshareApiApplication.class, args);
  }
}
