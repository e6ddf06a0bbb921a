package io.intellixity.ssrm.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

@SpringBootApplication(exclude = {MongoAutoConfiguration.class})
public class SsrmServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(SsrmServerApplication.class, args);
  }
}
