package io.docex.tenancy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;

@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
public class DocexTenancyApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocexTenancyApplication.class, args);
  }
}
