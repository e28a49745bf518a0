package com.mike.contactenricher;

import com.mike.contactenricher.config.EnricherProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(EnricherProperties.class)
public class ContactEnricherApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContactEnricherApplication.class, args);
    }

}
