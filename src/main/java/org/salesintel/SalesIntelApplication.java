package org.salesintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SalesIntelApplication {
    public static void main(String[] args) {
        SpringApplication.run(SalesIntelApplication.class, args);
    }
}
