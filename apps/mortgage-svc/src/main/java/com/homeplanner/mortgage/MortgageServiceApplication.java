package com.homeplanner.mortgage;

import com.homeplanner.mortgage.config.MortgageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MortgageProperties.class)
public class MortgageServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MortgageServiceApplication.class, args);
    }
}
