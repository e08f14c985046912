package com.ai.reservation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ReservationAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReservationAgentApplication.class, args);
    }
}
