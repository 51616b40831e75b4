package com.delta.signaltracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SignalTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalTrackerApplication.class, args);
    }
}
