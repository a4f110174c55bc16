package com.modelmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ModelMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelMonitorApplication.class, args);
    }
}
