package com.example.DmOracle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DmOracleApplication {

    public static void main(String[] args) {
        SpringApplication.run(DmOracleApplication.class, args);
    }
}
