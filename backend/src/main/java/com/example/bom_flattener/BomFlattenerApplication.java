package com.example.bom_flattener;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BomFlattenerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BomFlattenerApplication.class, args);
    }
}
