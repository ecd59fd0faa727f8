package com.jreinhal.formulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FormulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormulatorApplication.class, args);
    }
}
