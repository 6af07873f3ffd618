package com.casegovernor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CaseDataGovernorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaseDataGovernorApplication.class, args);
    }
}
