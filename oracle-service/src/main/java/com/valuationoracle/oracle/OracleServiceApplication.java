package com.valuationoracle.oracle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OracleServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OracleServiceApplication.class, args);
    }
}
