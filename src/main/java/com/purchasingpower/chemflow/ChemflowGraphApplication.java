package com.purchasingpower.chemflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChemflowGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChemflowGraphApplication.class, args);
    }
}
