package com.proofmill.witness;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WitnessGeneratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(WitnessGeneratorApplication.class, args);
    }
}
