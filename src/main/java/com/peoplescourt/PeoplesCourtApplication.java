package com.peoplescourt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PeoplesCourtApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeoplesCourtApplication.class, args);
    }
}
