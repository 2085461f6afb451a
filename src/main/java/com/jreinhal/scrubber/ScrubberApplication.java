package com.jreinhal.scrubber;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScrubberApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScrubberApplication.class, args);
    }
}
