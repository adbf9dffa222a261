package com.hmmviterbi.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HmmViterbiServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HmmViterbiServerApplication.class, args);
    }
}
