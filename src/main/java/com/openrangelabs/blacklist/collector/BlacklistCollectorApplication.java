package com.openrangelabs.blacklist.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlacklistCollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlacklistCollectorApplication.class, args);
    }

}
