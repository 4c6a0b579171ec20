package com.yescount.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class YesCountApplication {

    public static void main(String[] args) {
        SpringApplication.run(YesCountApplication.class, args);
    }
}
