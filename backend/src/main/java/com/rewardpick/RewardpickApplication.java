package com.rewardpick;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RewardpickApplication {

    public static void main(String[] args) {
        SpringApplication.run(RewardpickApplication.class, args);
    }
}
