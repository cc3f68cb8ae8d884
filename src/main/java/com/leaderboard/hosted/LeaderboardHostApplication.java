package com.leaderboard.hosted;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LeaderboardHostApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaderboardHostApplication.class, args);
    }
}
