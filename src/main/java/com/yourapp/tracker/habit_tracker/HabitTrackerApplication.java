package com.yourapp.tracker.habit_tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HabitTrackerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(HabitTrackerApplication.class, args)));
    }

}
