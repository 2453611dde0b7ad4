package com.example.skillgap.courses;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CourseMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseMatchApplication.class, args);
    }

}
