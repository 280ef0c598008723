package com.purchasingpower.studygraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StudyGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudyGraphApplication.class, args);
    }
}
