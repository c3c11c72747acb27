package com.tasklens.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TaskLensServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskLensServerApplication.class, args);
    }

}
