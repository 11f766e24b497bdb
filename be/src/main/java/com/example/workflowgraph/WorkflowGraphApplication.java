package com.example.workflowgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkflowGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowGraphApplication.class, args);
    }
}
