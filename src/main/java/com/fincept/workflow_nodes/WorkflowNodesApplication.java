package com.fincept.workflow_nodes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkflowNodesApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowNodesApplication.class, args);
    }
}
