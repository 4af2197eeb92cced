package com.purchasingpower.flowgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class FlowGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowGraphApplication.class, args);
    }
}
