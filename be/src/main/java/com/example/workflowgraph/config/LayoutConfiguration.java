package com.example.workflowgraph.config;

import com.example.workflowgraph.layout.LayoutDirection;
import com.example.workflowgraph.layout.LayoutOptions;
import com.example.workflowgraph.layout.WorkflowLayoutEngine;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LayoutConfiguration {

    @Bean
    public LayoutOptions defaultLayoutOptions(
            @Value("${workflow.layout.direction:LR}") String direction,
            @Value("${workflow.layout.node-spacing:150}") double nodeSpacing,
            @Value("${workflow.layout.layer-spacing:400}") double layerSpacing,
            @Value("${workflow.layout.iterations:4}") int iterations) {
        return new LayoutOptions(LayoutDirection.parse(direction), nodeSpacing, layerSpacing, iterations);
    }

    @Bean
    public WorkflowLayoutEngine workflowLayoutEngine(LayoutOptions defaultLayoutOptions) {
        return new WorkflowLayoutEngine(defaultLayoutOptions);
    }
}
