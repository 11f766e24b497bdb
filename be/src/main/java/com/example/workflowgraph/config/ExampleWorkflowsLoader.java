package com.example.workflowgraph.config;

import com.example.workflowgraph.codec.document.WorkflowDocument;
import com.example.workflowgraph.model.WorkflowGraphException;
import com.example.workflowgraph.service.WorkflowDesignService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads example workflow documents from classpath resources into storage at startup.
 * Existing examples are updated in place (by title) so sample workflows stay in sync.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExampleWorkflowsLoader implements ApplicationRunner {

    private static final String EXAMPLES_DIR = "examples/";
    public static final List<String> EXAMPLE_FILES = List.of(
            "resume-screening-workflow.json",
            "text-pipeline-workflow.json"
    );

    private final WorkflowDesignService service;
    private final JsonMapper jsonMapper;

    @Override
    public void run(ApplicationArguments args) {
        for (String filename : EXAMPLE_FILES) {
            loadExample(EXAMPLES_DIR + filename);
        }
    }

    private void loadExample(String path) {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Example workflow resource not found: {}", path);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            WorkflowDocument document = jsonMapper.readValue(in, WorkflowDocument.class);
            String id = service.saveOrUpdateByTitle(document);
            log.info("Loaded example workflow {} as id={}", path, id);
        } catch (JacksonException e) {
            log.error("Failed to parse example workflow {}: {}", path, e.getMessage());
        } catch (WorkflowGraphException e) {
            log.error("Invalid example workflow {} at {}: {}", path, e.getLocation(), e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read example workflow {}: {}", path, e.getMessage());
        }
    }
}
