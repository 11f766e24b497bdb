package com.example.workflowgraph.api.v1;

import com.example.workflowgraph.analysis.WorkflowAnalysis;
import com.example.workflowgraph.api.v1.dto.AnalysisResponse;
import com.example.workflowgraph.api.v1.dto.WorkflowIdResponse;
import com.example.workflowgraph.codec.document.WorkflowDocument;
import com.example.workflowgraph.codegen.SourceGenerationOptions;
import com.example.workflowgraph.layout.LayoutDirection;
import com.example.workflowgraph.service.WorkflowDesignService;
import com.example.workflowgraph.validation.WorkflowCheckReport;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for workflow graph documents.
 * <p>
 * Exposes {@code /api/v1/workflow-graphs} for the stateless design operations (check, layout, diagram, source,
 * analysis) and for storing documents: save (POST), get by id (GET /{id}) and update (PUT /{id}).
 * </p>
 */
@RestController
@RequestMapping("/api/v1/workflow-graphs")
@RequiredArgsConstructor
@Slf4j
public class WorkflowGraphController {

    private static final String DEFAULT_MAX_LENGTH = "4000";

    private final WorkflowDesignService service;

    @PostMapping("/check")
    public ResponseEntity<WorkflowCheckReport> check(@Valid @RequestBody WorkflowDocument document) {
        log.info("Checking workflow nodeCount={} edgeCount={}", document.nodes().size(), document.edges().size());
        return ResponseEntity.ok(service.check(document));
    }

    @PostMapping("/layout")
    public ResponseEntity<WorkflowDocument> layout(@Valid @RequestBody WorkflowDocument document,
                                                   @RequestParam(required = false) String direction) {
        log.info("Laying out workflow nodeCount={} direction={}", document.nodes().size(), direction);
        return ResponseEntity.ok(service.layout(document, direction != null ? LayoutDirection.parse(direction) : null));
    }

    @PostMapping(value = "/diagram", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> diagram(@Valid @RequestBody WorkflowDocument document,
                                          @RequestParam(required = false) String direction) {
        log.info("Rendering diagram nodeCount={} direction={}", document.nodes().size(), direction);
        return ResponseEntity.ok(service.diagram(document, direction != null ? LayoutDirection.parse(direction) : null));
    }

    @PostMapping(value = "/source", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> source(@Valid @RequestBody WorkflowDocument document,
                                         @RequestParam(required = false) String className,
                                         @RequestParam(required = false) String packageName) {
        log.info("Generating source nodeCount={} className={}", document.nodes().size(), className);
        return ResponseEntity.ok(service.source(document, new SourceGenerationOptions(packageName, className)));
    }

    @PostMapping("/analysis")
    public ResponseEntity<AnalysisResponse> analysis(@Valid @RequestBody WorkflowDocument document,
                                                     @RequestParam(defaultValue = "false") boolean connectedOnly,
                                                     @RequestParam(defaultValue = DEFAULT_MAX_LENGTH) int maxLength) {
        log.info("Analysing workflow nodeCount={} connectedOnly={} maxLength={}", document.nodes().size(), connectedOnly, maxLength);
        WorkflowAnalysis analysis = service.analyse(document, connectedOnly);
        return ResponseEntity.ok(new AnalysisResponse(analysis, service.summarise(analysis, maxLength)));
    }

    @PostMapping
    public ResponseEntity<WorkflowIdResponse> save(@Valid @RequestBody WorkflowDocument document) {
        log.info("Saving workflow nodeCount={} edgeCount={}", document.nodes().size(), document.edges().size());
        String id = service.save(document);
        log.info("Saved workflow id={}", id);
        return ResponseEntity.status(HttpStatus.CREATED).body(new WorkflowIdResponse(id));
    }

    @GetMapping("/{id}")
    public ResponseEntity<WorkflowDocument> getById(@PathVariable String id) {
        log.info("Getting workflow id={}", id);
        return ResponseEntity.ok(service.load(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<WorkflowDocument> update(@PathVariable String id, @Valid @RequestBody WorkflowDocument document) {
        log.info("Updating workflow id={} nodeCount={}", id, document.nodes().size());
        return ResponseEntity.ok(service.update(id, document));
    }
}
