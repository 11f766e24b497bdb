package com.example.workflowgraph.service;

import com.example.workflowgraph.analysis.WorkflowAnalysis;
import com.example.workflowgraph.analysis.WorkflowAnalysisFormatter;
import com.example.workflowgraph.analysis.WorkflowAnalyzer;
import com.example.workflowgraph.codec.MermaidDiagramCodec;
import com.example.workflowgraph.codec.WorkflowDocumentCodec;
import com.example.workflowgraph.codec.document.WorkflowDocument;
import com.example.workflowgraph.codegen.SourceGenerationOptions;
import com.example.workflowgraph.codegen.WorkflowSourceGenerator;
import com.example.workflowgraph.layout.LayoutDirection;
import com.example.workflowgraph.layout.WorkflowLayoutEngine;
import com.example.workflowgraph.model.Workflow;
import com.example.workflowgraph.sink.WorkflowDocumentSink;
import com.example.workflowgraph.validation.WorkflowCheckReport;
import com.example.workflowgraph.validation.WorkflowGraphValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Application service over the workflow graph engine.
 * <p>
 * Every operation first decodes the incoming document through {@link WorkflowDocumentCodec}, so malformed
 * documents fail with a located error before anything else happens. Stored documents are always the
 * canonical re-encoding of the decoded graph.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowDesignService {

    private final WorkflowDocumentCodec documentCodec;
    private final WorkflowLayoutEngine layoutEngine;
    private final MermaidDiagramCodec diagramCodec;
    private final WorkflowSourceGenerator sourceGenerator;
    private final WorkflowAnalyzer analyzer;
    private final WorkflowDocumentSink sink;

    public WorkflowCheckReport check(WorkflowDocument document) {
        WorkflowCheckReport report = WorkflowGraphValidator.check(documentCodec.fromDocument(document));
        log.debug("Checked workflow passed={} issues={}", report.passed(), report.issues().size());
        return report;
    }

    /**
     * @param direction flow direction, or {@code null} for the configured default
     */
    public WorkflowDocument layout(WorkflowDocument document, LayoutDirection direction) {
        Workflow workflow = documentCodec.fromDocument(document);
        layoutEngine.layout(workflow, direction != null
                ? layoutEngine.defaults().withDirection(direction)
                : layoutEngine.defaults());
        return documentCodec.toDocument(workflow);
    }

    public String diagram(WorkflowDocument document, LayoutDirection direction) {
        Workflow workflow = documentCodec.fromDocument(document);
        return diagramCodec.toDiagram(workflow, direction != null ? direction : layoutEngine.defaults().direction());
    }

    public String source(WorkflowDocument document, SourceGenerationOptions options) {
        return sourceGenerator.generateSource(document, options);
    }

    public WorkflowAnalysis analyse(WorkflowDocument document, boolean connectedOnly) {
        return analyzer.analyse(document, connectedOnly);
    }

    public String summarise(WorkflowAnalysis analysis, int maxLength) {
        return WorkflowAnalysisFormatter.formatForLlm(analysis, maxLength);
    }

    public String save(WorkflowDocument document) {
        WorkflowDocument canonical = canonical(document);
        String id = sink.submitDocument(canonical);
        log.info("Saved workflow id={} title='{}'", id, canonical.metadata().title());
        return id;
    }

    public WorkflowDocument update(String id, WorkflowDocument document) {
        WorkflowDocument canonical = canonical(document);
        sink.updateDocument(id, canonical);
        log.info("Updated workflow id={} title='{}'", id, canonical.metadata().title());
        return canonical;
    }

    public WorkflowDocument load(String id) {
        log.debug("Loading workflow id={}", id);
        return sink.fetchDocument(id);
    }

    /**
     * Updates the stored document with the same title, or saves a new one. Returns the id.
     */
    public String saveOrUpdateByTitle(WorkflowDocument document) {
        WorkflowDocument canonical = canonical(document);
        Optional<String> existing = sink.findIdByTitle(canonical.metadata().title());
        if (existing.isPresent()) {
            sink.updateDocument(existing.get(), canonical);
            return existing.get();
        }
        return sink.submitDocument(canonical);
    }

    private WorkflowDocument canonical(WorkflowDocument document) {
        return documentCodec.toDocument(documentCodec.fromDocument(document));
    }
}
