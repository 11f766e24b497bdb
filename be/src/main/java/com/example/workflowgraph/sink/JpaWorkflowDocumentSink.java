package com.example.workflowgraph.sink;

import com.example.workflowgraph.api.WorkflowNotFoundException;
import com.example.workflowgraph.codec.document.WorkflowDocument;
import com.example.workflowgraph.domain.WorkflowDefinition;
import com.example.workflowgraph.model.WorkflowMetadata;
import com.example.workflowgraph.repository.WorkflowDefinitionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores documents as JSON in the {@code workflow_definition} table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaWorkflowDocumentSink implements WorkflowDocumentSink {

    private final WorkflowDefinitionRepository repository;
    private final JsonMapper jsonMapper;

    @Override
    @Transactional
    public String submitDocument(WorkflowDocument document) {
        Instant now = Instant.now();
        UUID id = UUID.randomUUID();
        repository.save(new WorkflowDefinition(id, title(document), writeJson(document), now, now));
        log.debug("Persisted workflow document id={} nodes={}", id, document.nodes().size());
        return id.toString();
    }

    @Override
    @Transactional(readOnly = true)
    public WorkflowDocument fetchDocument(String remoteId) {
        WorkflowDefinition entity = find(remoteId);
        return readJson(entity.getDocumentJson());
    }

    @Override
    @Transactional
    public void updateDocument(String remoteId, WorkflowDocument document) {
        WorkflowDefinition existing = find(remoteId);
        repository.save(new WorkflowDefinition(existing.getId(), title(document), writeJson(document),
                existing.getCreatedAt(), Instant.now()));
        log.debug("Updated workflow document id={}", remoteId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findIdByTitle(String title) {
        return repository.findFirstByTitleOrderByCreatedAtAsc(title).map(d -> d.getId().toString());
    }

    private WorkflowDefinition find(String remoteId) {
        UUID id;
        try {
            id = UUID.fromString(remoteId);
        } catch (IllegalArgumentException e) {
            throw new WorkflowNotFoundException(remoteId);
        }
        return repository.findById(id).orElseThrow(() -> new WorkflowNotFoundException(remoteId));
    }

    private static String title(WorkflowDocument document) {
        return document.metadata() != null && document.metadata().title() != null
                ? document.metadata().title()
                : WorkflowMetadata.DEFAULT_TITLE;
    }

    private String writeJson(WorkflowDocument document) {
        try {
            return jsonMapper.writeValueAsString(document);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow document", e);
        }
    }

    private WorkflowDocument readJson(String json) {
        try {
            return jsonMapper.readValue(json, WorkflowDocument.class);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize stored workflow document", e);
        }
    }
}
