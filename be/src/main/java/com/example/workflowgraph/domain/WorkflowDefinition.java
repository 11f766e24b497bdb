package com.example.workflowgraph.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for a stored workflow document.
 * <p>
 * Keeps the workflow title for lookup and the canonical document JSON in {@code document_json}.
 * Timestamps are set on create and update.
 * </p>
 */
@Entity
@Table(name = "workflow_definition")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkflowDefinition {

    @Id
    private UUID id;

    @Column(nullable = false, length = 255)
    private String title;

    @Column(name = "document_json", nullable = false, columnDefinition = "CLOB")
    private String documentJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public WorkflowDefinition(UUID id, String title, String documentJson, Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = Objects.requireNonNull(title, "title");
        this.documentJson = Objects.requireNonNull(documentJson, "documentJson");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
