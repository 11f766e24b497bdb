package com.example.workflowgraph.codec;

import com.example.workflowgraph.codec.document.WorkflowDocument;
import com.example.workflowgraph.model.Workflow;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * JSON text form of workflow documents.
 */
@Component
@RequiredArgsConstructor
public class WorkflowJsonCodec {

    private final JsonMapper jsonMapper;
    private final WorkflowDocumentCodec documentCodec;

    public String write(WorkflowDocument document) {
        return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    }

    /**
     * @throws WorkflowDeserializationException if the text is not a well-formed document
     */
    public WorkflowDocument read(String json) {
        return readDocument(jsonMapper, json);
    }

    public String toJson(Workflow workflow) {
        return write(documentCodec.toDocument(workflow));
    }

    public Workflow fromJson(String json) {
        return documentCodec.fromDocument(read(json));
    }

    public static WorkflowDocument readDocument(JsonMapper jsonMapper, String json) {
        if (json == null || json.isBlank()) {
            throw new WorkflowDeserializationException("$", "document text is empty");
        }
        try {
            WorkflowDocument document = jsonMapper.readValue(json, WorkflowDocument.class);
            if (document == null) {
                throw new WorkflowDeserializationException("$", "document is null");
            }
            return document;
        } catch (JacksonException e) {
            throw new WorkflowDeserializationException("$", "malformed workflow JSON: " + e.getOriginalMessage(), e);
        }
    }
}
