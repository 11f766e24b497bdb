package com.example.workflowgraph.support;

import com.example.workflowgraph.api.WorkflowNotFoundException;
import com.example.workflowgraph.codec.document.WorkflowDocument;
import com.example.workflowgraph.sink.WorkflowDocumentSink;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryWorkflowDocumentSink implements WorkflowDocumentSink {

    private final Map<String, WorkflowDocument> documents = new LinkedHashMap<>();
    private int sequence;

    @Override
    public String submitDocument(WorkflowDocument document) {
        String id = "wf-" + (++sequence);
        documents.put(id, document);
        return id;
    }

    @Override
    public WorkflowDocument fetchDocument(String remoteId) {
        WorkflowDocument document = documents.get(remoteId);
        if (document == null) {
            throw new WorkflowNotFoundException(remoteId);
        }
        return document;
    }

    @Override
    public void updateDocument(String remoteId, WorkflowDocument document) {
        if (!documents.containsKey(remoteId)) {
            throw new WorkflowNotFoundException(remoteId);
        }
        documents.put(remoteId, document);
    }

    @Override
    public Optional<String> findIdByTitle(String title) {
        return documents.entrySet().stream()
                .filter(e -> e.getValue().metadata() != null && title.equals(e.getValue().metadata().title()))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public int size() {
        return documents.size();
    }
}
