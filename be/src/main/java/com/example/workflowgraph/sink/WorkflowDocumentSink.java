package com.example.workflowgraph.sink;

import com.example.workflowgraph.codec.document.WorkflowDocument;

import java.util.Optional;

/**
 * Where canonical workflow documents are stored. Ids are opaque strings assigned by the sink.
 */
public interface WorkflowDocumentSink {

    String submitDocument(WorkflowDocument document);

    /**
     * @throws com.example.workflowgraph.api.WorkflowNotFoundException if the id is unknown
     */
    WorkflowDocument fetchDocument(String remoteId);

    /**
     * @throws com.example.workflowgraph.api.WorkflowNotFoundException if the id is unknown
     */
    void updateDocument(String remoteId, WorkflowDocument document);

    /**
     * Id of the oldest stored document with this title, if any.
     */
    Optional<String> findIdByTitle(String title);
}
