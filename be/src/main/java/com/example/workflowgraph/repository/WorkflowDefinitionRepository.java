package com.example.workflowgraph.repository;

import com.example.workflowgraph.domain.WorkflowDefinition;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface WorkflowDefinitionRepository extends JpaRepository<WorkflowDefinition, UUID> {

    Optional<WorkflowDefinition> findFirstByTitleOrderByCreatedAtAsc(String title);
}
