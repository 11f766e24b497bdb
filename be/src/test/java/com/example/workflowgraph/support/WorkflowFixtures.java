package com.example.workflowgraph.support;

import com.example.workflowgraph.model.DataType;
import com.example.workflowgraph.model.Port;
import com.example.workflowgraph.model.Workflow;
import com.example.workflowgraph.model.WorkflowMetadata;
import com.example.workflowgraph.registry.DefaultNodeTypeRegistry;
import com.example.workflowgraph.registry.NodeTypeRegistry;

import tools.jackson.databind.json.JsonMapper;

/**
 * Shared graphs and collaborators for unit tests.
 */
public final class WorkflowFixtures {

    private static final JsonMapper JSON_MAPPER = JsonMapper.builder().build();
    private static final NodeTypeRegistry REGISTRY = new DefaultNodeTypeRegistry(JSON_MAPPER);

    private WorkflowFixtures() {
    }

    public static JsonMapper jsonMapper() {
        return JSON_MAPPER;
    }

    public static NodeTypeRegistry registry() {
        return REGISTRY;
    }

    /**
     * input(TextInOut) → template(TemplateCompose).userInput → llm(OpenAI).prompt → output(Text).text
     */
    public static Workflow textPipeline() {
        Workflow workflow = new Workflow(new WorkflowMetadata("Text pipeline", "four node chain", "en-US"));
        workflow.addNode(REGISTRY.createNode("input", "TextInOut"));
        workflow.addNode(REGISTRY.createNode("template", "TemplateCompose"));
        workflow.addNode(REGISTRY.createNode("llm", "OpenAI"));
        workflow.addNode(REGISTRY.createNode("output", "Text"));
        workflow.addPort("template", Port.input("userInput", DataType.TEXT));
        workflow.connect("input", "output", "template", "userInput");
        workflow.connect("template", "output", "llm", "prompt");
        workflow.connect("llm", "output", "output", "text");
        return workflow;
    }

    /**
     * Three TextInOut nodes wired a → b → c → a.
     */
    public static Workflow triangle() {
        Workflow workflow = new Workflow();
        for (String id : new String[]{"a", "b", "c"}) {
            workflow.addNode(REGISTRY.createNode(id, "TextInOut"));
        }
        workflow.connect("a", "output", "b", "text");
        workflow.connect("b", "output", "c", "text");
        workflow.connect("c", "output", "a", "text");
        return workflow;
    }
}
