package com.example.workflowgraph.model;

import com.example.workflowgraph.model.WorkflowStructureException.Reason;
import com.example.workflowgraph.registry.NodeTypeRegistry;
import com.example.workflowgraph.support.WorkflowFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Workflow")
class WorkflowTest {

    private final NodeTypeRegistry registry = WorkflowFixtures.registry();
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        workflow = new Workflow();
    }

    @Nested
    @DisplayName("nodes")
    class Nodes {

        @Test
        @DisplayName("keeps insertion order")
        void insertionOrder() {
            workflow.addNode(registry.createNode("b", "TextInOut"));
            workflow.addNode(registry.createNode("a", "OpenAI"));
            assertEquals(List.of("b", "a"), workflow.nodes().stream().map(Node::getId).toList());
        }

        @Test
        @DisplayName("rejects duplicate ids")
        void duplicateId() {
            workflow.addNode(registry.createNode("a", "TextInOut"));
            WorkflowStructureException ex = assertThrows(WorkflowStructureException.class,
                    () -> workflow.addNode(registry.createNode("a", "Text")));
            assertEquals(Reason.DUPLICATE_NODE, ex.getReason());
            assertEquals("TextInOut", workflow.node("a").getType());
        }

        @Test
        @DisplayName("addNodes adds nothing when one id clashes")
        void addNodesAtomic() {
            workflow.addNode(registry.createNode("a", "TextInOut"));
            assertThrows(WorkflowStructureException.class, () -> workflow.addNodes(List.of(
                    registry.createNode("b", "Text"), registry.createNode("a", "Text"))));
            assertFalse(workflow.containsNode("b"));
        }

        @Test
        @DisplayName("unknown node lookups fail with UNKNOWN_NODE")
        void unknownNode() {
            WorkflowStructureException ex = assertThrows(WorkflowStructureException.class, () -> workflow.node("nope"));
            assertEquals(Reason.UNKNOWN_NODE, ex.getReason());
            assertEquals("nodes[nope]", ex.getLocation());
        }
    }

    @Nested
    @DisplayName("removal")
    class Removal {

        @Test
        @DisplayName("refuses to remove a connected node without cascade")
        void refusesWithoutCascade() {
            Workflow pipeline = WorkflowFixtures.textPipeline();
            WorkflowStructureException ex = assertThrows(WorkflowStructureException.class,
                    () -> pipeline.removeNode("llm"));
            assertEquals(Reason.NODE_HAS_CONNECTIONS, ex.getReason());
            assertTrue(pipeline.containsNode("llm"));
            assertEquals(3, pipeline.connections().size());
        }

        @Test
        @DisplayName("cascade removes the node and every connection touching it")
        void cascade() {
            Workflow pipeline = WorkflowFixtures.textPipeline();
            pipeline.removeNode("llm", true);
            assertFalse(pipeline.containsNode("llm"));
            assertEquals(1, pipeline.connections().size());
            assertTrue(pipeline.connections().stream().noneMatch(c -> c.touches("llm")));
        }
    }

    @Nested
    @DisplayName("connect")
    class Connect {

        @BeforeEach
        void nodes() {
            workflow.addNode(registry.createNode("in", "TextInOut"));
            workflow.addNode(registry.createNode("in2", "TextInOut"));
            workflow.addNode(registry.createNode("llm", "OpenAI"));
            workflow.addNode(registry.createNode("edit", "ImageEditing"));
            workflow.addNode(registry.createNode("loader", "FileLoader"));
        }

        @Test
        @DisplayName("connects an output to a compatible input")
        void connects() {
            Connection c = workflow.connect("in", "output", "llm", "prompt");
            assertEquals(List.of(c), workflow.connections());
            assertEquals(List.of(c), workflow.incoming("llm"));
            assertEquals(List.of(c), workflow.outgoing("in"));
        }

        @Test
        @DisplayName("text into image fails and leaves the graph unchanged")
        void typeMismatch() {
            PortTypeMismatchException ex = assertThrows(PortTypeMismatchException.class,
                    () -> workflow.connect("in", "output", "edit", "input_image"));
            assertEquals(DataType.IMAGE, ex.getExpected());
            assertEquals(DataType.TEXT, ex.getActual());
            assertTrue(workflow.connections().isEmpty());
        }

        @Test
        @DisplayName("rejects input-to-input and output-to-output")
        void direction() {
            WorkflowStructureException fromInput = assertThrows(WorkflowStructureException.class,
                    () -> workflow.connect("in", "text", "llm", "prompt"));
            assertEquals(Reason.INVALID_DIRECTION, fromInput.getReason());
            WorkflowStructureException toOutput = assertThrows(WorkflowStructureException.class,
                    () -> workflow.connect("in", "output", "llm", "output"));
            assertEquals(Reason.INVALID_DIRECTION, toOutput.getReason());
        }

        @Test
        @DisplayName("rejects unknown ports")
        void unknownPort() {
            WorkflowStructureException ex = assertThrows(WorkflowStructureException.class,
                    () -> workflow.connect("in", "result", "llm", "prompt"));
            assertEquals(Reason.UNKNOWN_PORT, ex.getReason());
            assertEquals("nodes[in].ports[result]", ex.getLocation());
        }

        @Test
        @DisplayName("rejects a duplicate connection")
        void duplicate() {
            workflow.connect("in", "output", "loader", "files");
            WorkflowStructureException ex = assertThrows(WorkflowStructureException.class,
                    () -> workflow.connect("in", "output", "loader", "files"));
            assertEquals(Reason.DUPLICATE_CONNECTION, ex.getReason());
        }

        @Test
        @DisplayName("a single-input port takes one connection")
        void singleArity() {
            workflow.connect("in", "output", "llm", "prompt");
            WorkflowStructureException ex = assertThrows(WorkflowStructureException.class,
                    () -> workflow.connect("in2", "output", "llm", "prompt"));
            assertEquals(Reason.ARITY_VIOLATION, ex.getReason());
            assertEquals(1, workflow.connections().size());
        }

        @Test
        @DisplayName("a multiple-input port takes many connections")
        void multipleArity() {
            workflow.connect("in", "output", "loader", "files");
            workflow.connect("in2", "output", "loader", "files");
            assertEquals(2, workflow.incomingCount("loader", "files"));
        }

        @Test
        @DisplayName("cycles are allowed at build time")
        void cyclesAllowed() {
            Workflow triangle = WorkflowFixtures.triangle();
            assertEquals(3, triangle.connections().size());
        }

        @Test
        @DisplayName("disconnect removes only the named connection")
        void disconnect() {
            workflow.connect("in", "output", "llm", "prompt");
            workflow.disconnect("in", "output", "llm", "prompt");
            assertTrue(workflow.connections().isEmpty());
            WorkflowStructureException ex = assertThrows(WorkflowStructureException.class,
                    () -> workflow.disconnect("in", "output", "llm", "prompt"));
            assertEquals(Reason.UNKNOWN_CONNECTION, ex.getReason());
        }
    }

    @Nested
    @DisplayName("ports")
    class Ports {

        @Test
        @DisplayName("addPort rejects a name already on the node")
        void duplicatePort() {
            workflow.addNode(registry.createNode("t", "TemplateCompose"));
            workflow.addPort("t", Port.input("userInput", DataType.TEXT));
            WorkflowStructureException ex = assertThrows(WorkflowStructureException.class,
                    () -> workflow.addPort("t", Port.input("userInput", DataType.NUMBER)));
            assertEquals(Reason.DUPLICATE_PORT, ex.getReason());
        }

        @Test
        @DisplayName("setPortValue checks the value tag")
        void setPortValue() {
            workflow.addNode(registry.createNode("llm", "OpenAI"));
            workflow.setPortValue("llm", "temperature", PortValue.number(0.1));
            assertEquals(PortValue.number(0.1), workflow.port("llm", "temperature").value());
            assertThrows(PortTypeMismatchException.class,
                    () -> workflow.setPortValue("llm", "temperature", PortValue.text("hot")));
            assertEquals(PortValue.number(0.1), workflow.port("llm", "temperature").value());
        }
    }
}
