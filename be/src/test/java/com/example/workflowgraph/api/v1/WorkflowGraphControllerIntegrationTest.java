package com.example.workflowgraph.api.v1;

import com.example.workflowgraph.sink.WorkflowDocumentSink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(WorkflowGraphControllerIntegrationTest.RestTemplateTestConfig.class)
@DisplayName("Workflow graph API")
class WorkflowGraphControllerIntegrationTest {

    @TestConfiguration
    static class RestTemplateTestConfig {
        @Bean
        public RestTemplate restTemplate() {
            RestTemplate rest = new RestTemplate();
            rest.setErrorHandler(new org.springframework.web.client.ResponseErrorHandler() {
                @Override
                public boolean hasError(ClientHttpResponse response) {
                    return false;
                }

                @Override
                public void handleError(java.net.URI url, HttpMethod method, ClientHttpResponse response) throws java.io.IOException {
                }
            });
            return rest;
        }
    }

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {};

    private static final String PIPELINE_JSON = """
            {
              "nodes": [
                { "id": "input", "type": "TextInOut" },
                { "id": "template", "type": "TemplateCompose",
                  "ports": [ { "name": "userInput", "dataType": "text", "isOutput": false, "multiple": false, "shown": false } ] },
                { "id": "llm", "type": "OpenAI" },
                { "id": "output", "type": "Text" }
              ],
              "edges": [
                { "sourceNodeId": "input", "sourcePort": "output", "targetNodeId": "template", "targetPort": "userInput" },
                { "sourceNodeId": "template", "sourcePort": "output", "targetNodeId": "llm", "targetPort": "prompt" },
                { "sourceNodeId": "llm", "sourcePort": "output", "targetNodeId": "output", "targetPort": "text" }
              ],
              "metadata": { "title": "API pipeline", "brief": "", "language": "en-US" }
            }
            """;

    private static final String CYCLE_JSON = """
            {
              "nodes": [
                { "id": "a", "type": "TextInOut" },
                { "id": "b", "type": "TextInOut" }
              ],
              "edges": [
                { "sourceNodeId": "a", "sourcePort": "output", "targetNodeId": "b", "targetPort": "text" },
                { "sourceNodeId": "b", "sourcePort": "output", "targetNodeId": "a", "targetPort": "text" }
              ]
            }
            """;

    @LocalServerPort
    private int port;

    @Autowired
    private RestTemplate restTemplate;

    @Autowired
    private WorkflowDocumentSink sink;

    private String baseUrl() {
        return "http://localhost:" + port + "/api/v1/workflow-graphs";
    }

    private static HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private ResponseEntity<Map<String, Object>> exchange(String path, HttpMethod method, String body) {
        return restTemplate.exchange(baseUrl() + path, method, body != null ? json(body) : null, JSON_OBJECT);
    }

    private ResponseEntity<String> text(String path, String body) {
        return restTemplate.exchange(baseUrl() + path, HttpMethod.POST, json(body), String.class);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOf(Object value) {
        return (List<Map<String, Object>>) value;
    }

    @Nested
    @DisplayName("design operations")
    class DesignOperations {

        @Test
        @DisplayName("POST /check returns the report for a sound pipeline")
        void check() {
            ResponseEntity<Map<String, Object>> resp = exchange("/check", HttpMethod.POST, PIPELINE_JSON);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).containsEntry("noCycle", true)
                    .containsEntry("noIsolatedNodes", true)
                    .containsEntry("noTypeViolations", true);
        }

        @Test
        @DisplayName("POST /check reports a cycle with its witness")
        void checkCycle() {
            ResponseEntity<Map<String, Object>> resp = exchange("/check", HttpMethod.POST, CYCLE_JSON);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).containsEntry("noCycle", false);
            assertThat(resp.getBody().get("cycleWitness")).isEqualTo(List.of("a", "b"));
        }

        @Test
        @DisplayName("POST /layout?direction=TB places layers top to bottom")
        void layout() {
            ResponseEntity<Map<String, Object>> resp = exchange("/layout?direction=TB", HttpMethod.POST, PIPELINE_JSON);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            List<Map<String, Object>> nodes = listOf(resp.getBody().get("nodes"));
            assertThat(nodes).hasSize(4);
            Map<String, Object> outputPosition = (Map<String, Object>) nodes.get(3).get("position");
            assertThat(((Number) outputPosition.get("x")).doubleValue()).isEqualTo(0.0);
            assertThat(((Number) outputPosition.get("y")).doubleValue()).isGreaterThan(0.0);
        }

        @Test
        @DisplayName("POST /layout with a cycle returns 422 naming the cycle")
        void layoutCycle() {
            ResponseEntity<Map<String, Object>> resp = exchange("/layout", HttpMethod.POST, CYCLE_JSON);
            assertThat(resp.getStatusCode().value()).isEqualTo(422);
            List<Map<String, Object>> errors = listOf(resp.getBody().get("errors"));
            assertThat(errors).singleElement().satisfies(e -> assertThat(e.get("field")).isEqualTo("cycle"));
        }

        @Test
        @DisplayName("POST /layout with an unknown direction returns 400")
        void layoutBadDirection() {
            ResponseEntity<Map<String, Object>> resp = exchange("/layout?direction=UP", HttpMethod.POST, PIPELINE_JSON);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        }

        @Test
        @DisplayName("POST /diagram returns Mermaid flowchart text")
        void diagram() {
            ResponseEntity<String> resp = text("/diagram?direction=LR", PIPELINE_JSON);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).startsWith("flowchart LR\n")
                    .contains("\"llm: OpenAI\"")
                    .contains("-->|\"output -> prompt\"|");
        }

        @Test
        @DisplayName("POST /source returns a Java class with the requested name")
        void source() {
            ResponseEntity<String> resp = text("/source?className=ApiPipeline&packageName=demo.flows", PIPELINE_JSON);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).startsWith("package demo.flows;")
                    .contains("public final class ApiPipeline")
                    .contains("workflow.connect(\"llm\", \"output\", \"output\", \"text\");");
        }

        @Test
        @DisplayName("POST /source with an invalid class name returns 400")
        void sourceBadClassName() {
            ResponseEntity<String> resp = text("/source?className=class", PIPELINE_JSON);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        }

        @Test
        @DisplayName("POST /analysis returns the structured analysis and a bounded summary")
        void analysis() {
            ResponseEntity<Map<String, Object>> resp = exchange("/analysis?maxLength=120", HttpMethod.POST, PIPELINE_JSON);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            Map<String, Object> analysis = (Map<String, Object>) resp.getBody().get("analysis");
            assertThat(analysis).containsEntry("totalNodeCount", 4)
                    .containsEntry("connectionCount", 3)
                    .containsEntry("longestPathLength", 3)
                    .containsEntry("hasCycle", false);
            String summary = (String) resp.getBody().get("summary");
            assertThat(summary).startsWith("Workflow: 4 nodes, 3 connections");
            assertThat(summary.length()).isLessThanOrEqualTo(120);
        }

        @Test
        @DisplayName("an edge to an unknown node returns 400 with its location")
        void unknownNode() {
            String body = """
                    {
                      "nodes": [ { "id": "a", "type": "TextInOut" } ],
                      "edges": [ { "sourceNodeId": "a", "sourcePort": "output", "targetNodeId": "ghost", "targetPort": "text" } ]
                    }
                    """;
            ResponseEntity<Map<String, Object>> resp = exchange("/check", HttpMethod.POST, body);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            List<Map<String, Object>> errors = listOf(resp.getBody().get("errors"));
            assertThat(errors).singleElement().satisfies(e -> assertThat(e.get("field")).isEqualTo("edges[0].targetNodeId"));
        }

        @Test
        @DisplayName("malformed JSON returns 400")
        void malformedJson() {
            ResponseEntity<Map<String, Object>> resp = exchange("/check", HttpMethod.POST, "{ \"nodes\": [");
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).containsEntry("message", "Malformed workflow JSON");
        }
    }

    @Nested
    @DisplayName("storage")
    class Storage {

        @Test
        @DisplayName("POST returns 201 and id; GET returns the canonical document; PUT replaces it")
        void saveGetUpdate() {
            ResponseEntity<Map<String, Object>> created = exchange("", HttpMethod.POST, PIPELINE_JSON);
            assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
            String id = (String) created.getBody().get("id");
            assertThat(id).isNotBlank();

            ResponseEntity<Map<String, Object>> fetched = exchange("/" + id, HttpMethod.GET, null);
            assertThat(fetched.getStatusCode()).isEqualTo(HttpStatus.OK);
            List<Map<String, Object>> nodes = listOf(fetched.getBody().get("nodes"));
            assertThat(nodes).extracting(n -> n.get("id")).containsExactly("input", "template", "llm", "output");
            assertThat(nodes.get(2)).containsEntry("category", "llms");
            assertThat(listOf(nodes.get(2).get("ports"))).hasSize(8);

            ResponseEntity<Map<String, Object>> updated = exchange("/" + id, HttpMethod.PUT, CYCLE_JSON);
            assertThat(updated.getStatusCode()).isEqualTo(HttpStatus.OK);
            ResponseEntity<Map<String, Object>> refetched = exchange("/" + id, HttpMethod.GET, null);
            assertThat(listOf(refetched.getBody().get("nodes"))).hasSize(2);
        }

        @Test
        @DisplayName("GET and PUT on an unknown id return 404")
        void unknownId() {
            assertThat(exchange("/00000000-0000-0000-0000-000000000000", HttpMethod.GET, null).getStatusCode())
                    .isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(exchange("/not-a-uuid", HttpMethod.PUT, PIPELINE_JSON).getStatusCode())
                    .isEqualTo(HttpStatus.NOT_FOUND);
        }

        @Test
        @DisplayName("POST with an unknown node type stores nothing and returns 400")
        void saveInvalid() {
            String body = """
                    { "nodes": [ { "id": "x", "type": "Teleporter" } ] }
                    """;
            ResponseEntity<Map<String, Object>> resp = exchange("", HttpMethod.POST, body);
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            List<Map<String, Object>> errors = listOf(resp.getBody().get("errors"));
            assertThat(errors).singleElement().satisfies(e -> assertThat(e.get("field")).isEqualTo("nodes[0].type"));
        }
    }

    @Test
    @DisplayName("bundled example workflows are stored at startup and served by id")
    void exampleWorkflowsLoaded() {
        String id = sink.findIdByTitle("Resume screening").orElseThrow();
        ResponseEntity<Map<String, Object>> resp = exchange("/" + id, HttpMethod.GET, null);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(sink.findIdByTitle("Text summary pipeline")).isPresent();
    }

    @Test
    @DisplayName("GET /api/v1/health returns UP")
    void health() {
        ResponseEntity<Map<String, Object>> resp = restTemplate.exchange(
                "http://localhost:" + port + "/api/v1/health", HttpMethod.GET, null, JSON_OBJECT);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("status", "UP").containsEntry("service", "workflow-graph-be");
    }
}
