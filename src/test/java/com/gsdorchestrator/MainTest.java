package com.gsdorchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsdorchestrator.discovery.DiscoveryCache;
import com.gsdorchestrator.discovery.GsdDiscoveryService;
import com.gsdorchestrator.extension.ExtensionCapabilities;
import com.gsdorchestrator.gates.OperatingMode;
import com.gsdorchestrator.intent.IntentClassifier;
import com.gsdorchestrator.models.InstallLocation;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private Javalin app;

    @BeforeEach
    void startServer() throws Exception {
        Path fixture = Paths.get(getClass().getResource("/fixtures/gsd-v1.15").toURI());
        GsdDiscoveryService discovery = new GsdDiscoveryService(fixture, InstallLocation.LOCAL, new DiscoveryCache(), mapper);
        OrchestratorService service = new OrchestratorService(discovery, fixture.resolve("planning"),
            ExtensionCapabilities.none(), new IntentClassifier(), OperatingMode.INTERACTIVE, false, mapper);
        app = Main.createApp(service).start(0);
    }

    @AfterEach
    void stopServer() {
        app.stop();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + app.port() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + app.port() + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void classifyEndpointReturnsJson() throws Exception {
        HttpResponse<String> response = post("/api/classify", "{\"query\":\"/gsd:plan-phase 3 --research\"}");
        assertEquals(200, response.statusCode());
        JsonNode json = mapper.readTree(response.body());
        assertEquals("exact-match", json.get("type").asText());
        assertEquals("exact", json.get("method").asText());
        assertEquals("gsd:plan-phase", json.get("command").get("name").asText());
        assertEquals("3", json.get("arguments").get("phaseNumber").asText());
    }

    @Test
    void lifecycleEndpointSuggestsExecution() throws Exception {
        HttpResponse<String> response = get("/api/lifecycle/next");
        assertEquals(200, response.statusCode());
        JsonNode json = mapper.readTree(response.body());
        assertEquals("executing", json.get("stage").asText());
        assertEquals("gsd:execute-phase", json.get("primary").get("command").asText());
    }

    @Test
    void gateEndpointValidatesConfidence() throws Exception {
        HttpResponse<String> ok = post("/api/gate", "{\"command\":\"gsd:remove-phase\",\"confidence\":0.9}");
        assertEquals(200, ok.statusCode());
        assertEquals("confirm", mapper.readTree(ok.body()).get("action").asText());

        HttpResponse<String> bad = post("/api/gate", "{\"command\":\"gsd:remove-phase\",\"confidence\":\"high\"}");
        assertEquals(400, bad.statusCode());
        assertTrue(mapper.readTree(bad.body()).has("error"));
    }

    @Test
    void malformedBodyIsABadRequest() throws Exception {
        assertEquals(400, post("/api/classify", "{not json").statusCode());
    }
}
