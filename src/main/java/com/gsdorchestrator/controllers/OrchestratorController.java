package com.gsdorchestrator.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsdorchestrator.OrchestratorService;
import com.gsdorchestrator.gates.OperatingMode;
import com.gsdorchestrator.verbosity.OutputSection;
import com.gsdorchestrator.verbosity.VerbosityController;
import com.gsdorchestrator.verbosity.VerbosityLevel;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only JSON endpoints over the orchestrator. Nothing here writes project files or runs commands.
 */
public class OrchestratorController implements Controller {

    private final OrchestratorService service;
    private final ObjectMapper objectMapper;

    public OrchestratorController(OrchestratorService service, ObjectMapper objectMapper) {
        this.service = service;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/discovery", this::getDiscovery);
        app.get("/api/discovery/warnings", this::getWarnings);
        app.get("/api/state", this::getState);
        app.post("/api/classify", this::classify);
        app.post("/api/gate", this::evaluateGate);
        app.get("/api/lifecycle/next", this::suggestNext);
        app.post("/api/config/validate", this::validateConfig);
        app.get("/api/extension", this::getExtension);
        app.post("/api/verbosity/filter", this::filterVerbosity);
    }

    private void getDiscovery(Context ctx) {
        if (!service.hasInstallation()) {
            ctx.status(404).json(Map.of("error", "No GSD installation configured"));
            return;
        }
        ctx.json(service.discover());
    }

    private void getWarnings(Context ctx) {
        ctx.json(service.getWarnings());
    }

    private void getState(Context ctx) {
        ctx.json(service.readState());
    }

    private void classify(Context ctx) throws Exception {
        JsonNode json = readBody(ctx);
        String query = json.path("query").asText("");
        ctx.json(service.classify(query));
    }

    private void evaluateGate(Context ctx) throws Exception {
        JsonNode json = readBody(ctx);
        String command = json.path("command").asText(null);
        OperatingMode mode = json.hasNonNull("mode") ? OperatingMode.fromValue(json.get("mode").asText()) : null;
        JsonNode confidence = json.path("confidence");
        if (!confidence.isNumber()) {
            throw new IllegalArgumentException("confidence must be a number");
        }
        ctx.json(service.evaluateGate(command, mode, confidence.asDouble()));
    }

    private void suggestNext(Context ctx) {
        ctx.json(service.suggestNextStep(ctx.queryParam("after")));
    }

    private void validateConfig(Context ctx) {
        ctx.json(service.validateConfig(ctx.body()));
    }

    private void getExtension(Context ctx) {
        ctx.json(service.getExtension());
    }

    private void filterVerbosity(Context ctx) throws Exception {
        JsonNode json = readBody(ctx);
        VerbosityLevel level = VerbosityLevel.parse(
            json.hasNonNull("level") ? objectMapper.convertValue(json.get("level"), Object.class) : null);
        List<OutputSection> sections = new ArrayList<>();
        for (JsonNode node : json.path("sections")) {
            sections.add(objectMapper.treeToValue(node, OutputSection.class));
        }
        ctx.json(VerbosityController.filterByVerbosity(sections, level));
    }

    private JsonNode readBody(Context ctx) throws Exception {
        String body = ctx.body();
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("Request body is required");
        }
        JsonNode json = objectMapper.readTree(body);
        if (!json.isObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        return json;
    }
}
