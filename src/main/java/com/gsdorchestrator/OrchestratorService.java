package com.gsdorchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsdorchestrator.discovery.DiscoveryCache;
import com.gsdorchestrator.discovery.GsdDiscoveryService;
import com.gsdorchestrator.discovery.GsdInstallation;
import com.gsdorchestrator.discovery.InstallationDetector;
import com.gsdorchestrator.extension.ExtensionCapabilities;
import com.gsdorchestrator.extension.ExtensionDetector;
import com.gsdorchestrator.gates.GateDecision;
import com.gsdorchestrator.gates.GateEvaluator;
import com.gsdorchestrator.gates.OperatingMode;
import com.gsdorchestrator.intent.ClassificationResult;
import com.gsdorchestrator.intent.IntentClassifier;
import com.gsdorchestrator.lifecycle.LifecycleCoordinator;
import com.gsdorchestrator.lifecycle.LifecycleSuggestion;
import com.gsdorchestrator.models.DiscoveryResult;
import com.gsdorchestrator.models.DiscoveryWarning;
import com.gsdorchestrator.models.InstallLocation;
import com.gsdorchestrator.models.ProjectState;
import com.gsdorchestrator.state.ConfigValidator;
import com.gsdorchestrator.state.ProjectStateReader;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Wires discovery, state reading, classification, gating and lifecycle suggestions together for one
 * installation and one planning directory.
 *
 * <p>The classifier is retrained whenever discovery produces a new result (a cache miss); cache hits
 * reuse the trained model.
 */
public class OrchestratorService {

    private final GsdDiscoveryService discoveryService;
    private final ProjectStateReader stateReader;
    private final LifecycleCoordinator coordinator;
    private final ConfigValidator configValidator;
    private final ExtensionCapabilities extension;
    private final IntentClassifier classifier;
    private final OperatingMode defaultMode;
    private final boolean semanticRequested;
    private final AppLogger logger;
    private DiscoveryResult trainedOn;

    public OrchestratorService(GsdDiscoveryService discoveryService, Path planningDir, ExtensionCapabilities extension,
                               IntentClassifier classifier, OperatingMode defaultMode, boolean semanticRequested,
                               ObjectMapper objectMapper) {
        this.discoveryService = discoveryService;
        this.stateReader = new ProjectStateReader(planningDir, objectMapper);
        this.coordinator = new LifecycleCoordinator(planningDir);
        this.configValidator = new ConfigValidator(objectMapper);
        this.extension = extension != null ? extension : ExtensionCapabilities.none();
        this.classifier = classifier != null ? classifier : new IntentClassifier();
        this.defaultMode = defaultMode != null ? defaultMode : OperatingMode.INTERACTIVE;
        this.semanticRequested = semanticRequested;
        this.logger = AppLogger.get();
    }

    /**
     * Builds the service from command-line configuration, detecting the installation and extension.
     */
    public static OrchestratorService fromConfig(AppConfig config, ObjectMapper objectMapper) {
        GsdDiscoveryService discovery;
        if (config.getBasePath() != null) {
            discovery = new GsdDiscoveryService(config.getBasePath(), InstallLocation.GLOBAL,
                new DiscoveryCache(), objectMapper);
        } else {
            GsdInstallation installation = new InstallationDetector().detect();
            discovery = installation != null
                ? new GsdDiscoveryService(installation.getBasePath(), installation.getLocation(),
                    new DiscoveryCache(), objectMapper)
                : null;
        }
        if (discovery == null) {
            AppLogger.get().warn("No GSD installation found; discovery and classification are unavailable");
        }
        ExtensionCapabilities extension = new ExtensionDetector().detect();
        IntentClassifier classifier = new IntentClassifier(new IntentClassifier.Config().enableSemantic(config.isSemantic()));
        return new OrchestratorService(discovery, config.getPlanningPath(), extension, classifier,
            config.getMode(), config.isSemantic(), objectMapper);
    }

    public boolean hasInstallation() {
        return discoveryService != null;
    }

    public DiscoveryResult discover() {
        if (discoveryService == null) {
            throw new IllegalStateException("No GSD installation configured");
        }
        return discoveryService.discover();
    }

    public List<DiscoveryWarning> getWarnings() {
        return discoveryService != null ? discoveryService.getWarnings() : Collections.emptyList();
    }

    public ProjectState readState() {
        return stateReader.read();
    }

    public ClassificationResult classify(String query) {
        if (discoveryService == null) {
            return ClassificationResult.error(query, "No GSD installation configured");
        }
        ensureTrained();
        return classifier.classify(query, readState());
    }

    public GateDecision evaluateGate(String commandName, OperatingMode mode, double confidence) {
        return GateEvaluator.evaluateGate(commandName, mode != null ? mode : effectiveMode(), confidence);
    }

    public LifecycleSuggestion suggestNextStep(String afterCommand) {
        return coordinator.suggestNextStep(readState(), afterCommand);
    }

    public ConfigValidator.ValidationResult validateConfig(String rawJson) {
        return configValidator.validate(rawJson);
    }

    public ExtensionCapabilities getExtension() {
        return extension;
    }

    public IntentClassifier getClassifier() {
        return classifier;
    }

    /**
     * The mode from config.json when the project has one, otherwise the command-line mode.
     */
    public OperatingMode effectiveMode() {
        ProjectState state = readState();
        if (state.isHasConfig()) {
            return OperatingMode.fromValue(state.getConfig().getMode());
        }
        return defaultMode;
    }

    private synchronized void ensureTrained() {
        DiscoveryResult current = discoveryService.discover();
        if (current != trainedOn) {
            classifier.initialize(current, semanticRequested, extension);
            trainedOn = current;
            logger.info("Classifier retrained for discovery at " + current.getDiscoveredAt());
        }
    }
}
