package com.gsdorchestrator.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsdorchestrator.AppLogger;
import com.gsdorchestrator.models.ParsedProject;
import com.gsdorchestrator.models.ParsedRoadmap;
import com.gsdorchestrator.models.ParsedState;
import com.gsdorchestrator.models.PhaseInfo;
import com.gsdorchestrator.models.ProjectConfig;
import com.gsdorchestrator.models.ProjectState;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads a planning directory into one {@link ProjectState}. Each document is optional; an unreadable or
 * unparseable document is treated as missing.
 */
public class ProjectStateReader {

    public static final String ROADMAP_FILE = "ROADMAP.md";
    public static final String STATE_FILE = "STATE.md";
    public static final String PROJECT_FILE = "PROJECT.md";
    public static final String CONFIG_FILE = "config.json";
    public static final String PHASES_DIR = "phases";

    private static final Pattern PHASE_DIR_NUMBER = Pattern.compile("^(\\d+(?:\\.\\d+)?)(?:-.*)?$");

    private final Path planningDir;
    private final RoadmapParser roadmapParser = new RoadmapParser();
    private final StateParser stateParser = new StateParser();
    private final ProjectParser projectParser = new ProjectParser();
    private final ConfigParser configParser;
    private final AppLogger logger;

    public ProjectStateReader(Path planningDir) {
        this(planningDir, new ObjectMapper());
    }

    public ProjectStateReader(Path planningDir, ObjectMapper objectMapper) {
        this.planningDir = planningDir;
        this.configParser = new ConfigParser(objectMapper);
        this.logger = AppLogger.get();
    }

    public Path getPlanningDir() {
        return planningDir;
    }

    public ProjectState read() {
        ProjectState state = new ProjectState();
        state.setPlanningDir(planningDir.toString());
        if (!Files.isDirectory(planningDir)) {
            return state;
        }
        state.setInitialized(true);

        ParsedRoadmap roadmap = roadmapParser.parse(readSafe(ROADMAP_FILE));
        if (roadmap != null) {
            resolvePhaseDirectories(roadmap.getPhases());
            state.setRoadmap(roadmap);
            state.setPhases(roadmap.getPhases());
            state.setPlansByPhase(roadmap.getPlansByPhase());
            state.setHasRoadmap(true);
        }

        ParsedState parsedState = stateParser.parse(readSafe(STATE_FILE));
        if (parsedState != null) {
            state.setState(parsedState);
            state.setPosition(parsedState.getPosition());
            state.setHasState(true);
        }

        ParsedProject project = projectParser.parse(readSafe(PROJECT_FILE));
        if (project != null) {
            state.setProject(project);
            state.setHasProject(true);
        }

        ProjectConfig config = configParser.parse(readSafe(CONFIG_FILE));
        if (config != null) {
            state.setConfig(config);
            state.setHasConfig(true);
        }
        return state;
    }

    private String readSafe(String fileName) {
        Path file = planningDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Failed to read " + file + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Link each phase to its {@code phases/NN-slug} directory. Numbers compare numerically, so phase
     * {@code 1} finds {@code 01-foundation} and {@code 2.1} finds {@code 02.1-hotfix}.
     */
    private void resolvePhaseDirectories(List<PhaseInfo> phases) {
        Path phasesDir = planningDir.resolve(PHASES_DIR);
        if (phases.isEmpty() || !Files.isDirectory(phasesDir)) {
            return;
        }
        List<String> dirNames;
        try (Stream<Path> stream = Files.list(phasesDir)) {
            dirNames = stream
                .filter(Files::isDirectory)
                .map(p -> p.getFileName().toString())
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Failed to list " + phasesDir + ": " + e.getMessage());
            return;
        }
        for (PhaseInfo phase : phases) {
            for (String dirName : dirNames) {
                if (samePhaseNumber(phase.getNumber(), dirName)) {
                    phase.setDirectory(dirName);
                    break;
                }
            }
        }
    }

    static boolean samePhaseNumber(String phaseNumber, String dirName) {
        Matcher m = PHASE_DIR_NUMBER.matcher(dirName);
        if (phaseNumber == null || !m.matches()) {
            return false;
        }
        try {
            return new BigDecimal(m.group(1)).compareTo(new BigDecimal(phaseNumber)) == 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
