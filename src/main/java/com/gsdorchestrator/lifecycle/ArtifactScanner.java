package com.gsdorchestrator.lifecycle;

import com.gsdorchestrator.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scans one {@code phases/NN-slug} directory for planning artifacts:
 * {@code NN-MM-PLAN.md}, {@code NN-MM-SUMMARY.md}, {@code NN-CONTEXT.md}, {@code NN-RESEARCH.md},
 * {@code NN-UAT.md} and {@code NN-VERIFICATION.md}. Other files are ignored.
 */
public class ArtifactScanner {

    private static final Pattern PLAN_FILE = Pattern.compile("^(\\d+(?:\\.\\d+)?-\\d+)-PLAN\\.md$");
    private static final Pattern SUMMARY_FILE = Pattern.compile("^(\\d+(?:\\.\\d+)?-\\d+)-SUMMARY\\.md$");
    private static final Pattern DIRECTORY_NAME = Pattern.compile("^(\\d+(?:\\.\\d+)?)(?:-(.*))?$");

    private final Path phasesDir;

    public ArtifactScanner(Path phasesDir) {
        this.phasesDir = phasesDir;
    }

    /**
     * A missing or unreadable directory yields empty artifacts rather than an error.
     */
    public PhaseArtifacts scan(String phaseDirectory) {
        String phaseNumber = null;
        String phaseName = null;
        Matcher name = DIRECTORY_NAME.matcher(phaseDirectory);
        if (name.matches()) {
            phaseNumber = name.group(1);
            phaseName = name.group(2);
        }

        Path dir = phasesDir.resolve(phaseDirectory);
        if (!Files.isDirectory(dir)) {
            return PhaseArtifacts.empty(phaseNumber, phaseName, phaseDirectory);
        }

        List<String> fileNames;
        try (Stream<Path> stream = Files.list(dir)) {
            fileNames = stream
                .filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            AppLogger.get().warn("Failed to scan phase directory " + dir + ": " + e.getMessage());
            return PhaseArtifacts.empty(phaseNumber, phaseName, phaseDirectory);
        }

        List<String> plans = new ArrayList<>();
        List<String> summaries = new ArrayList<>();
        boolean context = false;
        boolean research = false;
        boolean uat = false;
        boolean verification = false;
        for (String fileName : fileNames) {
            Matcher plan = PLAN_FILE.matcher(fileName);
            Matcher summary = SUMMARY_FILE.matcher(fileName);
            if (plan.matches()) {
                plans.add(plan.group(1));
            } else if (summary.matches()) {
                summaries.add(summary.group(1));
            } else if (fileName.endsWith("-CONTEXT.md")) {
                context = true;
            } else if (fileName.endsWith("-RESEARCH.md")) {
                research = true;
            } else if (fileName.endsWith("-UAT.md")) {
                uat = true;
            } else if (fileName.endsWith("-VERIFICATION.md")) {
                verification = true;
            }
        }
        return new PhaseArtifacts(phaseNumber, phaseName, phaseDirectory, plans, summaries,
            context, research, uat, verification);
    }
}
