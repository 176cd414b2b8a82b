package com.gsdorchestrator.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsdorchestrator.AppLogger;
import com.gsdorchestrator.models.AgentSpec;
import com.gsdorchestrator.models.CommandSpec;
import com.gsdorchestrator.models.DiscoveryResult;
import com.gsdorchestrator.models.DiscoveryWarning;
import com.gsdorchestrator.models.InstallLocation;
import com.gsdorchestrator.models.TeamSpec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scans an installation directory for commands, agents and teams.
 *
 * <pre>
 * basePath/
 *   commands/gsd/*.md           one command per file
 *   agents/gsd-*.md             specialist agents (other names are ignored)
 *   teams/&lt;name&gt;/config.json
 *   get-shit-done/VERSION       version string, and its mtime is the cache key
 * </pre>
 *
 * Malformed artifacts are skipped and reported through {@link #getWarnings()}; a single bad file never
 * fails the scan.
 */
public class GsdDiscoveryService {

    public static final String AGENT_PREFIX = "gsd-";
    public static final String COMMAND_NAMESPACE = "gsd";

    private final Path basePath;
    private final InstallLocation location;
    private final DiscoveryCache cache;
    private final CommandParser commandParser;
    private final AgentParser agentParser;
    private final TeamConfigParser teamParser;
    private final AppLogger logger;
    private volatile List<DiscoveryWarning> warnings = Collections.emptyList();

    public GsdDiscoveryService(Path basePath) {
        this(basePath, InstallLocation.GLOBAL);
    }

    public GsdDiscoveryService(Path basePath, InstallLocation location) {
        this(basePath, location, new DiscoveryCache(), new ObjectMapper());
    }

    public GsdDiscoveryService(Path basePath, InstallLocation location, DiscoveryCache cache, ObjectMapper objectMapper) {
        this.basePath = basePath;
        this.location = location != null ? location : InstallLocation.GLOBAL;
        this.cache = cache != null ? cache : new DiscoveryCache();
        FrontmatterParser frontmatter = new FrontmatterParser();
        this.commandParser = new CommandParser(frontmatter);
        this.agentParser = new AgentParser(frontmatter);
        this.teamParser = new TeamConfigParser(objectMapper);
        this.logger = AppLogger.get();
    }

    /**
     * Service bound to the detected installation, or null when none is installed.
     */
    public static GsdDiscoveryService create(InstallationDetector detector) {
        GsdInstallation installation = detector.detect();
        if (installation == null) {
            return null;
        }
        return new GsdDiscoveryService(installation.getBasePath(), installation.getLocation());
    }

    public static Path versionFile(Path basePath) {
        return basePath.resolve("get-shit-done").resolve("VERSION");
    }

    public Path getBasePath() {
        return basePath;
    }

    /**
     * Warnings from the most recent {@link #discover()} call. A cache hit restores the warnings of the
     * scan that produced the cached result.
     */
    public List<DiscoveryWarning> getWarnings() {
        return warnings;
    }

    public DiscoveryResult discover() {
        long versionMtime = readVersionMtime();
        String cacheKey = basePath.toAbsolutePath().normalize().toString();

        DiscoveryCache.Entry hit = cache.get(cacheKey, versionMtime);
        if (hit != null) {
            warnings = hit.getWarnings();
            return hit.getResult();
        }

        List<DiscoveryWarning> collected = new ArrayList<>();
        List<CommandSpec> commands = discoverCommands(collected);
        List<AgentSpec> agents = discoverAgents(collected);
        List<TeamSpec> teams = discoverTeams(collected);
        String version = readVersion();

        DiscoveryResult result = new DiscoveryResult(
            commands, agents, teams, basePath.toString(), location, version, System.currentTimeMillis());

        cache.put(cacheKey, versionMtime, result, collected);
        warnings = Collections.unmodifiableList(collected);

        logger.info("Discovered " + commands.size() + " commands, " + agents.size() + " agents, "
            + teams.size() + " teams in " + basePath
            + (collected.isEmpty() ? "" : " (" + collected.size() + " skipped)"));
        return result;
    }

    private List<CommandSpec> discoverCommands(List<DiscoveryWarning> warnings) {
        Path dir = basePath.resolve("commands").resolve(COMMAND_NAMESPACE);
        List<CommandSpec> commands = new ArrayList<>();
        for (Path file : listFiles(dir, warnings)) {
            try {
                commands.add(commandParser.parse(readFile(file), file.toString()));
            } catch (ArtifactParseException e) {
                skip(warnings, file, e.getMessage());
            } catch (IOException e) {
                skip(warnings, file, "Unreadable file: " + e.getMessage());
            }
        }
        return commands;
    }

    private List<AgentSpec> discoverAgents(List<DiscoveryWarning> warnings) {
        Path dir = basePath.resolve("agents");
        List<AgentSpec> agents = new ArrayList<>();
        for (Path file : listFiles(dir, warnings)) {
            // Filtered, not an error: the agents directory is shared with other tools.
            if (!file.getFileName().toString().startsWith(AGENT_PREFIX)) {
                continue;
            }
            try {
                AgentSpec agent = agentParser.parse(readFile(file), file.toString());
                if (agent.getName().startsWith(AGENT_PREFIX)) {
                    agents.add(agent);
                }
            } catch (ArtifactParseException e) {
                skip(warnings, file, e.getMessage());
            } catch (IOException e) {
                skip(warnings, file, "Unreadable file: " + e.getMessage());
            }
        }
        return agents;
    }

    private List<TeamSpec> discoverTeams(List<DiscoveryWarning> warnings) {
        Path dir = basePath.resolve("teams");
        List<Path> teamDirs;
        try {
            teamDirs = DirectoryScanner.listDirectories(dir);
        } catch (IOException e) {
            skip(warnings, dir, "Unable to list directory: " + e.getMessage());
            return Collections.emptyList();
        }

        List<TeamSpec> teams = new ArrayList<>();
        for (Path teamDir : teamDirs) {
            Path configPath = teamDir.resolve("config.json");
            try {
                teams.add(teamParser.parse(readFile(configPath), configPath.toString()));
            } catch (ArtifactParseException e) {
                skip(warnings, configPath, e.getMessage());
            } catch (NoSuchFileException e) {
                skip(warnings, configPath, "Team directory has no config.json");
            } catch (IOException e) {
                skip(warnings, configPath, "Unreadable file: " + e.getMessage());
            }
        }
        return teams;
    }

    private List<Path> listFiles(Path dir, List<DiscoveryWarning> warnings) {
        try {
            return DirectoryScanner.listFiles(dir, ".md");
        } catch (IOException e) {
            skip(warnings, dir, "Unable to list directory: " + e.getMessage());
            return Collections.emptyList();
        }
    }

    private void skip(List<DiscoveryWarning> warnings, Path path, String message) {
        warnings.add(DiscoveryWarning.parseError(path.toString(), message));
        logger.warn("Skipping " + path + ": " + message);
    }

    private long readVersionMtime() {
        try {
            return Files.getLastModifiedTime(versionFile(basePath)).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    private String readVersion() {
        Path file = versionFile(basePath);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return readFile(file).trim();
        } catch (IOException e) {
            logger.warn("Failed to read version marker " + file + ": " + e.getMessage());
            return null;
        }
    }

    private static String readFile(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
