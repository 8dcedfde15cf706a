package com.hexwar.config;

import com.hexwar.model.HexCoordinate;
import com.hexwar.model.MapBounds;
import tools.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads all available scenario definitions at startup.
 * <p>
 * Scenarios are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:scenarios/*.json} – built-in scenarios shipped with the app</li>
 *   <li>External folder: {@code hexwar.scenarios.external-dir} (default {@code ./scenarios/}) – scenarios saved by the editor</li>
 * </ol>
 * If an external scenario has the same {@code id} as a built-in one, the external one wins.
 * Scenarios that place hexes or units off their own map are rejected.
 */
@Component
@Slf4j
public class ScenarioLoader {

    private final ObjectMapper objectMapper;
    private final Path externalDir;

    /** All loaded scenarios keyed by their id. */
    @Getter
    private final Map<String, ScenarioDefinition> scenarios = new LinkedHashMap<>();

    public ScenarioLoader(ObjectMapper objectMapper,
                          @Value("${hexwar.scenarios.external-dir:scenarios}") String externalDir) {
        this.objectMapper = objectMapper;
        this.externalDir = Paths.get(externalDir);
    }

    @PostConstruct
    public void loadScenarios() {
        loadClasspathScenarios();
        loadExternalScenarios();

        if (scenarios.isEmpty()) {
            log.warn("No scenario definitions found! Only ad-hoc movement queries will work.");
        } else {
            log.info("Loaded {} scenario(s): {}", scenarios.size(),
                    scenarios.values().stream().map(ScenarioDefinition::title).toList());
        }
    }

    /**
     * Returns an unmodifiable list of every loaded scenario.
     */
    public List<ScenarioDefinition> getAvailableScenarios() {
        return List.copyOf(scenarios.values());
    }

    /**
     * Get a specific scenario by its id.
     *
     * @throws IllegalArgumentException if the scenario id is unknown
     */
    public ScenarioDefinition getScenario(String scenarioId) {
        ScenarioDefinition scenario = scenarios.get(scenarioId);
        if (scenario == null) {
            throw new IllegalArgumentException("Unknown scenario: " + scenarioId
                    + ". Available scenarios: " + scenarios.keySet());
        }
        return scenario;
    }

    // ── classpath scenarios ─────────────────────────────────────────────

    private void loadClasspathScenarios() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:scenarios/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    ScenarioDefinition scenario = objectMapper.readValue(is, ScenarioDefinition.class);
                    register(scenario, "classpath:" + resource.getFilename());
                } catch (RuntimeException | IOException e) {
                    log.error("Failed to load classpath scenario: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for scenarios: {}", e.getMessage());
        }
    }

    // ── external scenarios ──────────────────────────────────────────────

    private void loadExternalScenarios() {
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external scenarios directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalScenarioFile);
        } catch (IOException e) {
            log.error("Error reading external scenarios directory", e);
        }
    }

    private void loadExternalScenarioFile(Path path) {
        try {
            ScenarioDefinition scenario = objectMapper.readValue(path.toFile(), ScenarioDefinition.class);
            register(scenario, path.toString());
        } catch (RuntimeException e) {
            log.error("Failed to load custom scenario: {}", path, e);
        }
    }

    // ── validation ──────────────────────────────────────────────────────

    private void register(ScenarioDefinition scenario, String origin) {
        List<String> problems = validate(scenario);
        if (!problems.isEmpty()) {
            log.error("Rejected scenario from {}: {}", origin, problems);
            return;
        }
        ScenarioDefinition previous = scenarios.put(scenario.id(), scenario);
        if (previous != null) {
            log.info("Scenario '{}' from {} replaces an earlier definition", scenario.id(), origin);
        } else {
            log.info("Loaded scenario '{}' ({}) from {}", scenario.title(), scenario.id(), origin);
        }
    }

    static List<String> validate(ScenarioDefinition scenario) {
        List<String> problems = new ArrayList<>();
        if (scenario.id() == null || scenario.id().isBlank()) {
            problems.add("missing id");
        }
        if (scenario.columns() < 1 || scenario.rows() < 1) {
            problems.add("map must be at least 1x1, was " + scenario.columns() + "x" + scenario.rows());
            return problems;
        }

        MapBounds bounds = scenario.bounds();
        for (HexDefinition hex : scenario.hexes()) {
            HexCoordinate coordinate = HexCoordinate.of(hex.column(), hex.row());
            if (!bounds.contains(coordinate)) {
                problems.add("hex " + coordinate + " is off the map");
            }
        }

        Set<String> unitIds = new HashSet<>();
        for (UnitDefinition unit : scenario.units()) {
            if (unit.id() == null || !unitIds.add(unit.id())) {
                problems.add("missing or duplicate unit id: " + unit.id());
            }
            if (unit.side() == null) {
                problems.add("unit " + unit.id() + " has no side");
            }
            if (unit.movementAllowance() < 0) {
                problems.add("unit " + unit.id() + " has a negative movement allowance");
            }
            HexCoordinate coordinate = HexCoordinate.of(unit.column(), unit.row());
            if (!bounds.contains(coordinate)) {
                problems.add("unit " + unit.id() + " at " + coordinate + " is off the map");
            }
        }
        return problems;
    }
}
