package com.supplier.resolution.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplier.resolution.api.ResolutionOptions;
import com.supplier.resolution.bulk.FieldParsers;
import com.supplier.resolution.scoring.FreshnessCurve;
import com.supplier.resolution.scoring.ScoringWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Loads a {@link ResolutionConfig} from a JSON file.
 *
 * <pre>
 * {
 *   "paths": {"input": "data/input.csv", "reference": "data/reference.csv", "output": "output"},
 *   "weights": {"name_similarity": 0.6, "country_match": 0.15, "city_match": 0.1,
 *               "freshness": 0.1, "has_website": 0.05},
 *   "thresholds": {"strong": 0.75, "review": 0.6, "name_hard_floor": 0.7},
 *   "quality": {"staleness_days": 730},
 *   "freshness": {"curve": "tiered"},
 *   "matching": {"blocking": false, "parallelism": 1, "renormalize_weights": false},
 *   "now": "2024-06-01T00:00:00Z"
 * }
 * </pre>
 *
 * <p>The file is located by {@link #locate(Path)}: an explicit path, then the
 * {@value #CONFIG_ENV_VAR} environment variable, then {@value #DEFAULT_CONFIG_PATH}.
 * Relative data paths are resolved against the working directory.</p>
 */
public class ResolutionConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ResolutionConfigLoader.class);

    public static final String CONFIG_ENV_VAR = "SUPPLIER_RESOLUTION_CONFIG";
    public static final String DEFAULT_CONFIG_PATH = "config/config.json";

    private final ObjectMapper objectMapper;
    private final Function<String, String> environment;
    private final Path workingDirectory;

    public ResolutionConfigLoader() {
        this(new ObjectMapper(), System::getenv, Path.of(""));
    }

    /**
     * @param environment      environment variable lookup
     * @param workingDirectory base for relative paths
     */
    public ResolutionConfigLoader(ObjectMapper objectMapper, Function<String, String> environment,
                                  Path workingDirectory) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
        this.environment = Objects.requireNonNull(environment, "environment is required");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory is required");
    }

    /**
     * Locates and loads the configuration.
     *
     * @param explicitPath path given on the command line, may be null
     * @throws InvalidConfigurationException if the file is missing, unreadable or invalid
     */
    public ResolutionConfig load(Path explicitPath) {
        return loadFile(locate(explicitPath));
    }

    /**
     * Resolves the configuration file to use, in discovery order.
     *
     * @throws InvalidConfigurationException if the chosen file does not exist
     */
    public Path locate(Path explicitPath) {
        Path candidate;
        String source;
        if (explicitPath != null) {
            candidate = explicitPath;
            source = "argument";
        } else {
            String fromEnv = environment.apply(CONFIG_ENV_VAR);
            if (fromEnv != null && !fromEnv.isBlank()) {
                candidate = Path.of(fromEnv.strip());
                source = CONFIG_ENV_VAR;
            } else {
                candidate = Path.of(DEFAULT_CONFIG_PATH);
                source = "default";
            }
        }
        Path resolved = resolve(candidate);
        if (!Files.isRegularFile(resolved)) {
            throw new InvalidConfigurationException("Config file not found: " + resolved + " (from " + source + ")");
        }
        log.info("config.located path={} source={}", resolved, source);
        return resolved;
    }

    public ResolutionConfig loadFile(Path file) {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Cannot read config file " + file, e);
        }
        return parse(json);
    }

    /**
     * Parses and validates configuration JSON.
     *
     * @throws InvalidConfigurationException on malformed JSON or invalid values
     */
    public ResolutionConfig parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException("Config is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidConfigurationException("Config must be a JSON object");
        }

        JsonNode paths = requireObject(root, "paths");
        Path input = resolve(Path.of(requireText(paths, "paths", "input")));
        Path output = resolve(Path.of(requireText(paths, "paths", "output")));
        String referenceText = optionalText(paths, "reference");
        Path reference = referenceText != null ? resolve(Path.of(referenceText)) : null;

        JsonNode matching = optionalObject(root, "matching");
        boolean renormalize = optionalBoolean(matching, "matching", "renormalize_weights", false);

        ResolutionOptions.Builder builder = ResolutionOptions.builder()
                .weights(weights(requireObject(root, "weights"), renormalize));

        JsonNode thresholds = requireObject(root, "thresholds");
        builder.strongThreshold(requireNumber(thresholds, "thresholds", "strong"))
                .reviewThreshold(requireNumber(thresholds, "thresholds", "review"))
                .nameFloor(requireNumber(thresholds, "thresholds", "name_hard_floor"));

        JsonNode quality = optionalObject(root, "quality");
        if (quality != null && quality.has("staleness_days")) {
            builder.stalenessDays(requireInt(quality, "quality", "staleness_days"));
        }

        JsonNode freshness = optionalObject(root, "freshness");
        if (freshness != null) {
            builder.freshnessCurve(curve(optionalText(freshness, "curve")));
        }

        builder.blockingEnabled(optionalBoolean(matching, "matching", "blocking", false));
        if (matching != null && matching.has("parallelism")) {
            builder.parallelism(requireInt(matching, "matching", "parallelism"));
        }

        String now = optionalText(root, "now");
        if (now != null) {
            builder.now(parseNow(now));
        }

        ResolutionConfig config = new ResolutionConfig(input, reference, output, builder.build());
        log.debug("config.loaded input={} reference={} output={} options={}",
                input, reference, output, config.options());
        return config;
    }

    /**
     * Parses a reference time in any format accepted for record timestamps.
     *
     * @throws InvalidConfigurationException if the value cannot be parsed
     */
    public static Instant parseNow(String value) {
        Instant parsed = FieldParsers.parseTimestamp(value);
        if (parsed == null) {
            throw new InvalidConfigurationException("Cannot parse reference time: " + value);
        }
        return parsed;
    }

    private ScoringWeights weights(JsonNode node, boolean renormalize) {
        ScoringWeights defaults = ScoringWeights.defaultWeights();
        double name = optionalNumber(node, "weights", "name_similarity", defaults.nameWeight());
        double country = optionalNumber(node, "weights", "country_match", defaults.countryWeight());
        double city = optionalNumber(node, "weights", "city_match", defaults.cityWeight());
        double fresh = optionalNumber(node, "weights", "freshness", defaults.freshnessWeight());
        double website = optionalNumber(node, "weights", "has_website", defaults.websiteWeight());
        return renormalize
                ? ScoringWeights.renormalized(name, country, city, fresh, website)
                : new ScoringWeights(name, country, city, fresh, website);
    }

    private static FreshnessCurve curve(String name) {
        try {
            return FreshnessCurve.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Unknown freshness curve: " + name, e);
        }
    }

    private Path resolve(Path path) {
        return path.isAbsolute() ? path : workingDirectory.resolve(path).toAbsolutePath().normalize();
    }

    private static JsonNode requireObject(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isObject()) {
            throw new InvalidConfigurationException("Missing or invalid section: " + field);
        }
        return node;
    }

    private static JsonNode optionalObject(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new InvalidConfigurationException("Section must be an object: " + field);
        }
        return node;
    }

    private static String requireText(JsonNode parent, String section, String field) {
        String value = optionalText(parent, field);
        if (value == null) {
            throw new InvalidConfigurationException("Missing required value: " + section + "." + field);
        }
        return value;
    }

    private static String optionalText(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text.strip();
    }

    private static double requireNumber(JsonNode parent, String section, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new InvalidConfigurationException("Missing required value: " + section + "." + field);
        }
        if (!node.isNumber()) {
            throw new InvalidConfigurationException(section + "." + field + " must be a number, got " + node);
        }
        return node.asDouble();
    }

    private static double optionalNumber(JsonNode parent, String section, String field, double defaultValue) {
        JsonNode node = parent.get(field);
        return node == null || node.isNull() ? defaultValue : requireNumber(parent, section, field);
    }

    private static int requireInt(JsonNode parent, String section, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new InvalidConfigurationException(section + "." + field + " must be an integer, got " + node);
        }
        return node.asInt();
    }

    private static boolean optionalBoolean(JsonNode parent, String section, String field, boolean defaultValue) {
        if (parent == null) {
            return defaultValue;
        }
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw new InvalidConfigurationException(section + "." + field + " must be true or false, got " + node);
        }
        return node.asBoolean();
    }
}
