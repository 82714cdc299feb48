package com.overseer.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Reads the declarative task file. {@code .json} files are parsed as JSON, {@code .yml} and
 * {@code .yaml} as YAML; any other suffix is tried as JSON first, then YAML.
 */
@Component
public class RunConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(RunConfigLoader.class);

    private final ObjectMapper json = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final ObjectMapper yaml = YAMLMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public RunConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Config file not found: " + path);
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigException("Cannot read config file " + path + ": " + e.getMessage(), e);
        }

        RunConfig config;
        if (name.endsWith(".json")) {
            config = parse(json, content, path);
        } else if (name.endsWith(".yml") || name.endsWith(".yaml")) {
            config = parse(yaml, content, path);
        } else {
            config = parseEither(content, path);
        }
        if (config == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        log.debug("Loaded {} task(s) and {} runner(s) from {}",
                config.tasks().size(), config.runners().size(), path);
        return config.withSource(path.toAbsolutePath().normalize());
    }

    private RunConfig parseEither(String content, Path path) {
        try {
            return json.readValue(content, RunConfig.class);
        } catch (JsonProcessingException e) {
            log.debug("{} is not JSON ({}), trying YAML", path, e.getOriginalMessage());
            return parse(yaml, content, path);
        }
    }

    private RunConfig parse(ObjectMapper mapper, String content, Path path) {
        try {
            return mapper.readValue(content, RunConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed config file " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a duration written as {@code 30s}, {@code 15m}, a bare number of seconds or ISO-8601.
     *
     * @throws ConfigException for unparseable or negative values
     */
    public static Duration parseDuration(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Duration duration;
        try {
            duration = DurationStyle.detectAndParse(value.trim(), ChronoUnit.SECONDS);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid duration for " + field + ": '" + value + "'", e);
        }
        if (duration.isNegative()) {
            throw new ConfigException("Negative duration for " + field + ": '" + value + "'");
        }
        return duration;
    }
}
