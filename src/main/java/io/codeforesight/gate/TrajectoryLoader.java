package io.codeforesight.gate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.codeforesight.config.ConfigException;
import io.codeforesight.model.TrajectoryPoint;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a caller-supplied risk history: a JSON array of {@code {"timestamp": "...", "riskLoad": 3.5}}
 * objects, or an object holding such an array under {@code "history"}. Timestamps are optional
 * ISO-8601 instants.
 */
public final class TrajectoryLoader {

    private final ObjectMapper mapper = new ObjectMapper();

    public List<TrajectoryPoint> load(Path path) throws IOException, ConfigException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is, path.toString());
        }
    }

    public List<TrajectoryPoint> load(InputStream is, String origin) throws IOException, ConfigException {
        JsonNode root;
        try {
            root = mapper.readTree(is);
        } catch (JsonProcessingException e) {
            throw new ConfigException("History " + origin + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode items = root != null && root.isObject() ? root.path("history") : root;
        if (items == null || !items.isArray()) {
            throw new ConfigException("History " + origin + " must be a JSON array of {timestamp, riskLoad}");
        }

        List<TrajectoryPoint> points = new ArrayList<>();
        int index = 0;
        for (JsonNode item : items) {
            index++;
            JsonNode load = item.path("riskLoad");
            if (!load.isNumber()) {
                throw new ConfigException("History " + origin + " entry " + index + " has no numeric riskLoad");
            }
            Instant timestamp = null;
            JsonNode ts = item.path("timestamp");
            if (ts.isTextual()) {
                try {
                    timestamp = Instant.parse(ts.asText());
                } catch (DateTimeParseException e) {
                    throw new ConfigException("History " + origin + " entry " + index
                            + " has an invalid timestamp '" + ts.asText() + "'", e);
                }
            }
            try {
                points.add(new TrajectoryPoint(timestamp, load.asDouble()));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("History " + origin + " entry " + index + ": " + e.getMessage(), e);
            }
        }
        return points;
    }
}
