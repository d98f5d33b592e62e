package com.wrestling.ratings.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wrestling.ratings.model.Overrides;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads the overrides file: a JSON object keyed by wrestler id.
 *
 * <pre>
 * {
 *   "w1": "132",
 *   "w2": { "weight": "138", "gradYear": 2026, "teamId": "t9" },
 *   "w3": { "exclude": true }
 * }
 * </pre>
 *
 * A bare string is a weight override. Entries of the wrong shape are logged and skipped.
 */
@Service
public class OverridesLoader {

    private static final Logger log = LoggerFactory.getLogger(OverridesLoader.class);

    private final ObjectMapper objectMapper;

    public OverridesLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Overrides load(Path path) {
        if (path == null) {
            return Overrides.empty();
        }
        if (!Files.exists(path)) {
            log.warn("Overrides file not found: {}", path);
            return Overrides.empty();
        }
        try {
            return parse(objectMapper.readTree(path.toFile()));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read overrides file " + path, e);
        }
    }

    public Overrides parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            log.warn("Overrides must be a JSON object keyed by wrestler id; ignoring");
            return Overrides.empty();
        }

        Overrides.Builder builder = Overrides.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String wrestlerId = field.getKey();
            JsonNode value = field.getValue();

            if (value.isTextual()) {
                builder.weight(wrestlerId, value.asText());
                continue;
            }
            if (!value.isObject()) {
                log.warn("Ignoring override for {}: expected string or object, got {}", wrestlerId, value.getNodeType());
                continue;
            }

            JsonNode weight = value.get("weight");
            if (weight != null && weight.isTextual()) {
                builder.weight(wrestlerId, weight.asText());
            } else if (weight != null && !weight.isNull()) {
                log.warn("Ignoring non-string weight override for {}: {}", wrestlerId, weight);
            }

            JsonNode exclude = value.get("exclude");
            if (exclude != null && exclude.asBoolean(false)) {
                builder.exclude(wrestlerId);
            }

            JsonNode gradYear = value.get("gradYear");
            if (gradYear != null && gradYear.isIntegralNumber()) {
                builder.gradYear(wrestlerId, gradYear.asInt());
            } else if (gradYear != null && !gradYear.isNull()) {
                log.warn("Ignoring non-integer gradYear override for {}: {}", wrestlerId, gradYear);
            }

            JsonNode teamId = value.get("teamId");
            if (teamId != null && teamId.isTextual()) {
                builder.team(wrestlerId, teamId.asText());
            } else if (teamId != null && !teamId.isNull()) {
                log.warn("Ignoring non-string teamId override for {}: {}", wrestlerId, teamId);
            }
        }

        Overrides overrides = builder.build();
        log.info("Loaded overrides: {} weights, {} excluded, {} grad years, {} teams",
                overrides.weights().size(), overrides.excluded().size(),
                overrides.gradYears().size(), overrides.teams().size());
        return overrides;
    }
}
