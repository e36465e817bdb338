package com.butterfly.runner;

import com.butterfly.core.config.EngineConfig;
import com.butterfly.core.model.CascadeOptions;
import com.butterfly.core.model.RootConsequence;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * One action to cascade, as read from a request file.
 *
 * <pre>
 * {
 *   "actionId": "a1",
 *   "actionDescription": "Player burns the granary",
 *   "consequences": [ { "id": "c1", "type": "economic", "confidence": 0.9, "impact": { ... } } ],
 *   "options": { "maxCascadingLevels": 2 }
 * }
 * </pre>
 *
 * {@code options} may set any subset of the cascade limits; the rest come from the engine config.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CascadeRequest(
    String actionId,
    String actionDescription,
    List<RootConsequence> consequences,
    JsonNode options
) {
    public CascadeRequest {
        actionDescription = actionDescription != null ? actionDescription : "";
        consequences = consequences != null ? List.copyOf(consequences) : List.of();
    }

    /**
     * Read and check a request file.
     *
     * @throws IOException              if the file cannot be read or is not valid JSON
     * @throws IllegalArgumentException if the request has no action id
     */
    public static CascadeRequest read(Path file, ObjectMapper mapper) throws IOException {
        CascadeRequest request = mapper.readValue(file.toFile(), CascadeRequest.class);
        if (request.actionId() == null || request.actionId().isBlank()) {
            throw new IllegalArgumentException("Request " + file + " has no actionId");
        }
        return request;
    }

    /**
     * Cascade limits for this request: the configured defaults with this request's overrides applied.
     */
    public CascadeOptions resolveOptions(EngineConfig.CascadeSettings defaults, ObjectMapper mapper) throws IOException {
        EngineConfig.CascadeSettings settings = defaults.copy();
        if (options != null && options.isObject()) {
            mapper.readerForUpdating(settings).readValue(options);
        }
        return settings.toOptions();
    }
}
