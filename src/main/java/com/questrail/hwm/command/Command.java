package com.questrail.hwm.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Command
 * -----------------------------------------------------------------------------
 * One request submitted to the ground station.
 *
 * <h2>Shape</h2>
 * A raw request must be a JSON object:
 * <pre>
 * {"command": string, "device_id"?: string, "parameters"?: object}
 * </pre>
 * Additional top-level members are tolerated.
 *
 * <h2>Lifecycle</h2>
 * A command is created from the raw text, validated once with
 * {@link #validate()}, and is immutable afterwards. The convenience accessors
 * ({@link #command()}, {@link #deviceId()}, {@link #parameters()}) are only
 * populated by a successful validation.
 */
public final class Command
{
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final TypeReference<Map<String, Object>> PARAMETERS_TYPE = new TypeReference<>() {};

    private final String raw;
    private final String userId;
    private final Instant receivedAt;

    private JsonNode parsed;
    private boolean valid;
    private String command;
    private String deviceId;
    private Map<String, Object> parameters = Map.of();
    private volatile Instant completedAt;

    /**
     * @param raw        raw request text
     * @param userId     issuing user, or {@code null} for commands the station issues itself
     * @param receivedAt time the request entered the parser
     */
    public Command(String raw, String userId, Instant receivedAt) {
        this.raw = raw;
        this.userId = userId;
        this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt");
    }

    /**
     * Parses and validates the raw request, then populates the convenience fields.
     *
     * @throws CommandMalformedException if the text is not JSON
     * @throws CommandInvalidSchemaException if the JSON does not have the command shape
     */
    public void validate() {
        if (valid) {
            return;
        }

        JsonNode node;
        try {
            node = raw == null ? null : JSON.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new CommandMalformedException("The submitted command contained a malformed JSON string.", e);
        }
        if (node == null || node.isMissingNode()) {
            throw new CommandMalformedException("The submitted command was empty and is therefore malformed.");
        }

        if (!node.isObject()) {
            throw schemaViolation("the request must be an object");
        }
        JsonNode name = node.get("command");
        if (name == null || !name.isTextual()) {
            throw schemaViolation("'command' is required and must be a string");
        }
        JsonNode device = node.get("device_id");
        if (device != null && !device.isTextual()) {
            throw schemaViolation("'device_id' must be a string");
        }
        JsonNode params = node.get("parameters");
        if (params != null && !params.isObject()) {
            throw schemaViolation("'parameters' must be an object");
        }

        this.parsed = node;
        this.command = name.asText();
        this.deviceId = device == null ? null : device.asText();
        this.parameters = params == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(JSON.convertValue(params, PARAMETERS_TYPE)));
        this.valid = true;
    }

    private static CommandInvalidSchemaException schemaViolation(String detail) {
        return new CommandInvalidSchemaException(
            "The submitted command did not conform to the command schema: " + detail + ".");
    }

    /**
     * Builds the response envelope for this command.
     */
    public CommandResponse buildResponse(boolean success, Map<String, Object> result, Instant completedAt) {
        this.completedAt = Objects.requireNonNull(completedAt, "completedAt");
        return new CommandResponse(
            success ? CommandResponse.Status.OKAY : CommandResponse.Status.ERROR,
            deviceId,
            receivedAt,
            completedAt,
            result);
    }

    public String raw() {
        return raw;
    }

    public Optional<JsonNode> parsed() {
        return Optional.ofNullable(parsed);
    }

    public boolean isValid() {
        return valid;
    }

    public String command() {
        return command;
    }

    public String deviceId() {
        return deviceId;
    }

    public Map<String, Object> parameters() {
        return parameters;
    }

    /**
     * Returns a parameter, or fails the command with a message naming it.
     */
    public Object requireParameter(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            throw new CommandException("The '" + command + "' command requires the '" + name + "' parameter.",
                Map.of("missing_parameter", name));
        }
        return value;
    }

    public Optional<String> userId() {
        return Optional.ofNullable(userId);
    }

    public Instant receivedAt() {
        return receivedAt;
    }

    /**
     * Time the response was built; empty while the command is in flight.
     */
    public Optional<Instant> completedAt() {
        return Optional.ofNullable(completedAt);
    }

    @Override
    public String toString() {
        return valid
            ? "Command[" + command + (deviceId != null ? " @" + deviceId : "") + "]"
            : "Command[unvalidated]";
    }
}
