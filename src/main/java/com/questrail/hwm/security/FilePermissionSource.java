package com.questrail.hwm.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * FilePermissionSource
 * -----------------------------------------------------------------------------
 * Reads the offline master permissions file exported by the station's user
 * interface: a JSON array of records shaped as
 * <pre>
 * {"user_id": string, "generated_at": number,
 *  "ignore_session_protections"?: boolean,
 *  "permitted_commands": [{"command": string, "device_id"?: string,
 *                          "system_command_handler"?: string}]}
 * </pre>
 * The whole file is returned on every load, so one load primes the cache for
 * every user it lists.
 */
public final class FilePermissionSource implements PermissionSource
{
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Path file;

    public FilePermissionSource(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public List<UserPermissions> load(String userId) {
        JsonNode root;
        try {
            root = JSON.readTree(Files.readAllBytes(file));
        } catch (JsonProcessingException e) {
            throw new PermissionsException("Could not parse local permissions file (invalid JSON).", e);
        } catch (IOException e) {
            throw new PermissionsException("There was an error loading the user permissions file.", e);
        }
        return parse(root);
    }

    static List<UserPermissions> parse(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw invalid("the permissions resource must be an array");
        }

        List<UserPermissions> records = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw invalid("each permission record must be an object");
            }
            JsonNode userId = node.get("user_id");
            JsonNode generatedAt = node.get("generated_at");
            JsonNode ignore = node.get("ignore_session_protections");
            JsonNode commands = node.get("permitted_commands");
            if (userId == null || !userId.isTextual()) {
                throw invalid("'user_id' is required and must be a string");
            }
            if (generatedAt == null || !generatedAt.isNumber()) {
                throw invalid("'generated_at' is required and must be a number");
            }
            if (ignore != null && !ignore.isBoolean()) {
                throw invalid("'ignore_session_protections' must be a boolean");
            }
            if (commands == null || !commands.isArray()) {
                throw invalid("'permitted_commands' is required and must be an array");
            }

            List<PermittedCommand> permitted = new ArrayList<>();
            for (JsonNode command : commands) {
                permitted.add(new PermittedCommand(
                    requiredText(command, "command"),
                    optionalText(command, "device_id"),
                    optionalText(command, "system_command_handler")));
            }

            long millis = Math.round(generatedAt.asDouble() * 1000.0);
            records.add(new UserPermissions(
                userId.asText(),
                Instant.ofEpochMilli(millis),
                ignore != null && ignore.asBoolean(),
                permitted));
        }
        return records;
    }

    private static String requiredText(JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null) {
            throw invalid("permitted command '" + field + "' is required");
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        if (!node.isObject()) {
            throw invalid("each permitted command must be an object");
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw invalid("permitted command '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static PermissionsInvalidSchemaException invalid(String detail) {
        return new PermissionsInvalidSchemaException(
            "The provided permission list did not conform to the defined schema: " + detail + ".");
    }
}
