package com.questrail.hwm.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.questrail.hwm.device.DeviceConfigInvalidException;
import com.questrail.hwm.pipeline.PipelineConfigInvalidException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * StationConfigLoader
 * =============================================================================
 * Reads the station YAML document into a {@link StationConfig}.
 *
 * <h2>Document shape</h2>
 * <pre>
 * devices:
 *   - id: "radio"
 *     driver: "loopback"
 *     allow_concurrent_use: false
 *     settings: { address: "127.0.0.1" }
 * pipelines:
 *   - id: "uhf"
 *     devices:
 *       - id: "radio"
 *         pipeline_input: true
 *         pipeline_output: true
 *     setup_commands:
 *       - command: "station_time"
 *       - device_id: "radio"
 *         command: "get_state"
 * permissions:
 *   file: "permissions.json"
 *   max_age_seconds: 3600
 * workers: 4
 * </pre>
 *
 * Only {@code devices} is required. Relative permission file paths resolve
 * against the directory of the configuration file, when there is one.
 *
 * <p>This class checks the document shape and duplicate device ids. Checks
 * that need the device registry (unknown device references, several output
 * devices) are left to pipeline construction.</p>
 */
public final class StationConfigLoader {

    private static final TypeReference<Map<String, Object>> SETTINGS_TYPE = new TypeReference<>() {};

    private final ObjectMapper yaml;

    public StationConfigLoader() {
        this.yaml = new YAMLMapper();
    }

    public StationConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read station configuration " + file, e);
        }
    }

    public StationConfig loadResource(String resource) {
        InputStream in = StationConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new DeviceConfigInvalidException("Station configuration resource not found: " + resource);
        }
        try (in) {
            return load(in, null);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read station configuration " + resource, e);
        }
    }

    public StationConfig load(InputStream in, Path baseDirectory) {
        JsonNode root;
        try {
            root = yaml.readTree(in);
        } catch (JsonProcessingException e) {
            throw new DeviceConfigInvalidException("The station configuration is not valid YAML: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (root == null || !root.isObject()) {
            throw new DeviceConfigInvalidException("The station configuration must be a mapping");
        }

        StationConfig.Builder builder = StationConfig.builder()
            .withDevices(parseDevices(root.get("devices")))
            .withPipelines(parsePipelines(root.get("pipelines")));

        JsonNode permissions = root.get("permissions");
        if (permissions != null && !permissions.isNull()) {
            String file = text(permissions, "file", true, "permissions");
            Path path = Path.of(file);
            if (!path.isAbsolute() && baseDirectory != null) {
                path = baseDirectory.resolve(path);
            }
            builder.withPermissionsFile(path);
            JsonNode maxAge = permissions.get("max_age_seconds");
            if (maxAge != null) {
                if (!maxAge.canConvertToLong()) {
                    throw new DeviceConfigInvalidException("permissions.max_age_seconds must be an integer");
                }
                builder.withPermissionMaxAge(Duration.ofSeconds(maxAge.asLong()));
            }
        }

        JsonNode workers = root.get("workers");
        if (workers != null) {
            if (!workers.canConvertToInt()) {
                throw new DeviceConfigInvalidException("workers must be an integer");
            }
            builder.withWorkerThreads(workers.asInt());
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new DeviceConfigInvalidException(e.getMessage(), e);
        }
    }

    /**
     * Parses the {@code devices} list. Duplicate ids are rejected here.
     */
    public List<DeviceConfig> parseDevices(JsonNode devices) {
        if (devices == null || !devices.isArray()) {
            throw new DeviceConfigInvalidException("The device configuration must contain a 'devices' list");
        }

        List<DeviceConfig> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode node : devices) {
            if (!node.isObject()) {
                throw new DeviceConfigInvalidException("Each device entry must be a mapping");
            }
            String id = deviceText(node, "id");
            String driver = deviceText(node, "driver");
            if (!seen.add(id)) {
                throw new DeviceConfigInvalidException("The device configuration contains a duplicate device: " + id);
            }

            JsonNode concurrent = node.get("allow_concurrent_use");
            if (concurrent != null && !concurrent.isBoolean()) {
                throw new DeviceConfigInvalidException("'allow_concurrent_use' of device '" + id + "' must be a boolean");
            }

            Map<String, Object> settings = Map.of();
            JsonNode settingsNode = node.get("settings");
            if (settingsNode != null && !settingsNode.isNull()) {
                if (!settingsNode.isObject()) {
                    throw new DeviceConfigInvalidException("'settings' of device '" + id + "' must be a mapping");
                }
                settings = yaml.convertValue(settingsNode, SETTINGS_TYPE);
            }

            result.add(new DeviceConfig(id, driver, concurrent != null && concurrent.asBoolean(), settings));
        }
        return result;
    }

    /**
     * Parses the optional {@code pipelines} list.
     */
    public List<PipelineConfig> parsePipelines(JsonNode pipelines) {
        if (pipelines == null || pipelines.isNull()) {
            return List.of();
        }
        if (!pipelines.isArray()) {
            throw new PipelineConfigInvalidException("'pipelines' must be a list");
        }

        List<PipelineConfig> result = new ArrayList<>();
        for (JsonNode node : pipelines) {
            String id = text(node, "id", true, "pipeline");
            PipelineConfig.Builder builder = PipelineConfig.builder(id);

            JsonNode members = node.get("devices");
            if (members == null || !members.isArray()) {
                throw new PipelineConfigInvalidException("Pipeline '" + id + "' must list its devices");
            }
            for (JsonNode member : members) {
                builder.withDevice(new PipelineConfig.Member(
                    text(member, "id", true, "pipeline '" + id + "' device"),
                    member.path("pipeline_input").asBoolean(false),
                    member.path("pipeline_output").asBoolean(false)));
            }

            for (SetupCommand command : parseSetupCommands(node.get("setup_commands"), "pipeline '" + id + "'")) {
                builder.withSetupCommand(command);
            }
            result.add(builder.build());
        }
        return result;
    }

    /**
     * Parses a {@code setup_commands} list; used for pipelines and reservations alike.
     */
    public List<SetupCommand> parseSetupCommands(JsonNode commands, String owner) {
        if (commands == null || commands.isNull()) {
            return List.of();
        }
        if (!commands.isArray()) {
            throw new PipelineConfigInvalidException("'setup_commands' of " + owner + " must be a list");
        }
        List<SetupCommand> result = new ArrayList<>();
        for (JsonNode node : commands) {
            String command = text(node, "command", true, owner + " setup command");
            String deviceId = text(node, "device_id", false, owner + " setup command");
            Map<String, Object> parameters = Map.of();
            JsonNode params = node.get("parameters");
            if (params != null && !params.isNull()) {
                if (!params.isObject()) {
                    throw new PipelineConfigInvalidException("Setup command parameters of " + owner + " must be a mapping");
                }
                parameters = yaml.convertValue(params, SETTINGS_TYPE);
            }
            result.add(new SetupCommand(deviceId, command, parameters));
        }
        return result;
    }

    private static String deviceText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new DeviceConfigInvalidException("Each device entry requires a textual '" + field + "'");
        }
        return value.asText();
    }

    private static String text(JsonNode node, String field, boolean required, String owner) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            if (required) {
                throw new PipelineConfigInvalidException(owner + " requires a '" + field + "' field");
            }
            return null;
        }
        if (!value.isTextual()) {
            throw new PipelineConfigInvalidException("'" + field + "' of " + owner + " must be text");
        }
        return value.asText();
    }
}
