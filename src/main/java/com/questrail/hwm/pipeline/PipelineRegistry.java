package com.questrail.hwm.pipeline;

import com.questrail.hwm.command.CommandParser;
import com.questrail.hwm.config.PipelineConfig;
import com.questrail.hwm.device.DeviceRegistry;
import com.questrail.hwm.internal.time.WallClock;
import com.questrail.hwm.observability.StationObservabilitySink;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PipelineRegistry
 * -----------------------------------------------------------------------------
 * Owns every configured pipeline.
 *
 * <p>The registry exists before its pipelines: devices are handed the registry
 * as their {@link PipelineDirectory} when they are built, and the pipelines are
 * loaded afterwards, once the device registry and command parser exist.</p>
 */
public final class PipelineRegistry implements PipelineDirectory
{
    private volatile Map<String, Pipeline> pipelines = Map.of();
    private boolean loaded;

    /**
     * Builds every configured pipeline. May only be called once.
     *
     * @throws PipelineConfigInvalidException for duplicate pipeline ids or an
     *         invalid pipeline definition
     */
    public synchronized void loadPipelines(List<PipelineConfig> configurations,
                                           DeviceRegistry deviceRegistry,
                                           CommandParser commandParser,
                                           WallClock clock,
                                           StationObservabilitySink observabilitySink)
    {
        if (loaded) {
            throw new IllegalStateException("Pipelines have already been loaded");
        }

        Map<String, Pipeline> built = new LinkedHashMap<>();
        for (PipelineConfig configuration : configurations) {
            if (built.containsKey(configuration.id())) {
                throw new PipelineConfigInvalidException("The pipeline configuration contains a duplicate pipeline: "
                    + configuration.id());
            }
            built.put(configuration.id(), new Pipeline(
                configuration, deviceRegistry, commandParser, clock, observabilitySink));
        }

        pipelines = Collections.unmodifiableMap(built);
        loaded = true;
    }

    /**
     * @throws PipelineNotFoundException if no pipeline with that id was loaded
     */
    public Pipeline getPipeline(String pipelineId) {
        Pipeline pipeline = pipelines.get(pipelineId);
        if (pipeline == null) {
            throw new PipelineNotFoundException("The '" + pipelineId + "' pipeline hasn't been loaded.");
        }
        return pipeline;
    }

    @Override
    public Optional<Pipeline> findPipeline(String pipelineId) {
        return Optional.ofNullable(pipelines.get(pipelineId));
    }

    @Override
    public Collection<Pipeline> allPipelines() {
        return pipelines.values();
    }
}
