package com.questrail.hwm.pipeline;

import java.util.Collection;
import java.util.Optional;

/**
 * Id-addressed view of the loaded pipelines.
 *
 * <p>Devices reach the pipelines they belong to only through this lookup.</p>
 */
public interface PipelineDirectory
{
    Optional<Pipeline> findPipeline(String pipelineId);

    Collection<Pipeline> allPipelines();
}
