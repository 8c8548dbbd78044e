package com.questrail.hwm.pipeline;

/**
 * The pipeline configuration references unknown devices, repeats a device, declares several output devices, or issues setup commands to a device outside the pipeline.
 */
public final class PipelineConfigInvalidException extends PipelineException
{
    public PipelineConfigInvalidException(String message) {
        super(message);
    }

    public PipelineConfigInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
