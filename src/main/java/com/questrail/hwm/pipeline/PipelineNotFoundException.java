package com.questrail.hwm.pipeline;

/**
 * The requested pipeline id is not loaded in the pipeline registry.
 */
public final class PipelineNotFoundException extends PipelineException
{
    public PipelineNotFoundException(String message) {
        super(message);
    }

    public PipelineNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
