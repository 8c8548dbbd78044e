package com.questrail.hwm.pipeline;

/**
 * Base type for pipeline, service and session registration failures.
 */
public class PipelineException extends RuntimeException
{
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
