package com.questrail.hwm.pipeline;

/**
 * Raised when a pipeline, or one of its devices, is already reserved.
 */
public final class PipelineInUseException extends PipelineException
{
    public PipelineInUseException(String message) {
        super(message);
    }

    public PipelineInUseException(String message, Throwable cause) {
        super(message, cause);
    }
}
