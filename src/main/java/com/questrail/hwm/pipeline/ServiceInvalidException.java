package com.questrail.hwm.pipeline;

/**
 * An active service selection names a service type or id that is not registered with the pipeline.
 */
public final class ServiceInvalidException extends PipelineException
{
    public ServiceInvalidException(String message) {
        super(message);
    }

    public ServiceInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
