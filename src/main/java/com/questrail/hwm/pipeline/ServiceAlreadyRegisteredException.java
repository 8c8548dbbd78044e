package com.questrail.hwm.pipeline;

/**
 * A service with the same type and id has already been registered with the pipeline.
 */
public final class ServiceAlreadyRegisteredException extends PipelineException
{
    public ServiceAlreadyRegisteredException(String message) {
        super(message);
    }

    public ServiceAlreadyRegisteredException(String message, Throwable cause) {
        super(message, cause);
    }
}
