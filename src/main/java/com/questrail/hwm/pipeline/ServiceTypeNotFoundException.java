package com.questrail.hwm.pipeline;

/**
 * No active service has been selected for the requested service type.
 */
public final class ServiceTypeNotFoundException extends PipelineException
{
    public ServiceTypeNotFoundException(String message) {
        super(message);
    }

    public ServiceTypeNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
