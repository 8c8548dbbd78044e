package com.questrail.hwm.pipeline;

/**
 * Raised when a session is registered with a pipeline that already has one.
 */
public final class SessionAlreadyRegisteredException extends PipelineException
{
    public SessionAlreadyRegisteredException(String message) {
        super(message);
    }

    public SessionAlreadyRegisteredException(String message, Throwable cause) {
        super(message, cause);
    }
}
