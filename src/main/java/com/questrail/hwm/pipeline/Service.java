package com.questrail.hwm.pipeline;

/**
 * A capability a device offers to the other devices of a pipeline, keyed by
 * {@code (type, id)}. Which service of a type is used is chosen per session.
 */
public interface Service
{
    String id();

    String type();
}
