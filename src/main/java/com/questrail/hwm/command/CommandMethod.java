package com.questrail.hwm.command;

import java.util.Map;

/**
 * One executable command of a handler.
 *
 * <p>Runs on a command worker thread, never on the station coordinator, so
 * it may block on device I/O.</p>
 */
@FunctionalInterface
public interface CommandMethod
{
    /**
     * @return the {@code result} payload of the success response (may be empty)
     * @throws Exception any failure; converted into an error response
     */
    Map<String, Object> execute(Command command) throws Exception;
}
