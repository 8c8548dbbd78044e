package com.questrail.hwm.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * General purpose command failure.
 *
 * <p>Handlers may attach {@code errorData}; its entries are merged into the
 * {@code result} object of the error response next to {@code error_message}.</p>
 */
public class CommandException extends RuntimeException
{
    private final Map<String, Object> errorData;

    public CommandException(String message) {
        this(message, Map.of());
    }

    public CommandException(String message, Map<String, Object> errorData) {
        super(message);
        this.errorData = copy(errorData);
    }

    public CommandException(String message, Map<String, Object> errorData, Throwable cause) {
        super(message, cause);
        this.errorData = copy(errorData);
    }

    public Map<String, Object> errorData() {
        return errorData;
    }

    private static Map<String, Object> copy(Map<String, Object> data) {
        return data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
