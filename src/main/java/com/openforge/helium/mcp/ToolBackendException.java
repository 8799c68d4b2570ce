package com.openforge.helium.mcp;

/**
 * Transport or protocol failure talking to the tool backend.
 * code carries the JSON-RPC error code when the server sent one.
 */
public class ToolBackendException extends RuntimeException {

    private final Integer code;

    public ToolBackendException(String message) {
        this(null, message, null);
    }

    public ToolBackendException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public ToolBackendException(Integer code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Integer getCode() {
        return code;
    }
}
