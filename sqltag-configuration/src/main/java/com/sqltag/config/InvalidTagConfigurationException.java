package com.sqltag.config;

/**
 * Thrown when a tag list, tagging registry or configuration document is structurally invalid
 * (blank key, missing handler, empty group, entry that is neither a key nor a group).
 * Configuration is rejected when it is built; a tag that merely resolves to nothing is not an error.
 */
public final class InvalidTagConfigurationException extends RuntimeException {

    public InvalidTagConfigurationException(String message) {
        super(message);
    }

    public InvalidTagConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
