package org.tarik.conf.exceptions;

import java.util.List;

import static org.tarik.conf.utils.CommonUtils.toDottedPath;

/**
 * Exception thrown when a config field cannot be resolved from a config tree.
 * It carries the path of the offending field and the reason of the failure.
 */
public class ConfigFieldException extends RuntimeException {
    private final List<String> path;
    private final Reason reason;

    public ConfigFieldException(List<String> path, Reason reason, String message) {
        super("field '%s': %s".formatted(toDottedPath(path), message));
        this.path = List.copyOf(path);
        this.reason = reason;
    }

    public ConfigFieldException(List<String> path, Reason reason, String message, Throwable cause) {
        super("field '%s': %s".formatted(toDottedPath(path), message), cause);
        this.path = List.copyOf(path);
        this.reason = reason;
    }

    public List<String> getPath() {
        return path;
    }

    public String getDottedPath() {
        return toDottedPath(path);
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        MISSING,
        WRONG_TYPE,
        INVALID_VALUE,
        RULE_VIOLATION,
        /**
         * Only reported by linting, parsing ignores keys which aren't declared.
         */
        UNKNOWN_FIELD
    }
}
