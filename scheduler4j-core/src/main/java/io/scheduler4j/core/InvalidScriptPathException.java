package io.scheduler4j.core;

/**
 * A script or interpreter path was rejected before anything was launched or recorded.
 */
public class InvalidScriptPathException extends IllegalArgumentException {

    private final String path;

    public InvalidScriptPathException(String path, String reason) {
        super(reason + ": " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
