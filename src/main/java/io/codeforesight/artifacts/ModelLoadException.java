package io.codeforesight.artifacts;

/**
 * A trained artifact or the rule index is missing, malformed or of an incompatible version.
 * Fatal at process startup, never raised by a detection call.
 */
public class ModelLoadException extends Exception {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
