package json.java17.engine;

import java.util.Objects;

/// A writer failure.
public record WriteError(WriteCode code, String message) {

    public WriteError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return message + " (" + code + ")";
    }
}
