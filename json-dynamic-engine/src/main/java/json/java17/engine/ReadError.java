package json.java17.engine;

import java.util.Objects;

/// A reader failure: what went wrong and the byte offset where it was detected.
public record ReadError(ReadCode code, String message, long position) {

    public ReadError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return message + " at " + position + " (" + code + ")";
    }
}
