package json.java17.dynamic;

import java.nio.charset.StandardCharsets;

/// Outcome of [JsonDynamic#encode].
///
/// On success [#json()] holds the UTF-8 bytes, [#errorMessage()] is `null` and
/// [#errorCode()] is `0`. On failure no bytes are returned and the code is a
/// [json.java17.engine.WriteCode] number or a [MappingCode] number.
public record EncodeResult(byte[] json, String errorMessage, int errorCode) {

    /// Message reported when storage for the document could not be allocated.
    public static final String MEMORY_MESSAGE = "Cannot allocate memory";

    static EncodeResult success(byte[] json) {
        return new EncodeResult(json, null, 0);
    }

    static EncodeResult failure(String message, int code) {
        return new EncodeResult(null, message, code);
    }

    public boolean isSuccess() {
        return errorMessage == null;
    }

    /// {@return the output decoded as UTF-8, or `null` on failure}
    public String text() {
        return json != null ? new String(json, StandardCharsets.UTF_8) : null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "EncodeResult[" + text() + "]"
                : "EncodeResult[error " + errorCode + ": " + errorMessage + "]";
    }
}
