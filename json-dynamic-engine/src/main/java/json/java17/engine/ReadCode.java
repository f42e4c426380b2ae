package json.java17.engine;

/// Result codes reported by [JsonReader].
public enum ReadCode {
    SUCCESS(0),
    /// Invalid parameter, such as an empty buffer or a bad length.
    INVALID_PARAMETER(1),
    /// The allocator refused a request.
    MEMORY_ALLOCATION(2),
    /// The input holds nothing but whitespace or comments.
    EMPTY_CONTENT(3),
    /// Content after the document, such as `[1]#`.
    UNEXPECTED_CONTENT(4),
    /// The input ended inside a value, such as `[123`.
    UNEXPECTED_END(5),
    /// A character that cannot start or continue the current token, such as `[#]`.
    UNEXPECTED_CHARACTER(6),
    /// Invalid structure, such as `[1,]`.
    JSON_STRUCTURE(7),
    /// Invalid comment, such as an unclosed block comment.
    INVALID_COMMENT(8),
    /// Invalid number, such as `123.e12` or `000`.
    INVALID_NUMBER(9),
    /// Invalid string, such as a bad escape sequence.
    INVALID_STRING(10),
    /// Invalid literal, such as `truu`.
    LITERAL(11),
    FILE_OPEN(12),
    FILE_READ(13);

    private final int code;

    ReadCode(int code) {
        this.code = code;
    }

    /// {@return the numeric code}
    public int code() {
        return code;
    }

    /// {@return the constant with the given numeric code}
    /// @throws IllegalArgumentException if no constant has that code
    public static ReadCode fromCode(int code) {
        for (ReadCode c : values()) {
            if (c.code == code) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown read code: " + code);
    }
}
