package json.java17.engine;

/// Result codes reported by [JsonWriter].
public enum WriteCode {
    SUCCESS(0),
    /// Invalid parameter, such as a document without a root.
    INVALID_PARAMETER(1),
    /// The allocator refused a request.
    MEMORY_ALLOCATION(2),
    /// A node of a type that cannot be written.
    INVALID_VALUE_TYPE(3),
    /// A NaN or infinite number without a flag that allows it.
    NAN_OR_INF(4),
    FILE_OPEN(5),
    FILE_WRITE(6),
    /// A string holding an unpaired surrogate.
    INVALID_STRING(7);

    private final int code;

    WriteCode(int code) {
        this.code = code;
    }

    /// {@return the numeric code}
    public int code() {
        return code;
    }

    /// {@return the constant with the given numeric code}
    /// @throws IllegalArgumentException if no constant has that code
    public static WriteCode fromCode(int code) {
        for (WriteCode c : values()) {
            if (c.code == code) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown write code: " + code);
    }
}
