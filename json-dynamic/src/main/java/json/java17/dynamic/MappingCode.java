package json.java17.dynamic;

/// Error codes raised by [ValueMapper], numbered after the reader codes.
public enum MappingCode {
    /// A node kind with no dynamic counterpart, such as a raw number.
    UNKNOWN_VALUE_TYPE(64),
    /// Nesting deeper than the configured maximum depth.
    STACK_EXHAUSTION(65);

    private final int code;

    MappingCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
