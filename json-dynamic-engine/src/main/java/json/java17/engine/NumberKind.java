package json.java17.engine;

/// Subtype of a [JsonType#NUM] node.
public enum NumberKind {
    /// Non-negative integer, payload is an unsigned 64-bit value held in a `long`.
    UINT,
    /// Negative integer.
    SINT,
    /// IEEE 754 double.
    REAL
}
