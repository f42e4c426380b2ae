package json.java17.engine;

/// Type tag of a node in a [JsonDoc] or [JsonMutDoc].
///
/// The numeric tags are stable and appear in diagnostics such as
/// `unknown value type 1`.
public enum JsonType {
    /// No value, e.g. a missing root.
    NONE(0),
    /// Raw text kept verbatim, produced by the number-as-raw read flags.
    RAW(1),
    NULL(2),
    BOOL(3),
    NUM(4),
    STR(5),
    ARR(6),
    OBJ(7);

    private final int tag;

    JsonType(int tag) {
        this.tag = tag;
    }

    /// {@return the numeric tag}
    public int tag() {
        return tag;
    }
}
