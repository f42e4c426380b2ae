package json.java17.dynamic;

/// The three tokens that tag values beyond what their shape conveys.
///
/// - [#nullToken()] marks an explicit JSON `null`, distinct from an absent key.
/// - [#asArrayToken()] and [#asObjectToken()], stored in a table's marker slot,
///   say whether the table is a JSON array or object.
///
/// A registry is immutable and safe to share. Each instance has its own tokens,
/// and a [ValueMapper] only recognises the tokens of the registry it was built with.
public final class SentinelRegistry {

    public static final String NULL_LABEL = "yyjson.null";
    public static final String AS_ARRAY_LABEL = "yyjson.as_array";
    public static final String AS_OBJECT_LABEL = "yyjson.as_object";

    private final Sentinel nullToken;
    private final Sentinel asArrayToken;
    private final Sentinel asObjectToken;

    private SentinelRegistry() {
        this.nullToken = new Sentinel(NULL_LABEL);
        this.asArrayToken = new Sentinel(AS_ARRAY_LABEL);
        this.asObjectToken = new Sentinel(AS_OBJECT_LABEL);
    }

    /// {@return a registry with fresh tokens}
    public static SentinelRegistry create() {
        return new SentinelRegistry();
    }

    public Sentinel nullToken() {
        return nullToken;
    }

    public Sentinel asArrayToken() {
        return asArrayToken;
    }

    public Sentinel asObjectToken() {
        return asObjectToken;
    }

    /// {@return `true` if `value` is one of this registry's tokens}
    public boolean owns(DynamicValue value) {
        return value == nullToken || value == asArrayToken || value == asObjectToken;
    }

    @Override
    public String toString() {
        return "SentinelRegistry[" + NULL_LABEL + ", " + AS_ARRAY_LABEL + ", " + AS_OBJECT_LABEL + "]";
    }
}
