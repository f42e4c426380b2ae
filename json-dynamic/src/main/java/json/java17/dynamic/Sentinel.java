package json.java17.dynamic;

/// Identity token handed out by a [SentinelRegistry].
///
/// Tokens are never copied and compare by identity only; two tokens with the
/// same label from different registries are different tokens.
public final class Sentinel implements DynamicValue {

    private final String label;

    Sentinel(String label) {
        this.label = label;
    }

    /// {@return the diagnostic label}
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
