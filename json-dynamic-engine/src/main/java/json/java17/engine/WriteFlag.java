package json.java17.engine;

/// Bit flags accepted by [JsonWriter]. Flags combine with `|`.
public final class WriteFlag {

    /// Minified output, error on inf or nan, no unicode or slash escaping.
    public static final int NOFLAG = 0;

    /// Pretty output with a 4-space indent.
    public static final int PRETTY = 1;

    /// Escape non-ASCII characters as six-character `\` `u` hex escapes, producing ASCII-only output.
    public static final int ESCAPE_UNICODE = 1 << 1;

    /// Escape `/` as `\/`.
    public static final int ESCAPE_SLASHES = 1 << 2;

    /// Write inf and nan as the non-standard `Infinity` and `NaN` literals.
    public static final int ALLOW_INF_AND_NAN = 1 << 3;

    /// Write inf and nan as `null`. Overrides [#ALLOW_INF_AND_NAN].
    public static final int INF_AND_NAN_AS_NULL = 1 << 4;

    /// Replace unpaired surrogates with U+FFFD instead of failing.
    public static final int ALLOW_INVALID_UNICODE = 1 << 5;

    /// Pretty output with a 2-space indent. Implies [#PRETTY].
    public static final int PRETTY_TWO_SPACES = 1 << 6;

    /// {@return `true` if `flag` is set in `flags`}
    public static boolean has(int flags, int flag) {
        return (flags & flag) != 0;
    }

    private WriteFlag() {
        throw new AssertionError("WriteFlag cannot be instantiated");
    }
}
