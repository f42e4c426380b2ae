package json.java17.engine;

/// Bit flags accepted by [JsonReader]. Flags combine with `|`.
public final class ReadFlag {

    /// RFC 8259 strict: non-negative integers as unsigned, negative as signed,
    /// integers out of 64-bit range as doubles, no comments, no trailing commas,
    /// no inf/nan, invalid UTF-8 rejected.
    public static final int NOFLAG = 0;

    /// Use the input buffer as scratch space for unescaped strings.
    /// The buffer must hold [#PADDING_SIZE] bytes past the given length.
    public static final int INSITU = 1;

    /// Stop after the first complete value instead of failing on trailing content.
    public static final int STOP_WHEN_DONE = 1 << 1;

    /// Allow a single trailing comma in arrays and objects, such as `[1,2,]`.
    public static final int ALLOW_TRAILING_COMMAS = 1 << 2;

    /// Allow C-style `//` and `/* */` comments.
    public static final int ALLOW_COMMENTS = 1 << 3;

    /// Allow case-insensitive `nan`, `inf`, `infinity` and numbers that overflow a double.
    public static final int ALLOW_INF_AND_NAN = 1 << 4;

    /// Read every number as a [JsonType#RAW] node holding its text.
    public static final int NUMBER_AS_RAW = 1 << 5;

    /// Keep invalid UTF-8 inside strings instead of failing.
    public static final int ALLOW_INVALID_UNICODE = 1 << 6;

    /// Read integers that do not fit 64 bits as [JsonType#RAW] instead of doubles.
    public static final int BIGNUM_AS_RAW = 1 << 7;

    /// Trailing bytes an in-situ buffer must carry past the document.
    public static final int PADDING_SIZE = 4;

    /// {@return `true` if `flag` is set in `flags`}
    public static boolean has(int flags, int flag) {
        return (flags & flag) != 0;
    }

    private ReadFlag() {
        throw new AssertionError("ReadFlag cannot be instantiated");
    }
}
