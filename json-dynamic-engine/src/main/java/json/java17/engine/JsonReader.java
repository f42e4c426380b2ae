package json.java17.engine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Byte-level JSON reader producing a [JsonDoc].
///
/// Containers are parsed with an explicit stack rather than recursion, so the
/// nesting depth of a document is bounded by memory, not by the thread stack.
///
/// Storage is charged to the caller's [BoundedAllocator]:
/// - a value pool of [#VAL_SIZE] bytes per value, sized from the input length and
///   grown by reallocation;
/// - unless [ReadFlag#INSITU] is set, a copy of the input plus [ReadFlag#PADDING_SIZE]
///   bytes into which strings are unescaped.
///
/// With [ReadFlag#INSITU] strings are unescaped into the caller's buffer instead.
public final class JsonReader {

    private static final Logger LOG = Logger.getLogger(JsonReader.class.getName());

    /// Bytes charged per value in the value pool.
    public static final int VAL_SIZE = 16;

    /// Input bytes per value assumed when sizing the first value pool.
    static final int ESTIMATED_BYTES_PER_VAL = 6;

    private static final int MAX_POOL_VALS = Integer.MAX_VALUE / VAL_SIZE;
    private static final long MAX_UINT_DIV_10 = 1844674407370955161L;
    private static final int MAX_UINT_MOD_10 = 5;

    private final byte[] dst;
    private final int end;
    private final int flags;
    private final BoundedAllocator alc;
    private Allocation valPool;
    private int valCap;
    private int valCount;
    private int pos;

    private JsonReader(byte[] dst, int end, int flags, BoundedAllocator alc) {
        this.dst = dst;
        this.end = end;
        this.flags = flags;
        this.alc = alc;
    }

    /// Reads one JSON document.
    ///
    /// @param buf the input; with [ReadFlag#INSITU] it must extend [ReadFlag#PADDING_SIZE]
    ///            bytes past `len` and its content is modified
    /// @param len the number of input bytes to read
    /// @param flags [ReadFlag] bits
    /// @param alc the allocator every byte of document storage is charged to
    /// @return the document, or the error that stopped the reader
    /// @throws NullPointerException if `alc` is `null`
    public static ReadResult read(byte[] buf, int len, int flags, BoundedAllocator alc) {
        Objects.requireNonNull(alc, "alc must not be null");
        if (buf == null) {
            return ReadResult.failure(ReadCode.INVALID_PARAMETER, "input data is null", 0);
        }
        if (len == 0) {
            return ReadResult.failure(ReadCode.INVALID_PARAMETER, "input length is 0", 0);
        }
        if (len < 0 || len > buf.length) {
            return ReadResult.failure(ReadCode.INVALID_PARAMETER, "input length is invalid", 0);
        }
        final boolean insitu = ReadFlag.has(flags, ReadFlag.INSITU);
        if (insitu && buf.length - len < ReadFlag.PADDING_SIZE) {
            return ReadResult.failure(ReadCode.INVALID_PARAMETER, "input buffer is not padded", 0);
        }
        LOG.fine(() -> "read " + len + " bytes, flags=" + flags + ", insitu=" + insitu);

        Allocation strPool = null;
        byte[] dst = buf;
        if (!insitu) {
            strPool = alc.allocate(len + ReadFlag.PADDING_SIZE);
            if (strPool == null) {
                return ReadResult.failure(ReadCode.MEMORY_ALLOCATION, "memory allocation failed", 0);
            }
            dst = strPool.block();
            System.arraycopy(buf, 0, dst, 0, len);
        }

        final var reader = new JsonReader(dst, len, flags, alc);
        try {
            final JsonVal root = reader.parseDocument();
            final var doc = new JsonDoc(alc, root, reader.pos, reader.valCount, reader.valPool, strPool);
            LOG.fine(() -> "read " + doc.valCount() + " values, consumed " + doc.readSize() + " bytes");
            return ReadResult.success(doc);
        } catch (ReadFailure failure) {
            if (reader.valPool != null) {
                alc.free(reader.valPool);
            }
            if (strPool != null) {
                alc.free(strPool);
            }
            LOG.fine(() -> "read failed: " + failure.getMessage() + " at " + failure.position
                    + " (" + failure.code + ")");
            return ReadResult.failure(failure.code, failure.getMessage(), failure.position);
        }
    }

    /// Reads one JSON document from a file.
    /// @return the document, or [ReadCode#FILE_OPEN]/[ReadCode#FILE_READ] when the file
    ///         cannot be opened or read, or any other reader error
    public static ReadResult readFile(Path path, int flags, BoundedAllocator alc) {
        Objects.requireNonNull(path, "path must not be null");
        final InputStream in;
        try {
            in = Files.newInputStream(path);
        } catch (IOException e) {
            LOG.fine(() -> "cannot open " + path + ": " + e);
            return ReadResult.failure(ReadCode.FILE_OPEN, "file opening failed", 0);
        }
        final byte[] content;
        try (in) {
            content = in.readAllBytes();
        } catch (IOException e) {
            LOG.fine(() -> "cannot read " + path + ": " + e);
            return ReadResult.failure(ReadCode.FILE_READ, "file reading failed", 0);
        }
        if (ReadFlag.has(flags, ReadFlag.INSITU)) {
            final byte[] padded = new byte[content.length + ReadFlag.PADDING_SIZE];
            System.arraycopy(content, 0, padded, 0, content.length);
            return read(padded, content.length, flags, alc);
        }
        return read(content, content.length, flags, alc);
    }

    /// Open container on the parse stack.
    private static final class Frame {
        final int offset;
        final List<JsonVal> elements;
        final List<JsonVal.Member> members;
        JsonVal key;

        Frame(int offset, boolean object) {
            this.offset = offset;
            this.elements = object ? null : new ArrayList<>();
            this.members = object ? new ArrayList<>() : null;
        }

        boolean isObject() {
            return members != null;
        }

        void add(JsonVal value) {
            if (members != null) {
                members.add(new JsonVal.Member(key, value));
                key = null;
            } else {
                elements.add(value);
            }
        }

        JsonVal finish() {
            return members != null ? JsonVal.ofObject(offset, members) : JsonVal.ofArray(offset, elements);
        }
    }

    private JsonVal parseDocument() {
        if (end >= 3 && (dst[0] & 0xff) == 0xEF && (dst[1] & 0xff) == 0xBB && (dst[2] & 0xff) == 0xBF) {
            throw new ReadFailure(ReadCode.UNEXPECTED_CHARACTER, "byte order mark (BOM) is not supported", 0);
        }
        reservePool();
        skipSpace();
        if (pos >= end) {
            throw new ReadFailure(ReadCode.EMPTY_CONTENT, "input data is empty", pos);
        }
        final JsonVal root = parseValue();
        if (!has(ReadFlag.STOP_WHEN_DONE)) {
            skipSpace();
            if (pos < end) {
                throw new ReadFailure(ReadCode.UNEXPECTED_CONTENT, "unexpected content after document", pos);
            }
        }
        return root;
    }

    private JsonVal parseValue() {
        final Deque<Frame> stack = new ArrayDeque<>();
        while (true) {
            skipSpace();
            if (pos >= end) {
                throw unexpectedEnd();
            }
            JsonVal completed;
            final byte c = dst[pos];
            if (c == '[' || c == '{') {
                final var frame = new Frame(pos, c == '{');
                newVal();
                pos++;
                skipSpace();
                if (pos < end && dst[pos] == (frame.isObject() ? '}' : ']')) {
                    pos++;
                    completed = frame.finish();
                } else {
                    stack.push(frame);
                    if (frame.isObject()) {
                        parseKey(frame);
                    }
                    continue;
                }
            } else {
                completed = parseScalar();
            }

            // attach the completed value to its parents, closing containers as they end
            while (true) {
                final var frame = stack.peek();
                if (frame == null) {
                    return completed;
                }
                frame.add(completed);
                skipSpace();
                if (pos >= end) {
                    throw unexpectedEnd();
                }
                final byte close = (byte) (frame.isObject() ? '}' : ']');
                final byte next = dst[pos];
                if (next == ',') {
                    pos++;
                    skipSpace();
                    if (pos >= end) {
                        throw unexpectedEnd();
                    }
                    if (dst[pos] == close) {
                        if (!has(ReadFlag.ALLOW_TRAILING_COMMAS)) {
                            throw new ReadFailure(ReadCode.JSON_STRUCTURE, "trailing comma is not allowed", pos);
                        }
                        pos++;
                        stack.pop();
                        completed = frame.finish();
                        continue;
                    }
                    if (frame.isObject()) {
                        parseKey(frame);
                    }
                    break;
                }
                if (next == close) {
                    pos++;
                    stack.pop();
                    completed = frame.finish();
                    continue;
                }
                throw new ReadFailure(ReadCode.UNEXPECTED_CHARACTER, frame.isObject()
                        ? "unexpected character, expected a comma or a closing brace"
                        : "unexpected character, expected a comma or a closing bracket", pos);
            }
        }
    }

    private void parseKey(Frame frame) {
        skipSpace();
        if (pos >= end) {
            throw unexpectedEnd();
        }
        if (dst[pos] != '"') {
            throw new ReadFailure(ReadCode.UNEXPECTED_CHARACTER,
                    "unexpected character, expected a string for object key", pos);
        }
        frame.key = parseString();
        skipSpace();
        if (pos >= end) {
            throw unexpectedEnd();
        }
        if (dst[pos] != ':') {
            throw new ReadFailure(ReadCode.UNEXPECTED_CHARACTER,
                    "unexpected character, expected a colon after object key", pos);
        }
        pos++;
    }

    private JsonVal parseScalar() {
        final byte c = dst[pos];
        switch (c) {
            case '"':
                return parseString();
            case 't':
                return parseLiteral("true", JsonVal.ofBool(pos, true));
            case 'f':
                return parseLiteral("false", JsonVal.ofBool(pos, false));
            case 'n':
                if (has(ReadFlag.ALLOW_INF_AND_NAN) && !matches("null") && !truncated("null")) {
                    return parseNonFinite(pos);
                }
                return parseLiteral("null", JsonVal.ofNull(pos));
            case '-':
            case '0': case '1': case '2': case '3': case '4':
            case '5': case '6': case '7': case '8': case '9':
                return parseNumber();
            case '+': case 'N': case 'I': case 'i':
                if (has(ReadFlag.ALLOW_INF_AND_NAN)) {
                    return parseNonFinite(pos);
                }
                if (c == '+') {
                    throw new ReadFailure(ReadCode.UNEXPECTED_CHARACTER, "unexpected character", pos);
                }
                throw new ReadFailure(ReadCode.LITERAL, "invalid literal", pos);
            default:
                throw new ReadFailure(ReadCode.UNEXPECTED_CHARACTER, "unexpected character", pos);
        }
    }

    private JsonVal parseLiteral(String literal, JsonVal value) {
        if (!matches(literal)) {
            if (truncated(literal)) {
                throw unexpectedEnd();
            }
            throw new ReadFailure(ReadCode.LITERAL, "invalid literal", pos);
        }
        newVal();
        pos += literal.length();
        return value;
    }

    /// Parses `nan`, `inf` or `infinity` in any case, optionally signed, at `start`.
    private JsonVal parseNonFinite(int start) {
        boolean negative = false;
        if (dst[pos] == '+' || dst[pos] == '-') {
            negative = dst[pos] == '-';
            pos++;
        }
        final double value;
        if (matchesIgnoreCase("infinity")) {
            pos += 8;
            value = negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        } else if (matchesIgnoreCase("inf")) {
            pos += 3;
            value = negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        } else if (matchesIgnoreCase("nan")) {
            pos += 3;
            value = Double.NaN;
        } else {
            throw new ReadFailure(ReadCode.LITERAL, "invalid literal", start);
        }
        newVal();
        if (has(ReadFlag.NUMBER_AS_RAW)) {
            return JsonVal.ofRaw(start, dst, start, pos - start);
        }
        return JsonVal.ofReal(start, value);
    }

    private JsonVal parseNumber() {
        final int start = pos;
        final boolean negative = dst[pos] == '-';
        if (negative) {
            pos++;
            if (pos < end && has(ReadFlag.ALLOW_INF_AND_NAN) && isNonFiniteStart(dst[pos])) {
                pos = start;
                return parseNonFinite(start);
            }
        }
        if (pos >= end || !isDigit(dst[pos])) {
            throw new ReadFailure(ReadCode.INVALID_NUMBER, "no digit after minus sign", pos);
        }
        if (dst[pos] == '0' && pos + 1 < end && isDigit(dst[pos + 1])) {
            throw new ReadFailure(ReadCode.INVALID_NUMBER, "number with leading zero is not allowed", pos);
        }

        long magnitude = 0;
        boolean overflow = false;
        while (pos < end && isDigit(dst[pos])) {
            final int d = dst[pos] - '0';
            if (!overflow) {
                if (Long.compareUnsigned(magnitude, MAX_UINT_DIV_10) > 0
                        || (magnitude == MAX_UINT_DIV_10 && d > MAX_UINT_MOD_10)) {
                    overflow = true;
                } else {
                    magnitude = magnitude * 10 + d;
                }
            }
            pos++;
        }

        boolean real = false;
        if (pos < end && dst[pos] == '.') {
            real = true;
            pos++;
            if (pos >= end || !isDigit(dst[pos])) {
                throw new ReadFailure(ReadCode.INVALID_NUMBER, "no digit after decimal point", pos);
            }
            while (pos < end && isDigit(dst[pos])) {
                pos++;
            }
        }
        if (pos < end && (dst[pos] == 'e' || dst[pos] == 'E')) {
            real = true;
            pos++;
            if (pos < end && (dst[pos] == '+' || dst[pos] == '-')) {
                pos++;
            }
            if (pos >= end || !isDigit(dst[pos])) {
                throw new ReadFailure(ReadCode.INVALID_NUMBER, "no digit after exponent sign", pos);
            }
            while (pos < end && isDigit(dst[pos])) {
                pos++;
            }
        }

        newVal();
        if (has(ReadFlag.NUMBER_AS_RAW)) {
            return JsonVal.ofRaw(start, dst, start, pos - start);
        }
        if (!real) {
            if (!overflow && !negative) {
                return JsonVal.ofUint(start, magnitude);
            }
            if (!overflow && Long.compareUnsigned(magnitude, Long.MIN_VALUE) <= 0) {
                return JsonVal.ofSint(start, -magnitude);
            }
            if (has(ReadFlag.BIGNUM_AS_RAW)) {
                return JsonVal.ofRaw(start, dst, start, pos - start);
            }
        }
        final double value = Double.parseDouble(ascii(start, pos));
        if (Double.isInfinite(value)) {
            if (has(ReadFlag.BIGNUM_AS_RAW)) {
                return JsonVal.ofRaw(start, dst, start, pos - start);
            }
            if (!has(ReadFlag.ALLOW_INF_AND_NAN)) {
                throw new ReadFailure(ReadCode.INVALID_NUMBER, "number is infinity when parsed as double", start);
            }
        }
        return JsonVal.ofReal(start, value);
    }

    /// Parses the string at `pos`, unescaping it in place.
    private JsonVal parseString() {
        final int offset = pos;
        pos++;
        final int start = pos;
        int out = pos;
        while (true) {
            if (pos >= end) {
                throw new ReadFailure(ReadCode.UNEXPECTED_END, "unclosed string", offset);
            }
            final int b = dst[pos] & 0xff;
            if (b == '"') {
                pos++;
                break;
            }
            if (b == '\\') {
                out = unescape(out);
            } else if (b < 0x20) {
                throw new ReadFailure(ReadCode.INVALID_STRING, "unexpected control character in string", pos);
            } else if (b < 0x80) {
                dst[out++] = (byte) b;
                pos++;
            } else {
                final int n = utf8Length(pos);
                if (n == 0) {
                    if (!has(ReadFlag.ALLOW_INVALID_UNICODE)) {
                        throw new ReadFailure(ReadCode.INVALID_STRING, "invalid UTF-8 encoding in string", pos);
                    }
                    dst[out++] = dst[pos++];
                } else {
                    for (int i = 0; i < n; i++) {
                        dst[out++] = dst[pos++];
                    }
                }
            }
        }
        newVal();
        return JsonVal.ofString(offset, dst, start, out - start);
    }

    private int unescape(int out) {
        final int escape = pos;
        pos++;
        if (pos >= end) {
            throw unexpectedEnd();
        }
        final byte e = dst[pos++];
        switch (e) {
            case '"': case '\\': case '/':
                dst[out++] = e;
                return out;
            case 'b':
                dst[out++] = '\b';
                return out;
            case 'f':
                dst[out++] = '\f';
                return out;
            case 'n':
                dst[out++] = '\n';
                return out;
            case 'r':
                dst[out++] = '\r';
                return out;
            case 't':
                dst[out++] = '\t';
                return out;
            case 'u':
                break;
            default:
                throw new ReadFailure(ReadCode.INVALID_STRING, "invalid escaped character in string", escape);
        }
        int cp = readHex4(escape);
        if (cp >= 0xDC00 && cp <= 0xDFFF) {
            throw new ReadFailure(ReadCode.INVALID_STRING, "invalid low surrogate in string", escape);
        }
        if (cp >= 0xD800 && cp <= 0xDBFF) {
            if (end - pos < 2 || dst[pos] != '\\' || dst[pos + 1] != 'u') {
                throw new ReadFailure(ReadCode.INVALID_STRING, "no low surrogate in string", escape);
            }
            pos += 2;
            final int low = readHex4(escape);
            if (low < 0xDC00 || low > 0xDFFF) {
                throw new ReadFailure(ReadCode.INVALID_STRING, "invalid low surrogate in string", escape);
            }
            cp = 0x10000 + ((cp - 0xD800) << 10) + (low - 0xDC00);
        }
        return writeUtf8(out, cp);
    }

    private int readHex4(int escape) {
        if (end - pos < 4) {
            throw unexpectedEnd();
        }
        int cp = 0;
        for (int i = 0; i < 4; i++) {
            final int h = Character.digit(dst[pos++], 16);
            if (h < 0) {
                throw new ReadFailure(ReadCode.INVALID_STRING, "invalid escaped unicode in string", escape);
            }
            cp = (cp << 4) | h;
        }
        return cp;
    }

    private int writeUtf8(int out, int cp) {
        if (cp < 0x80) {
            dst[out++] = (byte) cp;
        } else if (cp < 0x800) {
            dst[out++] = (byte) (0xC0 | (cp >> 6));
            dst[out++] = (byte) (0x80 | (cp & 0x3F));
        } else if (cp < 0x10000) {
            dst[out++] = (byte) (0xE0 | (cp >> 12));
            dst[out++] = (byte) (0x80 | ((cp >> 6) & 0x3F));
            dst[out++] = (byte) (0x80 | (cp & 0x3F));
        } else {
            dst[out++] = (byte) (0xF0 | (cp >> 18));
            dst[out++] = (byte) (0x80 | ((cp >> 12) & 0x3F));
            dst[out++] = (byte) (0x80 | ((cp >> 6) & 0x3F));
            dst[out++] = (byte) (0x80 | (cp & 0x3F));
        }
        return out;
    }

    /// {@return the length of the well-formed UTF-8 sequence at `p`, or `0` if it is malformed}
    private int utf8Length(int p) {
        final int b0 = dst[p] & 0xff;
        final int n;
        final int min;
        if (b0 >= 0xC2 && b0 <= 0xDF) {
            n = 2;
            min = 0x80;
        } else if (b0 >= 0xE0 && b0 <= 0xEF) {
            n = 3;
            min = 0x800;
        } else if (b0 >= 0xF0 && b0 <= 0xF4) {
            n = 4;
            min = 0x10000;
        } else {
            return 0;
        }
        if (end - p < n) {
            return 0;
        }
        int cp = b0 & (0xFF >> (n + 1));
        for (int i = 1; i < n; i++) {
            final int b = dst[p + i] & 0xff;
            if ((b & 0xC0) != 0x80) {
                return 0;
            }
            cp = (cp << 6) | (b & 0x3F);
        }
        if (cp < min || cp > 0x10FFFF || (cp >= 0xD800 && cp <= 0xDFFF)) {
            return 0;
        }
        return n;
    }

    private void skipSpace() {
        while (pos < end) {
            final byte c = dst[pos];
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
                pos++;
            } else if (c == '/' && has(ReadFlag.ALLOW_COMMENTS) && pos + 1 < end) {
                if (dst[pos + 1] == '/') {
                    pos += 2;
                    while (pos < end && dst[pos] != '\n') {
                        pos++;
                    }
                } else if (dst[pos + 1] == '*') {
                    final int start = pos;
                    pos += 2;
                    while (true) {
                        if (pos + 1 >= end) {
                            throw new ReadFailure(ReadCode.INVALID_COMMENT, "unclosed multiline comment", start);
                        }
                        if (dst[pos] == '*' && dst[pos + 1] == '/') {
                            pos += 2;
                            break;
                        }
                        pos++;
                    }
                } else {
                    return;
                }
            } else {
                return;
            }
        }
    }

    private void reservePool() {
        valCap = (int) Math.min(end / ESTIMATED_BYTES_PER_VAL + 4L, MAX_POOL_VALS);
        valPool = alc.allocate(valCap * VAL_SIZE);
        if (valPool == null) {
            throw new ReadFailure(ReadCode.MEMORY_ALLOCATION, "memory allocation failed", 0);
        }
    }

    /// Claims one slot of the value pool, growing it when full.
    private void newVal() {
        if (valCount == valCap) {
            if (valCap == MAX_POOL_VALS) {
                throw new ReadFailure(ReadCode.MEMORY_ALLOCATION, "memory allocation failed", pos);
            }
            final int grown = (int) Math.min(valCap + (valCap >> 1) + 1L, MAX_POOL_VALS);
            final var moved = alc.reallocate(valPool, grown * VAL_SIZE);
            if (moved == null) {
                throw new ReadFailure(ReadCode.MEMORY_ALLOCATION, "memory allocation failed", pos);
            }
            valPool = moved;
            valCap = grown;
        }
        valCount++;
    }

    private ReadFailure unexpectedEnd() {
        return new ReadFailure(ReadCode.UNEXPECTED_END, "unexpected end of data", pos);
    }

    private boolean has(int flag) {
        return ReadFlag.has(flags, flag);
    }

    private boolean matches(String literal) {
        if (end - pos < literal.length()) {
            return false;
        }
        for (int i = 0; i < literal.length(); i++) {
            if (dst[pos + i] != literal.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private boolean prefixMatches(String literal) {
        for (int i = 0; pos + i < end; i++) {
            if (dst[pos + i] != literal.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    /// {@return `true` if the input ends inside `literal`}
    private boolean truncated(String literal) {
        return end - pos < literal.length() && prefixMatches(literal);
    }

    private boolean matchesIgnoreCase(String literal) {
        if (end - pos < literal.length()) {
            return false;
        }
        for (int i = 0; i < literal.length(); i++) {
            if (Character.toLowerCase((char) dst[pos + i]) != literal.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private String ascii(int from, int to) {
        final char[] chars = new char[to - from];
        for (int i = from; i < to; i++) {
            chars[i - from] = (char) dst[i];
        }
        return new String(chars);
    }

    private static boolean isDigit(byte c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNonFiniteStart(byte c) {
        return c == 'i' || c == 'I' || c == 'n' || c == 'N';
    }

    /// Unwinds the reader to [#read] with the code and position of the failure.
    private static final class ReadFailure extends RuntimeException {

        private static final long serialVersionUID = 1L;

        final ReadCode code;
        final int position;

        ReadFailure(ReadCode code, String message, int position) {
            super(message, null, false, false);
            this.code = code;
            this.position = position;
        }
    }
}
