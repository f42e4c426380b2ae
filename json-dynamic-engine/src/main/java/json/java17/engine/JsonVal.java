package json.java17.engine;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

/// Immutable node of a [JsonDoc].
///
/// Strings and raw numbers keep a view of the document's string buffer and
/// produce their `String` lazily, the way the parsed values of `Json.parse` do.
/// Containers hold their children in document order; object members keep
/// duplicate names if the document had them.
public final class JsonVal {

    /// One object member.
    public record Member(JsonVal key, JsonVal value) {}

    private final JsonType type;
    private final NumberKind kind;
    private final int offset;
    private final long bits;
    private final double real;
    private final byte[] buf;
    private final int start;
    private final int length;
    private final List<JsonVal> elements;
    private final List<Member> members;
    private String text;

    private JsonVal(JsonType type, NumberKind kind, int offset, long bits, double real,
                    byte[] buf, int start, int length, List<JsonVal> elements, List<Member> members) {
        this.type = type;
        this.kind = kind;
        this.offset = offset;
        this.bits = bits;
        this.real = real;
        this.buf = buf;
        this.start = start;
        this.length = length;
        this.elements = elements;
        this.members = members;
    }

    static JsonVal ofNull(int offset) {
        return new JsonVal(JsonType.NULL, null, offset, 0, 0, null, 0, 0, null, null);
    }

    static JsonVal ofBool(int offset, boolean value) {
        return new JsonVal(JsonType.BOOL, null, offset, value ? 1 : 0, 0, null, 0, 0, null, null);
    }

    static JsonVal ofUint(int offset, long value) {
        return new JsonVal(JsonType.NUM, NumberKind.UINT, offset, value, 0, null, 0, 0, null, null);
    }

    static JsonVal ofSint(int offset, long value) {
        return new JsonVal(JsonType.NUM, NumberKind.SINT, offset, value, 0, null, 0, 0, null, null);
    }

    static JsonVal ofReal(int offset, double value) {
        return new JsonVal(JsonType.NUM, NumberKind.REAL, offset, 0, value, null, 0, 0, null, null);
    }

    static JsonVal ofString(int offset, byte[] buf, int start, int length) {
        return new JsonVal(JsonType.STR, null, offset, 0, 0, buf, start, length, null, null);
    }

    static JsonVal ofRaw(int offset, byte[] buf, int start, int length) {
        return new JsonVal(JsonType.RAW, null, offset, 0, 0, buf, start, length, null, null);
    }

    static JsonVal ofArray(int offset, List<JsonVal> elements) {
        return new JsonVal(JsonType.ARR, null, offset, 0, 0, null, 0, 0,
                Collections.unmodifiableList(elements), null);
    }

    static JsonVal ofObject(int offset, List<Member> members) {
        return new JsonVal(JsonType.OBJ, null, offset, 0, 0, null, 0, 0,
                null, Collections.unmodifiableList(members));
    }

    /// {@return the type tag}
    public JsonType type() {
        return type;
    }

    /// {@return the numeric subtype, or `null` if this is not a number}
    public NumberKind numberKind() {
        return kind;
    }

    /// {@return the byte offset in the input where this value starts}
    public int offset() {
        return offset;
    }

    public boolean getBool() {
        expect(JsonType.BOOL);
        return bits != 0;
    }

    /// {@return the unsigned 64-bit payload of a [NumberKind#UINT] number}
    public long getUint() {
        expectNumber(NumberKind.UINT);
        return bits;
    }

    public long getSint() {
        expectNumber(NumberKind.SINT);
        return bits;
    }

    public double getReal() {
        expectNumber(NumberKind.REAL);
        return real;
    }

    /// {@return the text of a string or raw node}
    public String getStr() {
        if (type != JsonType.STR && type != JsonType.RAW) {
            throw new IllegalStateException("not a string: " + type);
        }
        if (text == null) {
            text = new String(buf, start, length, StandardCharsets.UTF_8);
        }
        return text;
    }

    /// {@return the element count of an array or the member count of an object, `0` otherwise}
    public int size() {
        if (elements != null) {
            return elements.size();
        }
        return members != null ? members.size() : 0;
    }

    /// {@return the elements of an array, in document order}
    public List<JsonVal> elements() {
        expect(JsonType.ARR);
        return elements;
    }

    /// {@return the members of an object, in document order}
    public List<Member> members() {
        expect(JsonType.OBJ);
        return members;
    }

    private void expect(JsonType wanted) {
        if (type != wanted) {
            throw new IllegalStateException("expected " + wanted + " but was " + type);
        }
    }

    private void expectNumber(NumberKind wanted) {
        if (kind != wanted) {
            throw new IllegalStateException("expected " + wanted + " but was " + (kind == null ? type : kind));
        }
    }

    @Override
    public String toString() {
        return switch (type) {
            case NONE -> "none";
            case NULL -> "null";
            case BOOL -> Boolean.toString(bits != 0);
            case NUM -> switch (kind) {
                case UINT -> Long.toUnsignedString(bits);
                case SINT -> Long.toString(bits);
                case REAL -> Double.toString(real);
            };
            case STR -> "\"" + getStr() + "\"";
            case RAW -> getStr();
            case ARR -> "array[" + elements.size() + "]";
            case OBJ -> "object[" + members.size() + "]";
        };
    }
}
