package json.java17.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Mutable node of a [JsonMutDoc].
///
/// Nodes are created through the document so their storage is charged to its
/// allocator; linking nodes into containers costs nothing further.
public final class JsonMutVal {

    /// One object member.
    public record Member(JsonMutVal key, JsonMutVal value) {}

    private final JsonType type;
    private final NumberKind kind;
    private final long bits;
    private final double real;
    private final String str;
    private final List<JsonMutVal> elements;
    private final List<Member> members;

    private JsonMutVal(JsonType type, NumberKind kind, long bits, double real, String str) {
        this.type = type;
        this.kind = kind;
        this.bits = bits;
        this.real = real;
        this.str = str;
        this.elements = type == JsonType.ARR ? new ArrayList<>() : null;
        this.members = type == JsonType.OBJ ? new ArrayList<>() : null;
    }

    static JsonMutVal ofNull() {
        return new JsonMutVal(JsonType.NULL, null, 0, 0, null);
    }

    static JsonMutVal ofBool(boolean value) {
        return new JsonMutVal(JsonType.BOOL, null, value ? 1 : 0, 0, null);
    }

    static JsonMutVal ofUint(long value) {
        return new JsonMutVal(JsonType.NUM, NumberKind.UINT, value, 0, null);
    }

    static JsonMutVal ofSint(long value) {
        return new JsonMutVal(JsonType.NUM, NumberKind.SINT, value, 0, null);
    }

    static JsonMutVal ofReal(double value) {
        return new JsonMutVal(JsonType.NUM, NumberKind.REAL, 0, value, null);
    }

    static JsonMutVal ofStr(String value) {
        return new JsonMutVal(JsonType.STR, null, 0, 0, value);
    }

    static JsonMutVal ofArr() {
        return new JsonMutVal(JsonType.ARR, null, 0, 0, null);
    }

    static JsonMutVal ofObj() {
        return new JsonMutVal(JsonType.OBJ, null, 0, 0, null);
    }

    public JsonType type() {
        return type;
    }

    /// {@return the numeric subtype, or `null` if this is not a number}
    public NumberKind numberKind() {
        return kind;
    }

    public boolean getBool() {
        expect(JsonType.BOOL);
        return bits != 0;
    }

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

    public String getStr() {
        expect(JsonType.STR);
        return str;
    }

    /// {@return the element count of an array or the member count of an object, `0` otherwise}
    public int size() {
        if (elements != null) {
            return elements.size();
        }
        return members != null ? members.size() : 0;
    }

    /// {@return an unmodifiable view of the elements of an array}
    public List<JsonMutVal> elements() {
        expect(JsonType.ARR);
        return Collections.unmodifiableList(elements);
    }

    /// {@return an unmodifiable view of the members of an object}
    public List<Member> members() {
        expect(JsonType.OBJ);
        return Collections.unmodifiableList(members);
    }

    /// Appends `value` to this array.
    public void arrAppend(JsonMutVal value) {
        expect(JsonType.ARR);
        elements.add(Objects.requireNonNull(value, "value must not be null"));
    }

    /// Replaces the element at zero-based `index`.
    /// @return the element that was replaced
    /// @throws IndexOutOfBoundsException if there is no such element
    public JsonMutVal arrReplace(int index, JsonMutVal value) {
        expect(JsonType.ARR);
        return elements.set(index, Objects.requireNonNull(value, "value must not be null"));
    }

    /// Adds a member to this object. Existing members with the same name are kept.
    /// @throws IllegalArgumentException if `key` is not a string node
    public void objAdd(JsonMutVal key, JsonMutVal value) {
        expect(JsonType.OBJ);
        Objects.requireNonNull(key, "key must not be null");
        if (key.type != JsonType.STR) {
            throw new IllegalArgumentException("object key must be a string but was " + key.type);
        }
        members.add(new Member(key, Objects.requireNonNull(value, "value must not be null")));
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
            case STR -> "\"" + str + "\"";
            case RAW -> str;
            case ARR -> "array[" + elements.size() + "]";
            case OBJ -> "object[" + members.size() + "]";
        };
    }
}
