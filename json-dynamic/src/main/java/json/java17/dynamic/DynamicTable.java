package json.java17.dynamic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// The dynamic container: a mutable map from keys to values that serves as both
/// JSON array and JSON object.
///
/// Positive [DynamicValue.Int] keys are array positions, starting at `1`. String
/// keys are object members. [DynamicValue.Nil] is never stored; assigning it
/// removes the key, so arrays may have holes. Real keys with an integral value
/// are stored as integer keys.
///
/// The slot at [#MARKER_INDEX] is the marker slot. It holds a
/// [SentinelRegistry] token saying whether the table is an array or an object.
///
/// Iteration follows insertion order. Equality compares contents only.
public final class DynamicTable implements DynamicValue {

    /// Key of the marker slot, the position just before the first array index.
    public static final long MARKER_INDEX = -1L;

    private static final Int MARKER_KEY = new Int(MARKER_INDEX);

    private final Map<DynamicValue, DynamicValue> entries = new LinkedHashMap<>();

    public DynamicTable() {
    }

    /// {@return a table holding `values` at positions `1..n`; nil values leave holes}
    public static DynamicTable of(DynamicValue... values) {
        final var table = new DynamicTable();
        for (int i = 0; i < values.length; i++) {
            table.set(i + 1L, values[i]);
        }
        return table;
    }

    /// Stores `value` under `key`, or removes `key` when `value` is nil or `null`.
    /// @return this table
    /// @throws IllegalArgumentException if `key` is nil or a NaN real
    public DynamicTable put(DynamicValue key, DynamicValue value) {
        final var normalized = normalizeKey(key);
        if (value == null || value.isNil()) {
            entries.remove(normalized);
        } else {
            entries.put(normalized, value);
        }
        return this;
    }

    public DynamicTable set(long index, DynamicValue value) {
        return put(new Int(index), value);
    }

    public DynamicTable set(String key, DynamicValue value) {
        return put(new Str(key), value);
    }

    /// Stores `value` at the first position past [#arrayLength()].
    public DynamicTable append(DynamicValue value) {
        return set(arrayLength() + 1, value);
    }

    /// {@return the value under `key`, or nil when absent}
    public DynamicValue get(DynamicValue key) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isNil()) {
            return Nil.INSTANCE;
        }
        final var value = entries.get(normalizeKey(key));
        return value != null ? value : Nil.INSTANCE;
    }

    public DynamicValue get(long index) {
        return get(new Int(index));
    }

    public DynamicValue get(String key) {
        return get(new Str(key));
    }

    /// {@return `true` if `key` holds a value}
    public boolean containsKey(DynamicValue key) {
        return !get(key).isNil();
    }

    /// {@return the content of the marker slot, nil when unset}
    public DynamicValue marker() {
        return get(MARKER_KEY);
    }

    /// Sets the marker slot; nil clears it.
    public DynamicTable setMarker(DynamicValue marker) {
        return put(MARKER_KEY, marker);
    }

    /// {@return the largest `n` such that positions `1..n` all hold values}
    public long arrayLength() {
        long n = 0;
        while (entries.containsKey(new Int(n + 1))) {
            n++;
        }
        return n;
    }

    /// {@return the number of keys, the marker slot included}
    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /// {@return an unmodifiable view of the entries in insertion order}
    public Set<Map.Entry<DynamicValue, DynamicValue>> entries() {
        return Collections.unmodifiableMap(entries).entrySet();
    }

    private static DynamicValue normalizeKey(DynamicValue key) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isNil()) {
            throw new IllegalArgumentException("table index is nil");
        }
        if (key instanceof Real r) {
            final double d = r.value();
            if (Double.isNaN(d)) {
                throw new IllegalArgumentException("table index is NaN");
            }
            if (d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63) {
                return new Int((long) d);
            }
        }
        return key;
    }

    /// Compares contents. A value that is the table itself matches only the other
    /// table's own self-reference under the same key; longer cycles are not detected.
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DynamicTable other) || entries.size() != other.entries.size()) {
            return false;
        }
        for (Map.Entry<DynamicValue, DynamicValue> e : entries.entrySet()) {
            final var mine = e.getValue();
            final var theirs = other.entries.get(e.getKey());
            if (mine == this || theirs == other) {
                if (mine != this || theirs != other) {
                    return false;
                }
            } else if (!mine.equals(theirs)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<DynamicValue, DynamicValue> e : entries.entrySet()) {
            h += e.getKey().hashCode() ^ (e.getValue() == this ? 0 : e.getValue().hashCode());
        }
        return h;
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<DynamicValue, DynamicValue> e : entries.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append('[').append(e.getKey()).append("]=");
            sb.append(e.getValue() == this ? "<self>" : String.valueOf(e.getValue()));
        }
        return sb.append('}').toString();
    }
}
