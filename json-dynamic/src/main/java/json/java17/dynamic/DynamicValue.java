package json.java17.dynamic;

import java.util.Objects;

/// Value in the dynamic host model that [JsonDynamic] maps to and from JSON.
///
/// Scalars are records and compare by value. [DynamicTable] is the only container:
/// positive integer keys form its array part and string keys its object part.
/// [Sentinel] tokens compare by identity. [Opaque] wraps a host object that has
/// no JSON form, such as a callable.
public sealed interface DynamicValue
        permits DynamicValue.Nil, DynamicValue.Bool, DynamicValue.Int, DynamicValue.UInt,
        DynamicValue.Real, DynamicValue.Str, DynamicValue.Opaque, DynamicTable, Sentinel {

    /// Absence of a value. Storing it in a table removes the key.
    record Nil() implements DynamicValue {
        public static final Nil INSTANCE = new Nil();

        @Override
        public String toString() {
            return "nil";
        }
    }

    record Bool(boolean value) implements DynamicValue {
        public static final Bool TRUE = new Bool(true);
        public static final Bool FALSE = new Bool(false);

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /// Signed 64-bit integer.
    record Int(long value) implements DynamicValue {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /// Unsigned 64-bit integer above [Long#MAX_VALUE], stored in the bits of a `long`.
    ///
    /// Unsigned values that fit a signed long are represented as [Int], so every
    /// integer has exactly one form.
    record UInt(long bits) implements DynamicValue {
        public UInt {
            if (bits >= 0) {
                throw new IllegalArgumentException("unsigned value " + bits + " fits a signed long, use Int");
            }
        }

        @Override
        public String toString() {
            return Long.toUnsignedString(bits);
        }
    }

    record Real(double value) implements DynamicValue {
        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record Str(String value) implements DynamicValue {
        public Str {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    /// Host object without a JSON representation. Encodes to no value.
    record Opaque(Object payload) implements DynamicValue {}

    static DynamicValue nil() {
        return Nil.INSTANCE;
    }

    static DynamicValue of(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static DynamicValue of(long value) {
        return new Int(value);
    }

    /// {@return the unsigned 64-bit value held in the bits of `bits`, as [Int] when it fits}
    static DynamicValue ofUnsigned(long bits) {
        return bits >= 0 ? new Int(bits) : new UInt(bits);
    }

    static DynamicValue of(double value) {
        return new Real(value);
    }

    static DynamicValue of(String value) {
        return new Str(value);
    }

    /// {@return `true` for [Nil]}
    default boolean isNil() {
        return this instanceof Nil;
    }
}
