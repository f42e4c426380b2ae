package json.java17.dynamic;

/// Outcome of [JsonDynamic#decode].
///
/// On success [#value()] is set, [#errorMessage()] is `null`, [#errorCode()] is `0`
/// and [#consumedLength()] is the number of input bytes the reader consumed.
/// On failure [#value()] is `null` and [#consumedLength()] is `-1`. The code is a
/// [json.java17.engine.ReadCode] or a [MappingCode] number.
public record DecodeResult(DynamicValue value, String errorMessage, int errorCode, long consumedLength) {

    static DecodeResult success(DynamicValue value, long consumedLength) {
        return new DecodeResult(value, null, 0, consumedLength);
    }

    static DecodeResult failure(String message, int code) {
        return new DecodeResult(null, message, code, -1L);
    }

    public boolean isSuccess() {
        return errorMessage == null;
    }
}
