package json.java17.dynamic;

import json.java17.engine.WriteFlag;

/// Options of one [JsonDynamic#encode] call.
///
/// @param maxMemory byte ceiling of the call, `0` for unlimited
/// @param flags [WriteFlag] bits
/// @param unmappableAsNull write JSON `null` when the value has no JSON form;
///                         when `false` that is an error
public record EncodeOptions(long maxMemory, int flags, boolean unmappableAsNull) {

    /// {@return options with the configured ceiling and policy, writing minified JSON}
    public static EncodeOptions defaults() {
        return new EncodeOptions(DynamicJsonConfig.maxMemory(), WriteFlag.NOFLAG,
                DynamicJsonConfig.unmappableAsNull());
    }

    public EncodeOptions withMaxMemory(long bytes) {
        return new EncodeOptions(bytes, flags, unmappableAsNull);
    }

    public EncodeOptions withFlags(int writeFlags) {
        return new EncodeOptions(maxMemory, writeFlags, unmappableAsNull);
    }

    public EncodeOptions withUnmappableAsNull(boolean enabled) {
        return new EncodeOptions(maxMemory, flags, enabled);
    }
}
