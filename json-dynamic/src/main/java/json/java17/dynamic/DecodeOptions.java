package json.java17.dynamic;

import json.java17.engine.ReadFlag;

/// Options of one [JsonDynamic#decode] call.
///
/// @param withNull decode JSON `null` as [SentinelRegistry#nullToken()] instead of nil
/// @param withRef put [SentinelRegistry#asArrayToken()] or [SentinelRegistry#asObjectToken()]
///                in the marker slot of every decoded table
/// @param maxMemory byte ceiling of the call, `0` for unlimited
/// @param flags [ReadFlag] bits
public record DecodeOptions(boolean withNull, boolean withRef, long maxMemory, int flags) {

    /// {@return options with no sentinels, the configured memory ceiling and strict reading}
    public static DecodeOptions defaults() {
        return new DecodeOptions(false, false, DynamicJsonConfig.maxMemory(), ReadFlag.NOFLAG);
    }

    public DecodeOptions withNullSentinel(boolean enabled) {
        return new DecodeOptions(enabled, withRef, maxMemory, flags);
    }

    public DecodeOptions withRefMarkers(boolean enabled) {
        return new DecodeOptions(withNull, enabled, maxMemory, flags);
    }

    public DecodeOptions withMaxMemory(long bytes) {
        return new DecodeOptions(withNull, withRef, bytes, flags);
    }

    public DecodeOptions withFlags(int readFlags) {
        return new DecodeOptions(withNull, withRef, maxMemory, readFlags);
    }
}
