package json.java17.dynamic;

import java.util.Locale;
import java.util.logging.Logger;

/// Process-wide defaults read once from system properties.
///
/// | Property | Default | Meaning |
/// |---|---|---|
/// | `json.dynamic.max.depth` | `1000` | deepest container nesting the mapper descends into |
/// | `json.dynamic.max.memory` | `0` | byte ceiling of each call, `0` for unlimited |
/// | `json.dynamic.unmappable.as.null` | `true` | encode an unmappable root as JSON `null` |
///
/// Invalid values are logged and replaced by the default.
public final class DynamicJsonConfig {

    private static final Logger LOG = Logger.getLogger(DynamicJsonConfig.class.getName());

    public static final String MAX_DEPTH_PROPERTY = "json.dynamic.max.depth";
    public static final String MAX_MEMORY_PROPERTY = "json.dynamic.max.memory";
    public static final String UNMAPPABLE_AS_NULL_PROPERTY = "json.dynamic.unmappable.as.null";

    public static final int DEFAULT_MAX_DEPTH = 1000;
    public static final long DEFAULT_MAX_MEMORY = 0L;
    public static final boolean DEFAULT_UNMAPPABLE_AS_NULL = true;

    private static final int MAX_DEPTH;
    private static final long MAX_MEMORY;
    private static final boolean UNMAPPABLE_AS_NULL;

    static {
        MAX_DEPTH = (int) positiveLong(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH, Integer.MAX_VALUE, false);
        MAX_MEMORY = positiveLong(MAX_MEMORY_PROPERTY, DEFAULT_MAX_MEMORY, Long.MAX_VALUE, true);
        UNMAPPABLE_AS_NULL = bool(UNMAPPABLE_AS_NULL_PROPERTY, DEFAULT_UNMAPPABLE_AS_NULL);
        LOG.fine(() -> "config: maxDepth=" + MAX_DEPTH + ", maxMemory=" + MAX_MEMORY
                + ", unmappableAsNull=" + UNMAPPABLE_AS_NULL);
    }

    private DynamicJsonConfig() {
        throw new AssertionError("DynamicJsonConfig cannot be instantiated");
    }

    public static int maxDepth() {
        return MAX_DEPTH;
    }

    public static long maxMemory() {
        return MAX_MEMORY;
    }

    public static boolean unmappableAsNull() {
        return UNMAPPABLE_AS_NULL;
    }

    static long positiveLong(String property, long defaultValue, long max, boolean zeroAllowed) {
        final String raw = System.getProperty(property);
        if (raw == null) {
            return defaultValue;
        }
        try {
            final long value = Long.parseLong(raw.trim());
            if (value < 0 || value > max || (value == 0 && !zeroAllowed)) {
                LOG.warning(() -> "Invalid " + property + ": " + raw + ". Using default: " + defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            LOG.warning(() -> "Invalid " + property + ": " + raw + ". Using default: " + defaultValue);
            return defaultValue;
        }
    }

    static boolean bool(String property, boolean defaultValue) {
        final String raw = System.getProperty(property);
        if (raw == null) {
            return defaultValue;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> {
                LOG.warning(() -> "Invalid " + property + ": " + raw + ". Using default: " + defaultValue);
                yield defaultValue;
            }
        };
    }
}
