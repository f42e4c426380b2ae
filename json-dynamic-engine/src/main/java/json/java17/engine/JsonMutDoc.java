package json.java17.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Mutable document that builds a JSON tree for [JsonWriter].
///
/// Storage is charged to a [BoundedAllocator] the way a pooled C builder would
/// spend it: a fixed header when the document is created, then value slots and
/// string bytes carved out of chunks that double in size as they are used up.
///
/// Every factory method returns `null` when the allocator refuses a chunk. The
/// allocator's sticky [BoundedAllocator#outOfMemory()] flag records the failure.
public final class JsonMutDoc implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(JsonMutDoc.class.getName());

    /// Bytes charged for the document header.
    public static final int DOC_SIZE = 80;

    /// Bytes charged per value slot.
    public static final int VAL_SIZE = 24;

    static final int VAL_POOL_INIT = 0x100;
    static final int VAL_POOL_MAX = 0x10000000 / VAL_SIZE;
    static final int STR_POOL_INIT = 0x100;
    static final int STR_POOL_MAX = 0x10000000;

    private final BoundedAllocator alc;
    private final List<Allocation> chunks = new ArrayList<>();
    private Allocation header;
    private JsonMutVal root;
    private int valChunkSize = VAL_POOL_INIT;
    private int valRemaining;
    private int strChunkSize = STR_POOL_INIT;
    private int strRemaining;
    private int valCount;

    private JsonMutDoc(BoundedAllocator alc, Allocation header) {
        this.alc = alc;
        this.header = header;
    }

    /// Creates an empty document.
    /// @return the document, or `null` when the header cannot be allocated
    public static JsonMutDoc create(BoundedAllocator alc) {
        Objects.requireNonNull(alc, "alc must not be null");
        final var header = alc.allocate(DOC_SIZE);
        if (header == null) {
            LOG.fine(() -> "cannot allocate document header under " + alc);
            return null;
        }
        return new JsonMutDoc(alc, header);
    }

    /// {@return the allocator this document charges}
    public BoundedAllocator allocator() {
        return alc;
    }

    /// {@return the root, or `null` if none was set}
    public JsonMutVal root() {
        return root;
    }

    public void setRoot(JsonMutVal root) {
        this.root = root;
    }

    /// {@return the number of values created in this document}
    public int valCount() {
        return valCount;
    }

    public JsonMutVal newNull() {
        return claimVal() ? JsonMutVal.ofNull() : null;
    }

    public JsonMutVal newBool(boolean value) {
        return claimVal() ? JsonMutVal.ofBool(value) : null;
    }

    /// {@return a number node holding the unsigned 64-bit value `value`}
    public JsonMutVal newUint(long value) {
        return claimVal() ? JsonMutVal.ofUint(value) : null;
    }

    public JsonMutVal newSint(long value) {
        return claimVal() ? JsonMutVal.ofSint(value) : null;
    }

    public JsonMutVal newReal(double value) {
        return claimVal() ? JsonMutVal.ofReal(value) : null;
    }

    /// {@return a string node; its UTF-8 bytes and terminator are charged to the string pool}
    public JsonMutVal newStr(String value) {
        Objects.requireNonNull(value, "value must not be null");
        if (!claimStr(utf8Length(value) + 1)) {
            return null;
        }
        return claimVal() ? JsonMutVal.ofStr(value) : null;
    }

    public JsonMutVal newArr() {
        return claimVal() ? JsonMutVal.ofArr() : null;
    }

    public JsonMutVal newObj() {
        return claimVal() ? JsonMutVal.ofObj() : null;
    }

    /// Returns every chunk and the header to the allocator. Idempotent.
    @Override
    public void close() {
        for (Allocation chunk : chunks) {
            alc.free(chunk);
        }
        chunks.clear();
        if (header != null) {
            alc.free(header);
            header = null;
        }
        root = null;
        LOG.finer(() -> "mutable document freed, " + valCount + " values");
    }

    private boolean claimVal() {
        if (valRemaining == 0) {
            final var chunk = alc.allocate(valChunkSize * VAL_SIZE);
            if (chunk == null) {
                return false;
            }
            chunks.add(chunk);
            valRemaining = valChunkSize;
            LOG.finest(() -> "value chunk of " + valChunkSize + " slots");
            valChunkSize = Math.min(valChunkSize * 2, VAL_POOL_MAX);
        }
        valRemaining--;
        valCount++;
        return true;
    }

    private boolean claimStr(long bytes) {
        if (bytes > Integer.MAX_VALUE) {
            return false;
        }
        if (strRemaining < bytes) {
            final int size = (int) Math.max(strChunkSize, bytes);
            final var chunk = alc.allocate(size);
            if (chunk == null) {
                return false;
            }
            chunks.add(chunk);
            strRemaining = size;
            LOG.finest(() -> "string chunk of " + size + " bytes");
            strChunkSize = Math.min(strChunkSize * 2, STR_POOL_MAX);
        }
        strRemaining -= (int) bytes;
        return true;
    }

    /// {@return the UTF-8 length of `s`; unpaired surrogates count as three bytes}
    static long utf8Length(String s) {
        long n = 0;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c < 0x80) {
                n += 1;
            } else if (c < 0x800) {
                n += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < s.length()
                    && Character.isLowSurrogate(s.charAt(i + 1))) {
                n += 4;
                i++;
            } else {
                n += 3;
            }
        }
        return n;
    }
}
