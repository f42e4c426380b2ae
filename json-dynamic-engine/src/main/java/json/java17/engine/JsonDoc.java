package json.java17.engine;

import java.util.logging.Logger;

/// Immutable document produced by [JsonReader].
///
/// The document owns the storage the reader charged to its allocator: the value
/// pool and, unless the input was read in-situ, the padded copy of the input that
/// strings were unescaped into. [#close()] hands that storage back.
public final class JsonDoc implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(JsonDoc.class.getName());

    private final BoundedAllocator alc;
    private final JsonVal root;
    private final long readSize;
    private final int valCount;
    private Allocation valPool;
    private Allocation strPool;

    JsonDoc(BoundedAllocator alc, JsonVal root, long readSize, int valCount,
            Allocation valPool, Allocation strPool) {
        this.alc = alc;
        this.root = root;
        this.readSize = readSize;
        this.valCount = valCount;
        this.valPool = valPool;
        this.strPool = strPool;
    }

    /// {@return the root value}
    public JsonVal root() {
        return root;
    }

    /// {@return the number of input bytes consumed by the reader}
    public long readSize() {
        return readSize;
    }

    /// {@return the number of values in the document, containers included}
    public int valCount() {
        return valCount;
    }

    /// Returns the document storage to its allocator. Idempotent.
    @Override
    public void close() {
        if (valPool != null) {
            alc.free(valPool);
            valPool = null;
        }
        if (strPool != null) {
            alc.free(strPool);
            strPool = null;
        }
        LOG.finer(() -> "document freed, " + valCount + " values");
    }
}
