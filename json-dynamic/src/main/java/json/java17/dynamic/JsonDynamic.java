package json.java17.dynamic;

import json.java17.engine.BoundedAllocator;
import json.java17.engine.JsonMutDoc;
import json.java17.engine.JsonReader;
import json.java17.engine.JsonWriter;
import json.java17.engine.ReadCode;
import json.java17.engine.ReadFlag;
import json.java17.engine.WriteCode;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.logging.Logger;

/// Decodes JSON bytes into [DynamicValue]s and encodes them back, each call under
/// its own memory ceiling.
///
/// Every call creates a [BoundedAllocator] that all engine storage is charged to,
/// and closes it before returning, so a call either stays within
/// its ceiling or fails with a memory error and nothing is retained between calls.
/// Failures are returned as results, never thrown.
///
/// ```java
/// final var json = new JsonDynamic();
/// final var decoded = json.decode("{\"a\":[1,2]}");
/// final var table = (DynamicTable) decoded.value();
/// final var encoded = json.encode(table);
/// assert encoded.text().equals("{\"a\":[1,2]}");
/// ```
///
/// An instance is immutable and safe to share between threads.
public final class JsonDynamic {

    private static final Logger LOG = Logger.getLogger(JsonDynamic.class.getName());

    private final SentinelRegistry sentinels;
    private final ValueMapper mapper;

    /// Creates a facade with a fresh [SentinelRegistry].
    public JsonDynamic() {
        this(SentinelRegistry.create());
    }

    public JsonDynamic(SentinelRegistry sentinels) {
        this(new ValueMapper(sentinels));
    }

    public JsonDynamic(ValueMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.sentinels = mapper.sentinels();
    }

    /// {@return the registry whose tokens this facade reads and writes}
    public SentinelRegistry sentinels() {
        return sentinels;
    }

    public DecodeResult decode(String json) {
        Objects.requireNonNull(json, "json must not be null");
        return decode(json.getBytes(StandardCharsets.UTF_8), DecodeOptions.defaults());
    }

    public DecodeResult decode(byte[] input) {
        return decode(input, DecodeOptions.defaults());
    }

    /// Decodes one JSON document.
    ///
    /// With [ReadFlag#INSITU] the last [ReadFlag#PADDING_SIZE] bytes of `input` are
    /// padding, not content, and `input` is overwritten while strings are unescaped.
    /// The consumed length never includes the padding.
    ///
    /// @return the value and the number of bytes consumed, or the error; reader errors
    ///         carry a message of the form `<message> at <offset>`
    public DecodeResult decode(byte[] input, DecodeOptions options) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(options, "options must not be null");
        int length = input.length;
        if (ReadFlag.has(options.flags(), ReadFlag.INSITU)) {
            if (length < ReadFlag.PADDING_SIZE) {
                return DecodeResult.failure("input is shorter than the in-situ padding at 0",
                        ReadCode.INVALID_PARAMETER.code());
            }
            length -= ReadFlag.PADDING_SIZE;
        }
        final int contentLength = length;
        LOG.fine(() -> "decode " + contentLength + " bytes with " + options);

        final var alc = new BoundedAllocator(options.maxMemory());
        try {
            final var read = JsonReader.read(input, contentLength, options.flags(), alc);
            if (!read.isSuccess()) {
                final var error = read.error();
                LOG.fine(() -> "decode failed: " + error);
                return DecodeResult.failure(error.message() + " at " + error.position(), error.code().code());
            }
            try (var doc = read.doc()) {
                final var value = mapper.toDynamic(doc.root(), options.withNull(), options.withRef());
                return DecodeResult.success(value, doc.readSize());
            } catch (JsonMappingException e) {
                LOG.fine(() -> "decode mapping failed: " + e.getMessage());
                return DecodeResult.failure(e.getMessage(), e.code().code());
            }
        } finally {
            alc.close();
        }
    }

    public EncodeResult encode(DynamicValue value) {
        return encode(value, EncodeOptions.defaults());
    }

    /// Encodes a value as one JSON document.
    ///
    /// A memory error wins over everything else: if any allocation was refused
    /// while the tree was built, no output is produced even when a partial tree exists.
    ///
    /// @return the UTF-8 bytes or the error; writer errors are passed through unchanged
    public EncodeResult encode(DynamicValue value, EncodeOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(options, "options must not be null");
        LOG.fine(() -> "encode with " + options);

        final var alc = new BoundedAllocator(options.maxMemory());
        try {
            final var doc = JsonMutDoc.create(alc);
            if (doc == null) {
                return memoryFailure();
            }
            try (doc) {
                var root = mapper.toJson(value, doc);
                if (alc.outOfMemory()) {
                    return memoryFailure();
                }
                if (root == null) {
                    if (!options.unmappableAsNull()) {
                        LOG.fine(() -> "no JSON form for root " + value);
                        return EncodeResult.failure("value has no JSON representation",
                                WriteCode.INVALID_VALUE_TYPE.code());
                    }
                    root = doc.newNull();
                    if (root == null) {
                        return memoryFailure();
                    }
                }
                doc.setRoot(root);

                final var written = JsonWriter.write(doc, options.flags(), alc);
                if (!written.isSuccess()) {
                    final var error = written.error();
                    LOG.fine(() -> "encode failed: " + error);
                    return EncodeResult.failure(error.message(), error.code().code());
                }
                try {
                    return EncodeResult.success(written.toByteArray());
                } finally {
                    alc.free(written.buffer());
                }
            } catch (JsonMappingException e) {
                LOG.fine(() -> "encode mapping failed: " + e.getMessage());
                return EncodeResult.failure(e.getMessage(), e.code().code());
            }
        } finally {
            alc.close();
        }
    }

    private static EncodeResult memoryFailure() {
        LOG.fine(() -> "encode ran out of memory");
        return EncodeResult.failure(EncodeResult.MEMORY_MESSAGE, WriteCode.MEMORY_ALLOCATION.code());
    }
}
