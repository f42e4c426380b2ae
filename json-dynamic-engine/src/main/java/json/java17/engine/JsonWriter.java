package json.java17.engine;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.logging.Logger;

/// Serializes a [JsonMutDoc] into UTF-8 bytes.
///
/// The output buffer is allocated from the caller's [BoundedAllocator], sized from
/// the document's value count and grown by reallocation as needed.
public final class JsonWriter {

    private static final Logger LOG = Logger.getLogger(JsonWriter.class.getName());

    private static final byte[] HEX = "0123456789ABCDEF".getBytes(StandardCharsets.US_ASCII);
    private static final int MIN_BUFFER = 64;

    private final int flags;
    private final BoundedAllocator alc;
    private final int indent;
    private Allocation buf;
    private int len;

    private JsonWriter(int flags, BoundedAllocator alc) {
        this.flags = flags;
        this.alc = alc;
        if (has(WriteFlag.PRETTY_TWO_SPACES)) {
            indent = 2;
        } else if (has(WriteFlag.PRETTY)) {
            indent = 4;
        } else {
            indent = 0;
        }
    }

    /// Writes the document.
    ///
    /// @param doc the document; its root must be set
    /// @param flags [WriteFlag] bits
    /// @param alc the allocator the output buffer is charged to
    /// @return the output buffer and its length, or the error that stopped the writer
    /// @throws NullPointerException if `alc` is `null`
    public static WriteResult write(JsonMutDoc doc, int flags, BoundedAllocator alc) {
        Objects.requireNonNull(alc, "alc must not be null");
        if (doc == null) {
            return WriteResult.failure(WriteCode.INVALID_PARAMETER, "input JSON is NULL");
        }
        if (doc.root() == null) {
            return WriteResult.failure(WriteCode.INVALID_PARAMETER, "input JSON has no root");
        }
        LOG.fine(() -> "write " + doc.valCount() + " values, flags=" + flags);
        final var writer = new JsonWriter(flags, alc);
        try {
            writer.reserve(estimate(doc.valCount(), writer.indent));
            writer.writeValue(doc.root());
            final var out = writer.buf;
            final int length = writer.len;
            LOG.fine(() -> "wrote " + length + " bytes");
            return WriteResult.success(out, length);
        } catch (WriteFailure failure) {
            if (writer.buf != null) {
                alc.free(writer.buf);
            }
            LOG.fine(() -> "write failed: " + failure.getMessage() + " (" + failure.code + ")");
            return WriteResult.failure(failure.code, failure.getMessage());
        }
    }

    /// Writes the document to a file, replacing its content. The output buffer is
    /// released before returning.
    /// @return `null` on success, otherwise the error; file failures are
    ///         [WriteCode#FILE_OPEN] and [WriteCode#FILE_WRITE]
    public static WriteError writeFile(Path path, JsonMutDoc doc, int flags, BoundedAllocator alc) {
        Objects.requireNonNull(path, "path must not be null");
        final var result = write(doc, flags, alc);
        if (!result.isSuccess()) {
            return result.error();
        }
        try {
            final OutputStream out;
            try {
                out = Files.newOutputStream(path);
            } catch (IOException e) {
                LOG.fine(() -> "cannot open " + path + ": " + e);
                return new WriteError(WriteCode.FILE_OPEN, "file opening failed");
            }
            try (out) {
                out.write(result.buffer().block(), 0, result.length());
            } catch (IOException e) {
                LOG.fine(() -> "cannot write " + path + ": " + e);
                return new WriteError(WriteCode.FILE_WRITE, "file writing failed");
            }
            return null;
        } finally {
            alc.free(result.buffer());
        }
    }

    static int estimate(int valCount, int indent) {
        final long perVal = indent == 0 ? 16 : 16 + 2L * indent;
        return (int) Math.min(Math.max(MIN_BUFFER, valCount * perVal + MIN_BUFFER), Integer.MAX_VALUE - 8);
    }

    /// Writes `root` and everything below it, walking containers with an explicit
    /// frame stack so nesting depth is not limited by the thread stack.
    private void writeValue(JsonMutVal root) {
        if (!isContainer(root)) {
            writeScalar(root);
            return;
        }
        final Deque<WriteFrame> stack = new ArrayDeque<>();
        stack.push(open(root, 0));
        while (!stack.isEmpty()) {
            final var frame = stack.peek();
            if (!frame.hasNext()) {
                stack.pop();
                if (!frame.first) {
                    newline(frame.depth);
                }
                put(frame.elements != null ? ']' : '}');
                continue;
            }
            if (!frame.first) {
                put(',');
            }
            frame.first = false;
            newline(frame.depth + 1);
            final JsonMutVal child;
            if (frame.elements != null) {
                child = frame.elements.next();
            } else {
                final var member = frame.members.next();
                writeString(member.key().getStr());
                put(':');
                if (indent > 0) {
                    put(' ');
                }
                child = member.value();
            }
            if (isContainer(child)) {
                stack.push(open(child, frame.depth + 1));
            } else {
                writeScalar(child);
            }
        }
    }

    private static boolean isContainer(JsonMutVal val) {
        return val.type() == JsonType.ARR || val.type() == JsonType.OBJ;
    }

    private WriteFrame open(JsonMutVal val, int depth) {
        if (val.type() == JsonType.ARR) {
            put('[');
            return new WriteFrame(depth, val.elements().iterator(), null);
        }
        put('{');
        return new WriteFrame(depth, null, val.members().iterator());
    }

    private void writeScalar(JsonMutVal val) {
        switch (val.type()) {
            case NULL:
                putAscii("null");
                break;
            case BOOL:
                putAscii(val.getBool() ? "true" : "false");
                break;
            case NUM:
                writeNumber(val);
                break;
            case STR:
                writeString(val.getStr());
                break;
            default:
                throw new WriteFailure(WriteCode.INVALID_VALUE_TYPE, "invalid JSON value type");
        }
    }

    private void newline(int depth) {
        if (indent == 0) {
            return;
        }
        put('\n');
        for (int i = 0; i < depth * indent; i++) {
            put(' ');
        }
    }

    private void writeNumber(JsonMutVal val) {
        switch (val.numberKind()) {
            case UINT:
                putAscii(Long.toUnsignedString(val.getUint()));
                return;
            case SINT:
                putAscii(Long.toString(val.getSint()));
                return;
            default:
                break;
        }
        final double d = val.getReal();
        if (Double.isFinite(d)) {
            putAscii(Double.toString(d));
        } else if (has(WriteFlag.INF_AND_NAN_AS_NULL)) {
            putAscii("null");
        } else if (has(WriteFlag.ALLOW_INF_AND_NAN)) {
            putAscii(Double.isNaN(d) ? "NaN" : d > 0 ? "Infinity" : "-Infinity");
        } else {
            throw new WriteFailure(WriteCode.NAN_OR_INF, "nan or inf number is not allowed");
        }
    }

    private void writeString(String s) {
        put('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"':
                    put('\\');
                    put('"');
                    continue;
                case '\\':
                    put('\\');
                    put('\\');
                    continue;
                case '\b':
                    put('\\');
                    put('b');
                    continue;
                case '\f':
                    put('\\');
                    put('f');
                    continue;
                case '\n':
                    put('\\');
                    put('n');
                    continue;
                case '\r':
                    put('\\');
                    put('r');
                    continue;
                case '\t':
                    put('\\');
                    put('t');
                    continue;
                case '/':
                    if (has(WriteFlag.ESCAPE_SLASHES)) {
                        put('\\');
                    }
                    put('/');
                    continue;
                default:
                    break;
            }
            if (c < 0x20) {
                putEscaped(c);
            } else if (c < 0x80) {
                put(c);
            } else if (Character.isHighSurrogate(c) && i + 1 < s.length()
                    && Character.isLowSurrogate(s.charAt(i + 1))) {
                final char low = s.charAt(++i);
                if (has(WriteFlag.ESCAPE_UNICODE)) {
                    putEscaped(c);
                    putEscaped(low);
                } else {
                    putCodePoint(Character.toCodePoint(c, low));
                }
            } else if (Character.isSurrogate(c)) {
                if (!has(WriteFlag.ALLOW_INVALID_UNICODE)) {
                    throw new WriteFailure(WriteCode.INVALID_STRING, "invalid utf-8 encoding in string");
                }
                if (has(WriteFlag.ESCAPE_UNICODE)) {
                    putEscaped((char) 0xFFFD);
                } else {
                    putCodePoint(0xFFFD);
                }
            } else if (has(WriteFlag.ESCAPE_UNICODE)) {
                putEscaped(c);
            } else {
                putCodePoint(c);
            }
        }
        put('"');
    }

    private void putEscaped(char c) {
        reserve(len + 6);
        final byte[] b = buf.block();
        b[len++] = '\\';
        b[len++] = 'u';
        b[len++] = HEX[(c >> 12) & 0xF];
        b[len++] = HEX[(c >> 8) & 0xF];
        b[len++] = HEX[(c >> 4) & 0xF];
        b[len++] = HEX[c & 0xF];
    }

    private void putCodePoint(int cp) {
        reserve(len + 4);
        final byte[] b = buf.block();
        if (cp < 0x80) {
            b[len++] = (byte) cp;
        } else if (cp < 0x800) {
            b[len++] = (byte) (0xC0 | (cp >> 6));
            b[len++] = (byte) (0x80 | (cp & 0x3F));
        } else if (cp < 0x10000) {
            b[len++] = (byte) (0xE0 | (cp >> 12));
            b[len++] = (byte) (0x80 | ((cp >> 6) & 0x3F));
            b[len++] = (byte) (0x80 | (cp & 0x3F));
        } else {
            b[len++] = (byte) (0xF0 | (cp >> 18));
            b[len++] = (byte) (0x80 | ((cp >> 12) & 0x3F));
            b[len++] = (byte) (0x80 | ((cp >> 6) & 0x3F));
            b[len++] = (byte) (0x80 | (cp & 0x3F));
        }
    }

    private void putAscii(String s) {
        reserve(len + s.length());
        final byte[] b = buf.block();
        for (int i = 0; i < s.length(); i++) {
            b[len++] = (byte) s.charAt(i);
        }
    }

    private void put(char c) {
        reserve(len + 1);
        buf.block()[len++] = (byte) c;
    }

    /// Makes room for `needed` bytes in total, growing the buffer by half again.
    private void reserve(long needed) {
        if (buf != null && needed <= buf.size()) {
            return;
        }
        if (needed > Integer.MAX_VALUE - 8) {
            throw new WriteFailure(WriteCode.MEMORY_ALLOCATION, "memory allocation failed");
        }
        if (buf == null) {
            buf = alc.allocate((int) needed);
            if (buf == null) {
                throw new WriteFailure(WriteCode.MEMORY_ALLOCATION, "memory allocation failed");
            }
            return;
        }
        final long grown = Math.min(Math.max(needed, buf.size() + (buf.size() >> 1)), Integer.MAX_VALUE - 8);
        final var moved = alc.reallocate(buf, (int) grown);
        if (moved == null) {
            throw new WriteFailure(WriteCode.MEMORY_ALLOCATION, "memory allocation failed");
        }
        buf = moved;
    }

    private boolean has(int flag) {
        return WriteFlag.has(flags, flag);
    }

    /// An open container; exactly one of the iterators is set.
    private static final class WriteFrame {
        final int depth;
        final Iterator<JsonMutVal> elements;
        final Iterator<JsonMutVal.Member> members;
        boolean first = true;

        WriteFrame(int depth, Iterator<JsonMutVal> elements, Iterator<JsonMutVal.Member> members) {
            this.depth = depth;
            this.elements = elements;
            this.members = members;
        }

        boolean hasNext() {
            return elements != null ? elements.hasNext() : members.hasNext();
        }
    }

    /// Unwinds the writer to [#write] with the code of the failure.
    private static final class WriteFailure extends RuntimeException {

        private static final long serialVersionUID = 1L;

        final WriteCode code;

        WriteFailure(WriteCode code, String message) {
            super(message, null, false, false);
            this.code = code;
        }
    }
}
