package json.java17.engine;

import java.util.Arrays;

/// Outcome of [JsonWriter#write]: the output buffer or an error, never both.
///
/// On success the buffer is still charged to the allocator passed to the writer.
/// The caller copies what it needs with [#toByteArray()] and then releases the
/// buffer through that allocator.
public record WriteResult(Allocation buffer, int length, WriteError error) {

    public WriteResult {
        if ((buffer == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of buffer and error must be present");
        }
    }

    static WriteResult success(Allocation buffer, int length) {
        return new WriteResult(buffer, length, null);
    }

    static WriteResult failure(WriteCode code, String message) {
        return new WriteResult(null, 0, new WriteError(code, message));
    }

    /// {@return `true` when output was produced}
    public boolean isSuccess() {
        return buffer != null;
    }

    /// {@return a copy of the written bytes}
    /// @throws IllegalStateException if the write failed
    public byte[] toByteArray() {
        if (buffer == null) {
            throw new IllegalStateException("write failed: " + error);
        }
        return Arrays.copyOf(buffer.block(), length);
    }
}
