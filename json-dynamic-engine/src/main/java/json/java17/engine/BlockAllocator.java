package json.java17.engine;

import java.util.Arrays;

/// The primitive allocate/reallocate/free triple that a [BoundedAllocator] wraps.
///
/// Implementations return `null` when a block cannot be provided. They do no
/// bookkeeping of their own; sizes are remembered by the [BoundedAllocator].
public interface BlockAllocator {

    /// {@return a new block of exactly `size` bytes, or `null` if none can be provided}
    byte[] allocate(int size);

    /// {@return a block of `newSize` bytes holding the leading content of `block`, or `null`}
    /// The returned block may or may not be `block` itself.
    byte[] reallocate(byte[] block, int oldSize, int newSize);

    /// Releases a block previously returned by this allocator.
    void free(byte[] block, int size);

    /// Heap-backed blocks. A heap exhaustion is reported as `null` rather than an error.
    BlockAllocator HEAP = new BlockAllocator() {
        @Override
        public byte[] allocate(int size) {
            try {
                return new byte[size];
            } catch (OutOfMemoryError e) {
                return null;
            }
        }

        @Override
        public byte[] reallocate(byte[] block, int oldSize, int newSize) {
            try {
                return Arrays.copyOf(block, newSize);
            } catch (OutOfMemoryError e) {
                return null;
            }
        }

        @Override
        public void free(byte[] block, int size) {
            // reclaimed by the garbage collector
        }

        @Override
        public String toString() {
            return "BlockAllocator.HEAP";
        }
    };
}
