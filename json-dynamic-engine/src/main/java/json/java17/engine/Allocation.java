package json.java17.engine;

/// Opaque handle to a live block handed out by a [BoundedAllocator].
///
/// The handle carries the arena slot that records its size, so freeing or
/// reallocating never depends on the caller remembering how big the block was.
/// A handle is only meaningful to the allocator that created it.
public final class Allocation {

    private final BoundedAllocator owner;
    private final int slot;
    private final int size;
    private final byte[] block;

    Allocation(BoundedAllocator owner, int slot, int size, byte[] block) {
        this.owner = owner;
        this.slot = slot;
        this.size = size;
        this.block = block;
    }

    /// {@return the number of bytes charged for this block}
    public int size() {
        return size;
    }

    /// {@return the backing bytes} Only the first [#size()] bytes belong to the allocation.
    public byte[] block() {
        return block;
    }

    BoundedAllocator owner() {
        return owner;
    }

    int slot() {
        return slot;
    }

    @Override
    public String toString() {
        return "Allocation[slot=" + slot + ", size=" + size + "]";
    }
}
