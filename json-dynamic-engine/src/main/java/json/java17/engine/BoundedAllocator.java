package json.java17.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Allocation wrapper that enforces a byte ceiling and tracks every live block.
///
/// Live blocks are recorded in an arena indexed by slot number. Each [Allocation]
/// handle names its slot, so [#reallocate] and [#free] look the size up in the
/// arena instead of trusting the caller. The running [#usage()] is always the sum
/// of the sizes of the live records.
///
/// A ceiling of `0` means unlimited. Any request that would take the usage past
/// the ceiling, or overflow it, fails without touching the arena and raises a
/// sticky out-of-memory flag that stays set for the life of the instance.
///
/// An instance serves exactly one decode or encode call and is not thread safe.
/// [#close()] verifies that every block was given back.
public final class BoundedAllocator implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(BoundedAllocator.class.getName());

    private final long maxBytes;
    private final BlockAllocator primitive;
    private final List<Allocation> arena = new ArrayList<>();
    private final Deque<Integer> freeSlots = new ArrayDeque<>();

    private long usage;
    private int live;
    private boolean outOfMemory;
    private boolean closed;

    /// Creates an allocator backed by [BlockAllocator#HEAP].
    /// @param maxBytes the ceiling in bytes, `0` (or negative) for unlimited
    public BoundedAllocator(long maxBytes) {
        this(maxBytes, BlockAllocator.HEAP);
    }

    /// Creates an allocator over the given primitive triple.
    /// @param maxBytes the ceiling in bytes, `0` (or negative) for unlimited
    /// @param primitive the allocator that provides the actual blocks
    public BoundedAllocator(long maxBytes, BlockAllocator primitive) {
        this.maxBytes = Math.max(0L, maxBytes);
        this.primitive = Objects.requireNonNull(primitive, "primitive must not be null");
    }

    /// Allocates a block of `size` bytes.
    /// @return the handle, or `null` when the ceiling or the primitive allocator refuses
    /// @throws IllegalArgumentException if `size` is negative
    public Allocation allocate(int size) {
        ensureOpen();
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        if (exceedsCeiling(usage, size)) {
            return refuse("allocate", size);
        }
        final byte[] block = primitive.allocate(size);
        if (block == null) {
            return refuse("allocate", size);
        }
        final var handle = record(size, block);
        LOG.finest(() -> "allocate " + handle + " usage=" + usage);
        return handle;
    }

    /// Resizes a live block, keeping its leading content.
    ///
    /// On success the old handle is dead and the returned handle takes its place.
    /// On failure the old handle stays live and unchanged.
    /// @return the new handle, or `null` when the ceiling or the primitive allocator refuses
    /// @throws IllegalArgumentException if the handle is not live in this allocator
    public Allocation reallocate(Allocation handle, int newSize) {
        ensureOpen();
        if (newSize < 0) {
            throw new IllegalArgumentException("size must not be negative: " + newSize);
        }
        final var old = liveRecord(handle);
        final long base = usage - old.size();
        if (exceedsCeiling(base, newSize)) {
            return refuse("reallocate", newSize);
        }
        final byte[] block = primitive.reallocate(old.block(), old.size(), newSize);
        if (block == null) {
            return refuse("reallocate", newSize);
        }
        release(old);
        final var moved = record(newSize, block);
        LOG.finest(() -> "reallocate " + old + " -> " + moved + " usage=" + usage);
        return moved;
    }

    /// Releases a live block.
    /// @throws IllegalArgumentException if the handle is not live in this allocator
    public void free(Allocation handle) {
        ensureOpen();
        final var old = liveRecord(handle);
        release(old);
        primitive.free(old.block(), old.size());
        LOG.finest(() -> "free " + old + " usage=" + usage);
    }

    /// {@return the sum of the sizes of all live blocks}
    public long usage() {
        return usage;
    }

    /// {@return the number of live blocks}
    public int liveCount() {
        return live;
    }

    /// {@return the configured ceiling, `0` for unlimited}
    public long maxBytes() {
        return maxBytes;
    }

    /// {@return `true` once any request has been refused}
    public boolean outOfMemory() {
        return outOfMemory;
    }

    /// Tears the allocator down.
    /// @throws IllegalStateException if blocks are still live; that is a bug in the caller
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (usage != 0 || live != 0) {
            LOG.severe(() -> "allocator closed with " + live + " live blocks holding " + usage + " bytes");
            throw new IllegalStateException("allocator leaked " + usage + " bytes in " + live + " blocks");
        }
        LOG.finer(() -> "allocator closed, arena high water mark " + arena.size() + " slots");
    }

    private boolean exceedsCeiling(long base, int size) {
        if (Long.MAX_VALUE - size < base) {
            return true;
        }
        return maxBytes != 0 && base + size > maxBytes;
    }

    private Allocation refuse(String op, int size) {
        outOfMemory = true;
        LOG.fine(() -> op + " of " + size + " bytes refused, usage=" + usage + " max=" + maxBytes);
        return null;
    }

    private Allocation record(int size, byte[] block) {
        final Integer reused = freeSlots.poll();
        final int slot = reused != null ? reused : arena.size();
        final var handle = new Allocation(this, slot, size, block);
        if (reused != null) {
            arena.set(slot, handle);
        } else {
            arena.add(handle);
        }
        usage += size;
        live++;
        return handle;
    }

    private void release(Allocation handle) {
        arena.set(handle.slot(), null);
        freeSlots.push(handle.slot());
        usage -= handle.size();
        live--;
    }

    private Allocation liveRecord(Allocation handle) {
        Objects.requireNonNull(handle, "handle must not be null");
        if (handle.owner() != this) {
            throw new IllegalArgumentException(handle + " belongs to another allocator");
        }
        final var current = arena.get(handle.slot());
        if (current != handle) {
            throw new IllegalArgumentException(handle + " is no longer live");
        }
        return current;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("allocator is closed");
        }
    }

    @Override
    public String toString() {
        return "BoundedAllocator[usage=" + usage + ", max=" + maxBytes + ", live=" + live
                + ", outOfMemory=" + outOfMemory + "]";
    }
}
