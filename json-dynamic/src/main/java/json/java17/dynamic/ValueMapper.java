package json.java17.dynamic;

import json.java17.engine.JsonMutDoc;
import json.java17.engine.JsonMutVal;
import json.java17.engine.JsonType;
import json.java17.engine.JsonVal;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Converts between engine JSON trees and [DynamicValue]s.
///
/// ## Decoding
/// JSON arrays become tables keyed `1..n` and objects become tables keyed by
/// member name; for duplicate names the last member wins. JSON `null` is nil, so
/// null members and elements leave no entry, unless `withNull` asks for the null
/// sentinel instead. With `withRef` each table's marker slot records whether it
/// came from an array or an object.
///
/// ## Encoding
/// A table is written as an array or an object according to [#classify]. Array
/// positions are kept exactly: gaps are filled with `null`. Values with no JSON
/// form (opaque host objects, marker tokens, tokens of another registry) produce
/// no node and are skipped inside containers.
///
/// An instance is immutable and can be shared between threads.
public final class ValueMapper {

    private static final Logger LOG = Logger.getLogger(ValueMapper.class.getName());

    /// Largest array position an encoded array can hold.
    static final long MAX_ARRAY_POSITION = Integer.MAX_VALUE - 8;

    private final SentinelRegistry sentinels;
    private final int maxDepth;

    /// Creates a mapper using the configured [DynamicJsonConfig#maxDepth()].
    public ValueMapper(SentinelRegistry sentinels) {
        this(sentinels, DynamicJsonConfig.maxDepth());
    }

    /// @param sentinels the registry whose tokens this mapper recognises
    /// @param maxDepth deepest container nesting to descend into; the root container is depth 1
    public ValueMapper(SentinelRegistry sentinels, int maxDepth) {
        this.sentinels = Objects.requireNonNull(sentinels, "sentinels must not be null");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public SentinelRegistry sentinels() {
        return sentinels;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /// Maps a read tree to a dynamic value.
    ///
    /// Containers are walked with an explicit frame stack, so nesting depth is limited
    /// by [#maxDepth()] and the heap rather than by the thread stack.
    ///
    /// @param root the node to map, `null` for an absent value
    /// @param withNull map JSON `null` to the null sentinel instead of nil
    /// @param withRef record the container kind in each table's marker slot
    /// @return the value; nil for an absent node or a JSON `null` without `withNull`
    /// @throws JsonMappingException with [MappingCode#UNKNOWN_VALUE_TYPE] for a node kind
    ///         that has no dynamic form, or [MappingCode#STACK_EXHAUSTION] when the
    ///         nesting is deeper than [#maxDepth()]
    public DynamicValue toDynamic(JsonVal root, boolean withNull, boolean withRef) {
        if (!isContainer(root)) {
            return decodeScalar(root, withNull);
        }
        final Deque<DecodeFrame> stack = new ArrayDeque<>();
        final var top = openDecode(root, withRef, 1);
        stack.push(top);
        while (!stack.isEmpty()) {
            final var frame = stack.peek();
            final DynamicValue key;
            final JsonVal child;
            if (frame.elements != null && frame.elements.hasNext()) {
                key = DynamicValue.of(++frame.position);
                child = frame.elements.next();
            } else if (frame.members != null && frame.members.hasNext()) {
                final var member = frame.members.next();
                key = DynamicValue.of(member.key().getStr());
                child = member.value();
            } else {
                stack.pop();
                continue;
            }
            if (isContainer(child)) {
                final var nested = openDecode(child, withRef, stack.size() + 1);
                frame.table.put(key, nested.table);
                stack.push(nested);
            } else {
                frame.table.put(key, decodeScalar(child, withNull));
            }
        }
        return top.table;
    }

    private static boolean isContainer(JsonVal val) {
        return val != null && (val.type() == JsonType.ARR || val.type() == JsonType.OBJ);
    }

    private DecodeFrame openDecode(JsonVal val, boolean withRef, int depth) {
        if (depth > maxDepth) {
            LOG.fine(() -> "nesting deeper than " + maxDepth + " at offset " + val.offset());
            throw new JsonMappingException(MappingCode.STACK_EXHAUSTION, "out of stack space");
        }
        final var table = new DynamicTable();
        if (val.type() == JsonType.ARR) {
            if (withRef) {
                table.setMarker(sentinels.asArrayToken());
            }
            return new DecodeFrame(table, val.elements().iterator(), null);
        }
        if (withRef) {
            table.setMarker(sentinels.asObjectToken());
        }
        return new DecodeFrame(table, null, val.members().iterator());
    }

    private DynamicValue decodeScalar(JsonVal val, boolean withNull) {
        if (val == null) {
            return withNull ? sentinels.nullToken() : DynamicValue.nil();
        }
        switch (val.type()) {
            case NULL:
                return withNull ? sentinels.nullToken() : DynamicValue.nil();
            case BOOL:
                return DynamicValue.of(val.getBool());
            case NUM:
                return switch (val.numberKind()) {
                    case UINT -> DynamicValue.ofUnsigned(val.getUint());
                    case SINT -> DynamicValue.of(val.getSint());
                    case REAL -> DynamicValue.of(val.getReal());
                };
            case STR:
                return DynamicValue.of(val.getStr());
            default:
                LOG.finer(() -> "no dynamic form for " + val.type() + " at offset " + val.offset());
                throw new JsonMappingException(MappingCode.UNKNOWN_VALUE_TYPE,
                        "unknown value type " + val.type().tag());
        }
    }

    /// Builds the JSON node for `value` in `doc`.
    ///
    /// Tables are walked with an explicit frame stack. A table reached again through
    /// its own contents is a cycle and is reported like nesting that is too deep.
    ///
    /// @return the node, or `null` when `value` has no JSON form or the document's
    ///         allocator refused storage; the allocator's
    ///         [json.java17.engine.BoundedAllocator#outOfMemory()] flag tells the two apart
    /// @throws JsonMappingException with [MappingCode#STACK_EXHAUSTION] when tables nest
    ///         deeper than [#maxDepth()] or a table contains itself
    public JsonMutVal toJson(DynamicValue value, JsonMutDoc doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (!(value instanceof DynamicTable root)) {
            return encodeScalar(value, doc);
        }
        final Deque<EncodeFrame> stack = new ArrayDeque<>();
        final Set<DynamicTable> path = Collections.newSetFromMap(new IdentityHashMap<>());
        final var top = openEncode(root, doc, 1, path);
        if (top == null) {
            return null;
        }
        stack.push(top);
        while (!stack.isEmpty()) {
            final var frame = stack.peek();
            if (!frame.entries.hasNext()) {
                stack.pop();
                path.remove(frame.table);
                continue;
            }
            final var entry = frame.entries.next();
            if (!frame.accepts(entry.getKey())) {
                continue;
            }
            if (entry.getValue() instanceof DynamicTable nested) {
                final var child = openEncode(nested, doc, stack.size() + 1, path);
                if (child == null || !frame.attach(entry.getKey(), child.node, doc)) {
                    return null;
                }
                stack.push(child);
                continue;
            }
            final var node = encodeScalar(entry.getValue(), doc);
            if (node == null) {
                if (outOfMemory(doc)) {
                    return null;
                }
                continue;
            }
            if (!frame.attach(entry.getKey(), node, doc)) {
                return null;
            }
        }
        return top.node;
    }

    private EncodeFrame openEncode(DynamicTable table, JsonMutDoc doc, int depth, Set<DynamicTable> path) {
        if (depth > maxDepth) {
            LOG.fine(() -> "table nesting deeper than " + maxDepth);
            throw new JsonMappingException(MappingCode.STACK_EXHAUSTION, "out of stack space");
        }
        if (!path.add(table)) {
            LOG.fine(() -> "table contains itself at depth " + depth);
            throw new JsonMappingException(MappingCode.STACK_EXHAUSTION, "out of stack space");
        }
        final var node = classify(table) == ContainerKind.ARRAY ? doc.newArr() : doc.newObj();
        return node != null ? new EncodeFrame(table, node) : null;
    }

    private JsonMutVal encodeScalar(DynamicValue value, JsonMutDoc doc) {
        if (value instanceof DynamicValue.Nil) {
            return doc.newNull();
        }
        if (value instanceof Sentinel) {
            return value == sentinels.nullToken() ? doc.newNull() : null;
        }
        if (value instanceof DynamicValue.Bool b) {
            return doc.newBool(b.value());
        }
        if (value instanceof DynamicValue.Int i) {
            return i.value() > 0 ? doc.newUint(i.value()) : doc.newSint(i.value());
        }
        if (value instanceof DynamicValue.UInt u) {
            return doc.newUint(u.bits());
        }
        if (value instanceof DynamicValue.Real r) {
            return doc.newReal(r.value());
        }
        if (value instanceof DynamicValue.Str s) {
            return doc.newStr(s.value());
        }
        LOG.finer(() -> "no JSON form for " + value);
        return null;
    }

    /// Decides how a table is written:
    /// 1. the as-object token in the marker slot makes it an object;
    /// 2. the as-array token in the marker slot makes it an array;
    /// 3. a value at position `1` makes it an array;
    /// 4. anything else is an object.
    public ContainerKind classify(DynamicTable table) {
        final var marker = table.marker();
        if (marker == sentinels.asObjectToken()) {
            return ContainerKind.OBJECT;
        }
        if (marker == sentinels.asArrayToken()) {
            return ContainerKind.ARRAY;
        }
        return table.arrayLength() > 0 ? ContainerKind.ARRAY : ContainerKind.OBJECT;
    }

    /// A container being filled while decoding; exactly one of the iterators is set.
    private static final class DecodeFrame {
        final DynamicTable table;
        final Iterator<JsonVal> elements;
        final Iterator<JsonVal.Member> members;
        long position;

        DecodeFrame(DynamicTable table, Iterator<JsonVal> elements, Iterator<JsonVal.Member> members) {
            this.table = table;
            this.elements = elements;
            this.members = members;
        }
    }

    /// A table being written into `node`, which is an array or an object node.
    private static final class EncodeFrame {
        final DynamicTable table;
        final JsonMutVal node;
        final Iterator<Map.Entry<DynamicValue, DynamicValue>> entries;
        final boolean array;
        long max;

        EncodeFrame(DynamicTable table, JsonMutVal node) {
            this.table = table;
            this.node = node;
            this.entries = table.entries().iterator();
            this.array = node.type() == JsonType.ARR;
        }

        /// Arrays take positive integer keys, objects take string keys; the marker slot
        /// fits neither.
        boolean accepts(DynamicValue key) {
            if (array) {
                return key instanceof DynamicValue.Int i && i.value() >= 1 && i.value() <= MAX_ARRAY_POSITION;
            }
            return key instanceof DynamicValue.Str;
        }

        /// Adds `child` under `key`. A position past the highest so far is appended after
        /// `null` fillers; a lower position replaces the filler there.
        /// @return `false` when the allocator refused a filler or a member name
        boolean attach(DynamicValue key, JsonMutVal child, JsonMutDoc doc) {
            if (!array) {
                final var name = doc.newStr(((DynamicValue.Str) key).value());
                if (name == null) {
                    return false;
                }
                node.objAdd(name, child);
                return true;
            }
            final long position = ((DynamicValue.Int) key).value();
            if (position <= max) {
                node.arrReplace((int) (position - 1), child);
                return true;
            }
            for (long filler = max + 1; filler < position; filler++) {
                final var gap = doc.newNull();
                if (gap == null) {
                    return false;
                }
                node.arrAppend(gap);
            }
            node.arrAppend(child);
            max = position;
            return true;
        }
    }

    private static boolean outOfMemory(JsonMutDoc doc) {
        return doc.allocator().outOfMemory();
    }
}
