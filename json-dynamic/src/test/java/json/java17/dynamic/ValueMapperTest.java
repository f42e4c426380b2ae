package json.java17.dynamic;

import json.java17.engine.BoundedAllocator;
import json.java17.engine.JsonMutDoc;
import json.java17.engine.JsonReader;
import json.java17.engine.JsonType;
import json.java17.engine.JsonWriter;
import json.java17.engine.NumberKind;
import json.java17.engine.ReadFlag;
import json.java17.engine.WriteFlag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueMapperTest extends DynamicLoggingConfig {

    private static final Logger LOG = Logger.getLogger(ValueMapperTest.class.getName());

    private final SentinelRegistry sentinels = SentinelRegistry.create();
    private final ValueMapper mapper = new ValueMapper(sentinels, 16);

    private DynamicValue decode(String json, int flags, boolean withNull, boolean withRef) {
        final byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        final var alc = new BoundedAllocator(0);
        try (var doc = JsonReader.read(bytes, bytes.length, flags, alc).doc()) {
            return mapper.toDynamic(doc.root(), withNull, withRef);
        } finally {
            alc.close();
        }
    }

    private String encode(DynamicValue value) {
        final var alc = new BoundedAllocator(0);
        try (var doc = JsonMutDoc.create(alc)) {
            doc.setRoot(mapper.toJson(value, doc));
            final var written = JsonWriter.write(doc, WriteFlag.NOFLAG, alc);
            try {
                return new String(written.toByteArray(), StandardCharsets.UTF_8);
            } finally {
                alc.free(written.buffer());
            }
        } finally {
            alc.close();
        }
    }

    // ========== Decoding ==========

    @Test
    void testDecodeScalars() {
        LOG.info(() -> "TEST: testDecodeScalars");
        final var value = (DynamicTable) decode("[true, 3, -4, 2.5, \"s\", 18446744073709551615]",
                ReadFlag.NOFLAG, false, false);
        assertThat(value.get(1)).isEqualTo(DynamicValue.of(true));
        assertThat(value.get(2)).isEqualTo(DynamicValue.of(3));
        assertThat(value.get(3)).isEqualTo(DynamicValue.of(-4));
        assertThat(value.get(4)).isEqualTo(DynamicValue.of(2.5));
        assertThat(value.get(5)).isEqualTo(DynamicValue.of("s"));
        assertThat(value.get(6)).isEqualTo(new DynamicValue.UInt(-1L));
    }

    @Test
    void testDecodeNullRootAndMissingRoot() {
        LOG.info(() -> "TEST: testDecodeNullRootAndMissingRoot");
        assertThat(decode("null", ReadFlag.NOFLAG, false, false).isNil()).isTrue();
        assertThat(decode("null", ReadFlag.NOFLAG, true, false)).isSameAs(sentinels.nullToken());
        assertThat(mapper.toDynamic(null, false, false).isNil()).isTrue();
        assertThat(mapper.toDynamic(null, true, false)).isSameAs(sentinels.nullToken());
    }

    @Test
    void testNullElementsLeaveHoles() {
        LOG.info(() -> "TEST: testNullElementsLeaveHoles");
        final var holes = (DynamicTable) decode("[1,null,3]", ReadFlag.NOFLAG, false, false);
        assertThat(holes.size()).isEqualTo(2);
        assertThat(holes.get(2).isNil()).isTrue();
        assertThat(holes.get(3)).isEqualTo(DynamicValue.of(3));

        final var kept = (DynamicTable) decode("[1,null,3]", ReadFlag.NOFLAG, true, false);
        assertThat(kept.get(2)).isSameAs(sentinels.nullToken());
    }

    @Test
    void testDuplicateMembersLastOneWins() {
        LOG.info(() -> "TEST: testDuplicateMembersLastOneWins");
        final var table = (DynamicTable) decode("{\"a\":1,\"a\":2}", ReadFlag.NOFLAG, false, false);
        assertThat(table.get("a")).isEqualTo(DynamicValue.of(2));
        final var removed = (DynamicTable) decode("{\"a\":1,\"a\":null}", ReadFlag.NOFLAG, false, false);
        assertThat(removed.isEmpty()).isTrue();
    }

    @Test
    void testRefMarkers() {
        LOG.info(() -> "TEST: testRefMarkers");
        final var table = (DynamicTable) decode("{\"arr\":[],\"obj\":{}}", ReadFlag.NOFLAG, false, true);
        assertThat(table.marker()).isSameAs(sentinels.asObjectToken());
        assertThat(((DynamicTable) table.get("arr")).marker()).isSameAs(sentinels.asArrayToken());
        assertThat(((DynamicTable) table.get("obj")).marker()).isSameAs(sentinels.asObjectToken());
        assertThat(table.get(DynamicTable.MARKER_INDEX)).isSameAs(sentinels.asObjectToken());
    }

    @Test
    void testRawNodesHaveNoDynamicForm() {
        LOG.info(() -> "TEST: testRawNodesHaveNoDynamicForm");
        assertThatThrownBy(() -> decode("[1.5]", ReadFlag.NUMBER_AS_RAW, false, false))
                .isInstanceOfSatisfying(JsonMappingException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("unknown value type " + JsonType.RAW.tag());
                    assertThat(e.code()).isEqualTo(MappingCode.UNKNOWN_VALUE_TYPE);
                });
    }

    @Test
    void testDepthGuard() {
        LOG.info(() -> "TEST: testDepthGuard");
        final var shallow = new ValueMapper(sentinels, 3);
        final byte[] ok = "[[[1]]]".getBytes(StandardCharsets.UTF_8);
        final byte[] deep = "[[[[1]]]]".getBytes(StandardCharsets.UTF_8);
        final var alc = new BoundedAllocator(0);
        try (var doc = JsonReader.read(ok, ok.length, ReadFlag.NOFLAG, alc).doc()) {
            assertThat(shallow.toDynamic(doc.root(), false, false)).isInstanceOf(DynamicTable.class);
        }
        try (var doc = JsonReader.read(deep, deep.length, ReadFlag.NOFLAG, alc).doc()) {
            assertThatThrownBy(() -> shallow.toDynamic(doc.root(), false, false))
                    .isInstanceOf(JsonMappingException.class)
                    .hasMessage("out of stack space");
        }
        alc.close();
    }

    @Test
    void testRejectsNonPositiveDepth() {
        LOG.info(() -> "TEST: testRejectsNonPositiveDepth");
        assertThatThrownBy(() -> new ValueMapper(sentinels, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ========== Classification ==========

    @Test
    void testClassifyPriority() {
        LOG.info(() -> "TEST: testClassifyPriority");
        final var array = DynamicTable.of(DynamicValue.of(1));
        assertThat(mapper.classify(array)).isEqualTo(ContainerKind.ARRAY);
        array.setMarker(sentinels.asObjectToken());
        assertThat(mapper.classify(array)).isEqualTo(ContainerKind.OBJECT);

        final var empty = new DynamicTable();
        assertThat(mapper.classify(empty)).isEqualTo(ContainerKind.OBJECT);
        empty.setMarker(sentinels.asArrayToken());
        assertThat(mapper.classify(empty)).isEqualTo(ContainerKind.ARRAY);

        final var gapped = new DynamicTable().set(2, DynamicValue.of(1));
        assertThat(mapper.classify(gapped)).isEqualTo(ContainerKind.OBJECT);
    }

    @Test
    void testMarkersOfAnotherRegistryAreIgnored() {
        LOG.info(() -> "TEST: testMarkersOfAnotherRegistryAreIgnored");
        final var foreign = SentinelRegistry.create();
        final var table = new DynamicTable().setMarker(foreign.asArrayToken());
        assertThat(mapper.classify(table)).isEqualTo(ContainerKind.OBJECT);
    }

    // ========== Encoding ==========

    @Test
    void testEncodeIntegerSigns() {
        LOG.info(() -> "TEST: testEncodeIntegerSigns");
        final var alc = new BoundedAllocator(0);
        try (var doc = JsonMutDoc.create(alc)) {
            assertThat(mapper.toJson(DynamicValue.of(5), doc).numberKind()).isEqualTo(NumberKind.UINT);
            assertThat(mapper.toJson(DynamicValue.of(0), doc).numberKind()).isEqualTo(NumberKind.SINT);
            assertThat(mapper.toJson(DynamicValue.of(-5), doc).numberKind()).isEqualTo(NumberKind.SINT);
            assertThat(mapper.toJson(DynamicValue.ofUnsigned(-1L), doc).numberKind()).isEqualTo(NumberKind.UINT);
            assertThat(mapper.toJson(DynamicValue.of(0.5), doc).numberKind()).isEqualTo(NumberKind.REAL);
        }
        alc.close();
    }

    @Test
    void testSparseArrayGapsAreFilled() {
        LOG.info(() -> "TEST: testSparseArrayGapsAreFilled");
        final var table = new DynamicTable()
                .set(1, DynamicValue.of(10))
                .set(2, DynamicValue.of(20))
                .set(5, DynamicValue.of(50));
        table.setMarker(sentinels.asArrayToken());
        assertThat(encode(table)).isEqualTo("[10,20,null,null,50]");
    }

    @Test
    void testOutOfOrderKeysLandAtTheirPositions() {
        LOG.info(() -> "TEST: testOutOfOrderKeysLandAtTheirPositions");
        final var table = new DynamicTable()
                .set(5, DynamicValue.of(50))
                .set(1, DynamicValue.of(10))
                .set(2, DynamicValue.of(20));
        assertThat(encode(table)).isEqualTo("[10,20,null,null,50]");
    }

    @Test
    void testArrayIgnoresNonPositiveAndStringKeys() {
        LOG.info(() -> "TEST: testArrayIgnoresNonPositiveAndStringKeys");
        final var table = DynamicTable.of(DynamicValue.of("a"), DynamicValue.of("b"))
                .set(0, DynamicValue.of("zero"))
                .set(-3, DynamicValue.of("neg"))
                .set("name", DynamicValue.of("x"));
        assertThat(encode(table)).isEqualTo("[\"a\",\"b\"]");
    }

    @Test
    void testObjectIgnoresNonStringKeys() {
        LOG.info(() -> "TEST: testObjectIgnoresNonStringKeys");
        final var table = DynamicTable.of(DynamicValue.of(1))
                .set("x", DynamicValue.of(true))
                .setMarker(sentinels.asObjectToken());
        assertThat(encode(table)).isEqualTo("{\"x\":true}");
    }

    @Test
    void testUnrepresentableValuesAreSkipped() {
        LOG.info(() -> "TEST: testUnrepresentableValuesAreSkipped");
        final var foreign = SentinelRegistry.create();
        final var obj = new DynamicTable()
                .set("fn", new DynamicValue.Opaque(new Object()))
                .set("marker", sentinels.asArrayToken())
                .set("foreign", foreign.nullToken())
                .set("ok", sentinels.nullToken());
        assertThat(encode(obj)).isEqualTo("{\"ok\":null}");

        final var arr = DynamicTable.of(DynamicValue.of(1), new DynamicValue.Opaque("x"), DynamicValue.of(3));
        assertThat(encode(arr)).isEqualTo("[1,null,3]");
    }

    @Test
    void testUnrepresentableRootYieldsNoNode() {
        LOG.info(() -> "TEST: testUnrepresentableRootYieldsNoNode");
        final var alc = new BoundedAllocator(0);
        try (var doc = JsonMutDoc.create(alc)) {
            assertThat(mapper.toJson(new DynamicValue.Opaque(Runnable.class), doc)).isNull();
            assertThat(alc.outOfMemory()).isFalse();
        }
        alc.close();
    }

    @Test
    void testAllocationFailureShortCircuits() {
        LOG.info(() -> "TEST: testAllocationFailureShortCircuits");
        final var alc = new BoundedAllocator(200);
        try (var doc = JsonMutDoc.create(alc)) {
            final var table = DynamicTable.of(DynamicValue.of(1), DynamicValue.of(2));
            assertThat(mapper.toJson(table, doc)).isNull();
            assertThat(alc.outOfMemory()).isTrue();
        }
        assertThat(alc.usage()).isZero();
        alc.close();
    }

    @Test
    void testSelfReferenceIsStackExhaustion() {
        LOG.info(() -> "TEST: testSelfReferenceIsStackExhaustion");
        final var table = new DynamicTable();
        table.set(1, table);
        final var alc = new BoundedAllocator(0);
        try (var doc = JsonMutDoc.create(alc)) {
            assertThatThrownBy(() -> mapper.toJson(table, doc))
                    .isInstanceOf(JsonMappingException.class)
                    .hasMessage("out of stack space");
        }
        alc.close();
    }

    @Test
    void testSharedTableIsNotACycle() {
        LOG.info(() -> "TEST: testSharedTableIsNotACycle");
        final var shared = DynamicTable.of(DynamicValue.of(1));
        final var table = DynamicTable.of(shared, shared);
        final var alc = new BoundedAllocator(0);
        try (var doc = JsonMutDoc.create(alc)) {
            final var node = mapper.toJson(table, doc);
            assertThat(node.size()).isEqualTo(2);
            assertThat(node.elements().get(1).size()).isEqualTo(1);
        }
        alc.close();
    }

    @Test
    void testNestingFarBeyondThreadStack() {
        LOG.info(() -> "TEST: testNestingFarBeyondThreadStack");
        final int depth = 200_000;
        final var deep = new ValueMapper(sentinels, Integer.MAX_VALUE);
        DynamicValue value = new DynamicTable();
        for (int i = 1; i < depth; i++) {
            value = DynamicTable.of(value);
        }
        final var alc = new BoundedAllocator(0);
        try (var doc = JsonMutDoc.create(alc)) {
            final var node = deep.toJson(value, doc);
            assertThat(node).isNotNull();
            assertThat(doc.valCount()).isEqualTo(depth);
        }
        alc.close();
    }
}
