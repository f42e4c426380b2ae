package json.java17.dynamic;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DynamicTableTest extends DynamicLoggingConfig {

    private static final Logger LOG = Logger.getLogger(DynamicTableTest.class.getName());

    @Test
    void testAssigningNilRemovesKey() {
        LOG.info(() -> "TEST: testAssigningNilRemovesKey");
        final var table = new DynamicTable().set("a", DynamicValue.of(1));
        assertThat(table.containsKey(DynamicValue.of("a"))).isTrue();
        table.set("a", DynamicValue.nil());
        assertThat(table.isEmpty()).isTrue();
        assertThat(table.get("a").isNil()).isTrue();
    }

    @Test
    void testArrayLengthStopsAtFirstHole() {
        LOG.info(() -> "TEST: testArrayLengthStopsAtFirstHole");
        final var table = DynamicTable.of(DynamicValue.of(10), DynamicValue.of(20), DynamicValue.nil(), DynamicValue.of(40));
        assertThat(table.size()).isEqualTo(3);
        assertThat(table.arrayLength()).isEqualTo(2);
        assertThat(table.get(4)).isEqualTo(DynamicValue.of(40));
        assertThat(new DynamicTable().set(2, DynamicValue.of(true)).arrayLength()).isZero();
    }

    @Test
    void testAppendUsesArrayLength() {
        LOG.info(() -> "TEST: testAppendUsesArrayLength");
        final var table = new DynamicTable().append(DynamicValue.of("x")).append(DynamicValue.of("y"));
        assertThat(table.get(1)).isEqualTo(DynamicValue.of("x"));
        assertThat(table.get(2)).isEqualTo(DynamicValue.of("y"));
    }

    @Test
    void testMarkerSlot() {
        LOG.info(() -> "TEST: testMarkerSlot");
        final var registry = SentinelRegistry.create();
        final var table = new DynamicTable().setMarker(registry.asArrayToken());
        assertThat(table.marker()).isSameAs(registry.asArrayToken());
        assertThat(table.get(DynamicTable.MARKER_INDEX)).isSameAs(registry.asArrayToken());
        assertThat(table.arrayLength()).isZero();
        table.setMarker(DynamicValue.nil());
        assertThat(table.marker().isNil()).isTrue();
    }

    @Test
    void testIntegralRealKeysBecomeIntegerKeys() {
        LOG.info(() -> "TEST: testIntegralRealKeysBecomeIntegerKeys");
        final var table = new DynamicTable().put(DynamicValue.of(2.0), DynamicValue.of("two"));
        assertThat(table.get(2)).isEqualTo(DynamicValue.of("two"));
        table.put(DynamicValue.of(2.5), DynamicValue.of("half"));
        assertThat(table.get(DynamicValue.of(2.5))).isEqualTo(DynamicValue.of("half"));
        assertThat(table.size()).isEqualTo(2);
    }

    @Test
    void testInvalidKeys() {
        LOG.info(() -> "TEST: testInvalidKeys");
        final var table = new DynamicTable();
        assertThatThrownBy(() -> table.put(DynamicValue.nil(), DynamicValue.of(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nil");
        assertThatThrownBy(() -> table.put(DynamicValue.of(Double.NaN), DynamicValue.of(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NaN");
        assertThat(table.get(DynamicValue.nil()).isNil()).isTrue();
    }

    @Test
    void testEqualityIgnoresInsertionOrder() {
        LOG.info(() -> "TEST: testEqualityIgnoresInsertionOrder");
        final var a = new DynamicTable().set("x", DynamicValue.of(1)).set("y", DynamicValue.of(2));
        final var b = new DynamicTable().set("y", DynamicValue.of(2)).set("x", DynamicValue.of(1));
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        b.set("z", DynamicValue.of(3));
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void testEntriesFollowInsertionOrder() {
        LOG.info(() -> "TEST: testEntriesFollowInsertionOrder");
        final var table = new DynamicTable().set(5, DynamicValue.of(50)).set(1, DynamicValue.of(10));
        final List<DynamicValue> keys = new ArrayList<>();
        table.entries().forEach(e -> keys.add(e.getKey()));
        assertThat(keys).containsExactly(DynamicValue.of(5), DynamicValue.of(1));
        assertThatThrownBy(() -> table.entries().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testUnsignedValuesHaveOneForm() {
        LOG.info(() -> "TEST: testUnsignedValuesHaveOneForm");
        assertThat(DynamicValue.ofUnsigned(7)).isEqualTo(DynamicValue.of(7));
        assertThat(DynamicValue.ofUnsigned(-1L)).isInstanceOf(DynamicValue.UInt.class);
        assertThat(DynamicValue.ofUnsigned(-1L)).hasToString("18446744073709551615");
        assertThatThrownBy(() -> new DynamicValue.UInt(7)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testToStringShowsSelfReference() {
        LOG.info(() -> "TEST: testToStringShowsSelfReference");
        final var table = new DynamicTable();
        table.set("me", table);
        assertThat(table.toString()).isEqualTo("{[\"me\"]=<self>}");
    }

    @Test
    void testEqualityWithSelfReference() {
        LOG.info(() -> "TEST: testEqualityWithSelfReference");
        final var first = new DynamicTable().set("n", DynamicValue.of(1));
        first.set("me", first);
        final var second = new DynamicTable().set("n", DynamicValue.of(1));
        second.set("me", second);
        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());

        final var plain = new DynamicTable().set("n", DynamicValue.of(1)).set("me", new DynamicTable());
        assertThat(first).isNotEqualTo(plain);
        assertThat(plain).isNotEqualTo(first);
    }
}
