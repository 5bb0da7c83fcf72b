package org.logsim.compiler.frontend.names;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link NameTable}.
 */
public class NameTableTest {

    @Test
    @Tag("unit")
    void testInternReturnsInsertionIndexAndIsIdempotent() {
        NameTable names = new NameTable();

        int first = names.intern("DEVICES");
        int second = names.intern("sw1");
        int again = names.intern("DEVICES");

        assertThat(first).isZero();
        assertThat(second).isEqualTo(1);
        assertThat(again).isEqualTo(first);
        assertThat(names.size()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testInternAllPreservesOrder() {
        NameTable names = new NameTable();
        names.intern("b");

        List<Integer> ids = names.internAll(List.of("a", "b", "c"));

        assertThat(ids).containsExactly(1, 0, 2);
    }

    @Test
    @Tag("unit")
    void testQueryDoesNotInsert() {
        NameTable names = new NameTable();
        names.intern("known");

        assertThat(names.query("known")).contains(0);
        assertThat(names.query("unknown")).isEmpty();
        assertThat(names.size()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testResolveOutOfRangeIsEmpty() {
        NameTable names = new NameTable();
        names.intern("g1");

        assertThat(names.resolve(0)).contains("g1");
        assertThat(names.resolve(1)).isEmpty();
        assertThat(names.resolve(-1)).isEmpty();
    }

    /**
     * Codes minted over several calls are never handed out twice, and minting does not touch the names.
     */
    @Test
    @Tag("unit")
    void testAllocateMintsFreshCodes() {
        NameTable names = new NameTable();

        List<Integer> first = names.allocate(3);
        List<Integer> second = names.allocate(2);
        List<Integer> none = names.allocate(0);

        Set<Integer> all = new HashSet<>(first);
        all.addAll(second);
        assertThat(first).hasSize(3);
        assertThat(second).hasSize(2);
        assertThat(none).isEmpty();
        assertThat(all).hasSize(5);
        assertThat(names.size()).isZero();
    }

    @Test
    @Tag("unit")
    void testAllocateRejectsNegativeCount() {
        NameTable names = new NameTable();

        assertThatThrownBy(() -> names.allocate(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
