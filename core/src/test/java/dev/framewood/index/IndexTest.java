/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexTest {

    @Test
    void testLabelOrdering() {
        List<IndexLabel> labels = new ArrayList<>(List.of(
                IndexLabel.of("b"), IndexLabel.of(3), IndexLabel.of("a"), IndexLabel.of(-1)));
        labels.sort(null);

        assertThat(labels).containsExactly(
                IndexLabel.of(-1), IndexLabel.of(3), IndexLabel.of("a"), IndexLabel.of("b"));
        assertThat(IndexLabel.of(7)).hasToString("7");
        assertThat(IndexLabel.of("k")).hasToString("k");
    }

    @Test
    void testDuplicates() {
        assertThat(Index.ofLongs(1, 2, 3).hasDuplicates()).isFalse();
        assertThat(Index.ofStrings("a", "b", "a").hasDuplicates()).isTrue();
        assertThat(Index.of(List.of()).hasDuplicates()).isFalse();
    }

    @Test
    void testSortOrder() {
        assertThat(Index.ofLongs(1, 2, 5).sortOrder()).isEqualTo(SortOrder.ASCENDING_INT64);
        assertThat(Index.ofStrings("a", "b").sortOrder()).isEqualTo(SortOrder.ASCENDING_UTF8);
        assertThat(Index.ofLongs(1, 1, 2).sortOrder()).isEqualTo(SortOrder.UNSORTED);
        assertThat(Index.ofLongs(3, 2).sortOrder()).isEqualTo(SortOrder.UNSORTED);
        assertThat(Index.of(IndexLabel.of(1), IndexLabel.of("a")).sortOrder()).isEqualTo(SortOrder.UNSORTED);
        assertThat(Index.range(4).sortOrder()).isEqualTo(SortOrder.ASCENDING_INT64);
    }

    @Test
    void testCachesDoNotAffectEquality() {
        Index queried = Index.ofLongs(1, 2, 3);
        queried.hasDuplicates();
        queried.sortOrder();
        Index fresh = Index.ofLongs(1, 2, 3);

        assertThat(queried).isEqualTo(fresh);
        assertThat(queried.hashCode()).isEqualTo(fresh.hashCode());
        assertThat(Index.range(3)).isEqualTo(Index.ofLongs(0, 1, 2));
    }

    @Test
    void testPositionInSortedIndex() {
        Index index = Index.ofLongs(10, 20, 30, 40);

        assertThat(index.position(IndexLabel.of(30))).hasValue(2);
        assertThat(index.position(IndexLabel.of(25))).isEmpty();
        assertThat(index.position(IndexLabel.of("30"))).isEmpty();
    }

    @Test
    void testPositionInUnsortedIndex() {
        Index index = Index.of(IndexLabel.of("x"), IndexLabel.of(2), IndexLabel.of("x"));

        assertThat(index.position(IndexLabel.of("x"))).hasValue(0);
        assertThat(index.position(IndexLabel.of(2))).hasValue(1);
        assertThat(index.position(IndexLabel.of(3))).isEmpty();
    }

    @Test
    void testPositionMapFirst() {
        Map<IndexLabel, Integer> positions = Index.ofStrings("a", "b", "a", "c").positionMapFirst();

        assertThat(positions).containsOnly(
                Map.entry(IndexLabel.of("a"), 0),
                Map.entry(IndexLabel.of("b"), 1),
                Map.entry(IndexLabel.of("c"), 3));
    }

    @Test
    void testRange() {
        Index index = Index.range(3);

        assertThat(index.labels()).containsExactly(IndexLabel.of(0), IndexLabel.of(1), IndexLabel.of(2));
        assertThat(index.hasDuplicates()).isFalse();
        assertThat(Index.range(0).isEmpty()).isTrue();
        assertThatThrownBy(() -> Index.range(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testLabelsAreImmutable() {
        List<IndexLabel> source = new ArrayList<>(List.of(IndexLabel.of(1)));
        Index index = Index.of(source);
        source.add(IndexLabel.of(2));

        assertThat(index.length()).isEqualTo(1);
        assertThatThrownBy(() -> index.labels().add(IndexLabel.of(3)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
