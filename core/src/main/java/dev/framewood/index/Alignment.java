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

/**
 * Label alignment between two indexes.
 * <p>
 * All modes resolve labels through {@link Index#positionMapFirst()}, so a label
 * repeated on the looked-up side always resolves to its first occurrence.
 * Many-to-many label matching is the business of {@code Joins}, not of alignment.
 * </p>
 */
public final class Alignment {

    private Alignment() {
    }

    public static AlignmentPlan align(Index left, Index right, AlignMode mode) {
        return switch (mode) {
            case INNER -> alignInner(left, right);
            case LEFT -> alignLeft(left, right);
            case RIGHT -> alignRight(left, right);
            case OUTER -> alignUnion(left, right);
        };
    }

    /**
     * Keeps the left rows whose label occurs on the right, in left order.
     */
    public static AlignmentPlan alignInner(Index left, Index right) {
        Map<IndexLabel, Integer> rightFirst = right.positionMapFirst();
        List<IndexLabel> leftLabels = left.labels();

        List<IndexLabel> labels = new ArrayList<>();
        int[] leftPositions = new int[leftLabels.size()];
        int[] rightPositions = new int[leftLabels.size()];
        int count = 0;
        for (int i = 0; i < leftLabels.size(); i++) {
            IndexLabel label = leftLabels.get(i);
            Integer match = rightFirst.get(label);
            if (match != null) {
                labels.add(label);
                leftPositions[count] = i;
                rightPositions[count] = match;
                count++;
            }
        }
        return new AlignmentPlan(Index.wrap(labels), trim(leftPositions, count), trim(rightPositions, count));
    }

    /**
     * Keeps every left row, pairing it with the first right row of the same label if any.
     */
    public static AlignmentPlan alignLeft(Index left, Index right) {
        Map<IndexLabel, Integer> rightFirst = right.positionMapFirst();
        List<IndexLabel> leftLabels = left.labels();

        int[] leftPositions = new int[leftLabels.size()];
        int[] rightPositions = new int[leftLabels.size()];
        for (int i = 0; i < leftLabels.size(); i++) {
            Integer match = rightFirst.get(leftLabels.get(i));
            leftPositions[i] = i;
            rightPositions[i] = match != null ? match : AlignmentPlan.NO_ROW;
        }
        return new AlignmentPlan(left, leftPositions, rightPositions);
    }

    /**
     * Mirror image of {@link #alignLeft(Index, Index)}: every right row is kept.
     */
    public static AlignmentPlan alignRight(Index left, Index right) {
        AlignmentPlan swapped = alignLeft(right, left);
        return new AlignmentPlan(swapped.unionIndex(), swapped.rightPositions(), swapped.leftPositions());
    }

    /**
     * Every left label in order, followed by each right label that does not occur on
     * the left, in right order.
     */
    public static AlignmentPlan alignUnion(Index left, Index right) {
        Map<IndexLabel, Integer> leftFirst = left.positionMapFirst();
        Map<IndexLabel, Integer> rightFirst = right.positionMapFirst();

        List<IndexLabel> labels = new ArrayList<>(left.length() + right.length());
        labels.addAll(left.labels());
        for (IndexLabel label : right.labels()) {
            if (!leftFirst.containsKey(label)) {
                labels.add(label);
            }
        }

        int[] leftPositions = new int[labels.size()];
        int[] rightPositions = new int[labels.size()];
        for (int i = 0; i < labels.size(); i++) {
            IndexLabel label = labels.get(i);
            Integer leftMatch = leftFirst.get(label);
            Integer rightMatch = rightFirst.get(label);
            leftPositions[i] = leftMatch != null ? leftMatch : AlignmentPlan.NO_ROW;
            rightPositions[i] = rightMatch != null ? rightMatch : AlignmentPlan.NO_ROW;
        }
        return new AlignmentPlan(Index.wrap(labels), leftPositions, rightPositions);
    }

    /**
     * Checks that the union index and both position vectors have the same length.
     *
     * @throws InvalidAlignmentException if they do not
     */
    public static void validate(AlignmentPlan plan) {
        int expected = plan.unionIndex().length();
        if (plan.leftPositions().length != expected || plan.rightPositions().length != expected) {
            throw new InvalidAlignmentException("alignment vectors must have equal lengths: union="
                    + expected + ", left=" + plan.leftPositions().length
                    + ", right=" + plan.rightPositions().length);
        }
    }

    private static int[] trim(int[] positions, int count) {
        if (positions.length == count) {
            return positions;
        }
        int[] trimmed = new int[count];
        System.arraycopy(positions, 0, trimmed, 0, count);
        return trimmed;
    }
}
