/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.groupby;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import dev.framewood.column.Column;
import dev.framewood.frame.Series;
import dev.framewood.index.Alignment;
import dev.framewood.index.AlignmentPlan;
import dev.framewood.index.Index;
import dev.framewood.internal.groupby.DenseInt64Grouper;
import dev.framewood.internal.groupby.GroupByExecutionEvent;
import dev.framewood.internal.groupby.GroupedValues;
import dev.framewood.internal.groupby.HashGrouper;
import dev.framewood.types.DType;
import dev.framewood.types.Scalar;

/**
 * Groups a value series by the values of a key series and reduces each group.
 * <p>
 * Keys and values are first aligned on their index. When both share the same
 * duplicate-free index the rows are used as they are; otherwise both are
 * reindexed onto the union of the two indexes. Groups are emitted in the order
 * their key is first seen.
 * </p>
 * <p>
 * Small-range {@code INT64} keys are grouped with plain arrays indexed by
 * {@code key - min}; all other keys go through a hash map. Both paths produce
 * the same groups in the same order with the same sums.
 * </p>
 */
public final class GroupBy {

    private static final System.Logger LOG = System.getLogger(GroupBy.class.getName());

    private GroupBy() {
    }

    public static Series sum(Series keys, Series values) {
        return sum(keys, values, GroupByOptions.defaults());
    }

    public static Series sum(Series keys, Series values, GroupByOptions options) {
        return aggregate(keys, values, Aggregation.SUM, options);
    }

    /**
     * Aggregates {@code values} per distinct key of {@code keys}. Missing and
     * non-numeric values contribute nothing to their group.
     *
     * @return a series named after the aggregation, indexed by the group labels
     */
    public static Series aggregate(Series keys, Series values, Aggregation aggregation, GroupByOptions options) {
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(aggregation, "aggregation");
        Objects.requireNonNull(options, "options");

        GroupByExecutionEvent event = new GroupByExecutionEvent();
        event.begin();

        List<Scalar> keyValues;
        List<Scalar> valueValues;
        boolean identity = keys.index().equals(values.index()) && !keys.index().hasDuplicates();
        if (identity) {
            keyValues = keys.values();
            valueValues = values.values();
        }
        else {
            AlignmentPlan plan = Alignment.alignUnion(keys.index(), values.index());
            keyValues = keys.column().reindexByPositions(plan.leftPositions()).values();
            valueValues = values.column().reindexByPositions(plan.rightPositions()).values();
        }

        GroupedValues groups = null;
        if (options.denseEnabled()) {
            groups = DenseInt64Grouper.tryGroup(keyValues, valueValues, options.dropna());
        }
        boolean dense = groups != null;
        if (!dense) {
            groups = HashGrouper.group(keyValues, valueValues, options.dropna());
        }

        LOG.log(System.Logger.Level.DEBUG, "{0} over {1} rows: {2} groups via {3} path, identity alignment {4}",
                aggregation, keyValues.size(), groups.groupCount(), dense ? "dense" : "hash", identity);

        Series result = Series.of(aggregation.name().toLowerCase(Locale.ROOT),
                Index.of(groups.labels()), reduce(groups, aggregation));

        event.aggregation = aggregation.name();
        event.rows = keyValues.size();
        event.groups = groups.groupCount();
        event.dense = dense;
        event.identityAlignment = identity;
        event.commit();
        return result;
    }

    private static Column reduce(GroupedValues groups, Aggregation aggregation) {
        int groupCount = groups.groupCount();
        List<Scalar> out = new ArrayList<>(groupCount);
        double[] sums = groups.sums();
        long[] counts = groups.counts();
        switch (aggregation) {
            case SUM -> {
                for (int group = 0; group < groupCount; group++) {
                    out.add(new Scalar.Float64(sums[group]));
                }
                return Column.create(DType.FLOAT64, out);
            }
            case COUNT -> {
                for (int group = 0; group < groupCount; group++) {
                    out.add(new Scalar.Int64(counts[group]));
                }
                return Column.create(DType.INT64, out);
            }
            case MEAN -> {
                for (int group = 0; group < groupCount; group++) {
                    out.add(counts[group] == 0
                            ? Scalar.nan()
                            : new Scalar.Float64(sums[group] / counts[group]));
                }
                return Column.create(DType.FLOAT64, out);
            }
            default -> throw new IllegalArgumentException("Unknown aggregation: " + aggregation);
        }
    }
}
