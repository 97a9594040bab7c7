/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.frame;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import dev.framewood.column.ArithmeticOp;
import dev.framewood.column.Column;
import dev.framewood.column.LengthMismatchException;
import dev.framewood.index.Alignment;
import dev.framewood.index.AlignmentPlan;
import dev.framewood.index.Index;
import dev.framewood.index.IndexLabel;
import dev.framewood.join.JoinOptions;
import dev.framewood.join.JoinType;
import dev.framewood.join.JoinedSeries;
import dev.framewood.join.Joins;
import dev.framewood.types.Scalar;

/**
 * A named column with a row index of the same length.
 */
public final class Series {

    private final String name;
    private final Index index;
    private final Column column;

    private Series(String name, Index index, Column column) {
        this.name = name;
        this.index = index;
        this.column = column;
    }

    /**
     * @throws LengthMismatchException if index and column differ in length
     */
    public static Series of(String name, Index index, Column column) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(column, "column");
        if (index.length() != column.length()) {
            throw LengthMismatchException.indexAndColumn(index.length(), column.length());
        }
        return new Series(name, index, column);
    }

    public static Series fromValues(String name, List<IndexLabel> labels, List<? extends Scalar> values) {
        return of(name, Index.of(labels), Column.fromValues(values));
    }

    public String name() {
        return name;
    }

    public Index index() {
        return index;
    }

    public Column column() {
        return column;
    }

    public List<Scalar> values() {
        return column.values();
    }

    public int length() {
        return index.length();
    }

    public Series add(Series other) {
        return arithmetic(other, ArithmeticOp.ADD, ExecutionGuard.PERMISSIVE);
    }

    public Series add(Series other, ExecutionGuard guard) {
        return arithmetic(other, ArithmeticOp.ADD, guard);
    }

    public Series sub(Series other) {
        return arithmetic(other, ArithmeticOp.SUB, ExecutionGuard.PERMISSIVE);
    }

    public Series mul(Series other) {
        return arithmetic(other, ArithmeticOp.MUL, ExecutionGuard.PERMISSIVE);
    }

    public Series div(Series other) {
        return arithmetic(other, ArithmeticOp.DIV, ExecutionGuard.PERMISSIVE);
    }

    /**
     * Aligns both series on the union of their indexes and combines the aligned
     * columns row by row.
     *
     * @throws OperationRejectedException if the guard rejects duplicate labels or
     * the size of the aligned result
     */
    public Series arithmetic(Series other, ArithmeticOp op, ExecutionGuard guard) {
        String operation = "series_" + op.name().toLowerCase(Locale.ROOT);
        if (index.hasDuplicates() || other.index.hasDuplicates()) {
            if (guard.onDuplicateLabels(operation) == GuardDecision.REJECT) {
                throw new OperationRejectedException(operation + ": duplicate index labels rejected");
            }
        }

        AlignmentPlan plan = Alignment.alignUnion(index, other.index);
        Alignment.validate(plan);
        if (guard.onEstimatedRows(operation, plan.length()) == GuardDecision.REJECT) {
            throw new OperationRejectedException(operation + ": aligned result of " + plan.length()
                    + " rows rejected");
        }

        Column left = column.reindexByPositions(plan.leftPositions());
        Column right = other.column.reindexByPositions(plan.rightPositions());
        Column result = left.binaryNumeric(right, op);

        String outName = name.equals(other.name) ? name : name + symbol(op) + other.name;
        return new Series(outName, plan.unionIndex(), result);
    }

    public JoinedSeries join(Series other, JoinType type) {
        return join(other, type, ExecutionGuard.PERMISSIVE);
    }

    /**
     * Joins on index labels after consulting the guard about duplicates and the
     * estimated output size.
     *
     * @throws OperationRejectedException if the guard rejects the join
     */
    public JoinedSeries join(Series other, JoinType type, ExecutionGuard guard) {
        return join(other, type, guard, JoinOptions.defaults());
    }

    /**
     * Joins on index labels with explicit buffer options. The guard sees the exact
     * output size before any position buffer is allocated.
     *
     * @throws OperationRejectedException if the guard rejects the join
     */
    public JoinedSeries join(Series other, JoinType type, ExecutionGuard guard, JoinOptions options) {
        String operation = "series_join_" + type.name().toLowerCase(Locale.ROOT);
        if (index.hasDuplicates() || other.index.hasDuplicates()) {
            if (guard.onDuplicateLabels(operation) == GuardDecision.REJECT) {
                throw new OperationRejectedException(operation + ": duplicate index labels rejected");
            }
        }
        return Joins.joinSeries(this, other, type, options, rows -> Guards.admitRows(guard, operation, rows));
    }

    private static String symbol(ArithmeticOp op) {
        return switch (op) {
            case ADD -> "+";
            case SUB -> "-";
            case MUL -> "*";
            case DIV -> "/";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Series other)) {
            return false;
        }
        return name.equals(other.name) && index.equals(other.index) && column.equals(other.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, index, column);
    }

    @Override
    public String toString() {
        return "Series[name=" + name + ", index=" + index + ", column=" + column + "]";
    }
}
