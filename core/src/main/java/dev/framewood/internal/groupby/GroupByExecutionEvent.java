/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.groupby;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;
import jdk.jfr.StackTrace;

/**
 * JFR event emitted for every group-by aggregation.
 */
@Name("dev.framewood.GroupByExecution")
@Label("Group-By Execution")
@Category({"Framewood", "GroupBy"})
@Description("Grouping and aggregation of a value series by a key series")
@StackTrace(false)
public class GroupByExecutionEvent extends Event {

    @Label("Aggregation")
    public String aggregation;

    @Label("Input Rows")
    @Description("Rows after aligning keys and values")
    public long rows;

    @Label("Groups")
    public long groups;

    @Label("Dense")
    @Description("Whether the array-indexed path was used instead of hashing")
    public boolean dense;

    @Label("Identity Alignment")
    @Description("Whether keys and values shared the same index and skipped reindexing")
    public boolean identityAlignment;
}
