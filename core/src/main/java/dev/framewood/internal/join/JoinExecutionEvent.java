/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.join;

import jdk.jfr.Category;
import jdk.jfr.DataAmount;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;
import jdk.jfr.StackTrace;

/**
 * JFR event emitted for every join, recording the size estimate and which
 * buffer strategy it selected.
 */
@Name("dev.framewood.JoinExecution")
@Label("Join Execution")
@Category({"Framewood", "Join"})
@Description("Execution of a label join or a data frame merge")
@StackTrace(false)
public class JoinExecutionEvent extends Event {

    @Label("Join Type")
    public String joinType;

    @Label("Estimated Rows")
    @Description("Output rows estimated before allocating position buffers")
    public long estimatedRows;

    @Label("Estimated Size")
    @DataAmount
    public long estimatedBytes;

    @Label("Output Rows")
    public long outputRows;

    @Label("Arena")
    @Description("Whether the scoped arena was used instead of heap buffers")
    public boolean arena;
}
