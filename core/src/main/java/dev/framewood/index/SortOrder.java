/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.index;

/**
 * Sort classification of an {@link Index}. The ascending variants require every
 * label to be of the same kind and strictly increasing.
 */
public enum SortOrder {
    UNSORTED,
    ASCENDING_INT64,
    ASCENDING_UTF8
}
