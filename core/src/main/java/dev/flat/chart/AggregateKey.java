/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.chart;

/**
 * The key of an aggregate bucket.
 *
 * @param primary the primary dimension value
 * @param breakdown the breakdown dimension value, or null for views without a breakdown
 */
record AggregateKey(Object primary, Object breakdown) {
}
