/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

/**
 * Bus acknowledgement for one published event.
 *
 * @param destination bus-specific location, e.g. {@code topic-partition}
 * @param offset      bus-assigned offset, or -1 when the bus has none
 */
public record DeliveryReceipt(String dedupKey, String destination, long offset) {
}
