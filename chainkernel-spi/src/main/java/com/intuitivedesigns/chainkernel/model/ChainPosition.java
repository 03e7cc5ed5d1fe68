/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

/**
 * Position of one raw record within a source: block height (or slot / sequence) plus index inside it.
 */
public record ChainPosition(long height, int index) implements Comparable<ChainPosition> {

    public ChainPosition {
        if (height < 0) throw new IllegalArgumentException("height must be >= 0");
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
    }

    public static ChainPosition of(long height, int index) {
        return new ChainPosition(height, index);
    }

    public boolean isAfter(ChainPosition other) {
        return other == null || compareTo(other) > 0;
    }

    @Override
    public int compareTo(ChainPosition o) {
        int c = Long.compare(height, o.height);
        return c != 0 ? c : Integer.compare(index, o.index);
    }

    @Override
    public String toString() {
        return height + ":" + index;
    }
}
