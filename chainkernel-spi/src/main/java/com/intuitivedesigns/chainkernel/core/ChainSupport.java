/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import java.util.Objects;

/**
 * Everything the kernel needs for one chain type.
 */
public record ChainSupport(ChainDecoder decoder, RpcDialect dialect) {

    public ChainSupport {
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(dialect, "dialect");
        if (!decoder.chainType().equalsIgnoreCase(dialect.chainType())) {
            throw new IllegalArgumentException("Decoder/dialect chain type mismatch: "
                    + decoder.chainType() + " vs " + dialect.chainType());
        }
    }

    public String chainType() {
        return decoder.chainType();
    }
}
