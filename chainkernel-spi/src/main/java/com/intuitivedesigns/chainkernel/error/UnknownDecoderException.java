/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.error;

/**
 * No decoder is registered for a chain type. The owning source is marked failed.
 */
public class UnknownDecoderException extends ChainKernelException {

    private final String chainType;

    public UnknownDecoderException(String chainType) {
        super("No decoder registered for chain type '" + chainType + "'");
        this.chainType = chainType;
    }

    public String chainType() {
        return chainType;
    }
}
