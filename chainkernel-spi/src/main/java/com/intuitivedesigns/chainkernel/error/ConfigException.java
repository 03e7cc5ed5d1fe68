/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.error;

/**
 * A source definition failed to parse. That source is skipped; the rest proceed.
 */
public class ConfigException extends ChainKernelException {

    private final String sourceId;

    public ConfigException(String sourceId, String message) {
        super("Invalid source config '" + sourceId + "': " + message);
        this.sourceId = sourceId;
    }

    public String sourceId() {
        return sourceId;
    }
}
