/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.error;

/**
 * Transport failure talking to a source endpoint. Retried with bounded backoff.
 */
public class SourceConnectException extends ChainKernelException {

    public SourceConnectException(String message) {
        super(message);
    }

    public SourceConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
