/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.error;

/**
 * The node answered with a JSON-RPC error object.
 */
public class RpcErrorException extends SourceConnectException {

    private final int code;

    public RpcErrorException(String method, int code, String message) {
        super(method + " failed: [" + code + "] " + message);
        this.code = code;
    }

    public int code() {
        return code;
    }
}
