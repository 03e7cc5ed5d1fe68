/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.error;

/**
 * Root of the kernel's checked failures. Subtypes map one-to-one to how a failure is handled.
 */
public class ChainKernelException extends Exception {

    public ChainKernelException(String message) {
        super(message);
    }

    public ChainKernelException(String message, Throwable cause) {
        super(message, cause);
    }
}
