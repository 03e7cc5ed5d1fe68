/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

import java.util.Locale;

public enum WorkerStatus {
    STARTING,
    RUNNING,
    BACKOFF,
    STOPPED,
    FAILED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
