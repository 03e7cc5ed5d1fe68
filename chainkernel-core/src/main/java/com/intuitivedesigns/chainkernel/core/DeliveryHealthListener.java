/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

/**
 * Receives per-source delivery health changes from the {@link Publisher}.
 * Called from the publisher's delivery thread; implementations must only hand the signal off.
 */
@FunctionalInterface
public interface DeliveryHealthListener {

    void onDeliveryHealth(String sourceId, boolean degraded);
}
