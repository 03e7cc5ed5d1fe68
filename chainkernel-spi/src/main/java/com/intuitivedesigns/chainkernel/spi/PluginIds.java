/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

import java.util.Locale;

/**
 * Identifier normalization. Plugin ids compare upper-case; chain types travel lower-case
 * (registry values, event payloads, bus headers).
 */
public final class PluginIds {
    private PluginIds() {}

    public static String normalize(String id) {
        return id == null ? "" : id.trim().toUpperCase(Locale.ROOT);
    }

    public static String chainType(String chainType) {
        return chainType == null ? "" : chainType.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean sameId(String a, String b) {
        final String n = normalize(a);
        return !n.isEmpty() && n.equals(normalize(b));
    }
}
