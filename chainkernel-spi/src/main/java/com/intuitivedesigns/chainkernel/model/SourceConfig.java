/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

import com.intuitivedesigns.chainkernel.spi.PluginIds;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * One source definition from the registry. Owned by the admin layer; the kernel only reads it.
 *
 * @param id            unique source id (registry key)
 * @param chainType     decoder selector, normalized to lower case
 * @param endpoint      node address (http(s):// polls, ws(s):// subscribes)
 * @param credentialRef optional secret reference ({@code env:NAME} or {@code config:key})
 * @param enabled       whether a worker should run
 * @param startPosition optional {@code latest} or a decimal height
 */
public record SourceConfig(String id,
                           String chainType,
                           String endpoint,
                           String credentialRef,
                           boolean enabled,
                           String startPosition) {

    public static final String LATEST = "latest";

    public SourceConfig {
        id = requireText(id, "id");
        chainType = PluginIds.chainType(requireText(chainType, "chain_type"));
        endpoint = requireText(endpoint, "endpoint");
        credentialRef = blankToNull(credentialRef);
        startPosition = blankToNull(startPosition);
        if (startPosition != null && !LATEST.equalsIgnoreCase(startPosition)) {
            try {
                if (Long.parseLong(startPosition) < 0) {
                    throw new IllegalArgumentException("start_position must be >= 0: " + startPosition);
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("start_position must be 'latest' or a height: " + startPosition);
            }
        }
    }

    public static SourceConfig of(String id, String chainType, String endpoint, boolean enabled) {
        return new SourceConfig(id, chainType, endpoint, null, enabled, null);
    }

    /**
     * @return the configured start height, or empty for "latest".
     */
    public OptionalLong startHeight() {
        if (startPosition == null || LATEST.equalsIgnoreCase(startPosition)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Long.parseLong(startPosition));
    }

    public SourceConfig withEnabled(boolean value) {
        return new SourceConfig(id, chainType, endpoint, credentialRef, value, startPosition);
    }

    public SourceConfig withEndpoint(String value) {
        return new SourceConfig(id, chainType, value, credentialRef, enabled, startPosition);
    }

    private static String requireText(String s, String field) {
        Objects.requireNonNull(s, field);
        String t = s.trim();
        if (t.isEmpty()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return t;
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
