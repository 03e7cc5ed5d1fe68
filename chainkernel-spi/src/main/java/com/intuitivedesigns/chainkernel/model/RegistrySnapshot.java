/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Full registry contents at one point in time.
 *
 * @param configs    every parseable entry
 * @param invalid    source id to parse error, for entries that failed to parse
 * @param cursor     opaque resume token for {@code ConfigStore.watch}
 */
public record RegistrySnapshot(List<SourceConfig> configs, Map<String, String> invalid, String cursor) {

    public RegistrySnapshot {
        configs = List.copyOf(Objects.requireNonNull(configs, "configs"));
        invalid = Map.copyOf(Objects.requireNonNull(invalid, "invalid"));
        Objects.requireNonNull(cursor, "cursor");
    }
}
