/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

import java.util.Objects;

/**
 * One change observed on the source registry.
 *
 * <p>{@link Type#INVALID} carries an entry whose value could not be parsed into a {@link SourceConfig};
 * the kernel logs it and leaves that source alone.</p>
 */
public record RegistryChange(Type type, String sourceId, SourceConfig config, String error) {

    public enum Type { PUT, DELETE, INVALID }

    public RegistryChange {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sourceId, "sourceId");
        if (type == Type.PUT) Objects.requireNonNull(config, "config");
    }

    public static RegistryChange put(SourceConfig config) {
        return new RegistryChange(Type.PUT, config.id(), config, null);
    }

    public static RegistryChange delete(String sourceId) {
        return new RegistryChange(Type.DELETE, sourceId, null, null);
    }

    public static RegistryChange invalid(String sourceId, String error) {
        return new RegistryChange(Type.INVALID, sourceId, null, error);
    }
}
