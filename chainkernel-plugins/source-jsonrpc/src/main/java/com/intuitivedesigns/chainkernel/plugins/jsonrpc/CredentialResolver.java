/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.jsonrpc;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;

import java.util.function.UnaryOperator;

/**
 * Resolves a source's credential reference at connect time.
 *
 * <ul>
 *   <li>{@code env:NAME}: environment variable</li>
 *   <li>{@code config:key}: bootstrap configuration key</li>
 * </ul>
 */
final class CredentialResolver {

    static final String PLACEHOLDER = "${credential}";

    private final KernelConfig config;
    private final UnaryOperator<String> env;

    CredentialResolver(KernelConfig config, UnaryOperator<String> env) {
        this.config = config;
        this.env = env;
    }

    /**
     * @return the secret, or {@code null} when the source has no credential reference
     * @throws SourceConnectException the reference is malformed or names nothing
     */
    String resolve(String ref) throws SourceConnectException {
        if (ref == null) return null;

        final int colon = ref.indexOf(':');
        if (colon <= 0 || colon == ref.length() - 1) {
            throw new SourceConnectException("Malformed credential reference '" + ref + "' (expected env:NAME or config:key)");
        }
        final String scheme = ref.substring(0, colon);
        final String name = ref.substring(colon + 1);

        final String secret = switch (scheme) {
            case "env" -> env.apply(name);
            case "config" -> config.getString(name, null);
            default -> throw new SourceConnectException("Unknown credential scheme '" + scheme + "'");
        };
        if (secret == null || secret.isBlank()) {
            throw new SourceConnectException("Credential reference '" + ref + "' is not set");
        }
        return secret;
    }
}
