/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.error.DecodeException;
import com.intuitivedesigns.chainkernel.error.UnknownDecoderException;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import com.intuitivedesigns.chainkernel.model.RawRecord;
import com.intuitivedesigns.chainkernel.spi.PluginIds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Chain type to decode capability.
 *
 * <p>Populated once through {@link Builder} during bootstrap and immutable afterwards, so lookups need
 * no locking and every worker sees the same set. Chain types are case-insensitive.</p>
 */
public final class DecoderRegistry {

    private final Map<String, ChainDecoder> decoders;
    private final Map<String, RpcDialect> dialects;

    private DecoderRegistry(Map<String, ChainDecoder> decoders, Map<String, RpcDialect> dialects) {
        this.decoders = Collections.unmodifiableMap(new LinkedHashMap<>(decoders));
        this.dialects = Collections.unmodifiableMap(new LinkedHashMap<>(dialects));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Decodes one record with the decoder registered for its chain type.
     *
     * @throws UnknownDecoderException no decoder for {@code record.chainType()}
     * @throws DecodeException         the record is malformed; skip it
     */
    public NormalizedEvent decode(RawRecord record) throws UnknownDecoderException, DecodeException {
        Objects.requireNonNull(record, "record");
        return require(record.chainType()).decode(record);
    }

    public ChainDecoder require(String chainType) throws UnknownDecoderException {
        ChainDecoder decoder = decoders.get(key(chainType));
        if (decoder == null) {
            throw new UnknownDecoderException(chainType);
        }
        return decoder;
    }

    public boolean supports(String chainType) {
        return decoders.containsKey(key(chainType));
    }

    public Optional<RpcDialect> dialect(String chainType) {
        return Optional.ofNullable(dialects.get(key(chainType)));
    }

    public Set<String> chainTypes() {
        return decoders.keySet();
    }

    private static String key(String chainType) {
        return PluginIds.chainType(chainType);
    }

    public static final class Builder {
        private final Map<String, ChainDecoder> decoders = new LinkedHashMap<>();
        private final Map<String, RpcDialect> dialects = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(String chainType, ChainDecoder decoder) {
            Objects.requireNonNull(decoder, "decoder");
            String k = key(chainType);
            if (k.isEmpty()) {
                throw new IllegalArgumentException("chain type must not be blank");
            }
            if (decoders.putIfAbsent(k, decoder) != null) {
                throw new IllegalStateException("Decoder already registered for chain type '" + k + "'");
            }
            return this;
        }

        public Builder register(ChainDecoder decoder) {
            return register(decoder.chainType(), decoder);
        }

        public Builder register(ChainSupport support) {
            register(support.chainType(), support.decoder());
            dialects.put(key(support.chainType()), support.dialect());
            return this;
        }

        public DecoderRegistry build() {
            return new DecoderRegistry(decoders, dialects);
        }
    }
}
