/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.error.DecodeException;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import com.intuitivedesigns.chainkernel.model.RawRecord;

/**
 * Decodes one chain type's raw records. Must be deterministic and free of side effects.
 */
public interface ChainDecoder {

    String chainType();

    NormalizedEvent decode(RawRecord record) throws DecodeException;
}
