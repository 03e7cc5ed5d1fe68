/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.evm;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Quantity and calldata helpers for the Ethereum JSON-RPC hex encoding.
 */
final class EvmHex {

    static final String SELECTOR_TRANSFER = "a9059cbb";
    static final String SELECTOR_TRANSFER_FROM = "23b872dd";

    private static final int WORD = 64;

    private EvmHex() {}

    static String quantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    /**
     * @throws NumberFormatException if {@code hex} is not a 0x-prefixed quantity
     */
    static BigInteger toBigInteger(String hex) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) {
            throw new NumberFormatException("not a hex quantity: " + hex);
        }
        return new BigInteger(hex.substring(2), 16);
    }

    static long toLong(String hex) {
        return toBigInteger(hex).longValueExact();
    }

    static boolean isEmptyData(String input) {
        return input == null || input.isEmpty() || "0x".equals(input);
    }

    /**
     * 4-byte function selector without prefix, lower-case, or null if the input is too short.
     */
    static String selector(String input) {
        if (input == null || input.length() < 10 || !input.startsWith("0x")) return null;
        return input.substring(2, 10).toLowerCase(Locale.ROOT);
    }

    /**
     * Number of whole 32-byte argument words after the selector.
     */
    static int argumentWords(String input) {
        return (input.length() - 10) / WORD;
    }

    static String word(String input, int index) {
        final int start = 10 + index * WORD;
        return input.substring(start, start + WORD);
    }

    static String addressWord(String input, int index) {
        final String w = word(input, index);
        return "0x" + w.substring(WORD - 40).toLowerCase(Locale.ROOT);
    }

    static BigInteger uintWord(String input, int index) {
        return new BigInteger(word(input, index), 16);
    }
}
