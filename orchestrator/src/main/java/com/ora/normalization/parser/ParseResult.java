package com.ora.normalization.parser;

import java.util.Optional;

/**
 * Outcome of parsing one compound identifier. An invalid identifier is a data outcome, not an error.
 */
public sealed interface ParseResult permits ParseResult.Valid, ParseResult.Invalid {

    /**
     * The trimmed input, kept as the audit copy of the identifier.
     */
    String raw();

    boolean isValid();

    static ParseResult valid(String raw, String baseCode, String subCode) {
        return new Valid(raw, baseCode, subCode);
    }

    static ParseResult invalid(String raw, String error) {
        return new Invalid(raw, error);
    }

    /**
     * @param subCode lot number, {@code null} when the identifier is a bare SKU
     */
    record Valid(String raw, String baseCode, String subCode) implements ParseResult {

        public Optional<String> sub() {
            return Optional.ofNullable(subCode);
        }

        @Override
        public boolean isValid() {
            return true;
        }
    }

    record Invalid(String raw, String error) implements ParseResult {

        @Override
        public boolean isValid() {
            return false;
        }
    }
}
