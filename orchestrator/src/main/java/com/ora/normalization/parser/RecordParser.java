package com.ora.normalization.parser;

/**
 * Turns one free-text compound identifier into its components.
 * Implementations are pure: no I/O, no shared state, same result for the same input.
 */
public interface RecordParser {

    ParseResult parse(String raw);
}
