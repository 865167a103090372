package com.example.sgkdocumentreader.model;

/**
 * One re-encode of the page image during the size search. Index 0 is the
 * initial high-quality pass.
 */
public record CompressionAttempt(int index, float quality, int width, long sizeBytes) {
}
