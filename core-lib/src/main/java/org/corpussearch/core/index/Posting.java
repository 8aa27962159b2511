package org.corpussearch.core.index;

/**
 * A term occurrence in one document, weighted by {@code 1 + log10(tf)}.
 */
public record Posting(int documentId, double weight) {}
