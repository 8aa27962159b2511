package org.corpussearch.core.rank;

/**
 * One ranked hit: the document, its display label and its cosine score.
 */
public record RankedDocument(int documentId, String label, double score) {}
