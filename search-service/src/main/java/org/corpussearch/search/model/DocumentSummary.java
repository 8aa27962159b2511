package org.corpussearch.search.model;

/**
 * An indexed document as listed by the browse endpoint. A length of zero marks a document that had
 * no indexable tokens.
 */
public record DocumentSummary(
		int documentId,
		String label,
		double length
) {}
