package org.corpussearch.search.model;

import org.corpussearch.core.rank.RankedDocument;

public record SearchResult(
		int documentId,
		String label,
		double score
) {
	public static SearchResult fromRanked(RankedDocument ranked) {
		return new SearchResult(ranked.documentId(), ranked.label(), ranked.score());
	}
}
