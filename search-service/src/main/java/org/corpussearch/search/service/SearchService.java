package org.corpussearch.search.service;

import org.corpussearch.core.index.IndexBundle;
import org.corpussearch.core.rank.Ranker;
import org.corpussearch.search.model.DocumentSummary;
import org.corpussearch.search.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Query facade over an index built at startup.
 *
 * <p>The index is never modified here, so one instance serves all request threads.</p>
 */
public class SearchService {
	private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

	private final IndexBundle index;
	private final Ranker ranker;
	private final int defaultLimit;
	private final int maxResults;
	private final long buildTimeMs;

	public SearchService(IndexBundle index, int defaultLimit, int maxResults, long buildTimeMs) {
		this.index = index;
		this.ranker = new Ranker();
		this.defaultLimit = defaultLimit;
		this.maxResults = maxResults;
		this.buildTimeMs = buildTimeMs;
	}

	/**
	 * Rank documents for a query. A {@code null} limit means the configured default; any limit is capped
	 * at the configured maximum.
	 */
	public SearchPage search(String query, Integer limit) {
		int resultLimit = resolveLimit(limit);
		logger.debug("Search query: '{}', limit: {}", query, resultLimit);

		List<SearchResult> matches = ranker.rank(query, index, index.documentCount()).stream()
				.map(SearchResult::fromRanked)
				.collect(Collectors.toList());

		List<SearchResult> page = matches.size() > resultLimit
				? List.copyOf(matches.subList(0, resultLimit))
				: matches;
		return new SearchPage(page, matches.size());
	}

	/**
	 * List indexed documents in id order.
	 */
	public List<DocumentSummary> getDocuments(Integer limit) {
		int resultLimit = resolveLimit(limit);
		int count = Math.min(resultLimit, index.documentCount());

		List<DocumentSummary> documents = new ArrayList<>(count);
		for (int id = 1; id <= count; id++) {
			documents.add(new DocumentSummary(id, index.label(id), index.documentLength(id)));
		}
		return documents;
	}

	public SearchStats getStats() {
		int emptyDocuments = 0;
		for (int id = 1; id <= index.documentCount(); id++) {
			if (index.documentLength(id) == 0.0) {
				emptyDocuments++;
			}
		}
		return new SearchStats(index.documentCount(), index.termCount(), index.postingCount(),
				emptyDocuments, buildTimeMs);
	}

	private int resolveLimit(Integer limit) {
		if (limit == null) {
			return defaultLimit;
		}
		if (limit < 0) {
			throw new IllegalArgumentException("limit must not be negative: " + limit);
		}
		return Math.min(limit, maxResults);
	}

	/**
	 * One page of ranked results plus the number of documents that matched at all.
	 */
	public record SearchPage(List<SearchResult> results, int totalMatches) {}

	public record SearchStats(int totalDocuments, int uniqueTerms, long totalPostings,
							  int emptyDocuments, long buildTimeMs) {}
}
