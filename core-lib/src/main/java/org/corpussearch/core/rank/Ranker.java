package org.corpussearch.core.rank;

import org.corpussearch.core.index.IndexBundle;
import org.corpussearch.core.index.IndexConsistencyException;
import org.corpussearch.core.index.Posting;
import org.corpussearch.core.index.TermEntry;
import org.corpussearch.core.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cosine-similarity ranking over an {@link IndexBundle}.
 *
 * <p>Query terms are weighted {@code (1 + log10(tf)) * log10(N / df)} and the query vector is scaled
 * to unit length. Document weights are divided by the document length while scoring. Terms missing
 * from the index are dropped.</p>
 *
 * <p>The ranker keeps no state between calls and never writes to the index.</p>
 */
public class Ranker {
	private static final Logger logger = LoggerFactory.getLogger(Ranker.class);

	private static final Comparator<RankedDocument> RANK_ORDER =
			Comparator.comparingDouble(RankedDocument::score).reversed()
					.thenComparingInt(RankedDocument::documentId);

	/**
	 * Rank documents against a free-text query.
	 *
	 * @param query free text, may be empty
	 * @param index index to score against
	 * @param topK maximum number of results, {@code >= 0}
	 * @return at most {@code topK} documents with a positive score, best first, ties by ascending id
	 */
	public List<RankedDocument> rank(String query, IndexBundle index, int topK) {
		if (topK < 0) {
			throw new IllegalArgumentException("topK must be non-negative: " + topK);
		}
		if (topK == 0 || index.documentCount() == 0) {
			return Collections.emptyList();
		}

		Map<String, Double> queryWeights = queryVector(query, index);
		if (queryWeights.isEmpty()) {
			logger.debug("Query '{}' matched no indexed terms", query);
			return Collections.emptyList();
		}

		double[] scores = accumulate(queryWeights, index);

		List<RankedDocument> ranked = new ArrayList<>();
		for (int i = 0; i < scores.length; i++) {
			if (scores[i] != 0.0) {
				int documentId = i + 1;
				ranked.add(new RankedDocument(documentId, index.label(documentId), scores[i]));
			}
		}
		ranked.sort(RANK_ORDER);

		logger.debug("Query '{}' scored {} documents", query, ranked.size());
		return ranked.size() > topK ? List.copyOf(ranked.subList(0, topK)) : List.copyOf(ranked);
	}

	/**
	 * Build the unit-length query vector. Empty when no query term has a non-zero weight.
	 */
	Map<String, Double> queryVector(String query, IndexBundle index) {
		Map<String, Integer> counts = Tokenizer.termFrequencies(Tokenizer.tokenize(query));
		int documentCount = index.documentCount();

		Map<String, Double> weights = new LinkedHashMap<>();
		double squaredNorm = 0.0;
		for (Map.Entry<String, Integer> count : counts.entrySet()) {
			TermEntry entry = index.entry(count.getKey());
			if (entry == null) {
				continue;
			}

			int df = entry.documentFrequency();
			if (df <= 0 || df > documentCount) {
				throw new IndexConsistencyException(
						"term '" + count.getKey() + "' has document frequency " + df + " with N=" + documentCount);
			}

			double weight = Tokenizer.logWeight(count.getValue()) * Math.log10((double) documentCount / df);
			weights.put(count.getKey(), weight);
			squaredNorm += weight * weight;
		}

		double norm = Math.sqrt(squaredNorm);
		if (norm == 0.0) {
			return Collections.emptyMap();
		}

		Map<String, Double> normalized = new LinkedHashMap<>();
		for (Map.Entry<String, Double> weight : weights.entrySet()) {
			if (weight.getValue() != 0.0) {
				normalized.put(weight.getKey(), weight.getValue() / norm);
			}
		}
		return normalized;
	}

	private double[] accumulate(Map<String, Double> queryWeights, IndexBundle index) {
		double[] scores = new double[index.documentCount()];

		for (Map.Entry<String, Double> term : queryWeights.entrySet()) {
			double queryWeight = term.getValue();
			for (Posting posting : index.entry(term.getKey()).postings()) {
				int documentId = posting.documentId();
				if (!index.hasDocument(documentId)) {
					throw new IndexConsistencyException(
							"posting for '" + term.getKey() + "' references unknown document " + documentId);
				}

				double length = index.documentLength(documentId);
				if (length == 0.0) {
					continue;
				}
				scores[documentId - 1] += queryWeight * (posting.weight() / length);
			}
		}
		return scores;
	}
}
