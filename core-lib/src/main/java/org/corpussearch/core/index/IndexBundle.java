package org.corpussearch.core.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable result of index construction: term postings, per-document vector lengths, document labels
 * and the corpus size.
 *
 * <p>Document ids are dense, {@code 1..N}. Instances are created only by {@link InvertedIndexBuilder}
 * and expose no mutators, so a bundle can be shared between query threads without locking.</p>
 */
public final class IndexBundle {
	private final Map<String, TermEntry> terms;
	private final double[] documentLengths;
	private final String[] labels;
	private final int documentCount;

	IndexBundle(Map<String, TermEntry> terms, double[] documentLengths, String[] labels) {
		if (documentLengths.length != labels.length) {
			throw new IndexConsistencyException("length table and label table differ in size");
		}
		this.terms = Collections.unmodifiableMap(new LinkedHashMap<>(terms));
		this.documentLengths = documentLengths.clone();
		this.labels = labels.clone();
		this.documentCount = labels.length;
	}

	/**
	 * Corpus size N.
	 */
	public int documentCount() {
		return documentCount;
	}

	public int termCount() {
		return terms.size();
	}

	/**
	 * Total number of postings across all terms.
	 */
	public long postingCount() {
		long total = 0;
		for (TermEntry entry : terms.values()) {
			total += entry.documentFrequency();
		}
		return total;
	}

	/**
	 * @return the entry for a normalized term, or {@code null} when the term never occurred
	 */
	public TermEntry entry(String term) {
		return terms.get(term);
	}

	public boolean contains(String term) {
		return terms.containsKey(term);
	}

	public Set<String> terms() {
		return terms.keySet();
	}

	public String label(int documentId) {
		return labels[slot(documentId)];
	}

	/**
	 * Euclidean length of the document's log-tf vector; {@code 0} for a document without tokens.
	 */
	public double documentLength(int documentId) {
		return documentLengths[slot(documentId)];
	}

	public boolean hasDocument(int documentId) {
		return documentId >= 1 && documentId <= documentCount;
	}

	private int slot(int documentId) {
		if (!hasDocument(documentId)) {
			throw new IllegalArgumentException(
					"document id " + documentId + " outside 1.." + documentCount);
		}
		return documentId - 1;
	}
}
