package org.corpussearch.core.index;

import java.util.List;

/**
 * Inverted index entry for a single term.
 *
 * <p>Postings are ordered by ascending document id, and each id occurs at most once, so the
 * document frequency is the length of the posting list.</p>
 */
public record TermEntry(List<Posting> postings) {
	public TermEntry {
		postings = List.copyOf(postings);
		if (postings.isEmpty()) {
			throw new IndexConsistencyException("term entry must have at least one posting");
		}
	}

	public int documentFrequency() {
		return postings.size();
	}
}
