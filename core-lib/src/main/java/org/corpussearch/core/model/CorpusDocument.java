package org.corpussearch.core.model;

import org.jetbrains.annotations.NotNull;

/**
 * One raw document handed to the indexer: a display label and its already-decoded text.
 */
public record CorpusDocument(
		String label,
		String text
) {
	public CorpusDocument {
		if (label == null) {
			throw new IllegalArgumentException("label must not be null");
		}
		if (text == null) {
			text = "";
		}
	}

	@NotNull
	@Override
	public String toString() {
		return String.format("CorpusDocument{label='%s', chars=%d}", label, text.length());
	}
}
