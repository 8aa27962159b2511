package org.corpussearch.core.index;

import org.corpussearch.core.model.CorpusDocument;
import org.corpussearch.core.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds an {@link IndexBundle} from documents supplied in a caller-defined order.
 *
 * <p>Document ids are assigned sequentially from 1. A builder is single-use: once {@link #build()}
 * has returned, it rejects further documents.</p>
 */
public class InvertedIndexBuilder {
	private static final Logger logger = LoggerFactory.getLogger(InvertedIndexBuilder.class);

	private final Map<String, List<Posting>> postings = new LinkedHashMap<>();
	private final List<String> labels = new ArrayList<>();
	private boolean built;

	/**
	 * Index a complete corpus in one call.
	 */
	public static IndexBundle buildIndex(List<CorpusDocument> documents) {
		if (documents == null) {
			throw new IllegalArgumentException("documents must not be null");
		}

		InvertedIndexBuilder builder = new InvertedIndexBuilder();
		for (CorpusDocument document : documents) {
			builder.addDocument(document.label(), document.text());
		}
		return builder.build();
	}

	/**
	 * Index one document's text and return the id it was assigned.
	 */
	public int addDocument(String label, String text) {
		ensureOpen();

		labels.add(label);
		int documentId = labels.size();

		Map<String, Integer> counts = Tokenizer.termFrequencies(Tokenizer.tokenize(text));
		for (Map.Entry<String, Integer> count : counts.entrySet()) {
			double weight = Tokenizer.logWeight(count.getValue());
			postings.computeIfAbsent(count.getKey(), k -> new ArrayList<>())
					.add(new Posting(documentId, weight));
		}

		logger.debug("Indexed document {} ({}) with {} unique terms", documentId, label, counts.size());
		return documentId;
	}

	/**
	 * Compute document lengths and seal the index.
	 */
	public IndexBundle build() {
		ensureOpen();
		built = true;

		int documentCount = labels.size();
		double[] squaredSums = new double[documentCount];
		Map<String, TermEntry> entries = new LinkedHashMap<>();

		for (Map.Entry<String, List<Posting>> term : postings.entrySet()) {
			for (Posting posting : term.getValue()) {
				squaredSums[posting.documentId() - 1] += posting.weight() * posting.weight();
			}
			entries.put(term.getKey(), new TermEntry(term.getValue()));
		}

		double[] lengths = new double[documentCount];
		for (int i = 0; i < documentCount; i++) {
			lengths[i] = Math.sqrt(squaredSums[i]);
		}

		IndexBundle bundle = new IndexBundle(entries, lengths, labels.toArray(new String[0]));
		logger.info("Built inverted index: {} documents, {} unique terms, {} postings",
				bundle.documentCount(), bundle.termCount(), bundle.postingCount());
		return bundle;
	}

	private void ensureOpen() {
		if (built) {
			throw new IllegalStateException("index has already been built");
		}
	}
}
