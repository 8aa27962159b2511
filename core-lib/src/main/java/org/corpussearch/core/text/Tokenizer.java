package org.corpussearch.core.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Text normalization shared by indexing and querying.
 *
 * <p>Lower-cases the input, turns every character that is not an ASCII letter, digit or whitespace
 * into a space, and splits on whitespace runs. Documents and queries must go through the same
 * function or their term weights are not comparable.</p>
 */
public final class Tokenizer {
	private static final Pattern NON_TOKEN_CHAR = Pattern.compile("[^a-z0-9\\s]");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private Tokenizer() {}

	/**
	 * Tokenize text into normalized terms, in order of appearance.
	 */
	public static List<String> tokenize(String text) {
		if (text == null || text.isEmpty()) {
			return Collections.emptyList();
		}

		String cleaned = NON_TOKEN_CHAR.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");

		List<String> tokens = new ArrayList<>();
		for (String token : WHITESPACE.split(cleaned)) {
			if (!token.isEmpty()) {
				tokens.add(token);
			}
		}
		return tokens;
	}

	/**
	 * Count raw occurrences per distinct term, keyed in order of first appearance.
	 */
	public static Map<String, Integer> termFrequencies(List<String> tokens) {
		Map<String, Integer> counts = new LinkedHashMap<>();
		for (String token : tokens) {
			counts.merge(token, 1, Integer::sum);
		}
		return counts;
	}

	/**
	 * Log-scaled term frequency, {@code 1 + log10(tf)}.
	 */
	public static double logWeight(int tf) {
		if (tf <= 0) {
			throw new IllegalArgumentException("term frequency must be positive: " + tf);
		}
		return 1 + Math.log10(tf);
	}
}
