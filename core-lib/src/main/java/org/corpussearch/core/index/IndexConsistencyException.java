package org.corpussearch.core.index;

/**
 * Signals that an index violates its construction invariants (for example a document frequency larger
 * than the corpus). Always a bug in index construction, never a result of user input.
 */
public class IndexConsistencyException extends IllegalStateException {
	public IndexConsistencyException(String message) {
		super(message);
	}
}
