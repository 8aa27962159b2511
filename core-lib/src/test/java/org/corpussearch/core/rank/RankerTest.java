package org.corpussearch.core.rank;

import org.corpussearch.core.index.IndexBundle;
import org.corpussearch.core.index.InvertedIndexBuilder;
import org.corpussearch.core.model.CorpusDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RankerTest {

	private static final List<CorpusDocument> CAT_CORPUS = List.of(
			new CorpusDocument("doc1", "the cat sat"),
			new CorpusDocument("doc2", "the dog sat"),
			new CorpusDocument("doc3", "cat dog cat")
	);

	private Ranker ranker;
	private IndexBundle catIndex;

	@BeforeEach
	public void setUp() {
		ranker = new Ranker();
		catIndex = InvertedIndexBuilder.buildIndex(CAT_CORPUS);
	}

	@Test
	public void testSingleTermQueryPrefersHigherFrequency() {
		List<RankedDocument> results = ranker.rank("cat", catIndex, 10);

		assertEquals(2, results.size());
		assertEquals("doc3", results.get(0).label());
		assertEquals("doc1", results.get(1).label());

		double catWeight = 1 + Math.log10(2);
		assertEquals(catWeight / Math.sqrt(catWeight * catWeight + 1), results.get(0).score(), 1e-12);
		assertEquals(1 / Math.sqrt(3), results.get(1).score(), 1e-12);
		assertTrue(results.get(0).score() > results.get(1).score());
		assertTrue(results.get(1).score() > 0);
	}

	@Test
	public void testMultiTermQueryUsesNormalizedQueryVector() {
		List<RankedDocument> results = ranker.rank("cat dog", catIndex, 10);

		// cat and dog share df=2, so both carry weight 1/sqrt(2) after normalization
		double q = 1 / Math.sqrt(2);
		double catWeight = 1 + Math.log10(2);
		double doc3Length = Math.sqrt(catWeight * catWeight + 1);

		assertEquals(3, results.size());
		assertEquals(3, results.get(0).documentId());
		assertEquals(q * (catWeight + 1) / doc3Length, results.get(0).score(), 1e-12);
		assertEquals(1, results.get(1).documentId());
		assertEquals(2, results.get(2).documentId());
		assertEquals(results.get(1).score(), results.get(2).score(), 0.0);
	}

	@Test
	public void testCaseAndPunctuationInQueryAreNormalized() {
		assertEquals(ranker.rank("cat", catIndex, 10), ranker.rank("  CAT!!! ", catIndex, 10));
	}

	@Test
	public void testUnknownTermsReturnNothing() {
		assertTrue(ranker.rank("zebra", catIndex, 10).isEmpty());
		assertTrue(ranker.rank("", catIndex, 10).isEmpty());
		assertTrue(ranker.rank("?!", catIndex, 10).isEmpty());
		assertTrue(ranker.rank(null, catIndex, 10).isEmpty());
	}

	@Test
	public void testUnknownTermsDoNotAffectKnownOnes() {
		assertEquals(ranker.rank("cat", catIndex, 10), ranker.rank("cat zebra unicorn", catIndex, 10));
	}

	@Test
	public void testUbiquitousTermScoresNothing() {
		IndexBundle index = InvertedIndexBuilder.buildIndex(List.of(
				new CorpusDocument("a", "common alpha"),
				new CorpusDocument("b", "common beta")
		));

		assertTrue(ranker.rank("common", index, 10).isEmpty());

		List<RankedDocument> results = ranker.rank("common beta", index, 10);
		assertEquals(1, results.size());
		assertEquals("b", results.get(0).label());
	}

	@Test
	public void testTopKBounds() {
		assertTrue(ranker.rank("cat", catIndex, 0).isEmpty());
		assertEquals(1, ranker.rank("cat", catIndex, 1).size());
		assertEquals("doc3", ranker.rank("cat", catIndex, 1).get(0).label());
		assertEquals(2, ranker.rank("cat", catIndex, 50).size());
		assertThrows(IllegalArgumentException.class, () -> ranker.rank("cat", catIndex, -1));
	}

	@Test
	public void testTiesBreakByAscendingDocumentId() {
		IndexBundle index = InvertedIndexBuilder.buildIndex(List.of(
				new CorpusDocument("zeta", "apple pie"),
				new CorpusDocument("alpha", "apple pie"),
				new CorpusDocument("mid", "banana bread")
		));

		List<RankedDocument> results = ranker.rank("apple", index, 10);

		assertEquals(2, results.size());
		assertEquals(results.get(0).score(), results.get(1).score(), 0.0);
		assertEquals(1, results.get(0).documentId());
		assertEquals(2, results.get(1).documentId());
	}

	@Test
	public void testResultsAreSortedAndBounded() {
		IndexBundle index = InvertedIndexBuilder.buildIndex(List.of(
				new CorpusDocument("1", "search engines rank documents"),
				new CorpusDocument("2", "documents documents documents"),
				new CorpusDocument("3", "engines of the world"),
				new CorpusDocument("4", "rank and file"),
				new CorpusDocument("5", "search search rank"),
				new CorpusDocument("6", "nothing relevant")
		));

		for (int k = 0; k <= 6; k++) {
			List<RankedDocument> results = ranker.rank("search rank documents engines", index, k);
			assertTrue(results.size() <= k);

			for (int i = 1; i < results.size(); i++) {
				RankedDocument prev = results.get(i - 1);
				RankedDocument cur = results.get(i);
				assertTrue(prev.score() >= cur.score());
				if (prev.score() == cur.score()) {
					assertTrue(prev.documentId() < cur.documentId());
				}
				assertTrue(cur.score() > 0);
			}
		}
	}

	@Test
	public void testSelfQueryRanksOwnDocumentFirst() {
		List<CorpusDocument> corpus = List.of(
				new CorpusDocument("pie", "red apple pie with cinnamon"),
				new CorpusDocument("tart", "green apple tart"),
				new CorpusDocument("sea", "blue sky over the ocean")
		);
		IndexBundle index = InvertedIndexBuilder.buildIndex(corpus);

		for (CorpusDocument document : corpus) {
			List<RankedDocument> results = ranker.rank(document.text(), index, 10);
			assertFalse(results.isEmpty());
			assertEquals(document.label(), results.get(0).label());
		}
	}

	@Test
	public void testEmptyDocumentsAreNeverReturned() {
		IndexBundle index = InvertedIndexBuilder.buildIndex(List.of(
				new CorpusDocument("empty", ""),
				new CorpusDocument("text", "hello world"),
				new CorpusDocument("other", "goodbye moon")
		));

		List<RankedDocument> results = ranker.rank("hello moon", index, 10);

		assertEquals(2, results.size());
		assertTrue(results.stream().noneMatch(r -> r.documentId() == 1));
	}

	@Test
	public void testEmptyCorpusReturnsNothing() {
		IndexBundle empty = InvertedIndexBuilder.buildIndex(List.of());
		assertTrue(ranker.rank("anything at all", empty, 10).isEmpty());
	}

	@Test
	public void testRebuildGivesIdenticalScores() {
		IndexBundle rebuilt = InvertedIndexBuilder.buildIndex(CAT_CORPUS);

		for (String query : List.of("cat", "dog sat", "the cat the dog", "sat sat cat")) {
			assertEquals(ranker.rank(query, catIndex, 10), ranker.rank(query, rebuilt, 10), query);
		}
	}
}
