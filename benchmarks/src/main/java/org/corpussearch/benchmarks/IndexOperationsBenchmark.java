package org.corpussearch.benchmarks;

import org.corpussearch.core.index.IndexBundle;
import org.corpussearch.core.index.InvertedIndexBuilder;
import org.corpussearch.core.model.CorpusDocument;
import org.corpussearch.core.rank.RankedDocument;
import org.corpussearch.core.rank.Ranker;
import org.corpussearch.core.text.Tokenizer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for index construction and query ranking
 * over a synthetic corpus with a skewed vocabulary.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class IndexOperationsBenchmark {

	private static final int VOCABULARY_SIZE = 5000;
	private static final int WORDS_PER_DOCUMENT = 300;

	private List<CorpusDocument> corpus;
	private IndexBundle index;
	private Ranker ranker;

	private String shortQuery;
	private String longQuery;

	@Param({"100", "1000", "5000"})
	private int corpusSize;

	@Setup(Level.Trial)
	public void setup() {
		Random random = new Random(42);
		corpus = new ArrayList<>(corpusSize);
		for (int i = 0; i < corpusSize; i++) {
			corpus.add(new CorpusDocument("doc-" + i, randomText(random, WORDS_PER_DOCUMENT)));
		}

		index = InvertedIndexBuilder.buildIndex(corpus);
		ranker = new Ranker();

		shortQuery = randomText(random, 2);
		longQuery = randomText(random, 20);

		System.out.println("Index ready: " + index.termCount() + " unique terms, "
				+ index.postingCount() + " postings");
	}

	/**
	 * Zipf-like word choice so a few terms are common and most are rare.
	 */
	private static String randomText(Random random, int words) {
		StringBuilder text = new StringBuilder();
		for (int i = 0; i < words; i++) {
			int rank = (int) Math.floor(Math.pow(VOCABULARY_SIZE, random.nextDouble()));
			text.append("term").append(rank).append(' ');
		}
		return text.toString();
	}

	@Benchmark
	public void buildIndex(Blackhole blackhole) {
		blackhole.consume(InvertedIndexBuilder.buildIndex(corpus));
	}

	@Benchmark
	public void tokenizeDocument(Blackhole blackhole) {
		blackhole.consume(Tokenizer.tokenize(corpus.get(0).text()));
	}

	@Benchmark
	public void rankShortQuery(Blackhole blackhole) {
		List<RankedDocument> results = ranker.rank(shortQuery, index, 10);
		blackhole.consume(results);
	}

	@Benchmark
	public void rankLongQuery(Blackhole blackhole) {
		List<RankedDocument> results = ranker.rank(longQuery, index, 10);
		blackhole.consume(results);
	}
}
