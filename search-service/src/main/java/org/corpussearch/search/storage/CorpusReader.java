package org.corpussearch.search.storage;

import org.corpussearch.core.model.CorpusDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the corpus directory into documents for indexing.
 *
 * <p>Only regular files directly inside the directory are read, sorted by file name so document ids
 * are stable across restarts. The file name is the document label.</p>
 */
public class CorpusReader {
	private static final Logger logger = LoggerFactory.getLogger(CorpusReader.class);
	private final String corpusPath;

	public CorpusReader(String corpusPath) {
		this.corpusPath = corpusPath;
	}

	/**
	 * Read every document in the corpus, in file name order.
	 * A file that cannot be read fails the whole read.
	 */
	public List<CorpusDocument> readAll() throws IOException {
		List<Path> files = listDocuments();
		List<CorpusDocument> documents = new ArrayList<>(files.size());

		for (Path file : files) {
			documents.add(new CorpusDocument(file.getFileName().toString(), readDocument(file)));
		}

		logger.info("Read {} documents from corpus {}", documents.size(), corpusPath);
		return documents;
	}

	/**
	 * List corpus files sorted by file name
	 */
	public List<Path> listDocuments() throws IOException {
		Path corpusDir = Paths.get(corpusPath);

		if (!Files.isDirectory(corpusDir)) {
			throw new IOException("Corpus directory not found: " + corpusPath);
		}

		try (Stream<Path> paths = Files.list(corpusDir)) {
			return paths
					.filter(Files::isRegularFile)
					.sorted(Comparator.comparing(p -> p.getFileName().toString()))
					.collect(Collectors.toList());
		}
	}

	/**
	 * Read a file as UTF-8, dropping byte sequences that do not decode
	 */
	public String readDocument(Path file) throws IOException {
		byte[] bytes = Files.readAllBytes(file);
		return decodeLenient(bytes);
	}

	static String decodeLenient(byte[] bytes) throws CharacterCodingException {
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.IGNORE)
				.onUnmappableCharacter(CodingErrorAction.IGNORE);
		return decoder.decode(ByteBuffer.wrap(bytes)).toString();
	}
}
