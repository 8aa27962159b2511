package org.corpussearch.search.bootstrap;

import java.io.IOException;
import java.util.List;

import org.corpussearch.core.index.IndexBundle;
import org.corpussearch.core.index.InvertedIndexBuilder;
import org.corpussearch.core.model.CorpusDocument;
import org.corpussearch.search.config.SearchConfig;
import org.corpussearch.search.controller.SearchController;
import org.corpussearch.search.service.SearchService;
import org.corpussearch.search.storage.CorpusReader;
import org.corpussearch.search.web.SearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration, reads and indexes the corpus, starts the HTTP API, and registers a JVM
 * shutdown hook. The index is fully built before the server accepts requests.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run() {
        try {
            start();
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start() throws IOException {
        SearchConfig cfg = SearchConfig.load();
        SearchService service = buildService(cfg);
        Javalin app = startHttp(cfg, service);
        addShutdownHook(app);
        logger.info("Search Service started successfully on port {}.", app.port());
    }

    /**
     * Reads the configured corpus and builds the service around a freshly built index.
     */
    public static SearchService buildService(SearchConfig cfg) throws IOException {
        logger.info("Indexing corpus at {}", cfg.corpus().path());

        long started = System.currentTimeMillis();
        List<CorpusDocument> documents = new CorpusReader(cfg.corpus().path()).readAll();
        IndexBundle index = InvertedIndexBuilder.buildIndex(documents);
        long elapsed = System.currentTimeMillis() - started;

        logger.info("Index ready in {} ms", elapsed);
        return new SearchService(index, cfg.defaultLimit(), cfg.maxResults(), elapsed);
    }

    private static Javalin startHttp(SearchConfig cfg, SearchService service) {
        SearchController controller = new SearchController(service);
        return SearchHttpServer.start(cfg.serverPort(), controller);
    }

    private static void addShutdownHook(Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(app)));
    }

    private static void shutdown(Javalin app) {
        logger.info("Shutting down Search Service...");
        app.stop();
        logger.info("Search Service stopped.");
    }
}
