package org.corpussearch.search.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.corpussearch.search.model.DocumentSummary;
import org.corpussearch.search.model.SearchResponse;
import org.corpussearch.search.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = new Gson();
	private final SearchService searchService;

	public SearchController(SearchService searchService) {
		this.searchService = searchService;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get("/search", this::handleSearch);

		app.get("/documents", this::handleDocuments);

		app.get("/stats", this::handleStats);

		logger.info("Search routes registered");
	}

	/**
	 * GET /health
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "search-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());

		try {
			health.put("total_documents", searchService.getStats().totalDocuments());
		} catch (Exception e) {
			health.put("total_documents", "error");
			logger.error("Error getting stats for health check", e);
		}

		ctx.result(gson.toJson(health));
	}

	/**
	 * GET /search?q={query}&limit={limit}
	 */
	private void handleSearch(Context ctx) {
		try {
			String query = ctx.queryParam("q");
			if (query == null) {
				badRequest(ctx, "Query parameter 'q' is required.");
				return;
			}

			Integer limit;
			try {
				limit = parseLimit(ctx.queryParam("limit"));
			} catch (NumberFormatException e) {
				badRequest(ctx, "Invalid limit. Must be a non-negative integer.");
				return;
			}

			SearchService.SearchPage page = searchService.search(query, limit);
			SearchResponse response = new SearchResponse(
					query,
					page.totalMatches(),
					page.results().size(),
					page.results()
			);

			ctx.status(200).result(gson.toJson(response));
			logger.info("Returned {} of {} search results for '{}'",
					page.results().size(), page.totalMatches(), query);

		} catch (Exception e) {
			serverError(ctx, "Search failed: " + e.getMessage());
			logger.error("Search failed", e);
		}
	}

	/**
	 * GET /documents?limit={limit}
	 */
	private void handleDocuments(Context ctx) {
		try {
			Integer limit;
			try {
				limit = parseLimit(ctx.queryParam("limit"));
			} catch (NumberFormatException e) {
				badRequest(ctx, "Invalid limit. Must be a non-negative integer.");
				return;
			}

			List<DocumentSummary> documents = searchService.getDocuments(limit);

			Map<String, Object> response = new HashMap<>();
			response.put("total_documents", searchService.getStats().totalDocuments());
			response.put("returned_documents", documents.size());
			response.put("documents", documents);

			ctx.status(200).result(gson.toJson(response));
			logger.debug("Returned {} documents for browsing", documents.size());

		} catch (Exception e) {
			serverError(ctx, "Listing documents failed: " + e.getMessage());
			logger.error("Listing documents failed", e);
		}
	}

	/**
	 * GET /stats
	 */
	private void handleStats(Context ctx) {
		try {
			SearchService.SearchStats stats = searchService.getStats();

			Map<String, Object> response = new HashMap<>();
			response.put("total_documents", stats.totalDocuments());
			response.put("unique_terms", stats.uniqueTerms());
			response.put("total_postings", stats.totalPostings());
			response.put("empty_documents", stats.emptyDocuments());
			response.put("build_time_ms", stats.buildTimeMs());

			ctx.status(200).result(gson.toJson(response));
			logger.debug("Retrieved search statistics");

		} catch (Exception e) {
			serverError(ctx, "Failed to retrieve statistics: " + e.getMessage());
			logger.error("Failed to get statistics", e);
		}
	}

	/**
	 * @return {@code null} when absent, so the service applies its default
	 * @throws NumberFormatException when present but not a non-negative integer
	 */
	private static Integer parseLimit(String limitStr) {
		if (limitStr == null || limitStr.isEmpty()) {
			return null;
		}
		int limit = Integer.parseInt(limitStr.trim());
		if (limit < 0) {
			throw new NumberFormatException("negative limit: " + limit);
		}
		return limit;
	}

	private static void badRequest(Context ctx, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		ctx.status(400).result(gson.toJson(error));
	}

	private static void serverError(Context ctx, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		ctx.status(500).result(gson.toJson(error));
	}
}
