package org.corpussearch.search;

import org.corpussearch.search.bootstrap.SearchBootstrap;

public class SearchApp {
    public static void main(String[] args) {
        SearchBootstrap.run();
    }
}
