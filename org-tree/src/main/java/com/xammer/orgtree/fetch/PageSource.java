package com.xammer.orgtree.fetch;

/**
 * A single paged list call. Receives {@code null} for the first page and the previous page's
 * continuation token afterwards.
 */
@FunctionalInterface
public interface PageSource<T> {

    Page<T> fetchPage(String nextToken);
}
