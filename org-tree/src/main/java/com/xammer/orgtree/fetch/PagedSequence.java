package com.xammer.orgtree.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy view over a paged list call. Pages are requested only while the consumer iterates, in
 * provider order, until a page arrives without a continuation token.
 * <p>
 * A sequence can be iterated once. Any exception raised by the {@link PageSource} escapes from
 * {@code hasNext()} and ends the iteration.
 */
public final class PagedSequence<T> implements Iterable<T> {

    private static final Logger logger = LoggerFactory.getLogger(PagedSequence.class);

    private final ListOperation operation;
    private final String scope;
    private final PageSource<T> source;
    private boolean consumed;

    public PagedSequence(ListOperation operation, String scope, PageSource<T> source) {
        this.operation = operation;
        this.scope = scope;
        this.source = source;
    }

    public ListOperation getOperation() {
        return operation;
    }

    public String getScope() {
        return scope;
    }

    @Override
    public Iterator<T> iterator() {
        if (consumed) {
            throw new IllegalStateException(operation.getApiName() + " sequence for " + describeScope()
                    + " has already been consumed");
        }
        consumed = true;
        return new PageIterator();
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<T> toList() {
        List<T> items = new ArrayList<>();
        forEach(items::add);
        return items;
    }

    private String describeScope() {
        return scope == null ? "organization" : scope;
    }

    private final class PageIterator implements Iterator<T> {

        private Iterator<T> current = Collections.emptyIterator();
        private String nextToken;
        private boolean lastPageSeen;
        private int pages;

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (lastPageSeen) {
                    return false;
                }
                fetchNextPage();
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        private void fetchNextPage() {
            Page<T> page = source.fetchPage(nextToken);
            pages++;
            current = page.getItems().iterator();
            if (page.hasNextPage()) {
                nextToken = page.getNextToken();
            } else {
                lastPageSeen = true;
                logger.debug("{} for {} read {} page(s)", operation.getApiName(), describeScope(), pages);
            }
        }
    }
}
