package com.xammer.orgtree.fetch;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

@Getter
public final class Page<T> {

    private final List<T> items;
    private final String nextToken;

    private Page(List<T> items, String nextToken) {
        this.items = items == null ? Collections.emptyList() : items;
        this.nextToken = nextToken;
    }

    public static <T> Page<T> of(List<T> items, String nextToken) {
        return new Page<>(items, nextToken);
    }

    public static <T> Page<T> last(List<T> items) {
        return new Page<>(items, null);
    }

    public boolean hasNextPage() {
        return nextToken != null && !nextToken.isEmpty();
    }
}
