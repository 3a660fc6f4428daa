package de.mirkosertic.catalog.bitbucket.bitbucket;

import de.mirkosertic.catalog.bitbucket.bitbucket.model.Page;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Flattens a chain of pages into one iterator. The next page is only requested once
 * the current one is exhausted.
 */
class PagedIterator<T> implements Iterator<T> {

    private final Function<String, Page<T>> pageFetcher;

    private @Nullable String nextPageUrl;
    private Iterator<T> current = Collections.emptyIterator();

    PagedIterator(final String firstPageUrl, final Function<String, Page<T>> pageFetcher) {
        this.nextPageUrl = firstPageUrl;
        this.pageFetcher = pageFetcher;
    }

    @Override
    public boolean hasNext() {
        // Empty pages are legal, keep following "next" until we find a value or run out
        while (!current.hasNext() && nextPageUrl != null) {
            final Page<T> page = pageFetcher.apply(nextPageUrl);
            nextPageUrl = page.hasNext() ? page.next() : null;
            current = page.values().iterator();
        }
        return current.hasNext();
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }
}
