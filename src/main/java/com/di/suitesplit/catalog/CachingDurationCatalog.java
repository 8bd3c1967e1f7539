package com.di.suitesplit.catalog;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Cache-in-front of another {@link DurationCatalog}. Unavailability of the delegate is never cached.
 */
public class CachingDurationCatalog implements DurationCatalog {

    private final DurationCatalog delegate;
    private final Cache<TestRef, List<DurationSample>> byTest;

    public CachingDurationCatalog(DurationCatalog delegate, long maxSize, int expireAfterWriteMinutes) {
        this.delegate = delegate;
        this.byTest = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(expireAfterWriteMinutes, TimeUnit.MINUTES)
                .build();
    }

    @Override
    public List<DurationSample> lookup(TestRef test) {
        List<DurationSample> cached = byTest.getIfPresent(test);
        if (cached != null) return cached;
        List<DurationSample> fromDelegate = delegate.lookup(test);
        byTest.put(test, fromDelegate);
        return fromDelegate;
    }

    public void invalidateAll() {
        byTest.invalidateAll();
    }
}
