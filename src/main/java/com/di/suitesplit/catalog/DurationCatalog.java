package com.di.suitesplit.catalog;

import java.util.List;

/**
 * Source of historical test durations. Implementations can be in-memory, file-based, or
 * backed by a CI provider's statistics API.
 *
 * <p>Implementations throw {@link DurationCatalogUnavailableException} when the underlying
 * source cannot be reached; callers treat that as "no timing data" rather than a failure.
 */
public interface DurationCatalog {

    /**
     * Returns every recorded sample for the given test, possibly empty. Filtering to a
     * lookback window is the caller's job.
     */
    List<DurationSample> lookup(TestRef test);
}
