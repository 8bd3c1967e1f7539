package com.di.suitesplit.multiversion;

import lombok.Builder;
import lombok.Value;

/**
 * Per-suite inputs for multiversion expansion.
 */
@Value
@Builder(toBuilder = true)
public class MultiversionParams {
    /** Parent task; its backport tag {@code <parent>_backport_required_multiversion} is excluded. */
    String parentTaskName;
    /** Tag of tests requiring the latest feature compatibility version, e.g. {@code requires_fcv_51}. */
    String requiresFcvTag;
    /** Optional explicit tests appended to the runner arguments. */
    String testList;
}
