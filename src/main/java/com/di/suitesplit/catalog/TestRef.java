package com.di.suitesplit.catalog;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Identifier of a single test file. Equality is by the normalized identifier string;
 * path separators are normalized to {@code /} so history recorded on Windows hosts
 * matches tests listed on Linux hosts.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TestRef implements Comparable<TestRef> {

    @JsonValue
    String id;

    public static TestRef of(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Test identifier must not be blank");
        }
        return new TestRef(id.trim().replace('\\', '/'));
    }

    @Override
    public int compareTo(TestRef other) {
        return id.compareTo(other.id);
    }

    @Override
    public String toString() {
        return id;
    }
}
