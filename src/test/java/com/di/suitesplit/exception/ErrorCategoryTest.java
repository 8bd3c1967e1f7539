package com.di.suitesplit.exception;

import com.di.suitesplit.catalog.DurationCatalogUnavailableException;
import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.file.NoSuchFileException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    static Stream<Arguments> exceptions() {
        return Stream.of(
                Arguments.of(new ConfigurationException("maxSubSuites must be >= 1"), ErrorCategory.CONFIGURATION_ERROR),
                Arguments.of(new DurationCatalogUnavailableException("down"), ErrorCategory.HISTORY_UNAVAILABLE),
                Arguments.of(new JsonParseException(null, "bad"), ErrorCategory.SERIALIZATION_ERROR),
                Arguments.of(new IllegalArgumentException("taskName is required"), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new NoSuchFileException("history.json"), ErrorCategory.RESOURCE_ERROR),
                Arguments.of(new RuntimeException("boom"), ErrorCategory.APPLICATION_ERROR));
    }

    @ParameterizedTest
    @MethodSource("exceptions")
    @DisplayName("Should categorize exceptions by type")
    void testCategorize(Throwable exception, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(exception));
    }

    @Test
    @DisplayName("Should return UNKNOWN for null")
    void testCategorize_Null() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }

    @Test
    @DisplayName("Every category has a name and description")
    void testNameAndDescription() {
        for (ErrorCategory category : ErrorCategory.values()) {
            assertFalse(category.getName().isEmpty());
            assertFalse(category.getDescription().isEmpty());
        }
    }
}
