package com.di.taskpilot.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.dao.DataAccessResourceFailureException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.sql.SQLException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FailureCategory Tests")
class FailureCategoryTest {

    static Stream<Arguments> categorized() {
        return Stream.of(
                Arguments.of(new TimeoutException("slow"), FailureCategory.TIMEOUT),
                Arguments.of(new InterruptedException(), FailureCategory.INTERRUPTED),
                Arguments.of(new AccessDeniedException("/data"), FailureCategory.PERMISSION_DENIED),
                Arguments.of(new SQLException("locked"), FailureCategory.STORAGE_ERROR),
                Arguments.of(new DataAccessResourceFailureException("db gone"), FailureCategory.STORAGE_ERROR),
                Arguments.of(new UncheckedIOException(new IOException("disk")), FailureCategory.STORAGE_ERROR),
                Arguments.of(new OutOfMemoryError(), FailureCategory.RESOURCE_EXHAUSTION),
                Arguments.of(new IllegalArgumentException("bad"), FailureCategory.INVALID_INPUT),
                Arguments.of(new RuntimeException("boom"), FailureCategory.CALLBACK_ERROR));
    }

    @ParameterizedTest
    @MethodSource("categorized")
    @DisplayName("Should categorize throwables by type")
    void testCategorize(Throwable t, FailureCategory expected) {
        assertEquals(expected, FailureCategory.categorize(t));
    }

    @Test
    @DisplayName("Should return UNKNOWN for null")
    void testCategorize_Null() {
        assertEquals(FailureCategory.UNKNOWN, FailureCategory.categorize(null));
    }

    @Test
    @DisplayName("Should expose a name and description for every category")
    void testGetNameAndDescription() {
        for (FailureCategory c : FailureCategory.values()) {
            assertFalse(c.getName().isBlank());
            assertFalse(c.getDescription().isBlank());
        }
    }
}
