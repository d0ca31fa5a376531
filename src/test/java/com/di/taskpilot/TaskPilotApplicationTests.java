package com.di.taskpilot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test for TaskPilotApplication without starting a context; wiring is covered per component.
 */
@DisplayName("TaskPilotApplication Tests")
class TaskPilotApplicationTests {

    @Test
    @DisplayName("Should have a public static main method")
    void testMainMethodExists() throws NoSuchMethodException {
        Method main = TaskPilotApplication.class.getMethod("main", String[].class);
        assertTrue(Modifier.isStatic(main.getModifiers()));
        assertTrue(Modifier.isPublic(main.getModifiers()));
    }

    @Test
    @DisplayName("Should exclude the auto-configured DataSource")
    void testDataSourceAutoConfigurationExcluded() {
        SpringBootApplication annotation = TaskPilotApplication.class.getAnnotation(SpringBootApplication.class);
        assertNotNull(annotation);
        assertTrue(Arrays.stream(annotation.exclude())
                .anyMatch(c -> c.getSimpleName().equals("DataSourceAutoConfiguration")));
    }
}
