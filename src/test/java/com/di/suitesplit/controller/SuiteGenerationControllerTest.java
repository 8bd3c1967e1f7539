package com.di.suitesplit.controller;

import com.di.suitesplit.catalog.InMemoryDurationCatalog;
import com.di.suitesplit.config.SuiteSplitProperties;
import com.di.suitesplit.config.TaskGenerationProperties;
import com.di.suitesplit.exception.GlobalExceptionHandler;
import com.di.suitesplit.multiversion.MultiversionExpander;
import com.di.suitesplit.naming.SubSuiteIdentity;
import com.di.suitesplit.service.SuiteGenerationService;
import com.di.suitesplit.split.SuitePartitioner;
import com.di.suitesplit.task.ResmokeTaskGenerator;
import com.di.suitesplit.task.TaskGenerationOptions;
import com.di.suitesplit.timeout.TimeoutEstimator;
import com.di.suitesplit.timeout.TimeoutPolicy;
import com.di.suitesplit.util.SplitMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("SuiteGenerationController Tests")
class SuiteGenerationControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        TaskGenerationProperties generation = new TaskGenerationProperties();
        TaskGenerationOptions options = generation.toOptions();
        ResmokeTaskGenerator taskGenerator = new ResmokeTaskGenerator(
                new TimeoutEstimator(TimeoutPolicy.DEFAULT), new SubSuiteIdentity(), options);
        SuiteGenerationService service = new SuiteGenerationService(
                SuitePartitioner.withDefaults(), taskGenerator, new MultiversionExpander(taskGenerator, options),
                InMemoryDurationCatalog.empty(), new SuiteSplitProperties(), generation,
                new SplitMetrics(new SimpleMeterRegistry()), Clock.systemUTC());
        mockMvc = MockMvcBuilders.standaloneSetup(new SuiteGenerationController(service))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /api/suites/generate splits with inline history")
    void generate_withInlineHistory() throws Exception {
        String body = """
                {
                  "taskName": "core_gen",
                  "buildVariant": "linux",
                  "tests": ["a.js", "b.js", "c.js"],
                  "maxSubSuites": 2,
                  "targetTimePerSuiteSeconds": 100,
                  "history": [
                    {"test": "a.js", "durationSeconds": 100},
                    {"test": "b.js", "durationSeconds": 50},
                    {"test": "c.js", "durationSeconds": 50}
                  ]
                }
                """;

        mockMvc.perform(post("/api/suites/generate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tasks.length()").value(3))
                .andExpect(jsonPath("$.tasks[0].name").value("core_0_2_linux"))
                .andExpect(jsonPath("$.tasks[0].members[0]").value("a.js"))
                .andExpect(jsonPath("$.tasks[1].members.length()").value(2))
                .andExpect(jsonPath("$.tasks[2].name").value("core_misc_linux"))
                .andExpect(jsonPath("$.summary.strategy").value("GREEDY_BALANCE"))
                .andExpect(jsonPath("$.displayTasks[1].name").value("generator_tasks"));
    }

    @Test
    @DisplayName("Without history the split falls back to round-robin")
    void generate_withoutHistory() throws Exception {
        String body = """
                {"taskName": "core", "buildVariant": "linux", "tests": ["a.js", "b.js"], "maxTestsPerSuite": 1}
                """;

        mockMvc.perform(post("/api/suites/generate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.strategy").value("ROUND_ROBIN"))
                .andExpect(jsonPath("$.summary.subSuiteCount").value(2));
    }

    @Test
    @DisplayName("Invalid body is rejected with field details")
    void generate_invalidBody() throws Exception {
        String body = """
                {"taskName": "core", "buildVariant": "linux", "tests": [], "maxSubSuites": 0}
                """;

        mockMvc.perform(post("/api/suites/generate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Request validation failed"))
                .andExpect(jsonPath("$.details.tests").exists())
                .andExpect(jsonPath("$.details.maxSubSuites").exists());
    }

    @Test
    @DisplayName("Malformed JSON is a serialization error")
    void generate_malformedJson() throws Exception {
        mockMvc.perform(post("/api/suites/generate").contentType(MediaType.APPLICATION_JSON).content("{ nope"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("SERIALIZATION_ERROR"))
                .andExpect(jsonPath("$.path").value("/api/suites/generate"));
    }
}
