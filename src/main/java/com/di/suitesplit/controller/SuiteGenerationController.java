package com.di.suitesplit.controller;

import com.di.suitesplit.catalog.DurationSample;
import com.di.suitesplit.catalog.InMemoryDurationCatalog;
import com.di.suitesplit.catalog.TestRef;
import com.di.suitesplit.controller.dto.GenerateSuitesRequest;
import com.di.suitesplit.controller.dto.HistoricalDuration;
import com.di.suitesplit.service.GenerationRequest;
import com.di.suitesplit.service.GenerationResult;
import com.di.suitesplit.service.SuiteGenerationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Splits a suite and returns the generated tasks.
 * Use: POST /api/suites/generate
 */
@Slf4j
@RestController
@RequestMapping("/api/suites")
@RequiredArgsConstructor
public class SuiteGenerationController {

    private final SuiteGenerationService generationService;

    @PostMapping(path = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GenerationResult> generate(@Valid @RequestBody GenerateSuitesRequest body) {
        GenerationRequest request = toRequest(body);
        GenerationResult result;
        if (body.getHistory() != null && !body.getHistory().isEmpty()) {
            result = generationService.generate(request, toCatalog(body.getHistory()));
        } else {
            result = generationService.generate(request);
        }
        return ResponseEntity.ok(result);
    }

    static GenerationRequest toRequest(GenerateSuitesRequest body) {
        return GenerationRequest.builder()
                .taskName(body.getTaskName())
                .suiteName(body.getSuiteName())
                .buildVariant(body.getBuildVariant())
                .tests(body.getTests())
                .suiteDefinition(body.getSuiteDefinition())
                .maxSubSuites(body.getMaxSubSuites())
                .maxTestsPerSuite(body.getMaxTestsPerSuite())
                .targetTimePerSuiteSeconds(body.getTargetTimePerSuiteSeconds())
                .resmokeArgs(body.getResmokeArgs())
                .repeatSuites(body.getRepeatSuites())
                .resmokeJobsMax(body.getResmokeJobsMax())
                .genTaskConfigLocation(body.getGenTaskConfigLocation())
                .multiversion(body.isMultiversion())
                .sharded(body.isSharded())
                .versionMixes(body.getVersionMixes() != null ? body.getVersionMixes() : List.of())
                .testList(body.getTestList())
                .build();
    }

    private static InMemoryDurationCatalog toCatalog(List<HistoricalDuration> history) {
        InMemoryDurationCatalog catalog = InMemoryDurationCatalog.empty();
        for (HistoricalDuration h : history) {
            catalog.record(DurationSample.builder()
                    .test(TestRef.of(h.getTest()))
                    .durationSeconds(h.getDurationSeconds())
                    .observedAt(h.getObservedAt())
                    .build());
        }
        log.debug("[GENERATE] Using inline history for {} tests", catalog.size());
        return catalog;
    }
}
