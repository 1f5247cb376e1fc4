package com.subradar.api.controller;

import com.subradar.analysis.RecurringChargeAnalysisService;
import com.subradar.api.dto.AnalysisRequest;
import com.subradar.api.dto.AnalysisResponse;
import com.subradar.api.dto.TransactionRequest;
import com.subradar.domain.TransactionRecord;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * POST /api/v1/analyses. Analysis blocks on link resolution, so it runs off the event loop.
 */
@RestController
@RequestMapping("/api/v1/analyses")
@RequiredArgsConstructor
public class AnalysisController {

    private final RecurringChargeAnalysisService analysisService;

    @PostMapping
    public Mono<ResponseEntity<AnalysisResponse>> analyze(@Valid @RequestBody AnalysisRequest request) {
        List<TransactionRecord> records = request.transactions().stream()
                .map(TransactionRequest::toRecord)
                .toList();
        List<String> exclusions = request.exclusions() != null ? request.exclusions() : List.of();
        return Mono.fromCallable(() -> analysisService.analyze(records, exclusions))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(AnalysisResponse.from(result)));
    }
}
