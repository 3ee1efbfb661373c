package com.virtualcommittee.committee.controller;

import com.virtualcommittee.committee.dto.EvaluationRequest;
import com.virtualcommittee.committee.dto.ScanReport;
import com.virtualcommittee.committee.dto.ScanRequest;
import com.virtualcommittee.committee.service.CommitteeAggregator;
import com.virtualcommittee.committee.service.CommitteeScanService;
import com.virtualcommittee.common.config.CommitteeConfig;
import com.virtualcommittee.common.exception.CommitteeException;
import com.virtualcommittee.common.model.CommitteeDecision;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/committee")
public class CommitteeController {

    private final CommitteeAggregator aggregator;
    private final CommitteeScanService scanService;
    private final CommitteeConfig defaultConfig;

    public CommitteeController(CommitteeAggregator aggregator,
                               CommitteeScanService scanService,
                               CommitteeConfig defaultConfig) {
        this.aggregator    = aggregator;
        this.scanService   = scanService;
        this.defaultConfig = defaultConfig;
    }

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<CommitteeDecision>> evaluate(@RequestBody EvaluationRequest request) {
        return Mono.fromCallable(() -> evaluateInstrument(request))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/scan")
    public Mono<ResponseEntity<ScanReport>> scan(@RequestBody ScanRequest request) {
        return scanService.scan(request)
            .map(ResponseEntity::ok);
    }

    private CommitteeDecision evaluateInstrument(EvaluationRequest request) {
        if (request.instrumentId() == null || request.instrumentId().isBlank()) {
            throw new CommitteeException("CommitteeController", "instrumentId is required");
        }
        if (request.ticker() == null) {
            throw CommitteeException.forInstrument("CommitteeController", request.instrumentId(),
                "ticker snapshot is required");
        }
        CommitteeConfig config = defaultConfig.with(request.capital(), request.leverage());
        return aggregator.evaluate(request.instrumentId(), request.ticker(), request.market(),
                                   request.catalyst(), request.tradePlan(), config);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
