package com.virtualcommittee.committee.service;

import com.virtualcommittee.committee.dto.ScanCandidate;
import com.virtualcommittee.committee.dto.ScanReport;
import com.virtualcommittee.committee.dto.ScanRequest;
import com.virtualcommittee.committee.evaluator.RegimeDetector;
import com.virtualcommittee.committee.screen.InstrumentScreen;
import com.virtualcommittee.common.config.CommitteeConfig;
import com.virtualcommittee.common.exception.CommitteeException;
import com.virtualcommittee.common.model.CommitteeDecision;
import com.virtualcommittee.common.model.Decision;
import com.virtualcommittee.common.model.MarketSnapshot;
import com.virtualcommittee.common.model.RegimeResult;
import com.virtualcommittee.common.model.TradePlan;
import com.virtualcommittee.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Evaluates a batch of candidates against one market snapshot.
 *
 * <p>Each candidate is screened and, if it passes, put before the committee on
 * {@code boundedElastic}. Candidates are independent, so they run in parallel;
 * a candidate that fails is logged and reported as a SKIP without affecting the
 * rest. Results are then ranked by final score, best first. Equal scores keep
 * submission order.
 */
@Service
public class CommitteeScanService {

    private static final Logger log = LoggerFactory.getLogger(CommitteeScanService.class);

    public static final int MAX_OPPORTUNITIES = 5;
    public static final int MAX_WATCHLIST     = 10;

    private final CommitteeAggregator aggregator;
    private final RegimeDetector      regimeDetector;
    private final InstrumentScreen    screen;
    private final CommitteeConfig     defaultConfig;

    public CommitteeScanService(CommitteeAggregator aggregator,
                                RegimeDetector regimeDetector,
                                InstrumentScreen screen,
                                CommitteeConfig defaultConfig) {
        this.aggregator     = aggregator;
        this.regimeDetector = regimeDetector;
        this.screen         = screen;
        this.defaultConfig  = defaultConfig;
    }

    public Mono<ScanReport> scan(ScanRequest request) {
        if (request == null || request.candidates() == null || request.candidates().isEmpty()) {
            throw new CommitteeException("CommitteeScanService", "Scan request has no candidates");
        }
        List<ScanCandidate> candidates = request.candidates().stream()
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
        CommitteeConfig config = defaultConfig.with(request.capital(), request.leverage());
        MarketSnapshot market  = request.market() != null ? request.market() : MarketSnapshot.empty();
        RegimeResult regime    = regimeDetector.detect(market);
        String scanId          = UUID.randomUUID().toString();

        TraceContextUtil.withMdc(scanId, null, () ->
            log.info("Scan started. scanId={} candidates={} regime={}", scanId, candidates.size(), regime.regime()));

        Flux<ScanOutcome> outcomes = Flux.fromIterable(candidates)
            .flatMapSequential(candidate -> evaluateCandidate(candidate, market, config));

        return TraceContextUtil.withScanId(outcomes, scanId)
            .collectList()
            .map(results -> buildReport(scanId, regime, candidates, results));
    }

    private Mono<ScanOutcome> evaluateCandidate(ScanCandidate candidate, MarketSnapshot market,
                                                CommitteeConfig config) {
        return Mono.deferContextual(ctx -> {
            String scanId = TraceContextUtil.getScanId(ctx);
            return Mono.fromCallable(() -> screenAndEvaluate(candidate, market, config))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(outcome -> TraceContextUtil.withMdc(scanId, candidate.instrumentId(), () ->
                    log.info("Candidate={} complete. decision={} score={} excluded={}",
                        candidate.instrumentId(), outcome.decision().decision(),
                        outcome.decision().finalScore(), outcome.excluded())))
                .onErrorResume(e -> {
                    TraceContextUtil.withMdc(scanId, candidate.instrumentId(), () ->
                        log.error("Candidate={} failed in scan={}", candidate.instrumentId(), scanId, e));
                    return Mono.just(new ScanOutcome(
                        CommitteeDecision.skipped(candidate.instrumentId(), "Evaluation failed: " + e.getMessage()),
                        false));
                });
        });
    }

    private ScanOutcome screenAndEvaluate(ScanCandidate candidate, MarketSnapshot market, CommitteeConfig config) {
        Optional<String> exclusion = screen.exclusionReason(candidate.instrumentId(), candidate.ticker());
        if (exclusion.isPresent()) {
            return new ScanOutcome(CommitteeDecision.skipped(candidate.instrumentId(), exclusion.get()), true);
        }
        CommitteeDecision decision = aggregator.evaluate(candidate.instrumentId(), candidate.ticker(), market,
                                                         candidate.catalyst(), TradePlan.none(), config);
        return new ScanOutcome(decision, false);
    }

    private ScanReport buildReport(String scanId, RegimeResult regime,
                                   List<ScanCandidate> candidates, List<ScanOutcome> outcomes) {
        // sorted() is stable on an ordered stream: ties keep submission order
        List<CommitteeDecision> ranked = outcomes.stream()
            .map(ScanOutcome::decision)
            .sorted(Comparator.comparingInt(CommitteeDecision::finalScore).reversed())
            .collect(Collectors.toList());

        List<CommitteeDecision> buys = ranked.stream()
            .filter(d -> d.decision() == Decision.BUY)
            .collect(Collectors.toList());
        List<CommitteeDecision> watch = ranked.stream()
            .filter(d -> d.decision() == Decision.WATCHLIST)
            .collect(Collectors.toList());

        int catalysts = (int) candidates.stream().filter(c -> c.catalyst() != null).count();
        int excluded  = (int) outcomes.stream().filter(ScanOutcome::excluded).count();

        TraceContextUtil.withMdc(scanId, null, () ->
            log.info("Scan complete. scanId={} scanned={} buy={} watchlist={} excluded={}",
                scanId, candidates.size(), buys.size(), watch.size(), excluded));

        return new ScanReport(
            scanId,
            Instant.now(),
            regime,
            List.copyOf(buys.subList(0, Math.min(MAX_OPPORTUNITIES, buys.size()))),
            List.copyOf(watch.subList(0, Math.min(MAX_WATCHLIST, watch.size()))),
            candidates.size(),
            buys.size(),
            watch.size(),
            catalysts,
            excluded);
    }

    private record ScanOutcome(CommitteeDecision decision, boolean excluded) {}
}
