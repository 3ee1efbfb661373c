package com.virtualcommittee.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.util.context.ContextView;

/**
 * Carries a scan identifier through the per-candidate fan-out of a batch scan.
 *
 * <p>The Reactor Context is the only store for {@code scanId}. MDC is written
 * just for the duration of a single log call and cleared right after, because
 * candidates hop across {@code boundedElastic} threads. Candidate log lines
 * also carry the {@code instrumentId} being evaluated.
 *
 * <pre>
 *     TraceContextUtil.withScanId(Flux.fromIterable(candidates).flatMapSequential(...), scanId)
 *     ...
 *     Mono.deferContextual(ctx -&gt; { String id = TraceContextUtil.getScanId(ctx); ... })
 * </pre>
 */
public final class TraceContextUtil {

    public static final String SCAN_ID_KEY       = "scanId";
    public static final String INSTRUMENT_ID_KEY = "instrumentId";

    private TraceContextUtil() {}

    /**
     * Stores {@code scanId} in the Reactor Context of the candidate stream. Context
     * writes propagate upstream, so every per-candidate publisher assembled inside
     * {@code candidates} can read it.
     */
    public static <T> Flux<T> withScanId(Flux<T> candidates, String scanId) {
        return candidates.contextWrite(ctx -> ctx.put(SCAN_ID_KEY, scanId));
    }

    /** Returns the scanId, or {@code "unknown"} when none was written. Never {@code null}. */
    public static String getScanId(ContextView ctx) {
        return ctx.getOrDefault(SCAN_ID_KEY, "unknown");
    }

    /**
     * Runs {@code logAction} with the scan and, when non-null, the instrument
     * bridged into MDC, then removes both.
     */
    public static void withMdc(String scanId, String instrumentId, Runnable logAction) {
        MDC.put(SCAN_ID_KEY, scanId);
        if (instrumentId != null) {
            MDC.put(INSTRUMENT_ID_KEY, instrumentId);
        }
        try {
            logAction.run();
        } finally {
            MDC.remove(SCAN_ID_KEY);
            MDC.remove(INSTRUMENT_ID_KEY);
        }
    }
}
