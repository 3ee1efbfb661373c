package com.virtualcommittee.committee.screen;

import com.virtualcommittee.common.config.ScreeningCriteria;
import com.virtualcommittee.common.model.TickerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Exclusion filters applied before an instrument reaches the committee.
 *
 * <p>Checks run in order and stop at the first failure. A check whose input
 * field is absent or exactly zero is skipped; negative values are checked:
 * <ol>
 *   <li>price below minimum (penny stock)</li>
 *   <li>price above maximum</li>
 *   <li>market cap below minimum</li>
 *   <li>market cap above maximum (mega cap)</li>
 *   <li>beta below minimum</li>
 *   <li>20d average volume below the market-cap tier minimum</li>
 * </ol>
 */
@Component
public class InstrumentScreen {

    private static final Logger log = LoggerFactory.getLogger(InstrumentScreen.class);

    private final ScreeningCriteria criteria;

    public InstrumentScreen(ScreeningCriteria criteria) {
        this.criteria = criteria;
    }

    /**
     * @return the exclusion reason, or empty when the instrument may be evaluated
     */
    public Optional<String> exclusionReason(String instrumentId, TickerSnapshot ticker) {
        if (ticker == null) {
            return Optional.empty();
        }
        Optional<String> reason = firstFailure(ticker);
        reason.ifPresent(r -> log.info("[Screen] instrument={} excluded: {}", instrumentId, r));
        return reason;
    }

    private Optional<String> firstFailure(TickerSnapshot ticker) {
        Double price     = presentOrNull(ticker.price());
        Double marketCap = presentOrNull(ticker.marketCap());
        Double avgVolume = presentOrNull(ticker.avgVolume20d());
        Double beta      = presentOrNull(ticker.beta());

        if (price != null && price < criteria.minPrice()) {
            return reason("Penny stock ($%.2f < $%.2f)", price, criteria.minPrice());
        }
        if (price != null && price > criteria.maxPrice()) {
            return reason("Price too high ($%.2f > $%.2f)", price, criteria.maxPrice());
        }
        if (marketCap != null && marketCap < criteria.minMarketCap()) {
            return reason("Market cap too low ($%.0fM < $%.0fM)", marketCap / 1e6, criteria.minMarketCap() / 1e6);
        }
        if (marketCap != null && marketCap > criteria.maxMarketCap()) {
            return reason("Mega cap ($%.0fB > $%.0fB)", marketCap / 1e9, criteria.maxMarketCap() / 1e9);
        }
        if (beta != null && beta < criteria.minBeta()) {
            return reason("Beta too low (%.2f < %.2f)", beta, criteria.minBeta());
        }
        if (marketCap != null && avgVolume != null) {
            double minVolume = criteria.minVolumeFor(marketCap);
            if (avgVolume < minVolume) {
                return reason("Insufficient volume for %s (%.2fM < %.2fM)",
                    tierName(marketCap), avgVolume / 1e6, minVolume / 1e6);
            }
        }
        return Optional.empty();
    }

    private static String tierName(double marketCap) {
        if (marketCap < ScreeningCriteria.SMALL_CAP_CEILING) return "small cap";
        if (marketCap < ScreeningCriteria.MID_CAP_CEILING)   return "mid cap";
        return "large cap";
    }

    /** Zero is treated like absent; a negative beta (inverse products) is still a value. */
    private static Double presentOrNull(Double value) {
        return (value != null && value != 0.0) ? value : null;
    }

    private static Optional<String> reason(String template, Object... args) {
        return Optional.of(String.format(Locale.ROOT, template, args));
    }
}
