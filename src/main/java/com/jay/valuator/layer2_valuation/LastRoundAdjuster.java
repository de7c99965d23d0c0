package com.jay.valuator.layer2_valuation;

import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.model.IndexData;
import com.jay.valuator.model.LastRoundResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Layer 2: Last Financing Round.
 * Carries the post-money valuation of the most recent round forward by the
 * market index return since the round date. Rounds older than the staleness
 * window are flagged, not rejected.
 */
@Slf4j
@Component
public class LastRoundAdjuster {

    private final ValuatorConfig config;
    private final Clock clock;

    @Autowired
    public LastRoundAdjuster(ValuatorConfig config) {
        this(config, Clock.systemUTC());
    }

    public LastRoundAdjuster(ValuatorConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public LastRoundResult value(double lastRoundValuation, String roundDate, IndexData indexData) {
        List<String> warnings = new ArrayList<>();

        Integer months = monthsSince(roundDate);
        if (months == null) {
            warnings.add("Could not parse round date: " + roundDate);
        } else if (months > config.lastRound().getStalenessMonths()) {
            warnings.add(String.format("Last round was %d months ago, valuation may be stale", months));
        }

        Double indexReturn = null;
        double factor = 1.0;
        if (indexData != null) {
            indexReturn = indexData.getReturnSinceRound();
            factor = 1.0 + indexReturn;
        } else {
            warnings.add("No index data available, using unadjusted last-round valuation");
        }

        double ev = lastRoundValuation * factor;
        log.info("Last round: {} on {} x {} -> EV {}",
            String.format("%,.0f", lastRoundValuation), roundDate, String.format("%.4f", factor),
            String.format("%,.0f", ev));

        return LastRoundResult.builder()
            .enterpriseValue(ev)
            .lastRoundValuation(lastRoundValuation)
            .indexReturn(indexReturn)
            .adjustmentFactor(factor)
            .monthsSinceRound(months)
            .warnings(warnings)
            .build();
    }

    /** Whole 30-day months between the round date and today; null if the date does not parse. */
    public Integer monthsSince(String roundDate) {
        if (roundDate == null) return null;
        try {
            LocalDate date = LocalDate.parse(roundDate.trim());
            long days = ChronoUnit.DAYS.between(date, LocalDate.now(clock));
            return (int) Math.floorDiv(days, 30L);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
