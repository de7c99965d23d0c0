package com.jay.valuator.layer2_valuation;

import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.model.DcfResult;
import com.jay.valuator.model.FinancialProjections;
import com.jay.valuator.model.SensitivityCell;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 2: Discounted Cash Flow.
 *
 * Per projected year:
 *   EBITDA = revenue × margin, D&A = revenue × depreciation%
 *   tax    = max(0, (EBITDA − D&A) × taxRate)
 *   FCF    = EBITDA − tax − revenue × capex% − revenue × nwc%
 *
 * Starting FCF from EBITDA keeps D&A out of the cash outflows while still
 * giving the tax shield through EBIT.
 * EV = Σ FCF/(1+WACC)^(i+1) + Gordon terminal value discounted over N years.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DcfEngine {

    private final ValuatorConfig config;

    private record Projection(double enterpriseValue, List<Double> fcfs, double terminalValue) {}

    public DcfResult value(FinancialProjections p) {
        double wacc = p.getWacc();
        double growth = p.getTerminalGrowthRate();
        List<String> warnings = new ArrayList<>();

        if (wacc <= 0) {
            warnings.add(String.format("WACC (%s) must be positive", wacc));
            return zero(wacc, growth, warnings);
        }
        if (wacc <= growth) {
            warnings.add(String.format("WACC (%s) must be greater than terminal growth rate (%s)", wacc, growth));
            return zero(wacc, growth, warnings);
        }
        List<Double> revenues = p.getRevenueProjections();
        if (revenues == null || revenues.isEmpty()) {
            warnings.add("No revenue projections provided");
            return zero(wacc, growth, warnings);
        }

        Projection base = project(p);
        List<SensitivityCell> grid = sensitivity(p);
        log.info("DCF: {} years, WACC {} g {} -> EV {} (terminal value {})",
            revenues.size(), wacc, growth,
            String.format("%,.0f", base.enterpriseValue()), String.format("%,.0f", base.terminalValue()));

        return DcfResult.builder()
            .enterpriseValue(base.enterpriseValue())
            .projectedFcfs(base.fcfs())
            .terminalValue(base.terminalValue())
            .discountRate(wacc)
            .terminalGrowthRate(growth)
            .sensitivityTable(grid)
            .warnings(warnings)
            .build();
    }

    /**
     * Recomputes EV over WACC and terminal growth offsets around the base case.
     * Cells where WACC ≤ g or WACC ≤ 0 are omitted; the zero/zero offset is the base case.
     */
    public List<SensitivityCell> sensitivity(FinancialProjections p) {
        ValuatorConfig.Dcf cfg = config.dcf();
        List<SensitivityCell> cells = new ArrayList<>();
        for (double dw : cfg.getWaccDeltas()) {
            double w = p.getWacc() + dw;
            for (double dg : cfg.getGrowthDeltas()) {
                double g = p.getTerminalGrowthRate() + dg;
                if (w <= g || w <= 0) continue;
                Projection cell = project(p.withRates(w, g));
                cells.add(new SensitivityCell(round(w, 4), round(g, 4), round(cell.enterpriseValue(), 2)));
            }
        }
        return cells;
    }

    /** Year-by-year free cash flow for the projection horizon. */
    public List<Double> freeCashFlows(FinancialProjections p) {
        List<Double> revenues = p.getRevenueProjections();
        List<Double> margins = p.getEbitdaMargins();
        List<Double> fcfs = new ArrayList<>(revenues.size());
        for (int i = 0; i < revenues.size(); i++) {
            double revenue = revenues.get(i);
            double ebitda = revenue * marginAt(margins, i);
            double da = revenue * p.getDepreciationPercent();
            double tax = Math.max(0.0, (ebitda - da) * p.getTaxRate());
            double capex = revenue * p.getCapexPercent();
            double nwc = revenue * p.getNwcChangePercent();
            fcfs.add(ebitda - tax - capex - nwc);
        }
        return fcfs;
    }

    private Projection project(FinancialProjections p) {
        double wacc = p.getWacc();
        double growth = p.getTerminalGrowthRate();
        List<Double> fcfs = freeCashFlows(p);
        int n = fcfs.size();
        double pv = 0;
        for (int i = 0; i < n; i++) {
            pv += fcfs.get(i) / Math.pow(1 + wacc, i + 1);
        }
        double terminalValue = fcfs.get(n - 1) * (1 + growth) / (wacc - growth);
        double pvTerminal = terminalValue / Math.pow(1 + wacc, n);
        return new Projection(pv + pvTerminal, fcfs, terminalValue);
    }

    // Margins shorter than the horizon repeat their last value
    private static double marginAt(List<Double> margins, int i) {
        if (margins == null || margins.isEmpty()) return 0.0;
        return i < margins.size() ? margins.get(i) : margins.get(margins.size() - 1);
    }

    private static DcfResult zero(double wacc, double growth, List<String> warnings) {
        log.warn("DCF not computed: {}", warnings);
        return DcfResult.builder()
            .enterpriseValue(0)
            .discountRate(wacc)
            .terminalGrowthRate(growth)
            .warnings(warnings)
            .build();
    }

    private static double round(double v, int places) {
        double scale = Math.pow(10, places);
        return Math.round(v * scale) / scale;
    }
}
