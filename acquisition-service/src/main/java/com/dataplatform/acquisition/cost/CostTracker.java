package com.dataplatform.acquisition.cost;

import com.dataplatform.common.model.ProviderCategory;
import com.dataplatform.common.model.ProviderDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.YearMonth;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider monthly request count and spend. Counters restart on the first call of a
 * new calendar month (in the clock's zone).
 *
 * <p>{@link #withinBudget} is the router's budget gate: a commercial provider with a monthly
 * budget drops out of routing once its spend reaches the budget. Government sources and
 * providers without a budget are always within budget.
 */
public class CostTracker {

    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);

    private final Clock clock;
    private final ConcurrentHashMap<String, Ledger> ledgers = new ConcurrentHashMap<>();

    public CostTracker(Clock clock) {
        this.clock = clock;
    }

    /** Records one successful paid request. */
    public void record(ProviderDescriptor provider) {
        Ledger ledger = ledgers.computeIfAbsent(provider.id(), id -> new Ledger());
        YearMonth month = YearMonth.now(clock);
        double spend;
        synchronized (ledger) {
            ledger.rollTo(month);
            ledger.requests++;
            ledger.spend += provider.costPerRequest();
            spend = ledger.spend;
        }
        if (provider.hasMonthlyBudget() && spend >= provider.monthlyBudget()
                && spend - provider.costPerRequest() < provider.monthlyBudget()) {
            log.warn("COST_BUDGET_EXHAUSTED provider={} month={} spend={} budget={}",
                     provider.id(), month, spend, provider.monthlyBudget());
        }
    }

    public boolean withinBudget(ProviderDescriptor provider) {
        if (provider.category() == ProviderCategory.GOVERNMENT || !provider.hasMonthlyBudget()) {
            return true;
        }
        return spend(provider.id()) < provider.monthlyBudget();
    }

    public double spend(String providerId) {
        Ledger ledger = ledgers.get(providerId);
        if (ledger == null) {
            return 0.0;
        }
        synchronized (ledger) {
            ledger.rollTo(YearMonth.now(clock));
            return ledger.spend;
        }
    }

    public Map<String, CostSnapshot> snapshot(Iterable<ProviderDescriptor> providers) {
        YearMonth month = YearMonth.now(clock);
        Map<String, CostSnapshot> out = new TreeMap<>();
        for (ProviderDescriptor p : providers) {
            Ledger ledger = ledgers.computeIfAbsent(p.id(), id -> new Ledger());
            synchronized (ledger) {
                ledger.rollTo(month);
                out.put(p.id(), new CostSnapshot(month, ledger.requests, ledger.spend,
                                                 p.monthlyBudget(), withinBudget(p)));
            }
        }
        return out;
    }

    private static final class Ledger {
        private YearMonth month;
        private long requests;
        private double spend;

        void rollTo(YearMonth current) {
            if (!current.equals(month)) {
                if (month != null) {
                    log.info("COST_MONTH_ROLLOVER from={} to={} requests={} spend={}",
                             month, current, requests, spend);
                }
                month = current;
                requests = 0;
                spend = 0.0;
            }
        }
    }
}
