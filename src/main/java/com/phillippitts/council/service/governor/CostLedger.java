package com.phillippitts.council.service.governor;

import com.phillippitts.council.config.properties.CostGovernorProperties;
import com.phillippitts.council.domain.BudgetScope;
import com.phillippitts.council.domain.QueryCostSummary;
import com.phillippitts.council.exception.AdmissionDeniedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only ledger of priced calls and the source of truth for budget decisions.
 *
 * <p>Admission works in two steps. {@link #reserve} checks the day and query budgets against
 * the spend derived from the ledger entries plus all in-flight reservations, and holds the
 * estimate if both fit. {@link #record} swaps the reservation for the real entry. Both steps
 * run under one short lock, so concurrent queries cannot both pass a check that only one of
 * them fits into. No gateway call ever happens under the lock.
 *
 * <p>The daily budget resets at midnight in the configured zone. Entries older than the
 * retention window are dropped from memory; a {@link LedgerSink} persists them if configured.
 */
@Component
public class CostLedger {

    private static final Logger LOG = LogManager.getLogger(CostLedger.class);

    private final CostGovernorProperties properties;
    private final Clock clock;
    private final List<LedgerSink> sinks;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<LedgerEntry> entries = new ArrayDeque<>();
    private final Map<Long, Reservation> pending = new LinkedHashMap<>();
    private long nextSequence = 1;
    private long nextReservation = 1;

    @Autowired
    public CostLedger(CostGovernorProperties properties, Clock clock, ObjectProvider<LedgerSink> sinks) {
        this(properties, clock, sinks.orderedStream().toList());
    }

    public CostLedger(CostGovernorProperties properties, Clock clock) {
        this(properties, clock, List.<LedgerSink>of());
    }

    CostLedger(CostGovernorProperties properties, Clock clock, List<LedgerSink> sinks) {
        this.properties = properties;
        this.clock = clock;
        this.sinks = List.copyOf(sinks);
    }

    /**
     * Holds {@code estimate} against both budgets.
     *
     * @throws AdmissionDeniedException if the estimate would push day or query spend past its
     *                                  limit; nothing is held in that case
     */
    public Reservation reserve(String queryId, double estimate) {
        lock.lock();
        try {
            double daySpent = daySpentLocked(startOfToday());
            if (daySpent + estimate > properties.getDailyLimit()) {
                throw new AdmissionDeniedException(BudgetScope.DAY, daySpent, estimate, properties.getDailyLimit());
            }
            double querySpent = querySpentLocked(queryId);
            if (querySpent + estimate > properties.getQueryLimit()) {
                throw new AdmissionDeniedException(BudgetScope.QUERY, querySpent, estimate, properties.getQueryLimit());
            }
            Reservation reservation = new Reservation(nextReservation++, queryId, estimate);
            pending.put(reservation.id(), reservation);
            return reservation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks that the day still has budget left before a query starts.
     *
     * @throws AdmissionDeniedException if the daily budget is exhausted
     */
    public void checkDayOpen() {
        lock.lock();
        try {
            double daySpent = daySpentLocked(startOfToday());
            if (daySpent >= properties.getDailyLimit()) {
                throw new AdmissionDeniedException(BudgetScope.DAY, daySpent, 0.0, properties.getDailyLimit());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the reservation and appends the real outcome.
     *
     * @return the appended entry
     */
    LedgerEntry record(Reservation reservation, CallRecord call) {
        LedgerEntry entry;
        boolean overran = call.cost() > reservation.amount();
        lock.lock();
        try {
            pending.remove(reservation.id());
            Instant now = clock.instant();
            Instant dayStart = startOfToday();
            double querySpent = querySpentLocked(reservation.queryId()) + call.cost();
            double daySpent = daySpentLocked(dayStart) + call.cost();
            entry = new LedgerEntry(nextSequence++, now, reservation.queryId(), call.workspace(),
                    call.purpose(), call.backendId(), call.promptTokens(), call.completionTokens(),
                    call.latencyMs(), call.cost(), call.success(), call.failureKind(),
                    List.of(BudgetBalance.of(BudgetScope.QUERY, querySpent, properties.getQueryLimit()),
                            BudgetBalance.of(BudgetScope.DAY, daySpent, properties.getDailyLimit())));
            entries.addLast(entry);
            pruneLocked(now);
        } finally {
            lock.unlock();
        }
        if (overran) {
            LOG.warn("Call to {} for query {} cost {} against a reservation of {}; query balance now {}",
                    call.backendId(), reservation.queryId(), call.cost(), reservation.amount(),
                    entry.balances().get(0).remaining());
        }
        publish(entry);
        return entry;
    }

    /**
     * Drops a reservation whose call never produced an outcome. No-op if already recorded.
     */
    void release(Reservation reservation) {
        lock.lock();
        try {
            pending.remove(reservation.id());
        } finally {
            lock.unlock();
        }
    }

    public BudgetBalance dayBalance() {
        lock.lock();
        try {
            return BudgetBalance.of(BudgetScope.DAY, daySpentLocked(startOfToday()), properties.getDailyLimit());
        } finally {
            lock.unlock();
        }
    }

    public BudgetBalance queryBalance(String queryId) {
        lock.lock();
        try {
            return BudgetBalance.of(BudgetScope.QUERY, querySpentLocked(queryId), properties.getQueryLimit());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of all retained entries in append order.
     */
    public List<LedgerEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public List<LedgerEntry> entriesFor(String queryId) {
        lock.lock();
        try {
            List<LedgerEntry> result = new ArrayList<>();
            for (LedgerEntry e : entries) {
                if (e.queryId().equals(queryId)) {
                    result.add(e);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public QueryCostSummary summarize(String queryId, long elapsedMs) {
        double cost = 0.0;
        int calls = 0;
        int failed = 0;
        long tokens = 0;
        for (LedgerEntry e : entriesFor(queryId)) {
            cost += e.cost();
            calls++;
            if (!e.success()) {
                failed++;
            }
            tokens += e.totalTokens();
        }
        return new QueryCostSummary(queryId, cost, calls, failed, tokens, elapsedMs);
    }

    /**
     * Per-day totals for the last {@code days} days including today, oldest first.
     */
    public CostReport report(int days) {
        requireWindow(days);
        ZoneId zone = properties.getResetZone();
        LocalDate today = LocalDate.ofInstant(clock.instant(), zone);
        LocalDate first = today.minusDays(days - 1L);

        Map<LocalDate, double[]> totals = new LinkedHashMap<>();
        for (LocalDate d = first; !d.isAfter(today); d = d.plusDays(1)) {
            totals.put(d, new double[3]);
        }
        for (LedgerEntry e : entries()) {
            double[] t = totals.get(LocalDate.ofInstant(e.timestamp(), zone));
            if (t != null) {
                t[0] += e.cost();
                t[1]++;
                if (!e.success()) {
                    t[2]++;
                }
            }
        }
        List<DailyCost> result = new ArrayList<>(days);
        double total = 0.0;
        for (Map.Entry<LocalDate, double[]> e : totals.entrySet()) {
            double[] t = e.getValue();
            result.add(new DailyCost(e.getKey(), t[0], (int) t[1], (int) t[2]));
            total += t[0];
        }
        return new CostReport(result, total, total / days, properties.getDailyLimit(), dayBalance());
    }

    /**
     * Per-backend totals for the last {@code days} days including today.
     *
     * @param backendId restricts the report to one backend; null for all
     */
    public BackendReport backendReport(int days, String backendId) {
        requireWindow(days);
        ZoneId zone = properties.getResetZone();
        Instant since = LocalDate.ofInstant(clock.instant(), zone).minusDays(days - 1L)
                .atStartOfDay(zone).toInstant();

        Map<String, BackendTotals> totals = new LinkedHashMap<>();
        for (LedgerEntry e : entries()) {
            if (e.timestamp().isBefore(since) || (backendId != null && !backendId.equals(e.backendId()))) {
                continue;
            }
            totals.computeIfAbsent(e.backendId(), id -> new BackendTotals()).add(e);
        }
        List<BackendStats> stats = new ArrayList<>(totals.size());
        double total = 0.0;
        for (Map.Entry<String, BackendTotals> e : totals.entrySet()) {
            BackendStats s = e.getValue().toStats(e.getKey());
            stats.add(s);
            total += s.totalCost();
        }
        stats.sort(Comparator.comparingDouble(BackendStats::totalCost).reversed()
                .thenComparing(BackendStats::backendId));
        return new BackendReport(days, stats, total);
    }

    public int retentionDays() {
        return properties.getLedgerRetentionDays();
    }

    private void requireWindow(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be positive, got: " + days);
        }
        if (days > properties.getLedgerRetentionDays()) {
            throw new IllegalArgumentException("days must not exceed the ledger retention of "
                    + properties.getLedgerRetentionDays() + ", got: " + days);
        }
    }

    private double daySpentLocked(Instant dayStart) {
        double spent = 0.0;
        Iterator<LedgerEntry> it = entries.descendingIterator();
        while (it.hasNext()) {
            LedgerEntry e = it.next();
            if (e.timestamp().isBefore(dayStart)) {
                break;
            }
            spent += e.cost();
        }
        for (Reservation r : pending.values()) {
            spent += r.amount();
        }
        return spent;
    }

    private double querySpentLocked(String queryId) {
        double spent = 0.0;
        for (LedgerEntry e : entries) {
            if (e.queryId().equals(queryId)) {
                spent += e.cost();
            }
        }
        for (Reservation r : pending.values()) {
            if (r.queryId().equals(queryId)) {
                spent += r.amount();
            }
        }
        return spent;
    }

    private Instant startOfToday() {
        ZoneId zone = properties.getResetZone();
        return LocalDate.ofInstant(clock.instant(), zone).atStartOfDay(zone).toInstant();
    }

    private void pruneLocked(Instant now) {
        ZoneId zone = properties.getResetZone();
        Instant horizon = LocalDate.ofInstant(now, zone)
                .minusDays(properties.getLedgerRetentionDays())
                .atStartOfDay(zone).toInstant();
        while (!entries.isEmpty() && entries.peekFirst().timestamp().isBefore(horizon)) {
            entries.removeFirst();
        }
    }

    private void publish(LedgerEntry entry) {
        for (LedgerSink sink : sinks) {
            try {
                sink.append(entry);
            } catch (RuntimeException e) {
                LOG.error("Ledger sink {} failed for entry seq={}", sink.getClass().getSimpleName(),
                        entry.sequence(), e);
            }
        }
    }

    private static final class BackendTotals {
        private double cost;
        private int calls;
        private int failed;
        private long latencyMs;
        private long tokens;

        void add(LedgerEntry e) {
            cost += e.cost();
            calls++;
            if (!e.success()) {
                failed++;
            }
            latencyMs += e.latencyMs();
            tokens += e.totalTokens();
        }

        BackendStats toStats(String backendId) {
            double successRate = calls == 0 ? 0.0 : (double) (calls - failed) / calls;
            double avgLatency = calls == 0 ? 0.0 : (double) latencyMs / calls;
            return new BackendStats(backendId, cost, calls, failed, successRate, avgLatency, tokens);
        }
    }
}
