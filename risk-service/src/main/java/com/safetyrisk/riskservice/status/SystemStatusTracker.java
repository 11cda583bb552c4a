package com.safetyrisk.riskservice.status;

import com.safetyrisk.common.cache.EvaluationCache.CacheStats;
import com.safetyrisk.common.model.EvaluationReport;
import com.safetyrisk.common.model.ReportingPeriod;
import com.safetyrisk.common.model.RiskResult;
import com.safetyrisk.riskservice.config.RiskEngineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Remembers what the most recent evaluation covered and how fresh it is.
 *
 * <p>Observability state only: the engine never reads it.
 */
@Component
public class SystemStatusTracker {

    private record LastEvaluation(Instant at, ReportingPeriod latestPeriod,
                                  int neighborhoods, int rejected, int alerts) {}

    private final Clock clock;
    private final Duration freshnessThreshold;
    private final AtomicReference<LastEvaluation> last = new AtomicReference<>();
    private final AtomicLong evaluations = new AtomicLong();

    @Autowired
    public SystemStatusTracker(RiskEngineProperties properties, Clock clock) {
        this(properties.getStatus().getFreshnessThreshold(), clock);
    }

    public SystemStatusTracker(Duration freshnessThreshold, Clock clock) {
        if (freshnessThreshold == null || freshnessThreshold.isNegative() || freshnessThreshold.isZero()) {
            throw new IllegalArgumentException("Freshness threshold must be positive: " + freshnessThreshold);
        }
        this.freshnessThreshold = freshnessThreshold;
        this.clock = clock;
    }

    public void recordEvaluation(EvaluationReport report) {
        ReportingPeriod latest = report.results().stream()
            .map(RiskResult::latestPeriod)
            .max(Comparator.naturalOrder())
            .orElse(null);
        last.set(new LastEvaluation(clock.instant(), latest,
            report.results().size(), report.rejections().size(), report.alerts().size()));
        evaluations.incrementAndGet();
    }

    public SystemStatus snapshot(CacheStats cacheStats) {
        Instant now = clock.instant();
        LastEvaluation current = last.get();
        if (current == null) {
            return new SystemStatus(null, null, 0, 0, 0, evaluations.get(),
                cacheStats.hitRate(), cacheStats.entries(), true, now);
        }
        boolean stale = Duration.between(current.at(), now).compareTo(freshnessThreshold) > 0;
        return new SystemStatus(current.at(), current.latestPeriod(), current.neighborhoods(),
            current.rejected(), current.alerts(), evaluations.get(),
            cacheStats.hitRate(), cacheStats.entries(), stale, now);
    }
}
