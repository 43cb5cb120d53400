package com.example.guardianintake.service.ocr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps cloud OCR calls inside their free-tier quotas.
 * One token bucket per engine, refilled per minute and per day.
 */
@Service
public class RateLimiterService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiterService.class);

    private static final long MINUTE_MS = 60_000L;
    private static final long DAY_MS = 86_400_000L;

    @Value("${ocr.rate-limit.enabled:true}")
    private boolean enabled;

    @Value("${ocr.rate-limit.requests-per-minute:10}")
    private int requestsPerMinute;

    @Value("${ocr.rate-limit.requests-per-day:500}")
    private int requestsPerDay;

    private final ConcurrentHashMap<String, QuotaBucket> buckets = new ConcurrentHashMap<>();

    /**
     * Consumes one request from the engine's quota.
     *
     * @return false when the quota is spent and the call should be skipped
     */
    public boolean acquire(String engineName) {
        if (!enabled) {
            return true;
        }
        boolean allowed = bucketFor(engineName).acquire(System.currentTimeMillis());
        if (!allowed) {
            logger.warn("⚠️ Quota exhausted for {} ({}/min, {}/day)", engineName, requestsPerMinute, requestsPerDay);
        }
        return allowed;
    }

    /**
     * Checks the quota without consuming it.
     */
    public boolean wouldAllow(String engineName) {
        if (!enabled) {
            return true;
        }
        QuotaBucket bucket = buckets.get(engineName);
        return bucket == null || bucket.wouldAllow(System.currentTimeMillis());
    }

    public Map<String, Integer> remainingToday() {
        Map<String, Integer> remaining = new LinkedHashMap<>();
        buckets.forEach((name, bucket) -> remaining.put(name, bucket.remainingToday()));
        return remaining;
    }

    private QuotaBucket bucketFor(String engineName) {
        return buckets.computeIfAbsent(engineName, k -> new QuotaBucket(requestsPerMinute, requestsPerDay));
    }

    private static class QuotaBucket {
        private final int perMinute;
        private final int perDay;
        private int minuteTokens;
        private int dayTokens;
        private long minuteStart;
        private long dayStart;

        QuotaBucket(int perMinute, int perDay) {
            this.perMinute = perMinute;
            this.perDay = perDay;
            this.minuteTokens = perMinute;
            this.dayTokens = perDay;
            long now = System.currentTimeMillis();
            this.minuteStart = now;
            this.dayStart = now;
        }

        synchronized boolean acquire(long now) {
            refill(now);
            if (minuteTokens <= 0 || dayTokens <= 0) {
                return false;
            }
            minuteTokens--;
            dayTokens--;
            return true;
        }

        synchronized boolean wouldAllow(long now) {
            refill(now);
            return minuteTokens > 0 && dayTokens > 0;
        }

        synchronized int remainingToday() {
            return dayTokens;
        }

        private void refill(long now) {
            if (now - minuteStart >= MINUTE_MS) {
                minuteTokens = perMinute;
                minuteStart = now;
            }
            if (now - dayStart >= DAY_MS) {
                dayTokens = perDay;
                dayStart = now;
            }
        }
    }
}
