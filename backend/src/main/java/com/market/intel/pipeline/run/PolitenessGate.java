package com.market.intel.pipeline.run;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Host-keyed next-allowed timestamps shared by every worker of one run.
 */
public class PolitenessGate {
    private final long perHostDelayMs;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PolitenessGate(long perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public void await(String host) throws InterruptedException {
        String key = key(host);
        Object lock = hostLocks.computeIfAbsent(key, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(key, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(key, Instant.now().plusMillis(perHostDelayMs));
        }
    }

    public void extendBackoff(String host, Duration duration) {
        String key = key(host);
        Object lock = hostLocks.computeIfAbsent(key, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(key, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(key, candidate);
            }
        }
    }

    public Instant nextAllowedAt(String host) {
        return hostNextAllowed.get(key(host));
    }

    private String key(String host) {
        return host == null ? "" : host.toLowerCase(Locale.ROOT);
    }
}
