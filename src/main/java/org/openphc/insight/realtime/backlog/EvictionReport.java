package org.openphc.insight.realtime.backlog;

/**
 * Outcome of one eviction pass over every scope.
 */
public record EvictionReport(int scopesEvicted, long entriesEvicted, int hardBoundScopes, int failedScopes) {

    public static EvictionReport empty() {
        return new EvictionReport(0, 0, 0, 0);
    }

    public boolean hardBoundHit() {
        return hardBoundScopes > 0;
    }

    public EvictionReport plus(long entries, boolean hard) {
        return new EvictionReport(scopesEvicted + 1, entriesEvicted + entries,
                hardBoundScopes + (hard ? 1 : 0), failedScopes);
    }

    public EvictionReport plusFailure() {
        return new EvictionReport(scopesEvicted, entriesEvicted, hardBoundScopes, failedScopes + 1);
    }
}
