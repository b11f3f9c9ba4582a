package org.openphc.insight.realtime.delivery;

/**
 * Identity established from a verified access token.
 */
public record AuthenticatedPrincipal(String userId, String tenantId) {
}
