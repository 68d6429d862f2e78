package jobflow.ratelimit;

/**
 * Snapshot of one tenant's consumption against its limits.
 *
 * @param tenantId           the tenant
 * @param requestsLastMinute requests in the trailing 60 seconds
 * @param requestsThisHour   requests in the current hour window
 * @param requestsToday      requests in the current day window
 * @param tokensThisMinute   tokens reported in the current minute window
 * @param tokensToday        tokens reported in the current day window
 * @param costToday          cost reported in the current day window
 * @param burstAvailable     whole tokens left in the shared burst bucket
 * @param limits             the limits in force
 */
public record TenantUsage(
    String tenantId,
    int requestsLastMinute,
    int requestsThisHour,
    int requestsToday,
    long tokensThisMinute,
    long tokensToday,
    double costToday,
    int burstAvailable,
    RateLimitConfig limits) {
}
