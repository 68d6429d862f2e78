/**
 * Outbound call control: per-tenant {@link jobflow.ratelimit.RateLimiter}, request
 * coalescing with {@link jobflow.ratelimit.BatchAggregator} and model spend
 * accounting with {@link jobflow.ratelimit.CostTracker}.
 */
package jobflow.ratelimit;
