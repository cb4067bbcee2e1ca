package com.mikov.emailvalidator.dns;

import com.mikov.emailvalidator.util.GoldenRatio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Domain-keyed cache of DNS lookup results.
 * <p>
 * Entries live for {@code baseTtl * PHI^(priority - 3)}, where the priority (1..5) is
 * derived from the looked-up data, so domains with MX records on well-known providers
 * stay cached longer. When the cache grows past its capacity it keeps the
 * highest-priority, latest-expiring entries. Failed lookups are returned but never stored.
 * <p>
 * Reads are lock-free; inserts and the eviction pass that follows them share one lock.
 * Concurrent misses for the same domain share a single in-flight lookup.
 *
 * @author zahari.mikov
 */
public class DnsResultCache {
    private static final Logger logger = LoggerFactory.getLogger(DnsResultCache.class);

    static final int DEFAULT_PRIORITY = 3;
    static final int MIN_PRIORITY = 1;
    static final int MAX_PRIORITY = 5;

    private static final Comparator<DomainDnsRecord> RETENTION_ORDER =
            Comparator.comparingInt(DomainDnsRecord::priority).reversed()
                    .thenComparing(DomainDnsRecord::expiresAt, Comparator.reverseOrder());

    private final Map<String, DomainDnsRecord> cache = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<DnsLookupResult>> pendingLookups = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    private final DnsResolver resolver;
    private final Executor lookupExecutor;
    private final Clock clock;
    private final Duration baseTtl;
    private final int capacity;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public DnsResultCache(final DnsResolver resolver, final Executor lookupExecutor, final Clock clock,
                          final Duration baseTtl, final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        if (baseTtl == null || baseTtl.isNegative() || baseTtl.isZero()) {
            throw new IllegalArgumentException("Base TTL must be positive: " + baseTtl);
        }
        this.resolver = resolver;
        this.lookupExecutor = lookupExecutor;
        this.clock = clock;
        this.baseTtl = baseTtl;
        this.capacity = capacity;
    }

    /**
     * Returns what is known about the domain's DNS, looking it up when there is no live
     * entry. The returned future never completes exceptionally: resolver failures surface
     * as a result with {@code hasDns == false} and an error code. Callers that miss while
     * a lookup for the domain is already running join it instead of starting another.
     */
    public CompletableFuture<DnsLookupResult> resolve(final String domain) {
        final var key = normalizeDomain(domain);
        final var cached = get(key);
        if (cached != null) {
            hits.incrementAndGet();
            logger.debug("DNS cache hit for {}", key);
            return CompletableFuture.completedFuture(cached);
        }

        final var pending = new CompletableFuture<DnsLookupResult>();
        final var inFlight = pendingLookups.putIfAbsent(key, pending);
        if (inFlight != null) {
            hits.incrementAndGet();
            logger.debug("Joining in-flight DNS lookup for {}", key);
            return inFlight.copy();
        }
        misses.incrementAndGet();

        CompletableFuture<DnsLookupResult> lookup;
        try {
            lookup = lookup(key);
        } catch (final RuntimeException e) {
            lookup = CompletableFuture.completedFuture(failureResult(key, e));
        }
        lookup.whenComplete((result, ex) -> {
            pendingLookups.remove(key, pending);
            pending.complete(result);
        });
        return pending.copy();
    }

    /**
     * Returns the cached lookup for a domain, or {@code null} when absent or expired.
     * Expired entries are dropped on the way out.
     */
    public DnsLookupResult get(final String domain) {
        final var record = getRecord(domain);
        return record != null ? record.result() : null;
    }

    public DomainDnsRecord getRecord(final String domain) {
        final var key = normalizeDomain(domain);
        final var record = cache.get(key);
        if (record == null) {
            return null;
        }
        if (record.isExpired(clock.instant())) {
            cache.remove(key, record);
            return null;
        }
        return record;
    }

    public DomainDnsRecord put(final String domain, final DnsLookupResult result) {
        return put(domain, result, baseTtl);
    }

    /**
     * Stores a lookup result. Priority and TTL are computed from the result and the entry
     * is inserted in one step, after which the cache is trimmed back to capacity.
     *
     * @param ttl base TTL before the priority adjustment
     */
    public DomainDnsRecord put(final String domain, final DnsLookupResult result, final Duration ttl) {
        final var key = normalizeDomain(domain);
        synchronized (writeLock) {
            final var priority = calculatePriority(result);
            final var adjustedTtl = calculateTtl(ttl, priority);
            final var record = new DomainDnsRecord(key, result, clock.instant().plus(adjustedTtl), priority);
            cache.put(key, record);
            maintain();
            return record;
        }
    }

    /**
     * Scores how much a lookup is worth keeping: 3, +1 with MX records, +1 when any MX is a
     * popular provider, -1 without any DNS, clamped to [1,5].
     */
    public int calculatePriority(final DnsLookupResult result) {
        if (result == null) {
            return DEFAULT_PRIORITY;
        }
        var priority = DEFAULT_PRIORITY;
        if (result.isHasMx()) {
            priority++;
        }
        if (result.getMxRecords().stream().anyMatch(MailExchange::popular)) {
            priority++;
        }
        if (!result.isHasDns()) {
            priority--;
        }
        return Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priority));
    }

    public static Duration calculateTtl(final Duration base, final int priority) {
        return Duration.ofMillis((long) Math.floor(base.toMillis() * Math.pow(GoldenRatio.PHI, priority - DEFAULT_PRIORITY)));
    }

    /**
     * Splits a capacity into the three golden-ratio sections used for retention.
     */
    static int[] retentionSections(final int capacity) {
        final var section1 = (int) Math.floor(capacity / (GoldenRatio.PHI * GoldenRatio.PHI));
        final var section2 = (int) Math.floor(capacity / GoldenRatio.PHI);
        final var section3 = capacity - section1 - section2;
        return new int[] {section1, section2, section3};
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int clearExpired() {
        final var now = clock.instant();
        var removed = 0;
        for (final var entry : cache.entrySet()) {
            if (entry.getValue().isExpired(now) && cache.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Removed {} expired DNS cache entries", removed);
        }
        return removed;
    }

    public int size() {
        return cache.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public CacheStatistics getStatistics() {
        return new CacheStatistics(cache.size(), capacity, hits.get(), misses.get(), evictions.get());
    }

    // Caller must hold writeLock.
    private void maintain() {
        if (cache.size() <= capacity) {
            return;
        }
        final var sections = retentionSections(capacity);
        final var retained = sections[0] + sections[1] + sections[2];

        final List<DomainDnsRecord> ranked = cache.values().stream()
                .sorted(RETENTION_ORDER)
                .toList();

        var evicted = 0;
        for (final var record : ranked.subList(retained, ranked.size())) {
            if (cache.remove(record.domain(), record)) {
                evicted++;
            }
        }
        evictions.addAndGet(evicted);
        logger.debug("DNS cache over capacity, evicted {} entries, {} retained", evicted, cache.size());
    }

    private CompletableFuture<DnsLookupResult> lookup(final String key) {
        final var started = System.nanoTime();
        final var mxFuture = CompletableFuture.supplyAsync(() -> lookupMx(key), lookupExecutor);
        final var aFuture = CompletableFuture.supplyAsync(() -> lookupA(key), lookupExecutor);

        return mxFuture.thenCombine(aFuture, (mxRecords, aRecords) ->
                        buildResult(key, mxRecords, aRecords, Duration.ofNanos(System.nanoTime() - started).toMillis()))
                .thenApply(result -> {
                    put(key, result);
                    return result;
                })
                .exceptionally(ex -> failureResult(key, ex));
    }

    private List<MxRecord> lookupMx(final String domain) {
        try {
            return resolver.resolveMx(domain);
        } catch (final DnsLookupException e) {
            throw new CompletionException(e);
        }
    }

    private List<String> lookupA(final String domain) {
        try {
            return resolver.resolveA(domain);
        } catch (final DnsLookupException e) {
            throw new CompletionException(e);
        }
    }

    private static DnsLookupResult buildResult(final String domain, final List<MxRecord> mxRecords,
                                               final List<String> aRecords, final long responseTimeMs) {
        final var mx = mxRecords == null ? List.<MxRecord>of() : mxRecords;
        final var a = aRecords == null ? List.<String>of() : List.copyOf(aRecords);
        final var hasMx = !mx.isEmpty();
        final var hasValidA = !a.isEmpty();
        return DnsLookupResult.builder()
                .domain(domain)
                .hasMx(hasMx)
                .hasValidA(hasValidA)
                .hasDns(hasMx || hasValidA)
                .mxRecords(MailProviderTable.normalize(mx))
                .aRecords(a)
                .responseTimeMs(responseTimeMs)
                .build();
    }

    private static DnsLookupResult failureResult(final String domain, final Throwable error) {
        var cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof DnsLookupException lookupException) {
            final var code = lookupException.getErrorCode();
            final var message = switch (code) {
                case DOMAIN_NOT_FOUND -> "Domain " + domain + " does not exist";
                case DNS_TIMEOUT -> "DNS lookup timeout for " + domain;
                case DNS_ERROR -> lookupException.getMessage();
            };
            logger.warn("DNS lookup failed for {}: {}", domain, code);
            return DnsLookupResult.failure(domain, code, message);
        }
        logger.warn("DNS lookup failed for {}: {}", domain, cause.getMessage());
        return DnsLookupResult.failure(domain, DnsErrorCode.DNS_ERROR, cause.getMessage());
    }

    private static String normalizeDomain(final String domain) {
        return domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
    }
}
