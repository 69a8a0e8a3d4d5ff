// Part of Suspense
package com.machinezoo.suspense.cache;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.CloseableScope;
import com.machinezoo.noexception.*;
import com.machinezoo.stagean.*;
import com.machinezoo.suspense.client.*;
import com.machinezoo.suspense.util.*;
import io.micrometer.core.instrument.*;

/*
 * Registry of live entries. One lock guards everything: the entry map, consumer counts, handle replacement,
 * and the policy decisions QueryBinding makes while holding this object's monitor.
 *
 * Handles are created under the lock, but nothing that could fire triggers runs under it.
 * A freshly created handle has no subscribers yet, so even a fetch that completes inline is safe.
 * Store refreshes are applied after the lock is released.
 */
/**
 * Deduplicating registry of in-flight and settled fetches keyed by {@link RequestKey}.
 * Every consumer of the same key shares one {@link CacheEntry} and therefore one fetch.
 * Entries are removed as soon as their last consumer releases them.
 * <p>
 * Instances are independent. Applications usually create one per client.
 * All methods are thread-safe.
 */
@DraftDocs("explain interaction with QueryBinding")
public class SuspenseCache {
	private static final Logger logger = LoggerFactory.getLogger(SuspenseCache.class);
	private static final Counter fetchCount = Metrics.counter("suspense.cache.fetches");
	private static final Counter readCount = Metrics.counter("suspense.cache.reads");
	private static final Counter evictionCount = Metrics.counter("suspense.cache.evictions");
	private static final Counter discardCount = Metrics.counter("suspense.cache.discards");
	private static final Counter refreshCount = Metrics.counter("suspense.cache.refreshes");
	private final Map<RequestKey, CacheEntry> entries = new HashMap<>();
	private volatile FetchPolicy defaultPolicy = FetchPolicy.CACHE_FIRST;
	/**
	 * Gets the policy used by {@link QueryBinding#use(QueryDocument, Map)} and other overloads without explicit policy.
	 *
	 * @return default policy, {@link FetchPolicy#CACHE_FIRST} unless configured otherwise
	 */
	public FetchPolicy defaultPolicy() {
		return defaultPolicy;
	}
	/**
	 * Configures default policy.
	 *
	 * @param defaultPolicy
	 *            new default policy
	 * @return {@code this}
	 * @throws InvalidFetchPolicyException
	 *             if the policy cannot suspend
	 */
	public SuspenseCache defaultPolicy(FetchPolicy defaultPolicy) {
		this.defaultPolicy = FetchPolicyResolver.validate(defaultPolicy);
		return this;
	}
	public SuspenseCache() {
		OwnerTrace.of(this).alias("cache");
	}
	public synchronized int size() {
		return entries.size();
	}
	public synchronized List<CacheEntry> entries() {
		return new ArrayList<>(entries.values());
	}
	/**
	 * Read-only probe. Consumer counts are not changed.
	 *
	 * @param key
	 *            request key
	 * @return live entry or empty
	 */
	public synchronized Optional<CacheEntry> lookup(RequestKey key) {
		Objects.requireNonNull(key);
		return Optional.ofNullable(entries.get(key));
	}
	/*
	 * Convenience for diagnostics, queries without variables are common.
	 */
	public Optional<CacheEntry> lookup(QueryDocument query) {
		return lookup(new RequestKey(query));
	}
	/**
	 * Gets existing entry or creates a new one with a fresh fetch.
	 * The caller's interest is counted in both cases.
	 * Existing entry is returned as is, whether its handle is reused is up to the caller.
	 *
	 * @param key
	 *            request key
	 * @param policy
	 *            policy the new fetch runs under
	 * @param fetchFn
	 *            starts the fetch, called at most once and only when the entry does not exist
	 * @return live entry for the key
	 */
	public synchronized CacheEntry getOrCreate(RequestKey key, FetchPolicy policy, Supplier<FetchHandle> fetchFn) {
		Objects.requireNonNull(fetchFn);
		return create(key, policy, fetchFn, true);
	}
	/**
	 * Gets existing entry or creates one that is already resolved with data read from the store.
	 * No fetch is started. The caller's interest is counted.
	 *
	 * @param key
	 *            request key
	 * @param policy
	 *            policy of the binding that read the store
	 * @param result
	 *            result read synchronously from the store
	 * @return live entry for the key
	 */
	public synchronized CacheEntry settle(RequestKey key, FetchPolicy policy, QueryResult result) {
		Objects.requireNonNull(result);
		return create(key, policy, () -> FetchHandle.fulfilled(result), false);
	}
	private CacheEntry create(RequestKey key, FetchPolicy policy, Supplier<FetchHandle> supplier, boolean fetched) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(policy);
		CacheEntry entry = entries.get(key);
		if (entry != null) {
			entry.retain();
			return entry;
		}
		entry = OwnerTrace.of(new CacheEntry(key))
			.parent(this)
			.target();
		/*
		 * Entry is registered only after the supplier succeeds. A failing fetch function leaves nothing behind.
		 */
		FetchHandle handle = Objects.requireNonNull(supplier.get());
		attach(entry, handle, policy, fetched);
		entry.retain();
		entries.put(key, entry);
		return entry;
	}
	public synchronized CacheEntry retain(RequestKey key) {
		CacheEntry entry = live(key);
		entry.retain();
		return entry;
	}
	/**
	 * Releases one consumer. The last release evicts the entry.
	 * Pending fetch is not cancelled. Its result is discarded when it arrives.
	 *
	 * @param key
	 *            request key
	 * @throws IllegalStateException
	 *             if there is no live entry for the key
	 */
	public synchronized void release(RequestKey key) {
		CacheEntry entry = live(key);
		if (entry.release() == 0) {
			entries.remove(key);
			entry.evict();
			evictionCount.increment();
			logger.debug("Evicted {}.", entry.key());
		}
	}
	/**
	 * Starts a new fetch for a live entry and makes it the entry's current handle.
	 * Consumer count is preserved. Consumers holding the previous handle keep seeing it.
	 *
	 * @param entry
	 *            live entry
	 * @param policy
	 *            policy the new fetch runs under
	 * @param fetchFn
	 *            starts the fetch
	 * @return new current handle
	 * @throws IllegalStateException
	 *             if the entry was evicted
	 */
	public synchronized FetchHandle replace(CacheEntry entry, FetchPolicy policy, Supplier<FetchHandle> fetchFn) {
		Objects.requireNonNull(entry);
		Objects.requireNonNull(policy);
		Objects.requireNonNull(fetchFn);
		if (entries.get(entry.key()) != entry)
			throw new IllegalStateException("Cannot replace handle of evicted entry: " + entry.key());
		return attach(entry, Objects.requireNonNull(fetchFn.get()), policy, true);
	}
	/**
	 * Subscribes the entry's current handle to store updates.
	 * Updates refresh the handle only while it is fulfilled and still current.
	 * The subscription is closed when the handle is replaced or the entry is evicted.
	 *
	 * @param entry
	 *            live entry whose current handle should follow the store
	 * @param client
	 *            client owning the store
	 */
	public synchronized void follow(CacheEntry entry, QueryClient client) {
		Objects.requireNonNull(entry);
		Objects.requireNonNull(client);
		if (entries.get(entry.key()) != entry)
			throw new IllegalStateException("Cannot follow evicted entry: " + entry.key());
		FetchHandle handle = entry.handle();
		RequestKey key = entry.key();
		CloseableScope watch = client.watch(key.query(), key.variables(), Exceptions.log(logger).consumer(r -> refresh(entry, handle, r)));
		entry.watch(watch);
	}
	private FetchHandle attach(CacheEntry entry, FetchHandle handle, FetchPolicy policy, boolean fetched) {
		entry.attach(handle, policy, fetched);
		if (fetched) {
			fetchCount.increment();
			logger.debug("Fetching {} with policy {}.", entry.key(), policy);
		} else
			readCount.increment();
		/*
		 * Runs inline for handles that are already complete. The lock is reentrant, so that is fine.
		 */
		handle.completable().whenComplete((r, ex) -> settled(entry, handle, ex));
		return handle;
	}
	private synchronized void settled(CacheEntry entry, FetchHandle handle, Throwable exception) {
		if (!entry.current(handle)) {
			discardCount.increment();
			logger.debug("Discarded stale result for {}.", entry.key());
		} else if (exception != null)
			logger.debug("Fetch failed for {}.", entry.key(), exception);
	}
	private void refresh(CacheEntry entry, FetchHandle handle, QueryResult result) {
		synchronized (this) {
			if (!entry.current(handle)) {
				discardCount.increment();
				logger.debug("Discarded store update for {}.", entry.key());
				return;
			}
		}
		if (handle.refresh(result))
			refreshCount.increment();
	}
	private CacheEntry live(RequestKey key) {
		Objects.requireNonNull(key);
		CacheEntry entry = entries.get(key);
		if (entry == null)
			throw new IllegalStateException("No live entry for " + key);
		return entry;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " [" + size() + " entries]";
	}
}
