// Part of Suspense
package com.machinezoo.suspense.cache;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.junit.jupiter.api.*;
import com.machinezoo.suspense.*;
import com.machinezoo.suspense.client.*;

public class SuspenseCacheTest extends TestBase {
	private static final QueryDocument query = QueryDocument.query("Greeting", "query Greeting { greeting }");
	private static final RequestKey key = new RequestKey(query);
	private static QueryResult result(String greeting) {
		return new QueryResult(Collections.singletonMap("greeting", greeting));
	}
	private final AtomicInteger fetches = new AtomicInteger();
	private final List<CompletableFuture<QueryResult>> futures = new ArrayList<>();
	private final Supplier<FetchHandle> fetchFn = () -> {
		fetches.incrementAndGet();
		CompletableFuture<QueryResult> future = new CompletableFuture<>();
		synchronized (futures) {
			futures.add(future);
		}
		return new FetchHandle(future);
	};
	@Test
	public void create() {
		SuspenseCache cache = new SuspenseCache();
		CacheEntry entry = cache.getOrCreate(key, FetchPolicy.CACHE_FIRST, fetchFn);
		assertEquals(1, fetches.get());
		assertEquals(1, cache.size());
		assertEquals(1, entry.consumers());
		assertEquals(1, entry.fetches());
		assertEquals(EntryState.PENDING, entry.state());
		assertSame(FetchPolicy.CACHE_FIRST, entry.policy());
		// Second caller shares the entry and the fetch.
		assertSame(entry, cache.getOrCreate(new RequestKey(query, new HashMap<>()), FetchPolicy.CACHE_FIRST, fetchFn));
		assertEquals(1, fetches.get());
		assertEquals(2, entry.consumers());
		// Settlement resolves the entry.
		futures.get(0).complete(result("hello"));
		assertEquals(EntryState.RESOLVED, entry.state());
	}
	@Test
	public void release() {
		SuspenseCache cache = new SuspenseCache();
		CacheEntry entry = cache.getOrCreate(key, FetchPolicy.CACHE_FIRST, fetchFn);
		cache.retain(key);
		FetchHandle handle = entry.handle();
		// Partial release keeps the entry and its handle.
		cache.release(key);
		assertEquals(1, entry.consumers());
		assertSame(entry, cache.lookup(key).get());
		assertSame(handle, entry.handle());
		// The last release evicts.
		cache.release(key);
		assertEquals(0, cache.size());
		assertFalse(cache.lookup(key).isPresent());
		assertTrue(entry.evicted());
		assertEquals(EntryState.ABSENT, entry.state());
		assertNull(entry.handle());
		// Releasing absent key is a programming error.
		assertThrows(IllegalStateException.class, () -> cache.release(key));
		assertThrows(IllegalStateException.class, () -> cache.retain(key));
		// Eviction does not cancel the fetch.
		assertFalse(futures.get(0).isCancelled());
	}
	@Test
	public void lookup() {
		SuspenseCache cache = new SuspenseCache();
		assertFalse(cache.lookup(key).isPresent());
		CacheEntry entry = cache.getOrCreate(key, FetchPolicy.CACHE_FIRST, fetchFn);
		// Probes do not count as consumers.
		assertSame(entry, cache.lookup(new RequestKey(query)).get());
		assertSame(entry, cache.lookup(query).get());
		assertEquals(1, entry.consumers());
		assertThat(cache.entries(), contains(entry));
	}
	@Test
	public void replace() {
		SuspenseCache cache = new SuspenseCache();
		CacheEntry entry = cache.getOrCreate(key, FetchPolicy.CACHE_FIRST, fetchFn);
		FetchHandle first = entry.handle();
		QueryResult result = result("hello");
		futures.get(0).complete(result);
		FetchHandle second = cache.replace(entry, FetchPolicy.NETWORK_ONLY, fetchFn);
		assertNotSame(first, second);
		assertSame(second, entry.handle());
		assertSame(FetchPolicy.NETWORK_ONLY, entry.policy());
		assertEquals(EntryState.PENDING, entry.state());
		assertEquals(2, entry.fetches());
		assertEquals(1, entry.consumers());
		// The old handle keeps reporting its own result.
		assertSame(result, first.read());
		// Evicted entries cannot be replaced.
		cache.release(key);
		assertThrows(IllegalStateException.class, () -> cache.replace(entry, FetchPolicy.NETWORK_ONLY, fetchFn));
		assertEquals(2, fetches.get());
	}
	@Test
	public void settleFromStore() {
		SuspenseCache cache = new SuspenseCache();
		QueryResult result = result("stored");
		CacheEntry entry = cache.settle(key, FetchPolicy.CACHE_FIRST, result);
		// No fetch, entry is resolved immediately.
		assertEquals(0, entry.fetches());
		assertEquals(EntryState.RESOLVED, entry.state());
		assertSame(result, entry.handle().read());
		assertEquals(1, entry.consumers());
	}
	@Test
	public void failingFetch() {
		SuspenseCache cache = new SuspenseCache();
		assertThrows(IllegalStateException.class, () -> cache.getOrCreate(key, FetchPolicy.CACHE_FIRST, () -> {
			throw new IllegalStateException();
		}));
		// Nothing is left behind.
		assertEquals(0, cache.size());
	}
	@Test
	public void staleResult() {
		SuspenseCache cache = new SuspenseCache();
		CacheEntry entry = cache.getOrCreate(key, FetchPolicy.CACHE_FIRST, fetchFn);
		FetchHandle handle = entry.handle();
		cache.release(key);
		// Late result is silently discarded by the cache.
		QueryResult result = result("late");
		futures.get(0).complete(result);
		assertEquals(0, cache.size());
		// Anyone still holding the handle sees the result.
		assertSame(result, handle.read());
		// New consumer starts from scratch.
		CacheEntry fresh = cache.getOrCreate(key, FetchPolicy.CACHE_FIRST, fetchFn);
		assertNotSame(entry, fresh);
		assertEquals(2, fetches.get());
	}
	@Test
	public void follow() {
		MockQueryClient client = new MockQueryClient();
		SuspenseCache cache = new SuspenseCache();
		CacheEntry entry = cache.settle(key, FetchPolicy.CACHE_AND_NETWORK, result("initial"));
		cache.follow(entry, client);
		assertEquals(1, client.watchers(query, null));
		// Store writes refresh the current handle.
		QueryResult updated = result("updated");
		client.write(query, null, updated);
		assertSame(updated, entry.handle().read());
		// Replacing the handle closes the subscription.
		FetchHandle previous = entry.handle();
		cache.replace(entry, FetchPolicy.NETWORK_ONLY, fetchFn);
		assertEquals(0, client.watchers(query, null));
		client.write(query, null, result("ignored"));
		assertSame(updated, previous.read());
	}
	@Test
	public void followEvicted() {
		MockQueryClient client = new MockQueryClient();
		SuspenseCache cache = new SuspenseCache();
		CacheEntry entry = cache.settle(key, FetchPolicy.CACHE_AND_NETWORK, result("initial"));
		cache.follow(entry, client);
		FetchHandle handle = entry.handle();
		cache.release(key);
		// Eviction closes the subscription, so later store writes do not reach the handle.
		assertEquals(0, client.watchers(query, null));
		client.write(query, null, result("late"));
		assertEquals(result("initial"), handle.read());
		assertThrows(IllegalStateException.class, () -> cache.follow(entry, client));
	}
	@Test
	public void defaultPolicy() {
		SuspenseCache cache = new SuspenseCache();
		assertSame(FetchPolicy.CACHE_FIRST, cache.defaultPolicy());
		assertSame(cache, cache.defaultPolicy(FetchPolicy.NETWORK_ONLY));
		assertSame(FetchPolicy.NETWORK_ONLY, cache.defaultPolicy());
		assertThrows(InvalidFetchPolicyException.class, () -> cache.defaultPolicy(FetchPolicy.STANDBY));
	}
	@Test
	public void independent() {
		// Caches do not share entries.
		SuspenseCache first = new SuspenseCache();
		SuspenseCache second = new SuspenseCache();
		first.getOrCreate(key, FetchPolicy.CACHE_FIRST, fetchFn);
		assertEquals(0, second.size());
		second.getOrCreate(key, FetchPolicy.CACHE_FIRST, fetchFn);
		assertEquals(2, fetches.get());
	}
	@Test
	public void concurrent() throws Exception {
		SuspenseCache cache = new SuspenseCache();
		int threads = 8;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<CacheEntry>> entries = new ArrayList<>();
		for (int i = 0; i < threads; ++i) {
			entries.add(executor.submit(() -> {
				start.await();
				return cache.getOrCreate(new RequestKey(query, Collections.emptyMap()), FetchPolicy.CACHE_FIRST, fetchFn);
			}));
		}
		start.countDown();
		Set<CacheEntry> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
		for (Future<CacheEntry> entry : entries)
			distinct.add(entry.get(10, TimeUnit.SECONDS));
		executor.shutdown();
		// All threads share one entry and one fetch.
		assertEquals(1, distinct.size());
		assertEquals(1, fetches.get());
		assertEquals(threads, distinct.iterator().next().consumers());
	}
}
