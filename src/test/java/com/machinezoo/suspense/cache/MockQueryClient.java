// Part of Suspense
package com.machinezoo.suspense.cache;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.suspense.client.*;

/*
 * In-memory client. Responses are registered per request, fetches either complete immediately
 * or wait until the test completes them. Results are written to the store unless the policy is no-cache.
 */
public class MockQueryClient implements QueryClient {
	private final Map<RequestKey, QueryResult> responses = new HashMap<>();
	private final Map<RequestKey, QueryResult> store = new HashMap<>();
	private final Map<RequestKey, List<CompletableFuture<QueryResult>>> pending = new HashMap<>();
	private final Map<RequestKey, List<Consumer<QueryResult>>> watchers = new HashMap<>();
	private final Map<RequestKey, Integer> fetches = new HashMap<>();
	private final List<FetchPolicy> policies = new ArrayList<>();
	private boolean immediate;
	public synchronized MockQueryClient immediate(boolean immediate) {
		this.immediate = immediate;
		return this;
	}
	/*
	 * Failing fetches and watches throw from the client call itself instead of returning a future or subscription.
	 */
	private boolean failFetches;
	public synchronized MockQueryClient failFetches(boolean failFetches) {
		this.failFetches = failFetches;
		return this;
	}
	private boolean failWatches;
	public synchronized MockQueryClient failWatches(boolean failWatches) {
		this.failWatches = failWatches;
		return this;
	}
	public synchronized MockQueryClient respond(QueryDocument query, Map<String, Object> variables, Map<String, Object> data) {
		responses.put(new RequestKey(query, variables), new QueryResult(data, variables));
		return this;
	}
	public synchronized int fetches() {
		return fetches.values().stream().mapToInt(n -> n).sum();
	}
	public synchronized int fetches(QueryDocument query, Map<String, Object> variables) {
		return fetches.getOrDefault(new RequestKey(query, variables), 0);
	}
	public synchronized List<FetchPolicy> policies() {
		return new ArrayList<>(policies);
	}
	public synchronized Optional<QueryResult> stored(QueryDocument query, Map<String, Object> variables) {
		return Optional.ofNullable(store.get(new RequestKey(query, variables)));
	}
	public synchronized int watchers(QueryDocument query, Map<String, Object> variables) {
		return watchers.getOrDefault(new RequestKey(query, variables), Collections.emptyList()).size();
	}
	@Override
	public CompletableFuture<QueryResult> fetch(QueryDocument query, Map<String, Object> variables, FetchPolicy policy) {
		RequestKey key = new RequestKey(query, variables);
		CompletableFuture<QueryResult> future = new CompletableFuture<>();
		boolean complete;
		synchronized (this) {
			if (failFetches)
				throw new IllegalStateException("Client is offline.");
			fetches.merge(key, 1, Integer::sum);
			policies.add(policy);
			complete = immediate;
			if (!complete)
				pending.computeIfAbsent(key, k -> new ArrayList<>()).add(future);
		}
		future.thenAccept(r -> {
			if (policy != FetchPolicy.NO_CACHE)
				write(query, variables, r);
		});
		if (complete)
			future.complete(response(key));
		return future;
	}
	private synchronized QueryResult response(RequestKey key) {
		QueryResult response = responses.get(key);
		if (response == null)
			throw new IllegalStateException("No response for " + key);
		return response;
	}
	private synchronized CompletableFuture<QueryResult> next(QueryDocument query, Map<String, Object> variables) {
		List<CompletableFuture<QueryResult>> futures = pending.get(new RequestKey(query, variables));
		if (futures == null || futures.isEmpty())
			throw new IllegalStateException("No pending fetch for " + query);
		return futures.remove(0);
	}
	/*
	 * Completes the oldest pending fetch for the request.
	 */
	public QueryResult complete(QueryDocument query, Map<String, Object> variables) {
		QueryResult result = response(new RequestKey(query, variables));
		next(query, variables).complete(result);
		return result;
	}
	public void fail(QueryDocument query, Map<String, Object> variables, Throwable exception) {
		next(query, variables).completeExceptionally(exception);
	}
	/*
	 * Writes to the store and notifies watchers, like a normalized cache would after any write touching the request.
	 */
	public void write(QueryDocument query, Map<String, Object> variables, QueryResult result) {
		RequestKey key = new RequestKey(query, variables);
		List<Consumer<QueryResult>> notified;
		synchronized (this) {
			store.put(key, result);
			notified = new ArrayList<>(watchers.getOrDefault(key, Collections.emptyList()));
		}
		for (Consumer<QueryResult> listener : notified)
			listener.accept(result);
	}
	@Override
	public synchronized Optional<QueryResult> read(QueryDocument query, Map<String, Object> variables) {
		return stored(query, variables);
	}
	@Override
	public synchronized CloseableScope watch(QueryDocument query, Map<String, Object> variables, Consumer<QueryResult> listener) {
		if (failWatches)
			throw new IllegalStateException("Store is unavailable.");
		RequestKey key = new RequestKey(query, variables);
		List<Consumer<QueryResult>> listeners = watchers.computeIfAbsent(key, k -> new ArrayList<>());
		listeners.add(listener);
		return () -> {
			synchronized (this) {
				listeners.remove(listener);
			}
		};
	}
}
