// Part of Suspense
package com.machinezoo.suspense.cache;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;
import com.machinezoo.suspense.*;
import com.machinezoo.suspense.cache.FetchPolicyResolver.KeyChange;
import com.machinezoo.suspense.client.*;
import com.machinezoo.suspense.util.*;

/*
 * One binding per consumer, typically one per component instance. The binding holds at most one unit of interest
 * in the cache at a time, which is what makes unbind() the only thing needed to avoid leaks.
 *
 * Lock order is binding, then cache. Renderers call bindings from their render pass,
 * so the full order is renderer, binding, cache. Nothing takes these locks in reverse.
 */
/**
 * Attaches one consumer to a shared {@link CacheEntry}.
 * The consumer calls {@link #bind(QueryDocument, Map, FetchPolicy)} once, {@link #rebind(QueryDocument, Map, FetchPolicy)}
 * whenever its inputs might have changed, {@link #read()} to obtain the result, and {@link #unbind()} on teardown.
 * Render functions usually call {@link #use(QueryDocument, Map, FetchPolicy)}, which does all of it except teardown.
 */
@DraftDocs("document examples")
public class QueryBinding implements AutoCloseable {
	private final QueryClient client;
	private final SuspenseCache cache;
	/**
	 * Creates unbound binding. Both parameters may be {@code null},
	 * which makes every subsequent bind fail with {@link MissingContextException}.
	 *
	 * @param client
	 *            client performing fetches or {@code null}
	 * @param cache
	 *            cache shared by consumers or {@code null}
	 */
	public QueryBinding(QueryClient client, SuspenseCache cache) {
		this.client = client;
		this.cache = cache;
		OwnerTrace.of(this).alias("binding");
		if (cache != null)
			OwnerTrace.of(this).parent(cache);
	}
	private RequestKey key;
	public synchronized RequestKey key() {
		return key;
	}
	private FetchPolicy policy;
	public synchronized FetchPolicy policy() {
		return policy;
	}
	private FetchHandle handle;
	public synchronized FetchHandle handle() {
		return handle;
	}
	public synchronized boolean bound() {
		return key != null;
	}
	/*
	 * Everything here fails before the cache is touched, so invalid requests never suspend.
	 */
	private void validate(QueryDocument query, FetchPolicy policy) {
		if (cache == null)
			throw new MissingContextException("Could not find a suspense cache. Create the binding with a SuspenseCache instance.");
		if (client == null)
			throw new MissingContextException("Could not find a query client. Create the binding with a QueryClient instance.");
		Objects.requireNonNull(query);
		Objects.requireNonNull(policy);
		if (query.operation() != OperationType.QUERY)
			throw new InvalidOperationException(query.operation());
		FetchPolicyResolver.validate(policy);
	}
	/**
	 * Registers interest in the request and attaches to its entry, starting a fetch if needed.
	 *
	 * @param query
	 *            query document
	 * @param variables
	 *            variables or {@code null} for none
	 * @param policy
	 *            fetch policy
	 * @return handle attached to the binding
	 * @throws MissingContextException
	 *             if the binding has no cache or no client
	 * @throws InvalidOperationException
	 *             if the document is not a query
	 * @throws InvalidFetchPolicyException
	 *             if the policy cannot suspend
	 * @throws IllegalStateException
	 *             if the binding is already bound
	 */
	public synchronized FetchHandle bind(QueryDocument query, Map<String, Object> variables, FetchPolicy policy) {
		validate(query, policy);
		if (key != null)
			throw new IllegalStateException("Binding is already bound to " + key);
		return attach(new RequestKey(query, variables), policy, KeyChange.INITIAL);
	}
	/**
	 * Re-evaluates the binding with possibly changed inputs.
	 * Structurally equal request keeps its entry and adopts the entry's current handle.
	 * Different request binds the new key first and only then releases the old one.
	 *
	 * @param query
	 *            query document
	 * @param variables
	 *            variables or {@code null} for none
	 * @param policy
	 *            fetch policy
	 * @return handle attached to the binding
	 * @throws MissingContextException
	 *             if the binding has no cache or no client
	 * @throws InvalidOperationException
	 *             if the document is not a query
	 * @throws InvalidFetchPolicyException
	 *             if the policy cannot suspend
	 * @throws IllegalStateException
	 *             if the binding is not bound
	 */
	public synchronized FetchHandle rebind(QueryDocument query, Map<String, Object> variables, FetchPolicy policy) {
		validate(query, policy);
		if (key == null)
			throw new IllegalStateException("Binding is not bound.");
		RequestKey requested = new RequestKey(query, variables);
		if (requested.equals(key))
			return attach(requested, policy, KeyChange.UNCHANGED);
		RequestKey previous = key;
		FetchHandle attached = attach(requested, policy, KeyChange.CHANGED);
		cache.release(previous);
		return attached;
	}
	private FetchHandle attach(RequestKey requested, FetchPolicy policy, KeyChange change) {
		synchronized (cache) {
			CacheEntry entry = cache.lookup(requested).orElse(null);
			EntryState state = entry != null ? entry.state() : EntryState.ABSENT;
			/*
			 * Only cache-first with absent entry looks at the store. Other cases skip the read entirely.
			 */
			Optional<QueryResult> stored = state == EntryState.ABSENT && policy == FetchPolicy.CACHE_FIRST
				? client.read(requested.query(), requested.variables())
				: Optional.empty();
			FetchDecision decision = FetchPolicyResolver.resolve(policy, change, state, stored.isPresent());
			Supplier<FetchHandle> fetchFn = () -> OwnerTrace
				.of(new FetchHandle(client.fetch(requested.query(), requested.variables(), policy)))
				.tag("key", requested.digest())
				.target();
			FetchHandle attached;
			switch (decision) {
			case REUSE:
				if (change != KeyChange.UNCHANGED)
					cache.retain(requested);
				attached = entry.handle();
				break;
			case READ_STORE:
				attached = cache.settle(requested, policy, stored.get()).handle();
				break;
			case FETCH:
				boolean counted = entry == null || change != KeyChange.UNCHANGED;
				if (entry == null)
					entry = cache.getOrCreate(requested, policy, fetchFn);
				else {
					/*
					 * Interest is counted only after the client accepted the fetch.
					 * When it throws, the binding stays where it was and the count is untouched.
					 */
					cache.replace(entry, policy, fetchFn);
					if (counted)
						cache.retain(requested);
				}
				if (policy == FetchPolicy.CACHE_AND_NETWORK) {
					try {
						cache.follow(entry, client);
					} catch (RuntimeException ex) {
						if (counted)
							cache.release(requested);
						throw ex;
					}
				}
				attached = entry.handle();
				break;
			default:
				throw new IllegalStateException();
			}
			key = requested;
			this.policy = policy;
			handle = attached;
			return attached;
		}
	}
	/**
	 * Releases interest in the bound entry. Calling it again or on unbound binding does nothing.
	 */
	public synchronized void unbind() {
		if (key != null) {
			RequestKey released = key;
			key = null;
			policy = null;
			handle = null;
			cache.release(released);
		}
	}
	@Override
	public void close() {
		unbind();
	}
	/**
	 * Reads the bound handle. This is the only place where the binding suspends.
	 *
	 * @return result of the bound handle, same reference on repeated calls until the handle changes
	 * @throws SuspensionException
	 *             if the bound handle is still pending
	 * @throws java.util.concurrent.CompletionException
	 *             if the fetch failed
	 * @throws IllegalStateException
	 *             if the binding is not bound
	 */
	public QueryResult read() {
		FetchHandle current;
		synchronized (this) {
			if (handle == null)
				throw new IllegalStateException("Binding is not bound.");
			current = handle;
		}
		return current.read();
	}
	/**
	 * Binds on the first call, rebinds on later calls, then reads.
	 * This is the usual way to consume queries from a render function.
	 *
	 * @param query
	 *            query document
	 * @param variables
	 *            variables or {@code null} for none
	 * @param policy
	 *            fetch policy
	 * @return query result
	 * @throws SuspensionException
	 *             if the result is not available yet
	 */
	public QueryResult use(QueryDocument query, Map<String, Object> variables, FetchPolicy policy) {
		synchronized (this) {
			if (key == null)
				bind(query, variables, policy);
			else
				rebind(query, variables, policy);
		}
		return read();
	}
	public QueryResult use(QueryDocument query, Map<String, Object> variables) {
		return use(query, variables, cache != null ? cache.defaultPolicy() : FetchPolicy.CACHE_FIRST);
	}
	public QueryResult use(QueryDocument query) {
		return use(query, null);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + Objects.toString(key, "unbound");
	}
}
