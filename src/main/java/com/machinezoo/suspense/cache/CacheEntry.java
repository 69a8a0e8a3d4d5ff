// Part of Suspense
package com.machinezoo.suspense.cache;

import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;
import com.machinezoo.suspense.client.*;
import com.machinezoo.suspense.util.*;

/*
 * Shared state for one request key. All mutation happens in SuspenseCache while it holds its lock.
 * Fields are volatile, so that diagnostics and tests can read them without taking the lock.
 *
 * Consumer count is the only thing deciding entry lifetime. The entry does not know its consumers,
 * it only counts them, and eviction happens exactly when the count drops to zero.
 */
/**
 * Registry entry holding the current {@link FetchHandle} and consumer count for one {@link RequestKey}.
 */
@StubDocs
public class CacheEntry {
	private final RequestKey key;
	public RequestKey key() {
		return key;
	}
	private volatile FetchHandle handle;
	/**
	 * Gets the handle new consumers attach to.
	 * Consumers that attached earlier may still hold an older handle.
	 *
	 * @return current handle or {@code null} after eviction
	 */
	public FetchHandle handle() {
		return handle;
	}
	private volatile FetchPolicy policy;
	/**
	 * Gets the policy under which the current handle was created.
	 *
	 * @return policy of the current handle
	 */
	public FetchPolicy policy() {
		return policy;
	}
	private volatile int consumers;
	public int consumers() {
		return consumers;
	}
	private volatile int fetches;
	/**
	 * Counts fetches started for this entry. Handles created from a synchronous store read are not counted.
	 *
	 * @return number of fetches issued for this entry
	 */
	public int fetches() {
		return fetches;
	}
	private volatile boolean evicted;
	public boolean evicted() {
		return evicted;
	}
	/*
	 * Store subscription, present only while the current handle runs under cache-and-network and is fulfilled.
	 */
	private CloseableScope watch;
	CacheEntry(RequestKey key) {
		Objects.requireNonNull(key);
		this.key = key;
		OwnerTrace.of(this)
			.alias("entry")
			.tag("query", key.query().name())
			.tag("variables", key.digest());
	}
	/*
	 * Settlement is read from the future rather than from the handle's variable.
	 * Policy decisions must not become dependencies of the render pass that triggered them.
	 */
	public EntryState state() {
		FetchHandle current = handle;
		if (evicted || current == null)
			return EntryState.ABSENT;
		CompletableFuture<QueryResult> completable = current.completable();
		if (!completable.isDone())
			return EntryState.PENDING;
		return completable.isCompletedExceptionally() ? EntryState.REJECTED : EntryState.RESOLVED;
	}
	FetchHandle attach(FetchHandle handle, FetchPolicy policy, boolean fetched) {
		Objects.requireNonNull(handle);
		Objects.requireNonNull(policy);
		OwnerTrace.of(handle).parent(this).tag("policy", policy.wire());
		closeWatch();
		this.handle = handle;
		this.policy = policy;
		if (fetched)
			++fetches;
		return handle;
	}
	int retain() {
		return ++consumers;
	}
	int release() {
		if (consumers <= 0)
			throw new IllegalStateException("Entry has no consumers to release: " + key);
		return --consumers;
	}
	void watch(CloseableScope watch) {
		closeWatch();
		this.watch = watch;
	}
	void closeWatch() {
		if (watch != null) {
			CloseableScope closed = watch;
			watch = null;
			closed.close();
		}
	}
	void evict() {
		evicted = true;
		closeWatch();
		handle = null;
	}
	boolean current(FetchHandle handle) {
		return !evicted && this.handle == handle;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " [" + state() + ", " + consumers + " consumers]";
	}
}
