// Part of Suspense
package com.machinezoo.suspense.cache;

import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;
import com.machinezoo.suspense.*;
import com.machinezoo.suspense.client.*;
import com.machinezoo.suspense.util.*;

/*
 * Awaitable handle for one fetch. The future is the source of truth, the variable is its observable mirror.
 * Render passes read the variable, which is what lets their triggers fire when the future completes.
 *
 * A handle is bound to exactly one fetch for its whole life. A later fetch for the same key gets a new handle,
 * so consumers still holding this one see it frozen in whatever state it reached.
 * The only post-settlement change is a store refresh under cache-and-network,
 * which the owning entry applies while the handle is still its current one.
 */
/**
 * Pending, fulfilled, or rejected fetch shared by all consumers of one {@link CacheEntry}.
 */
@StubDocs
public class FetchHandle {
	/**
	 * Settlement state of a {@link FetchHandle}.
	 */
	public enum State {
		PENDING,
		FULFILLED,
		REJECTED
	}
	private final CompletableFuture<QueryResult> completable;
	public CompletableFuture<QueryResult> completable() {
		return completable;
	}
	/*
	 * Refreshed result may be equal but distinct object. The variable treats it as a change,
	 * so consumers memoizing on identity see the new reference.
	 */
	private final SuspenseVariable<QueryResult> variable = OwnerTrace
		.of(new SuspenseVariable<QueryResult>(new SuspenseValue<>(null, null, true)))
		.parent(this)
		.target();
	/*
	 * Completion callback holds a strong reference to the handle, so a pending fetch keeps the handle alive
	 * even after its entry was evicted and nobody else references it.
	 */
	private void complete(QueryResult result, Throwable exception) {
		variable.value(new SuspenseValue<>(result, exception, false));
	}
	public FetchHandle(CompletableFuture<QueryResult> completable) {
		Objects.requireNonNull(completable);
		OwnerTrace.of(this).alias("handle");
		this.completable = completable;
		/*
		 * Runs inline when the future is already complete, so such handle is fulfilled before the constructor returns.
		 */
		completable.whenComplete(this::complete);
	}
	public static FetchHandle fulfilled(QueryResult result) {
		Objects.requireNonNull(result);
		return new FetchHandle(CompletableFuture.completedFuture(result));
	}
	public State state() {
		SuspenseValue<QueryResult> value = variable.value();
		if (value.suspended())
			return State.PENDING;
		return value.exception() != null ? State.REJECTED : State.FULFILLED;
	}
	public boolean pending() {
		return state() == State.PENDING;
	}
	public boolean fulfilled() {
		return state() == State.FULFILLED;
	}
	public boolean rejected() {
		return state() == State.REJECTED;
	}
	private QueryResult unpack(SuspenseValue<QueryResult> value) {
		if (value.exception() instanceof CancellationException)
			throw (CancellationException)value.exception();
		if (value.exception() != null)
			throw new CompletionException(value.exception());
		return value.result();
	}
	/**
	 * Returns the result or suspends.
	 * While pending, the current render pass is suspended and {@link SuspensionException} is thrown.
	 * When rejected, the failure is thrown wrapped in {@link CompletionException}.
	 * When fulfilled, the same result reference is returned every time until a store refresh replaces it.
	 *
	 * @return fetched result
	 * @throws SuspensionException
	 *             if the fetch is still pending
	 * @throws CompletionException
	 *             if the fetch failed
	 * @throws CancellationException
	 *             if the fetch was cancelled by the client
	 */
	public QueryResult read() {
		SuspenseValue<QueryResult> value = variable.value();
		if (value.suspended())
			throw SuspensionException.suspend("Waiting for " + this);
		return unpack(value);
	}
	/*
	 * Only fulfilled handles accept refreshes. A refresh racing with a pending fetch would otherwise
	 * let store data overtake the network result that this handle promises to report.
	 */
	boolean refresh(QueryResult result) {
		Objects.requireNonNull(result);
		synchronized (this) {
			SuspenseValue<QueryResult> current;
			try (CloseableScope ignored = SuspenseScope.ignore()) {
				current = variable.value();
			}
			if (current.suspended() || current.exception() != null || current.result() == result)
				return false;
			variable.value(new SuspenseValue<>(result));
		}
		return true;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
