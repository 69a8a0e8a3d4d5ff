// Part of Suspense
package com.machinezoo.suspense;

import java.util.*;
import com.machinezoo.stagean.*;
import com.machinezoo.suspense.util.*;

/**
 * Observable cell holding a {@link SuspenseValue}.
 * <p>
 * {@link com.machinezoo.suspense.cache.FetchHandle} keeps its settlement state in one of these.
 * A render pass that reads the cell while the fetch is pending records the version it saw in its {@link SuspenseScope}.
 * The renderer then arms a {@link SuspenseTrigger} on that version, and the write that settles the fetch resumes the renderer.
 * <p>
 * A write is a change when it carries a different result or exception object or a different suspension flag.
 * Equal but distinct results are changes, because consumers memoize on result identity.
 *
 * @param <T>
 *            type of the carried result
 */
@DraftDocs("link to resumption article")
public class SuspenseVariable<T> {
	private SuspenseValue<T> value;
	private long version = 1;
	/*
	 * Waiters are held strongly. Every waiter is removed either by the next change or when its trigger is closed,
	 * and renderers close their triggers on every invalidation and on unmount.
	 */
	private List<SuspenseTrigger> waiters = new ArrayList<>();
	public SuspenseVariable(SuspenseValue<T> value) {
		Objects.requireNonNull(value);
		this.value = value;
		OwnerTrace.of(this).alias("var");
	}
	public SuspenseVariable(T value) {
		this(new SuspenseValue<>(value));
	}
	public SuspenseVariable() {
		this(new SuspenseValue<>());
	}
	/**
	 * Gets current version. Versions start at 1 and increase by one with every change.
	 *
	 * @return current version
	 */
	public synchronized long version() {
		return version;
	}
	/**
	 * Reads the value. Inside a {@link SuspenseScope}, the read is recorded together with the version it observed.
	 *
	 * @return current value
	 */
	public SuspenseValue<T> value() {
		SuspenseScope pass = SuspenseScope.current();
		synchronized (this) {
			if (pass != null)
				pass.record(this, version);
			return value;
		}
	}
	/**
	 * Writes new value. If it is a change, every trigger waiting on this variable fires
	 * on the calling thread after the variable's lock is released.
	 *
	 * @param value
	 *            new value
	 * @return {@code true} if the write was a change
	 */
	public boolean value(SuspenseValue<T> value) {
		Objects.requireNonNull(value);
		List<SuspenseTrigger> resumed;
		synchronized (this) {
			if (this.value.same(value))
				return false;
			this.value = value;
			++version;
			resumed = waiters;
			waiters = new ArrayList<>();
		}
		for (SuspenseTrigger trigger : resumed)
			trigger.fire(this);
		return true;
	}
	/*
	 * Version check and registration happen under one lock, so no change can slip between them.
	 * Returns false without registering when the observed version is already outdated.
	 */
	synchronized boolean await(SuspenseTrigger trigger, long observed) {
		if (observed != version)
			return false;
		waiters.add(trigger);
		return true;
	}
	synchronized void cancel(SuspenseTrigger trigger) {
		waiters.remove(trigger);
	}
	synchronized int waiters() {
		return waiters.size();
	}
	/**
	 * Reads and unpacks the value. Suspension and exceptions propagate as described in {@link SuspenseValue#get()}.
	 *
	 * @return carried result
	 */
	public T get() {
		return value().get();
	}
	public boolean set(T value) {
		return value(new SuspenseValue<>(value));
	}
	@Override
	public String toString() {
		SuspenseValue<T> current;
		int waiting;
		synchronized (this) {
			current = value;
			waiting = waiters();
		}
		return OwnerTrace.of(this) + " = " + current + (waiting > 0 ? " (" + waiting + " waiting)" : "");
	}
}
