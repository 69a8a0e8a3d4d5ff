// Part of Suspense
package com.machinezoo.suspense;

import java.util.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;
import com.machinezoo.suspense.util.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * One scope corresponds to one render pass. While the scope is active on the current thread,
 * every SuspenseVariable read during the pass is recorded here together with the version that was read.
 * The renderer later arms a trigger on the pass, which is how a suspended render learns
 * that the handle it was waiting for has settled.
 *
 * Scopes are not thread-safe. Render passes run on one thread. Nothing in the cache core
 * assumes a particular scheduler beyond that.
 */
/**
 * Thread-local context of a render pass that records data dependencies and suspension.
 */
@StubDocs
public class SuspenseScope {
	public SuspenseScope() {
		OwnerTrace.of(this).alias("scope");
	}
	private static final ThreadLocal<SuspenseScope> current = new ThreadLocal<SuspenseScope>();
	/*
	 * May return null. Code that must work outside of render passes should go through CurrentSuspenseScope.
	 */
	public static SuspenseScope current() {
		return current.get();
	}
	private SuspenseScope parent;
	/*
	 * Scopes nest. Each one remembers the scope it has shadowed and restores it when closed.
	 */
	public CloseableScope enter() {
		if (parent != null || current.get() == this)
			throw new IllegalStateException("Cannot enter the same scope recursively.");
		parent = current.get();
		current.set(this);
		return () -> {
			current.set(parent);
			parent = null;
		};
	}
	/*
	 * Cache bookkeeping reads variables too, for example handle state during policy resolution.
	 * Those reads must not become dependencies of the render pass.
	 */
	public static CloseableScope ignore() {
		SuspenseScope shadowed = current.get();
		current.set(null);
		return () -> current.set(shadowed);
	}
	/*
	 * Only the first version read matters. If the variable changed since, the pass is already stale.
	 */
	private final Object2LongMap<SuspenseVariable<?>> dependencies = new Object2LongOpenHashMap<>();
	void record(SuspenseVariable<?> variable, long version) {
		if (!dependencies.containsKey(variable))
			dependencies.put(variable, version);
	}
	public Set<SuspenseVariable<?>> dependencies() {
		return Collections.unmodifiableSet(dependencies.keySet());
	}
	/**
	 * Gets the version of the variable observed by the first read in this pass.
	 *
	 * @param variable
	 *            variable read during the pass
	 * @return observed version or 0 if the variable was not read
	 */
	public long version(SuspenseVariable<?> variable) {
		Objects.requireNonNull(variable);
		return dependencies.getLong(variable);
	}
	private boolean suspended;
	public boolean suspended() {
		return suspended;
	}
	/*
	 * There is no resume(). A suspended pass is thrown away and the renderer starts a fresh scope.
	 */
	public void suspend() {
		suspended = true;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
