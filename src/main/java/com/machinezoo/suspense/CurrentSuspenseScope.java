// Part of Suspense
package com.machinezoo.suspense;

import com.machinezoo.stagean.*;

/*
 * Bindings are often used outside of any render pass, most notably in tests and in blocking adapters.
 * These helpers make that safe without null checks at every call site.
 */
/**
 * Null-safe access to the current {@link SuspenseScope}.
 * Calls are forwarded to {@link SuspenseScope#current()} when there is one.
 * Outside of any scope, methods fall back to harmless defaults.
 *
 * @see SuspenseScope
 */
@DraftDocs("render pass article link")
public class CurrentSuspenseScope {
	/**
	 * Marks the current render pass as suspended.
	 * Outside of any {@link SuspenseScope}, this method does nothing.
	 *
	 * @see SuspenseScope#suspend()
	 */
	public static void suspend() {
		SuspenseScope current = SuspenseScope.current();
		if (current != null)
			current.suspend();
	}
	/**
	 * Checks whether the current render pass is suspended.
	 *
	 * @return {@code true} if the current pass is suspended, {@code false} if it is not or if there is no current scope
	 *
	 * @see SuspenseScope#suspended()
	 */
	public static boolean suspended() {
		SuspenseScope current = SuspenseScope.current();
		return current != null && current.suspended();
	}
}
