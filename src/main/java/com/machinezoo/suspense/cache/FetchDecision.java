// Part of Suspense
package com.machinezoo.suspense.cache;

/**
 * Outcome of {@link FetchPolicyResolver}.
 */
public enum FetchDecision {
	/**
	 * Keep using the entry's current handle. No fetch is started.
	 */
	REUSE,
	/**
	 * Create a handle that is already fulfilled with data from the store. Consumer does not suspend.
	 */
	READ_STORE,
	/**
	 * Start a new fetch. Consumer suspends until it settles.
	 */
	FETCH
}
