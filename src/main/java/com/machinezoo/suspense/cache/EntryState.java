// Part of Suspense
package com.machinezoo.suspense.cache;

/**
 * Lifecycle state of a {@link CacheEntry}.
 * Legal transitions are {@code ABSENT -> PENDING -> RESOLVED -> ABSENT} and the same with {@code REJECTED} in place of {@code RESOLVED},
 * {@code RESOLVED -> PENDING} and {@code REJECTED -> PENDING} when a new fetch replaces the handle,
 * and {@code PENDING -> ABSENT} when the last consumer leaves before the fetch settles.
 */
public enum EntryState {
	/**
	 * No entry for the key, or the entry was evicted.
	 */
	ABSENT,
	/**
	 * Entry exists and its current handle has not settled yet.
	 */
	PENDING,
	/**
	 * Entry exists and its current handle is fulfilled.
	 */
	RESOLVED,
	/**
	 * Entry exists and its current fetch failed or was cancelled.
	 */
	REJECTED
}
