// Part of Suspense
package com.machinezoo.suspense.cache;

import java.util.*;

/**
 * Rule deciding whether a request reuses stored data, goes to the network, or does both.
 * Policies that never produce a settling operation cannot be used with suspense
 * and are rejected with {@link InvalidFetchPolicyException}.
 */
public enum FetchPolicy {
	/**
	 * Answer from the store when it has the data, fetch otherwise.
	 */
	CACHE_FIRST("cache-first", true),
	/**
	 * Always fetch, write the result to the store.
	 */
	NETWORK_ONLY("network-only", true),
	/**
	 * Always fetch, never write the result to the store.
	 */
	NO_CACHE("no-cache", true),
	/**
	 * Fetch and keep following store updates for the request afterwards.
	 */
	CACHE_AND_NETWORK("cache-and-network", true),
	/**
	 * Read the store only. Never settles when the store is empty, so it cannot suspend.
	 */
	CACHE_ONLY("cache-only", false),
	/**
	 * Do not run at all until explicitly refetched. Cannot suspend.
	 */
	STANDBY("standby", false);
	private final String wire;
	private final boolean suspensible;
	FetchPolicy(String wire, boolean suspensible) {
		this.wire = wire;
		this.suspensible = suspensible;
	}
	/**
	 * Gets the hyphenated name used by clients and configuration, e.g. {@code cache-first}.
	 *
	 * @return hyphenated policy name
	 */
	public String wire() {
		return wire;
	}
	public boolean suspensible() {
		return suspensible;
	}
	/**
	 * Parses hyphenated policy name.
	 *
	 * @param wire
	 *            hyphenated name, e.g. {@code network-only}
	 * @return matching policy
	 * @throws IllegalArgumentException
	 *             if there is no such policy
	 */
	public static FetchPolicy parse(String wire) {
		Objects.requireNonNull(wire);
		for (FetchPolicy policy : values())
			if (policy.wire.equals(wire))
				return policy;
		throw new IllegalArgumentException("Unknown fetch policy: " + wire);
	}
	@Override
	public String toString() {
		return wire;
	}
}
