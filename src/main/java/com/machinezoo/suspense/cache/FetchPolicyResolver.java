// Part of Suspense
package com.machinezoo.suspense.cache;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Decision table for one binding evaluation. It has no state and performs no I/O.
 * Whether the store has the data is passed in as a flag. Callers evaluate it lazily,
 * because only cache-first with an absent entry ever looks at it.
 *
 * Policy      | unchanged key | changed key, entry resolved | changed key or first bind, entry absent
 * ------------+---------------+-----------------------------+----------------------------------------
 * cache-first | reuse         | reuse                       | store has data ? read store : fetch
 * others      | reuse         | fetch (replaces handle)     | fetch
 *
 * A pending entry is always reused, whatever the policy. That keeps one fetch per key in flight.
 * A rejected entry holds no data, so it is reused only under an unchanged key.
 * Every other evaluation refetches and replaces its handle.
 */
/**
 * Decides whether a binding reuses a handle, reads the store synchronously, or starts a fetch.
 */
@StubDocs
public class FetchPolicyResolver {
	/**
	 * How the binding's request key relates to its previous evaluation.
	 */
	public enum KeyChange {
		/**
		 * Binding is evaluated for the first time.
		 */
		INITIAL,
		/**
		 * Key is structurally equal to the previously bound one.
		 */
		UNCHANGED,
		/**
		 * Key differs from the previously bound one in query or variables.
		 */
		CHANGED
	}
	/**
	 * Rejects policies that cannot suspend.
	 *
	 * @param policy
	 *            requested policy
	 * @return the same policy
	 * @throws InvalidFetchPolicyException
	 *             if the policy never settles
	 */
	public static FetchPolicy validate(FetchPolicy policy) {
		Objects.requireNonNull(policy);
		if (!policy.suspensible())
			throw new InvalidFetchPolicyException(policy);
		return policy;
	}
	/**
	 * Resolves one binding evaluation.
	 *
	 * @param policy
	 *            requested policy
	 * @param change
	 *            relation of the key to the previous evaluation of the same binding
	 * @param entry
	 *            state of the entry for the requested key
	 * @param stored
	 *            whether the store already holds data for the requested key
	 * @return what the binding should do
	 * @throws InvalidFetchPolicyException
	 *             if the policy cannot suspend
	 */
	public static FetchDecision resolve(FetchPolicy policy, KeyChange change, EntryState entry, boolean stored) {
		validate(policy);
		Objects.requireNonNull(change);
		Objects.requireNonNull(entry);
		if (entry == EntryState.PENDING)
			return FetchDecision.REUSE;
		if (entry == EntryState.REJECTED)
			return change == KeyChange.UNCHANGED ? FetchDecision.REUSE : FetchDecision.FETCH;
		if (entry == EntryState.RESOLVED) {
			if (change != KeyChange.CHANGED || policy == FetchPolicy.CACHE_FIRST)
				return FetchDecision.REUSE;
			return FetchDecision.FETCH;
		}
		/*
		 * Absent entry under unchanged key means it was evicted under the binding, which bindings never allow.
		 * It is handled like the first evaluation anyway.
		 */
		if (policy == FetchPolicy.CACHE_FIRST && stored)
			return FetchDecision.READ_STORE;
		return FetchDecision.FETCH;
	}
}
