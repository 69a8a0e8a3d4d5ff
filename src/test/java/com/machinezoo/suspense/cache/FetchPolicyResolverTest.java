// Part of Suspense
package com.machinezoo.suspense.cache;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.*;
import org.junit.jupiter.params.provider.*;
import com.machinezoo.suspense.cache.FetchPolicyResolver.KeyChange;

public class FetchPolicyResolverTest {
	@ParameterizedTest
	@EnumSource(value = FetchPolicy.class, names = { "CACHE_ONLY", "STANDBY" })
	public void unsuspensible(FetchPolicy policy) {
		InvalidFetchPolicyException ex = assertThrows(InvalidFetchPolicyException.class, () -> FetchPolicyResolver.validate(policy));
		assertEquals("The fetch policy `" + policy.wire() + "` is not supported with suspense.", ex.getMessage());
		assertSame(policy, ex.policy());
		// Resolution fails the same way regardless of entry state.
		assertThrows(InvalidFetchPolicyException.class, () -> FetchPolicyResolver.resolve(policy, KeyChange.INITIAL, EntryState.RESOLVED, true));
	}
	@ParameterizedTest
	@EnumSource(value = FetchPolicy.class, names = { "CACHE_FIRST", "NETWORK_ONLY", "NO_CACHE", "CACHE_AND_NETWORK" })
	public void pending(FetchPolicy policy) {
		// In-flight fetch is never duplicated.
		for (KeyChange change : KeyChange.values())
			assertEquals(FetchDecision.REUSE, FetchPolicyResolver.resolve(policy, change, EntryState.PENDING, false));
	}
	@ParameterizedTest
	@EnumSource(value = FetchPolicy.class, names = { "CACHE_FIRST", "NETWORK_ONLY", "NO_CACHE", "CACHE_AND_NETWORK" })
	public void unchanged(FetchPolicy policy) {
		assertEquals(FetchDecision.REUSE, FetchPolicyResolver.resolve(policy, KeyChange.UNCHANGED, EntryState.RESOLVED, true));
		assertEquals(FetchDecision.REUSE, FetchPolicyResolver.resolve(policy, KeyChange.UNCHANGED, EntryState.RESOLVED, false));
	}
	@ParameterizedTest
	@EnumSource(value = FetchPolicy.class, names = { "CACHE_FIRST", "NETWORK_ONLY", "NO_CACHE", "CACHE_AND_NETWORK" })
	public void join(FetchPolicy policy) {
		// Second consumer joins resolved entry.
		assertEquals(FetchDecision.REUSE, FetchPolicyResolver.resolve(policy, KeyChange.INITIAL, EntryState.RESOLVED, false));
	}
	@ParameterizedTest
	@EnumSource(value = FetchPolicy.class, names = { "CACHE_FIRST", "NETWORK_ONLY", "NO_CACHE", "CACHE_AND_NETWORK" })
	public void rejected(FetchPolicy policy) {
		// Failure is stable for the consumer that saw it.
		assertEquals(FetchDecision.REUSE, FetchPolicyResolver.resolve(policy, KeyChange.UNCHANGED, EntryState.REJECTED, false));
		// Everybody else retries, cache-first included.
		assertEquals(FetchDecision.FETCH, FetchPolicyResolver.resolve(policy, KeyChange.INITIAL, EntryState.REJECTED, false));
		assertEquals(FetchDecision.FETCH, FetchPolicyResolver.resolve(policy, KeyChange.CHANGED, EntryState.REJECTED, false));
	}
	@Test
	public void cacheFirst() {
		assertEquals(FetchDecision.READ_STORE, FetchPolicyResolver.resolve(FetchPolicy.CACHE_FIRST, KeyChange.INITIAL, EntryState.ABSENT, true));
		assertEquals(FetchDecision.FETCH, FetchPolicyResolver.resolve(FetchPolicy.CACHE_FIRST, KeyChange.INITIAL, EntryState.ABSENT, false));
		assertEquals(FetchDecision.READ_STORE, FetchPolicyResolver.resolve(FetchPolicy.CACHE_FIRST, KeyChange.CHANGED, EntryState.ABSENT, true));
		assertEquals(FetchDecision.FETCH, FetchPolicyResolver.resolve(FetchPolicy.CACHE_FIRST, KeyChange.CHANGED, EntryState.ABSENT, false));
		assertEquals(FetchDecision.REUSE, FetchPolicyResolver.resolve(FetchPolicy.CACHE_FIRST, KeyChange.CHANGED, EntryState.RESOLVED, false));
	}
	@ParameterizedTest
	@EnumSource(value = FetchPolicy.class, names = { "NETWORK_ONLY", "NO_CACHE", "CACHE_AND_NETWORK" })
	public void network(FetchPolicy policy) {
		// Store contents are irrelevant.
		assertEquals(FetchDecision.FETCH, FetchPolicyResolver.resolve(policy, KeyChange.INITIAL, EntryState.ABSENT, true));
		assertEquals(FetchDecision.FETCH, FetchPolicyResolver.resolve(policy, KeyChange.CHANGED, EntryState.ABSENT, true));
		// Changed key refetches even when somebody else holds a resolved entry.
		assertEquals(FetchDecision.FETCH, FetchPolicyResolver.resolve(policy, KeyChange.CHANGED, EntryState.RESOLVED, true));
	}
}
