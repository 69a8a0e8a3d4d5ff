// Part of Suspense
package com.machinezoo.suspense.cache;

/**
 * Thrown when a binding requests a {@link FetchPolicy} that cannot suspend.
 * It is always thrown synchronously from {@link QueryBinding#bind} or {@link QueryBinding#rebind},
 * never deferred into a suspended state.
 */
public class InvalidFetchPolicyException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;
	private final FetchPolicy policy;
	public FetchPolicy policy() {
		return policy;
	}
	public InvalidFetchPolicyException(FetchPolicy policy) {
		super("The fetch policy `" + policy.wire() + "` is not supported with suspense.");
		this.policy = policy;
	}
}
