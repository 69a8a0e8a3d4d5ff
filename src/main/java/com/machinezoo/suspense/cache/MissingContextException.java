// Part of Suspense
package com.machinezoo.suspense.cache;

/**
 * Thrown from {@link QueryBinding#bind} when the binding was created without a {@link SuspenseCache}
 * or without a {@link com.machinezoo.suspense.client.QueryClient}.
 */
public class MissingContextException extends IllegalStateException {
	private static final long serialVersionUID = 1L;
	public MissingContextException(String message) {
		super(message);
	}
}
