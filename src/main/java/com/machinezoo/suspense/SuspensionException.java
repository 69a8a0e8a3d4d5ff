// Part of Suspense
package com.machinezoo.suspense;

/**
 * Exception thrown at the suspension point when requested data is not available yet.
 * <p>
 * Throwing this exception alone does not suspend anything.
 * The current render pass must be marked as suspended via {@link CurrentSuspenseScope#suspend()}.
 * Static {@link #suspend()} methods do both, which is what
 * {@link com.machinezoo.suspense.cache.QueryBinding#read()} uses when its handle is pending.
 * <p>
 * Renderers discard output of suspended passes, so the exception only serves to unwind the render function.
 * Code that can provide a fallback instead of throwing should do so and just call {@link CurrentSuspenseScope#suspend()},
 * because that lets the rest of the render pass start other fetches in parallel.
 *
 * @see CurrentSuspenseScope#suspend()
 * @see SuspenseRenderer
 */
public class SuspensionException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	/**
	 * Constructs new {@code SuspensionException} without suspending the current render pass.
	 *
	 * @param message
	 *            message, possibly {@code null}
	 * @param cause
	 *            cause, possibly {@code null}
	 */
	public SuspensionException(String message, Throwable cause) {
		super(message, cause);
	}
	public SuspensionException(String message) {
		this(message, null);
	}
	public SuspensionException() {
		this(null, null);
	}
	/**
	 * Suspends the current render pass and throws {@code SuspensionException} with the given message.
	 * Return type allows callers to write {@code throw SuspensionException.suspend(...)} to satisfy the compiler.
	 *
	 * @param message
	 *            message, possibly {@code null}
	 * @return never returns
	 */
	public static SuspensionException suspend(String message) {
		CurrentSuspenseScope.suspend();
		throw new SuspensionException(message);
	}
	public static SuspensionException suspend() {
		throw suspend(null);
	}
}
