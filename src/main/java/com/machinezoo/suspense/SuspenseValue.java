// Part of Suspense
package com.machinezoo.suspense;

import java.io.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;

/**
 * Output of a render pass or state of a fetch, consisting of result, exception, and suspension flag.
 * {@code SuspenseValue} is immutable.
 * <p>
 * Code running in a {@link SuspenseScope} communicates its output implicitly, through return value, exception,
 * and by calling {@link CurrentSuspenseScope#suspend()}.
 * {@code SuspenseValue} is the explicit form of the same output.
 * Use {@link #capture(Supplier)} to convert implicit output to explicit form and {@link #get()} to convert it back.
 * <p>
 * A value can be suspended and still carry result or exception.
 * This is how renderers and fetch handles express a fallback while data is still on the way.
 *
 * @param <T>
 *            type of the carried result
 *
 * @see SuspenseVariable
 * @see SuspenseScope
 */
@DraftDocs("suspension article link")
public class SuspenseValue<T> {
	private final T result;
	/**
	 * Gets the result, which may be {@code null} even when there is no exception.
	 *
	 * @return carried result or {@code null}
	 */
	public T result() {
		return result;
	}
	private final Throwable exception;
	/**
	 * Gets the carried exception.
	 *
	 * @return carried exception or {@code null}
	 */
	public Throwable exception() {
		return exception;
	}
	private final boolean suspended;
	/**
	 * Returns {@code true} if the computation that produced this value had to suspend.
	 *
	 * @return suspension flag
	 */
	public boolean suspended() {
		return suspended;
	}
	/**
	 * Constructs new {@code SuspenseValue} from its components.
	 *
	 * @param result
	 *            result, possibly {@code null}
	 * @param exception
	 *            exception, possibly {@code null}
	 * @param suspended
	 *            suspension flag
	 * @throws IllegalArgumentException
	 *             if both {@code result} and {@code exception} are non-{@code null}
	 */
	public SuspenseValue(T result, Throwable exception, boolean suspended) {
		if (result != null && exception != null)
			throw new IllegalArgumentException("Cannot carry both result and exception.");
		this.result = result;
		this.exception = exception;
		this.suspended = suspended;
	}
	public SuspenseValue() {
		this(null, null, false);
	}
	public SuspenseValue(T result) {
		this(result, null, false);
	}
	public SuspenseValue(Throwable exception) {
		this(null, exception, false);
	}
	public SuspenseValue(T result, boolean suspended) {
		this(result, null, suspended);
	}
	public SuspenseValue(Throwable exception, boolean suspended) {
		this(null, exception, suspended);
	}
	/**
	 * Unpacks the value into implicit output.
	 * Suspension flag is propagated to the current {@link SuspenseScope} via {@link CurrentSuspenseScope#suspend()}.
	 * Exception is thrown wrapped in {@link CompletionException}, which keeps the original stack trace intact.
	 *
	 * @return carried result
	 * @throws CompletionException
	 *             if this value carries an exception
	 */
	public T get() {
		if (suspended)
			CurrentSuspenseScope.suspend();
		if (exception != null)
			throw new CompletionException(exception);
		return result;
	}
	/**
	 * Runs {@code supplier} and captures its implicit output.
	 * If there is no current {@link SuspenseScope}, temporary scope is created, so that suspension is detected.
	 * Any exception, including {@link SuspensionException}, is captured rather than thrown.
	 *
	 * @param <T>
	 *            type of the result
	 * @param supplier
	 *            code to run
	 * @return captured output
	 */
	public static <T> SuspenseValue<T> capture(Supplier<T> supplier) {
		Objects.requireNonNull(supplier);
		if (SuspenseScope.current() != null)
			return captureScoped(supplier);
		try (CloseableScope pass = new SuspenseScope().enter()) {
			return captureScoped(supplier);
		}
	}
	private static <T> SuspenseValue<T> captureScoped(Supplier<T> supplier) {
		try {
			T result = supplier.get();
			return new SuspenseValue<>(result, CurrentSuspenseScope.suspended());
		} catch (Throwable ex) {
			return new SuspenseValue<>(ex, CurrentSuspenseScope.suspended());
		}
	}
	/*
	 * Exceptions do not implement equals(). Comparing printed stack traces catches the common case
	 * of the same failure reported twice without confusing different failures with identical messages.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof SuspenseValue))
			return false;
		SuspenseValue<?> other = (SuspenseValue<?>)obj;
		if (suspended != other.suspended)
			return false;
		if ((exception != null) != (other.exception != null))
			return false;
		return Objects.equals(result, other.result) && Objects.equals(dump(exception), dump(other.exception));
	}
	@Override
	public int hashCode() {
		return Objects.hash(result, dump(exception), suspended);
	}
	/**
	 * Compares components by reference.
	 * This is cheaper than {@link #equals(Object)} and it is what referential stability of results relies on.
	 *
	 * @param other
	 *            value to compare with, possibly {@code null}
	 * @return {@code true} if result and exception are the same objects and suspension flags match
	 */
	public boolean same(SuspenseValue<?> other) {
		return other != null && result == other.result && exception == other.exception && suspended == other.suspended;
	}
	private static String dump(Throwable exception) {
		if (exception == null)
			return null;
		StringWriter writer = new StringWriter();
		exception.printStackTrace(new PrintWriter(writer));
		return writer.toString();
	}
	@Override
	public String toString() {
		return (exception == null ? Objects.toString(result) : exception.toString()) + (suspended ? " [suspended]" : "");
	}
}
