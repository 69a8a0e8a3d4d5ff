// Part of Suspense
package com.machinezoo.suspense;

import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;
import com.machinezoo.suspense.util.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;

/*
 * Minimal rendering adapter. It plays the role of a component inside a suspense boundary:
 * run the render function, keep its output, notice when something it read has changed, render again when asked.
 * A suspended pass leaves output with the suspension flag set. The pass is rerun after
 * the handle it waited for settles, because the handle's variable is among the recorded dependencies.
 *
 * Advancement is explicit. Hosts decide when to rerender, tests do it synchronously.
 */
/**
 * Repeatedly evaluated render function with suspension and resumption support.
 *
 * @param <T>
 *            output type of the render function
 */
@StubDocs
public class SuspenseRenderer<T> implements AutoCloseable {
	private static final Timer timer = Metrics.timer("suspense.renderer.renders");
	private final SuspenseVariable<T> output;
	/*
	 * Kept separate from output, so that hosts can wait for staleness without depending on output changes.
	 */
	private final SuspenseVariable<Boolean> valid = OwnerTrace
		.of(new SuspenseVariable<>(false))
		.parent(this)
		.tag("role", "valid")
		.target();
	public SuspenseValue<T> output() {
		return output.value();
	}
	public boolean valid() {
		return valid.get();
	}
	private int renders;
	/**
	 * Counts render passes, including suspended ones.
	 *
	 * @return number of times the render function was invoked
	 */
	public synchronized int renders() {
		return renders;
	}
	private final Supplier<T> render;
	private SuspenseRenderer(SuspenseValue<T> initial, Supplier<T> render) {
		Objects.requireNonNull(initial);
		Objects.requireNonNull(render);
		OwnerTrace.of(this).alias("renderer");
		this.render = render;
		output = OwnerTrace
			.of(new SuspenseVariable<>(initial))
			.parent(this)
			.tag("role", "output")
			.target();
	}
	public static <T> SuspenseRenderer<T> supply(SuspenseValue<T> initial, Supplier<T> render) {
		return new SuspenseRenderer<>(initial, render);
	}
	/*
	 * Before the first pass, the renderer shows the boundary fallback, i.e. it is suspended.
	 */
	public static <T> SuspenseRenderer<T> supply(Supplier<T> render) {
		return supply(new SuspenseValue<>(new SuspensionException(), true), render);
	}
	private SuspenseTrigger trigger;
	private boolean closed;
	/**
	 * Runs another render pass if the last one is stale. Does nothing while the last pass is still valid or after {@link #close()}.
	 */
	@SuppressWarnings("resource")
	public synchronized void advance() {
		if (closed)
			return;
		if (trigger != null) {
			/*
			 * Depend on validity, so that a controlling pass gets rerun when this one becomes stale.
			 */
			valid.get();
			return;
		}
		SuspenseScope scope = OwnerTrace.of(new SuspenseScope())
			.parent(this)
			.target();
		++renders;
		try (CloseableScope pass = scope.enter()) {
			SuspenseValue<T> value = SuspenseValue.capture(() -> timer.record(render));
			valid.set(true);
			output.value(value);
		}
		/*
		 * Recorded after valid was set to true, otherwise the write above would invalidate the controlling pass immediately.
		 */
		valid.get();
		trigger = OwnerTrace
			.of(new SuspenseTrigger(this::invalidate))
			.parent(this)
			.target();
		/*
		 * Arming may fire inline when a handle settled during the pass. Invalidation then just clears the trigger again.
		 */
		trigger.arm(scope);
	}
	private synchronized void invalidate() {
		if (trigger != null) {
			trigger.close();
			trigger = null;
			valid.set(false);
		}
	}
	/*
	 * Equivalent of unmount. Output stays readable, but no further passes run and no invalidation is reported.
	 */
	@Override
	public synchronized void close() {
		closed = true;
		if (trigger != null) {
			trigger.close();
			trigger = null;
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + output.value();
	}
}
