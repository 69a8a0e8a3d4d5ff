// Part of Suspense
package com.machinezoo.suspense;

import java.util.*;
import org.slf4j.*;
import com.machinezoo.noexception.*;
import com.machinezoo.stagean.*;
import com.machinezoo.suspense.util.*;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * Resumption half of suspension. The trigger is armed on everything a finished render pass read,
 * usually the variable of the handle the pass suspended on, and the first change of any of it resumes the owner.
 * Resumption only runs the callback. Renderers use it to mark themselves stale and rerender when the host asks.
 */
@StubDocs
public class SuspenseTrigger implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(SuspenseTrigger.class);
	public enum Stage {
		IDLE,
		ARMED,
		FIRED,
		CLOSED
	}
	private final Runnable callback;
	public SuspenseTrigger(Runnable callback) {
		Objects.requireNonNull(callback);
		this.callback = callback;
		OwnerTrace.of(this).alias("trigger");
	}
	private Stage stage = Stage.IDLE;
	public synchronized Stage stage() {
		return stage;
	}
	private List<SuspenseVariable<?>> awaited = Collections.emptyList();
	/**
	 * Waits for a change of anything the pass read. If something already changed since the pass read it,
	 * the trigger fires before this method returns.
	 *
	 * @param pass
	 *            finished render pass
	 * @throws IllegalStateException
	 *             if the trigger was already armed or closed
	 */
	public void arm(SuspenseScope pass) {
		Objects.requireNonNull(pass);
		synchronized (this) {
			if (stage != Stage.IDLE)
				throw new IllegalStateException("Trigger can be armed only once, but it is " + stage + ".");
			stage = Stage.ARMED;
		}
		List<SuspenseVariable<?>> registered = new ArrayList<>();
		for (SuspenseVariable<?> variable : pass.dependencies()) {
			if (!variable.await(this, pass.version(variable))) {
				fire(variable);
				break;
			}
			registered.add(variable);
		}
		boolean late;
		synchronized (this) {
			late = stage == Stage.CLOSED;
			if (!late)
				awaited = registered;
		}
		if (late)
			cancel(registered);
	}
	/*
	 * Runs at most once. Callback exceptions are logged, because the writer that settled the handle
	 * must not fail on account of a broken consumer.
	 */
	void fire(SuspenseVariable<?> cause) {
		synchronized (this) {
			if (stage != Stage.ARMED)
				return;
			stage = Stage.FIRED;
		}
		Span span = GlobalTracer.get().buildSpan("suspense.resume")
			.withTag("component", "suspense")
			.withTag("cause", cause.toString())
			.start();
		OwnerTrace.of(this).fill(span);
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			Exceptions.log(logger).run(callback);
		} finally {
			span.finish();
		}
	}
	/**
	 * Stops waiting. A closed trigger never fires.
	 */
	@Override
	public void close() {
		List<SuspenseVariable<?>> cancelled;
		synchronized (this) {
			if (stage == Stage.CLOSED)
				return;
			stage = Stage.CLOSED;
			cancelled = awaited;
			awaited = Collections.emptyList();
		}
		cancel(cancelled);
	}
	private void cancel(List<SuspenseVariable<?>> variables) {
		for (SuspenseVariable<?> variable : variables)
			variable.cancel(this);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " [" + stage() + "]";
	}
}
