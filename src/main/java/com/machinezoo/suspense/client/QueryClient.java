// Part of Suspense
package com.machinezoo.suspense.client;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;
import com.machinezoo.suspense.cache.*;

/**
 * Data-fetching client the cache delegates to.
 * The client owns transport, normalization, and the shared store.
 * The cache never calls {@link #fetch(QueryDocument, Map, FetchPolicy)} more than once per fetch decision.
 * <p>
 * Variables passed to the client are the caller's original (uncanonicalized) variables, never {@code null}.
 */
@DraftDocs("document thread requirements for implementations")
public interface QueryClient {
	/**
	 * Starts one network (or store) operation.
	 * The returned future may be already completed, for example when the client answers from its store.
	 * With {@link FetchPolicy#NO_CACHE}, the result must not be written to the shared store.
	 *
	 * @param query
	 *            query document
	 * @param variables
	 *            variables, possibly empty
	 * @param policy
	 *            fetch policy the operation runs under
	 * @return future completed with the result or with the failure
	 */
	CompletableFuture<QueryResult> fetch(QueryDocument query, Map<String, Object> variables, FetchPolicy policy);
	/**
	 * Synchronously checks whether the store can satisfy the request.
	 *
	 * @param query
	 *            query document
	 * @param variables
	 *            variables, possibly empty
	 * @return stored result or empty
	 */
	Optional<QueryResult> read(QueryDocument query, Map<String, Object> variables);
	/**
	 * Subscribes to store changes affecting the request.
	 * Listener may be called from any thread. Closing the returned scope unsubscribes.
	 *
	 * @param query
	 *            query document
	 * @param variables
	 *            variables, possibly empty
	 * @param listener
	 *            receives updated results
	 * @return subscription handle
	 */
	CloseableScope watch(QueryDocument query, Map<String, Object> variables, Consumer<QueryResult> listener);
}
