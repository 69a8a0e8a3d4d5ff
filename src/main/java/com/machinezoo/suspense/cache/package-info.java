// Part of Suspense
/**
 * Deduplicating query result cache with fetch policies and suspending reads.
 * Start with {@link com.machinezoo.suspense.cache.QueryBinding}.
 */
package com.machinezoo.suspense.cache;
