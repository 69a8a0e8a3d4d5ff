// Part of Suspense
/**
 * Interface of the data-fetching client and the value types it exchanges with the cache.
 */
package com.machinezoo.suspense.client;
