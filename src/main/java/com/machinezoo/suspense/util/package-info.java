// Part of Suspense
/**
 * Diagnostic helpers.
 */
package com.machinezoo.suspense.util;
