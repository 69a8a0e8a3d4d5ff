// Part of Suspense
/*
 * Diagnostic conventions shared by all objects in the library:
 * - Null check is performed on method parameters where appropriate.
 * - Exceptions that cannot be propagated, for example from trigger callbacks and store listeners, are logged.
 * - There is no other logging except debug messages about fetches, evictions, and discarded results.
 * - Metrics are exposed only by objects that generate events, i.e. the cache and the renderer.
 * - Opentracing spans are created only when SuspenseTrigger resumes its owner.
 * - Object's OwnerTrace has at least an alias. Identifying parameters of the object are added as tags.
 * - Child objects have their OwnerTrace parent set.
 * - Method toString() is defined. It uses OwnerTrace.toString().
 */
/**
 * Suspension primitives: render pass scope, observable variables, triggers, and a minimal renderer.
 */
package com.machinezoo.suspense;
