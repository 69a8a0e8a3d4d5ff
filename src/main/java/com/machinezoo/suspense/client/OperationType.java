// Part of Suspense
package com.machinezoo.suspense.client;

/**
 * Kind of operation declared by a {@link QueryDocument}.
 * Only {@link #QUERY} can be used with suspense.
 */
public enum OperationType {
	QUERY,
	MUTATION,
	SUBSCRIPTION;
	/*
	 * Lowercase form is used in error messages, matching how operations are written in documents.
	 */
	public String keyword() {
		return name().toLowerCase();
	}
}
