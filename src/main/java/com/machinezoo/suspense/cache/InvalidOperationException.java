// Part of Suspense
package com.machinezoo.suspense.cache;

import com.machinezoo.suspense.client.*;

/**
 * Thrown when a binding is given a document that is not a query, for example a mutation.
 */
public class InvalidOperationException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;
	private final OperationType operation;
	public OperationType operation() {
		return operation;
	}
	public InvalidOperationException(OperationType operation) {
		super("Running a query requires a query document, but a " + operation.keyword() + " was used instead.");
		this.operation = operation;
	}
}
