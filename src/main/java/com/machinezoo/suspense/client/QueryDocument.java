// Part of Suspense
package com.machinezoo.suspense.client;

import java.util.*;
import com.machinezoo.stagean.*;
import com.machinezoo.suspense.util.*;

/*
 * Parsing and validation of documents belong to the client. The cache only needs a stable identity
 * and the operation type, so this is a plain value object the client produces after parsing.
 * Two documents parsed from the same source are the same query for deduplication purposes.
 */
/**
 * Parsed request document as seen by the cache.
 */
@StubDocs
public final class QueryDocument {
	private final String name;
	/**
	 * Gets operation name, which is used only for diagnostics.
	 *
	 * @return operation name, possibly empty for anonymous operations
	 */
	public String name() {
		return name;
	}
	private final OperationType operation;
	public OperationType operation() {
		return operation;
	}
	private final String source;
	public String source() {
		return source;
	}
	private final int hashCode;
	public QueryDocument(OperationType operation, String name, String source) {
		Objects.requireNonNull(operation);
		Objects.requireNonNull(name);
		Objects.requireNonNull(source);
		this.operation = operation;
		this.name = name;
		this.source = source;
		hashCode = Objects.hash(operation, source);
		OwnerTrace.of(this)
			.alias("document")
			.tag("operation", operation.keyword())
			.tag("name", name.isEmpty() ? null : name);
	}
	public static QueryDocument query(String name, String source) {
		return new QueryDocument(OperationType.QUERY, name, source);
	}
	public static QueryDocument mutation(String name, String source) {
		return new QueryDocument(OperationType.MUTATION, name, source);
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof QueryDocument))
			return false;
		QueryDocument other = (QueryDocument)obj;
		return operation == other.operation && source.equals(other.source);
	}
	@Override
	public int hashCode() {
		return hashCode;
	}
	@Override
	public String toString() {
		return operation.keyword() + (name.isEmpty() ? "" : " " + name);
	}
}
