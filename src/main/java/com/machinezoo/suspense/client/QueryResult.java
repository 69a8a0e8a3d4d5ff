// Part of Suspense
package com.machinezoo.suspense.client;

import java.util.*;

/**
 * Data returned for one query together with the variables it was fetched with.
 * Instances are immutable and compared by value.
 * Consumers may nevertheless rely on reference identity of results returned repeatedly from the same handle.
 */
public final class QueryResult {
	private final Map<String, Object> data;
	public Map<String, Object> data() {
		return data;
	}
	private final Map<String, Object> variables;
	public Map<String, Object> variables() {
		return variables;
	}
	public QueryResult(Map<String, Object> data, Map<String, Object> variables) {
		Objects.requireNonNull(data);
		this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
		this.variables = variables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Collections.emptyMap();
	}
	public QueryResult(Map<String, Object> data) {
		this(data, null);
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof QueryResult))
			return false;
		QueryResult other = (QueryResult)obj;
		return data.equals(other.data) && variables.equals(other.variables);
	}
	@Override
	public int hashCode() {
		return Objects.hash(data, variables);
	}
	@Override
	public String toString() {
		return "{data=" + data + ", variables=" + variables + "}";
	}
}
