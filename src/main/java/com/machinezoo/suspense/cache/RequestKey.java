// Part of Suspense
package com.machinezoo.suspense.cache;

import java.lang.reflect.Array;
import java.math.*;
import java.util.*;
import com.machinezoo.stagean.*;
import com.machinezoo.suspense.client.*;

/*
 * Deduplication is only as good as key equality. Callers rebuild variable maps on every render,
 * so equality must be structural and insensitive to map ordering and boxed number types.
 * The canonical form is computed once in the constructor and the key is immutable afterwards.
 */
/**
 * Identity of a request: query document plus canonicalized variables.
 * Two keys are equal when their documents are equal and their variables are deep-equal,
 * regardless of object identity, map ordering, or number types.
 * Arrays, including primitive ones, are compared like lists.
 * Integral floating-point numbers are equal to the corresponding integers, so {@code 1.0} and {@code 1} make the same key.
 */
@DraftDocs("document canonicalization rules in detail")
public final class RequestKey {
	private final QueryDocument query;
	public QueryDocument query() {
		return query;
	}
	/*
	 * Callers' variables are kept for the client. The canonical copy is used only for equality.
	 */
	private final Map<String, Object> variables;
	public Map<String, Object> variables() {
		return variables;
	}
	private final Map<String, Object> canonical;
	private final int hashCode;
	public RequestKey(QueryDocument query, Map<String, Object> variables) {
		Objects.requireNonNull(query);
		this.query = query;
		this.variables = variables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Collections.emptyMap();
		@SuppressWarnings("unchecked") Map<String, Object> canonical = (Map<String, Object>)canonicalize(this.variables);
		this.canonical = canonical;
		hashCode = Objects.hash(query, canonical);
	}
	public RequestKey(QueryDocument query) {
		this(query, null);
	}
	private static Object canonicalize(Object value) {
		if (value instanceof Map) {
			Map<String, Object> sorted = new TreeMap<>();
			for (Map.Entry<?, ?> entry : ((Map<?, ?>)value).entrySet())
				sorted.put(String.valueOf(entry.getKey()), canonicalize(entry.getValue()));
			return Collections.unmodifiableMap(sorted);
		}
		if (value instanceof List) {
			List<Object> list = new ArrayList<>();
			for (Object item : (List<?>)value)
				list.add(canonicalize(item));
			return Collections.unmodifiableList(list);
		}
		/*
		 * Covers primitive arrays too. Their elements come out boxed and are normalized like any other number.
		 */
		if (value != null && value.getClass().isArray()) {
			int length = Array.getLength(value);
			List<Object> list = new ArrayList<>(length);
			for (int i = 0; i < length; ++i)
				list.add(canonicalize(Array.get(value, i)));
			return Collections.unmodifiableList(list);
		}
		if (value instanceof Set) {
			Set<Object> set = new HashSet<>();
			for (Object item : (Set<?>)value)
				set.add(canonicalize(item));
			return Collections.unmodifiableSet(set);
		}
		if (value instanceof Byte || value instanceof Short || value instanceof Integer)
			return ((Number)value).longValue();
		if (value instanceof BigInteger && ((BigInteger)value).bitLength() < 64)
			return ((BigInteger)value).longValue();
		if (value instanceof Float || value instanceof Double) {
			/*
			 * Variables usually come from JSON, where 1 and 1.0 are the same number.
			 */
			double number = ((Number)value).doubleValue();
			if (number == Math.rint(number) && Math.abs(number) < 0x1p63)
				return (long)number;
			return number;
		}
		return value;
	}
	/**
	 * Renders canonical variables as a stable JSON-like string.
	 * Equal keys always produce equal digests.
	 *
	 * @return digest of the canonical variables
	 */
	public String digest() {
		StringBuilder builder = new StringBuilder();
		render(builder, canonical);
		return builder.toString();
	}
	private static void render(StringBuilder builder, Object value) {
		if (value instanceof Map) {
			builder.append('{');
			boolean first = true;
			for (Map.Entry<?, ?> entry : ((Map<?, ?>)value).entrySet()) {
				if (!first)
					builder.append(',');
				first = false;
				quote(builder, entry.getKey().toString());
				builder.append(':');
				render(builder, entry.getValue());
			}
			builder.append('}');
		} else if (value instanceof Collection) {
			/*
			 * Sets have no order, so their rendering is sorted to keep the digest stable.
			 */
			List<String> items = new ArrayList<>();
			for (Object item : (Collection<?>)value) {
				StringBuilder nested = new StringBuilder();
				render(nested, item);
				items.add(nested.toString());
			}
			if (value instanceof Set)
				Collections.sort(items);
			builder.append('[').append(String.join(",", items)).append(']');
		} else if (value instanceof String || value instanceof Enum)
			quote(builder, value.toString());
		else
			builder.append(value);
	}
	private static void quote(StringBuilder builder, String text) {
		builder.append('"').append(text.replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof RequestKey))
			return false;
		RequestKey other = (RequestKey)obj;
		return hashCode == other.hashCode && query.equals(other.query) && canonical.equals(other.canonical);
	}
	@Override
	public int hashCode() {
		return hashCode;
	}
	@Override
	public String toString() {
		return query + " " + digest();
	}
}
