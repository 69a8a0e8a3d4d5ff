// Part of Suspense
package com.machinezoo.suspense.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Cache entries, handles, bindings, and renderers form an ownership tree.
 * A renderer owns its scope and trigger, a cache owns its entries, an entry owns its handle.
 * When a trigger fires deep inside that tree, the span it creates is only meaningful
 * if it carries tags of its ancestors, for example the request key of the owning entry.
 * This class attaches alias, tags, and parent link to any object without requiring a field on it.
 * The same information is used to build toString() of every object in the library.
 */
/**
 * Ancestry and tags of library objects for tracing and {@code toString()}.
 */
@NoTests
@StubDocs
@DraftApi("could be shared with other libraries")
public class OwnerTrace<T> {
	/*
	 * Guava's weak-keyed cache compares keys by identity, which matters here,
	 * because request keys and results define value equality and must not be merged.
	 * Values must not reference the target, otherwise the weak key would never be collected.
	 */
	private static final LoadingCache<Object, Node> nodes = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(Node::new));
	public static <T> OwnerTrace<T> of(T target) {
		return new OwnerTrace<T>(target, nodes.getUnchecked(target));
	}
	private final T target;
	public T target() {
		return target;
	}
	private final Node node;
	private OwnerTrace(T target, Node node) {
		Objects.requireNonNull(target);
		this.target = target;
		this.node = node;
	}
	private static class Node {
		volatile String alias;
		volatile Tag tags;
		volatile Node parent;
		Node(Object target) {
			alias = target instanceof Class ? ((Class<?>)target).getSimpleName() : target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		node.alias = alias;
		return this;
	}
	/*
	 * Tags are few per object. Singly linked list is the cheapest structure for reads.
	 */
	private static class Tag {
		final String key;
		volatile Object value;
		final Tag next;
		Tag(String key, Object value, Tag next) {
			this.key = key;
			this.value = value;
			this.next = next;
		}
	}
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		/*
		 * Null values are ignored, so that callers can tag optional properties without checks.
		 */
		if (value == null)
			return this;
		synchronized (node) {
			for (Tag tag = node.tags; tag != null; tag = tag.next) {
				if (tag.key.equals(key)) {
					tag.value = value;
					return this;
				}
			}
			node.tags = new Tag(key, value, node.tags);
		}
		return this;
	}
	private static final AtomicLong counter = new AtomicLong();
	public OwnerTrace<T> generateId() {
		return tag("id", counter.incrementAndGet());
	}
	public OwnerTrace<T> parent(Object parent) {
		if (parent instanceof OwnerTrace)
			node.parent = ((OwnerTrace<?>)parent).node;
		else if (parent == null)
			node.parent = null;
		else
			node.parent = OwnerTrace.of(parent).node;
		return this;
	}
	/*
	 * Ancestors are listed root first. Repeated aliases are numbered to keep tag names unique.
	 */
	private List<Map.Entry<String, Node>> ancestry() {
		List<Node> chain = new ArrayList<>();
		for (Node ancestor = node; ancestor != null; ancestor = ancestor.parent)
			chain.add(ancestor);
		Collections.reverse(chain);
		Object2IntMap<String> numbering = new Object2IntOpenHashMap<>(chain.size());
		List<Map.Entry<String, Node>> named = new ArrayList<>(chain.size());
		for (Node ancestor : chain) {
			String alias = ancestor.alias;
			int number = numbering.getInt(alias);
			named.add(new AbstractMap.SimpleImmutableEntry<>(number == 0 ? alias : alias + (number + 1), ancestor));
			numbering.put(alias, number + 1);
		}
		return named;
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		List<Map.Entry<String, Node>> ancestry = ancestry();
		span.setTag("owner", ancestry.stream().map(Map.Entry::getKey).collect(joining(".")));
		for (Map.Entry<String, Node> ancestor : ancestry) {
			for (Tag tag = ancestor.getValue().tags; tag != null; tag = tag.next) {
				String key = ancestor.getKey() + "." + tag.key;
				Object value = tag.value;
				if (value instanceof String)
					span.setTag(key, (String)value);
				else if (value instanceof Number)
					span.setTag(key, (Number)value);
				else if (value instanceof Boolean)
					span.setTag(key, (boolean)value);
				else
					span.setTag(key, value.toString());
			}
		}
		return span;
	}
	@Override
	public String toString() {
		Map<String, Object> sorted = new TreeMap<>();
		List<Map.Entry<String, Node>> ancestry = ancestry();
		for (Map.Entry<String, Node> ancestor : ancestry)
			for (Tag tag = ancestor.getValue().tags; tag != null; tag = tag.next)
				sorted.put(ancestor.getKey() + "." + tag.key, tag.value);
		return ancestry.stream().map(Map.Entry::getKey).collect(joining(".")) + sorted;
	}
}
