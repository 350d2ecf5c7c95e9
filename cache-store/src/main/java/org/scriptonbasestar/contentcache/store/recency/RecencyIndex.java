package org.scriptonbasestar.contentcache.store.recency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Key-indexed doubly linked list ordering keys from most recently used (head) to least
 * recently used (tail).
 * <p>
 * Nodes reference their neighbours by key, never by ownership, and each key appears at most
 * once. Every operation is O(1) except {@link #keysFromHead()}, {@link #keysFromTail()} and
 * {@link #rebuild(List)}.
 * </p>
 * <p>
 * Not thread-safe. {@code SBContentCache} only touches it while holding its write lock
 * (or its read lock for read-only walks).
 * </p>
 *
 * <pre>
 * moveToFront(a), moveToFront(b), moveToFront(c)   head→ c, b, a ←tail
 * moveToFront(a)                                   head→ a, c, b ←tail
 * remove(c)                                        head→ a, b    ←tail
 * </pre>
 *
 * @param <K> the type of keys
 * @author archmagece
 * @since 2025-02
 */
public class RecencyIndex<K> {

	private final Map<K, Node<K>> nodes = new HashMap<>();
	private K head;
	private K tail;

	/**
	 * Makes {@code key} the most recently used key, linking a new node if it is not indexed yet.
	 *
	 * @param key the key to promote
	 */
	public void moveToFront(K key) {
		Node<K> node = nodes.get(key);
		if (node == null) {
			node = new Node<>(key);
			node.next = head;
			if (head != null) {
				nodes.get(head).prev = key;
			} else {
				tail = key;
			}
			head = key;
			nodes.put(key, node);
			return;
		}

		if (key.equals(head)) {
			return;
		}

		unlink(node);

		node.prev = null;
		node.next = head;
		if (head != null) {
			nodes.get(head).prev = key;
		} else {
			tail = key;
		}
		head = key;
	}

	/**
	 * Detaches {@code key} from the chain.
	 *
	 * @param key the key to remove
	 * @return true if the key was indexed
	 */
	public boolean remove(K key) {
		Node<K> node = nodes.remove(key);
		if (node == null) {
			return false;
		}
		unlink(node);
		return true;
	}

	/**
	 * Splices a node out, patching its neighbours and the head/tail sentinels.
	 * The node's own links are left stale; callers reset or discard it.
	 */
	private void unlink(Node<K> node) {
		if (node.prev != null) {
			nodes.get(node.prev).next = node.next;
		} else {
			head = node.next;
		}

		if (node.next != null) {
			nodes.get(node.next).prev = node.prev;
		} else {
			tail = node.prev;
		}
	}

	/**
	 * Replaces the whole order. The first key becomes the head.
	 *
	 * @param orderedKeys keys from most to least preferred; duplicates keep their first position
	 */
	public void rebuild(List<K> orderedKeys) {
		clear();
		for (int i = orderedKeys.size() - 1; i >= 0; i--) {
			moveToFront(orderedKeys.get(i));
		}
	}

	/**
	 * @return the most recently used key, or null when empty
	 */
	public K head() {
		return head;
	}

	/**
	 * @return the least recently used key, or null when empty
	 */
	public K tail() {
		return tail;
	}

	/**
	 * @param key an indexed key
	 * @return the next more recently used key, or null if {@code key} is the head or not indexed
	 */
	public K previous(K key) {
		Node<K> node = nodes.get(key);
		return node == null ? null : node.prev;
	}

	/**
	 * @param key an indexed key
	 * @return the next less recently used key, or null if {@code key} is the tail or not indexed
	 */
	public K next(K key) {
		Node<K> node = nodes.get(key);
		return node == null ? null : node.next;
	}

	public boolean contains(K key) {
		return nodes.containsKey(key);
	}

	public int size() {
		return nodes.size();
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}

	public void clear() {
		nodes.clear();
		head = null;
		tail = null;
	}

	/**
	 * @return keys from most to least recently used
	 */
	public List<K> keysFromHead() {
		List<K> keys = new ArrayList<>(nodes.size());
		K cursor = head;
		while (cursor != null && keys.size() <= nodes.size()) {
			keys.add(cursor);
			cursor = nodes.get(cursor).next;
		}
		return keys;
	}

	/**
	 * @return keys from least to most recently used
	 */
	public List<K> keysFromTail() {
		List<K> keys = new ArrayList<>(nodes.size());
		K cursor = tail;
		while (cursor != null && keys.size() <= nodes.size()) {
			keys.add(cursor);
			cursor = nodes.get(cursor).prev;
		}
		return keys;
	}

	/**
	 * Walks the chain in both directions and checks it against the node table.
	 *
	 * @return true if the chain is a single acyclic list covering exactly the indexed keys
	 */
	public boolean isConsistent() {
		if ((head == null) != (tail == null) || (head == null) != nodes.isEmpty()) {
			return false;
		}
		List<K> forward = keysFromHead();
		List<K> backward = keysFromTail();
		if (forward.size() != nodes.size() || backward.size() != nodes.size()) {
			return false;
		}
		if (!nodes.keySet().containsAll(forward)) {
			return false;
		}
		List<K> reversed = new ArrayList<>(backward);
		Collections.reverse(reversed);
		return forward.equals(reversed);
	}

	@Override
	public String toString() {
		return "RecencyIndex" + keysFromHead();
	}

	private static final class Node<K> {
		private final K key;
		private K prev;
		private K next;

		private Node(K key) {
			this.key = key;
		}

		@Override
		public String toString() {
			return prev + " <- " + key + " -> " + next;
		}
	}
}
