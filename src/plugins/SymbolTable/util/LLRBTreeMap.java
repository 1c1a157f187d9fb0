/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.SymbolTable.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
** Ordered symbol table backed by a left-leaning red-black BST.
**
** A left-leaning red-black tree is a binary search tree which corresponds
** one-to-one with a 2-3 tree: black links are the edges of the 2-3 tree, and
** a red link glues a node to its parent to form a 3-node. The following
** properties hold after every public operation:
**
** * Every key in the left subtree of a node is smaller than the node's key,
**   and every key in the right subtree is greater.
** * Red links lean left; no node is entered from its parent's right side by
**   a red link.
** * No path has two red links in a row.
** * Every path from the root to a {@code null} link passes through the same
**   number of black links.
** * The root is black.
**
** Together these bound the height by {@code 2 lg(n+1)}, so that {@link
** #put(Object, Object)}, {@link #delete(Object)} and the ordered queries all
** run in logarithmic time in the worst case.
**
** Every node also keeps the size of the subtree rooted at it, which gives
** {@link #rank(Object)} and {@link #select(int)} in logarithmic time.
**
** Mutations descend recursively to the target key, then apply local fix-ups
** ({@link #rotateLeft(Node)}, {@link #rotateRight(Node)}, {@link
** #flipColors(Node)}) on the way back up. Each recursive call returns the new
** root of the subtree it was given, and the caller stores that in its child
** pointer.
**
** Keys are ordered by the comparator given at construction, or by their
** {@link Comparable natural} ordering if none was given. {@code null} keys
** and {@code null} values are not supported; to remove a mapping, use {@link
** #delete(Object)}.
**
** Note: this implementation, like {@link java.util.TreeMap}, is not
** thread-safe.
**
** @see java.util.TreeMap
** @see Comparator
** @see Comparable
*/
public class LLRBTreeMap<K, V> extends AbstractMap<K, V>
implements Map<K, V> {

	final private static Logger logger = LoggerFactory.getLogger(LLRBTreeMap.class);

	final static boolean RED = true;
	final static boolean BLACK = false;

	/**
	** Comparator for this map, or {@code null} to use the keys' natural
	** ordering.
	*/
	final protected Comparator<? super K> comparator;

	/**
	** Root node of the tree, or {@code null} if the map is empty.
	*/
	protected Node<K, V> root;

	/**
	** Number of structural modifications (insertions of new keys, and
	** deletions) made to this map. Overwriting the value of an existing key
	** does not count.
	*/
	protected transient int modCount = 0;

	/**
	** Creates a new empty map, sorted according to the given comparator.
	**
	** @param cmp The comparator for the tree, or {@code null} to use the keys'
	**            {@link Comparable natural} ordering.
	*/
	public LLRBTreeMap(Comparator<? super K> cmp) {
		comparator = cmp;
	}

	/**
	** Creates a new empty map, sorted according to the keys' {@link Comparable
	** natural} ordering.
	*/
	public LLRBTreeMap() {
		this(null);
	}

	/**
	** A node of the tree. The {@link #color} is the color of the link from the
	** node's parent; a {@code null} link counts as black.
	**
	** The key of a node never changes while the node is in the tree, except
	** when {@link LLRBTreeMap#delete(Node, Object)} overwrites it with that of
	** its in-order successor, just before the successor is unlinked.
	*/
	protected static class Node<K, V> {

		K key;
		V val;
		Node<K, V> left, right;
		boolean color;

		/**
		** Number of nodes in the subtree rooted here, including this one.
		*/
		int size;

		protected Node(K k, V v, boolean c, int s) {
			key = k;
			val = v;
			color = c;
			size = s;
		}

		public String toTreeString(String istr) {
			String nistr = istr + "\t";
			StringBuilder s = new StringBuilder();
			if (right != null) { s.append(right.toTreeString(nistr)); }
			s.append(istr).append(key).append(" (").append(color? "R": "B")
			 .append(", ").append(size).append(")\n");
			if (left != null) { s.append(left.toTreeString(nistr)); }
			return s.toString();
		}

	}

	/**
	** Compares two keys using the comparator for this tree, or the keys'
	** {@link Comparable natural} ordering if no comparator was given.
	**
	** @throws ClassCastException if the keys cannot be compared by the given
	**         comparator, or if they cannot be compared naturally (ie. they
	**         don't implement {@link Comparable})
	*/
	@SuppressWarnings("unchecked")
	public int compare(K key1, K key2) {
		return (comparator != null)? comparator.compare(key1, key2): ((Comparable<? super K>)key1).compareTo(key2);
	}

	public Comparator<? super K> comparator() {
		return comparator;
	}

	private static void checkKey(Object key, String method) {
		if (key == null) {
			throw new IllegalArgumentException("null key passed to " + method + "()");
		}
	}

	private void checkNotEmpty() {
		if (root == null) { throw new UnderflowException(); }
	}

	/*========================================================================
	  node helpers
	 ========================================================================*/

	static boolean isRed(Node<?, ?> node) {
		return node != null && node.color == RED;
	}

	static int size(Node<?, ?> node) {
		return (node == null)? 0: node.size;
	}

	/**
	** Makes a right-leaning red link lean to the left.
	*/
	static <K, V> Node<K, V> rotateLeft(Node<K, V> h) {
		assert(h != null && isRed(h.right));
		Node<K, V> x = h.right;
		h.right = x.left;
		x.left = h;
		x.color = h.color;
		h.color = RED;
		x.size = h.size;
		h.size = 1 + size(h.left) + size(h.right);
		return x;
	}

	/**
	** Makes a left-leaning red link lean to the right.
	*/
	static <K, V> Node<K, V> rotateRight(Node<K, V> h) {
		assert(h != null && isRed(h.left));
		Node<K, V> x = h.left;
		h.left = x.right;
		x.right = h;
		x.color = h.color;
		h.color = RED;
		x.size = h.size;
		h.size = 1 + size(h.left) + size(h.right);
		return x;
	}

	/**
	** Flips the colors of a node and its two children. On insert this splits a
	** temporary 4-node by passing its middle key up to the parent; on delete
	** it does the opposite, borrowing a red link from the parent.
	*/
	static void flipColors(Node<?, ?> h) {
		assert(h.left != null && h.right != null);
		h.color = !h.color;
		h.left.color = !h.left.color;
		h.right.color = !h.right.color;
	}

	/**
	** Assuming that {@code h} is red and both {@code h.left} and {@code
	** h.left.left} are black, makes {@code h.left} or one of its children red.
	*/
	static <K, V> Node<K, V> moveRedLeft(Node<K, V> h) {
		flipColors(h);
		if (isRed(h.right.left)) {
			h.right = rotateRight(h.right);
			h = rotateLeft(h);
			flipColors(h);
		}
		return h;
	}

	/**
	** Assuming that {@code h} is red and both {@code h.right} and {@code
	** h.right.left} are black, makes {@code h.right} or one of its children
	** red.
	*/
	static <K, V> Node<K, V> moveRedRight(Node<K, V> h) {
		flipColors(h);
		if (isRed(h.left.left)) {
			h = rotateRight(h);
			flipColors(h);
		}
		return h;
	}

	/**
	** Restores the local red-black properties at {@code h} and recomputes its
	** size.
	*/
	static <K, V> Node<K, V> balance(Node<K, V> h) {
		if (isRed(h.right) && !isRed(h.left)) { h = rotateLeft(h); }
		if (isRed(h.left) && isRed(h.left.left)) { h = rotateRight(h); }
		if (isRed(h.left) && isRed(h.right)) { flipColors(h); }
		h.size = 1 + size(h.left) + size(h.right);
		return h;
	}

	/*========================================================================
	  public interface Map
	 ========================================================================*/

	@Override public int size() {
		return size(root);
	}

	@Override public boolean isEmpty() {
		return root == null;
	}

	@Override public void clear() {
		root = null;
		++modCount;
	}

	/**
	** {@inheritDoc}
	**
	** @throws IllegalArgumentException if the key is {@code null}
	** @throws ClassCastException key cannot be compared with the keys
	**         currently in the map
	*/
	@SuppressWarnings("unchecked")
	@Override public boolean containsKey(Object k) {
		return contains((K)k);
	}

	/**
	** {@inheritDoc}
	**
	** This implementation just descends the tree, returning the value for the
	** given key if it can be found.
	**
	** @throws IllegalArgumentException if the key is {@code null}
	** @throws ClassCastException key cannot be compared with the keys
	**         currently in the map
	*/
	@SuppressWarnings("unchecked")
	@Override public V get(Object k) {
		checkKey(k, "get");
		Node<K, V> node = getNode((K)k);
		return (node == null)? null: node.val;
	}

	private Node<K, V> getNode(K key) {
		Node<K, V> node = root;
		while (node != null) {
			int cmp = compare(key, node.key);
			if (cmp < 0) {
				node = node.left;
			} else if (cmp > 0) {
				node = node.right;
			} else {
				return node;
			}
		}
		return null;
	}

	/**
	** Whether the map has a mapping for the given key.
	**
	** @throws IllegalArgumentException if the key is {@code null}
	*/
	public boolean contains(K key) {
		checkKey(key, "contains");
		return getNode(key) != null;
	}

	/**
	** {@inheritDoc}
	**
	** If the key is already present, its value is replaced and the size of the
	** map does not change. Otherwise a new red leaf is inserted and the tree
	** is rebalanced on the way back up to the root.
	**
	** @throws IllegalArgumentException if the key or the value is {@code null}
	** @throws ClassCastException key cannot be compared with the keys
	**         currently in the map
	*/
	@Override public V put(K key, V value) {
		checkKey(key, "put");
		if (value == null) {
			throw new IllegalArgumentException("null values are not supported; use delete() to remove a key");
		}
		Node<K, V> node = getNode(key);
		if (node != null) {
			V old = node.val;
			node.val = value;
			return old;
		}
		// type check on the first key, which has nothing to be compared with
		if (root == null) { compare(key, key); }
		root = put(root, key, value);
		root.color = BLACK;
		++modCount;
		return null;
	}

	private Node<K, V> put(Node<K, V> h, K key, V val) {
		if (h == null) { return new Node<K, V>(key, val, RED, 1); }

		int cmp = compare(key, h.key);
		if (cmp < 0) {
			h.left = put(h.left, key, val);
		} else if (cmp > 0) {
			h.right = put(h.right, key, val);
		} else {
			h.val = val;
		}

		// fix-up any right-leaning links
		if (isRed(h.right) && !isRed(h.left)) { h = rotateLeft(h); }
		if (isRed(h.left) && isRed(h.left.left)) { h = rotateRight(h); }
		if (isRed(h.left) && isRed(h.right)) { flipColors(h); }
		h.size = 1 + size(h.left) + size(h.right);
		return h;
	}

	/**
	** {@inheritDoc}
	**
	** This implementation looks up the value, then calls {@link
	** #delete(Object)}.
	**
	** @throws IllegalArgumentException if the key is {@code null}
	*/
	@SuppressWarnings("unchecked")
	@Override public V remove(Object k) {
		checkKey(k, "remove");
		Node<K, V> node = getNode((K)k);
		if (node == null) { return null; }
		V old = node.val;
		deletePresent((K)k);
		return old;
	}

	/*========================================================================
	  deletion
	 ========================================================================*/

	/**
	** Removes the given key and its value from the map. Deleting a key that is
	** not present does nothing.
	**
	** @throws IllegalArgumentException if the key is {@code null}
	*/
	public void delete(K key) {
		checkKey(key, "delete");
		// the recursive delete assumes the key is present
		if (getNode(key) == null) { return; }
		deletePresent(key);
	}

	private void deletePresent(K key) {
		// if both children of root are black, set root to red
		if (!isRed(root.left) && !isRed(root.right)) { root.color = RED; }
		root = delete(root, key);
		if (root != null) { root.color = BLACK; }
		++modCount;
	}

	private Node<K, V> delete(Node<K, V> h, K key) {
		if (compare(key, h.key) < 0) {
			if (!isRed(h.left) && !isRed(h.left.left)) { h = moveRedLeft(h); }
			h.left = delete(h.left, key);
		} else {
			if (isRed(h.left)) { h = rotateRight(h); }
			if (compare(key, h.key) == 0 && h.right == null) { return null; }
			if (!isRed(h.right) && !isRed(h.right.left)) { h = moveRedRight(h); }
			if (compare(key, h.key) == 0) {
				Node<K, V> x = minNode(h.right);
				h.key = x.key;
				h.val = x.val;
				h.right = deleteMin(h.right);
			} else {
				h.right = delete(h.right, key);
			}
		}
		return balance(h);
	}

	/**
	** Removes the smallest key and its value from the map.
	**
	** @return The key that was removed
	** @throws UnderflowException if the map is empty
	*/
	public K deleteMin() {
		checkNotEmpty();
		K key = minNode(root).key;
		if (!isRed(root.left) && !isRed(root.right)) { root.color = RED; }
		root = deleteMin(root);
		if (root != null) { root.color = BLACK; }
		++modCount;
		return key;
	}

	private static <K, V> Node<K, V> deleteMin(Node<K, V> h) {
		// the right subtree of a node without a left child is empty
		if (h.left == null) { return null; }
		if (!isRed(h.left) && !isRed(h.left.left)) { h = moveRedLeft(h); }
		h.left = deleteMin(h.left);
		return balance(h);
	}

	/**
	** Removes the largest key and its value from the map.
	**
	** @return The key that was removed
	** @throws UnderflowException if the map is empty
	*/
	public K deleteMax() {
		checkNotEmpty();
		K key = maxNode(root).key;
		if (!isRed(root.left) && !isRed(root.right)) { root.color = RED; }
		root = deleteMax(root);
		if (root != null) { root.color = BLACK; }
		++modCount;
		return key;
	}

	private static <K, V> Node<K, V> deleteMax(Node<K, V> h) {
		if (isRed(h.left)) { h = rotateRight(h); }
		if (h.right == null) { return null; }
		if (!isRed(h.right) && !isRed(h.right.left)) { h = moveRedRight(h); }
		h.right = deleteMax(h.right);
		return balance(h);
	}

	/*========================================================================
	  ordered symbol table
	 ========================================================================*/

	/**
	** @return The smallest key in the map
	** @throws UnderflowException if the map is empty
	*/
	public K min() {
		checkNotEmpty();
		return minNode(root).key;
	}

	private static <K, V> Node<K, V> minNode(Node<K, V> x) {
		while (x.left != null) { x = x.left; }
		return x;
	}

	/**
	** @return The largest key in the map
	** @throws UnderflowException if the map is empty
	*/
	public K max() {
		checkNotEmpty();
		return maxNode(root).key;
	}

	private static <K, V> Node<K, V> maxNode(Node<K, V> x) {
		while (x.right != null) { x = x.right; }
		return x;
	}

	/**
	** Returns the largest key in the map that is smaller than or equal to the
	** given key.
	**
	** @throws IllegalArgumentException if the key is {@code null}
	** @throws UnderflowException if the map is empty
	** @throws KeyNotFoundException if every key in the map is greater than
	**         the given key
	*/
	public K floor(K key) {
		checkKey(key, "floor");
		checkNotEmpty();
		Node<K, V> x = floor(root, key);
		if (x == null) { throw new KeyNotFoundException("argument to floor() is too small", key); }
		return x.key;
	}

	private Node<K, V> floor(Node<K, V> x, K key) {
		if (x == null) { return null; }
		int cmp = compare(key, x.key);
		if (cmp == 0) { return x; }
		if (cmp < 0) { return floor(x.left, key); }
		Node<K, V> t = floor(x.right, key);
		return (t != null)? t: x;
	}

	/**
	** Returns the smallest key in the map that is greater than or equal to
	** the given key.
	**
	** @throws IllegalArgumentException if the key is {@code null}
	** @throws UnderflowException if the map is empty
	** @throws KeyNotFoundException if every key in the map is smaller than
	**         the given key
	*/
	public K ceil(K key) {
		checkKey(key, "ceil");
		checkNotEmpty();
		Node<K, V> x = ceil(root, key);
		if (x == null) { throw new KeyNotFoundException("argument to ceil() is too large", key); }
		return x.key;
	}

	private Node<K, V> ceil(Node<K, V> x, K key) {
		if (x == null) { return null; }
		int cmp = compare(key, x.key);
		if (cmp == 0) { return x; }
		if (cmp > 0) { return ceil(x.right, key); }
		Node<K, V> t = ceil(x.left, key);
		return (t != null)? t: x;
	}

	/**
	** Returns the key of the given rank, ie. the {@code (k+1)}th smallest key
	** in the map.
	**
	** @throws IndexOutOfBoundsException if {@code k} is not in {@code [0,
	**         size())}
	*/
	public K select(int k) {
		if (k < 0 || k >= size()) {
			throw new IndexOutOfBoundsException("called select() with invalid rank " + k + " (size " + size() + ")");
		}
		Node<K, V> x = root;
		for (;;) {
			int ls = size(x.left);
			if (k < ls) {
				x = x.left;
			} else if (k > ls) {
				k -= ls + 1;
				x = x.right;
			} else {
				return x.key;
			}
		}
	}

	/**
	** Returns the number of keys in the map strictly smaller than the given
	** key. The key itself need not be present.
	**
	** @throws IllegalArgumentException if the key is {@code null}
	*/
	public int rank(K key) {
		checkKey(key, "rank");
		return rank(root, key);
	}

	private int rank(Node<K, V> x, K key) {
		if (x == null) { return 0; }
		int cmp = compare(key, x.key);
		if (cmp < 0) {
			return rank(x.left, key);
		} else if (cmp > 0) {
			return 1 + size(x.left) + rank(x.right, key);
		} else {
			return size(x.left);
		}
	}

	/**
	** Returns all keys in the map in ascending order. The list is a snapshot;
	** later changes to the map are not reflected in it.
	*/
	public List<K> keys() {
		if (root == null) { return new ArrayList<K>(); }
		return rangeKeys(min(), max());
	}

	/**
	** Returns the keys between {@code lo} and {@code hi} (both inclusive) in
	** ascending order. The list is a snapshot; later changes to the map are not
	** reflected in it.
	**
	** @throws IllegalArgumentException if either bound is {@code null}
	*/
	public List<K> rangeKeys(K lo, K hi) {
		checkKey(lo, "rangeKeys");
		checkKey(hi, "rangeKeys");
		List<K> keys = new ArrayList<K>();
		rangeKeys(root, keys, lo, hi);
		return keys;
	}

	private void rangeKeys(Node<K, V> x, List<K> keys, K lo, K hi) {
		if (x == null) { return; }
		int cmplo = compare(lo, x.key);
		int cmphi = compare(hi, x.key);
		if (cmplo < 0) { rangeKeys(x.left, keys, lo, hi); }
		if (cmplo <= 0 && cmphi >= 0) { keys.add(x.key); }
		if (cmphi > 0) { rangeKeys(x.right, keys, lo, hi); }
	}

	/**
	** Returns the number of keys between {@code lo} and {@code hi} (both
	** inclusive).
	**
	** @throws IllegalArgumentException if either bound is {@code null}
	*/
	public int keySize(K lo, K hi) {
		checkKey(lo, "keySize");
		checkKey(hi, "keySize");
		if (compare(lo, hi) > 0) { return 0; }
		return (getNode(hi) != null)? rank(hi) - rank(lo) + 1: rank(hi) - rank(lo);
	}

	/**
	** Returns the height of the tree; {@code -1} for an empty map and {@code 0}
	** for a map with a single key.
	*/
	public int height() {
		return height(root);
	}

	private static int height(Node<?, ?> x) {
		if (x == null) { return -1; }
		return 1 + Math.max(height(x.left), height(x.right));
	}

	/**
	** Returns the keys in breadth-first order, one list per level of the tree.
	*/
	public List<List<K>> levelOrder() {
		List<List<K>> levels = new ArrayList<List<K>>();
		if (root == null) { return levels; }
		Deque<Node<K, V>> queue = new ArrayDeque<Node<K, V>>();
		queue.add(root);
		while (!queue.isEmpty()) {
			List<K> level = new ArrayList<K>(queue.size());
			for (int i=queue.size(); i>0; --i) {
				Node<K, V> x = queue.remove();
				level.add(x.key);
				if (x.left != null) { queue.add(x.left); }
				if (x.right != null) { queue.add(x.right); }
			}
			levels.add(level);
		}
		return levels;
	}

	/**
	** Returns the number of black links on any path from the root to a {@code
	** null} link. This is the height of the corresponding 2-3 tree.
	*/
	public int blackHeight() {
		int black = 0;
		for (Node<K, V> x = root; x != null; x = x.left) {
			if (!isRed(x)) { ++black; }
		}
		return black;
	}

	/**
	** Returns the number of nodes entered by a red link, ie. the number of
	** 3-nodes in the corresponding 2-3 tree.
	*/
	public int redCount() {
		return redCount(root);
	}

	private static int redCount(Node<?, ?> x) {
		if (x == null) { return 0; }
		return (isRed(x)? 1: 0) + redCount(x.left) + redCount(x.right);
	}

	/**
	** Returns the sum of the depths of all nodes; the average search cost for
	** a present key is {@code 1 + internalPathLength() / size()}.
	*/
	public long internalPathLength() {
		return internalPathLength(root, 0);
	}

	private static long internalPathLength(Node<?, ?> x, int depth) {
		if (x == null) { return 0; }
		return depth + internalPathLength(x.left, depth + 1) + internalPathLength(x.right, depth + 1);
	}

	public String toTreeString() {
		return (root == null)? "": root.toTreeString("");
	}

	/*========================================================================
	  integrity checks
	 ========================================================================*/

	/**
	** Runs every integrity check, logging a warning for each one that fails.
	**
	** @return Whether all the checks passed
	*/
	public boolean check() {
		boolean ok = true;
		if (!isBST()) { logger.warn("Not in symmetric order"); ok = false; }
		if (!countCheck()) { logger.warn("Subtree counts not consistent"); ok = false; }
		if (!rankCheck()) { logger.warn("Ranks not consistent"); ok = false; }
		if (!is23()) { logger.warn("Not a 2-3 tree"); ok = false; }
		if (!isBalanced()) { logger.warn("Not balanced"); ok = false; }
		return ok;
	}

	/**
	** Simulates an assertion.
	**
	** @param b The test condition
	** @param what Description of the property being tested
	** @throws IllegalStateException if the test condition is false
	*/
	final static void verify(boolean b, String what) {
		if (!b) { throw new IllegalStateException("Verification failed: " + what); }
	}

	/**
	** Debugging method. Checks every property that {@link #check()} does.
	**
	** @throws IllegalStateException if the constraints are not satisfied
	*/
	public void verifyTreeIntegrity() {
		verify(isBST(), "symmetric order");
		verify(countCheck(), "subtree counts");
		verify(rankCheck(), "rank/select consistency");
		verify(is23(), "2-3 correspondence");
		verify(isBalanced(), "black balance");
		verify(!isRed(root), "black root");
	}

	/**
	** Whether every key lies strictly between the keys of the ancestors it
	** hangs off.
	*/
	public boolean isBST() {
		return isBST(root, null, null);
	}

	// null bounds mean no constraint
	private boolean isBST(Node<K, V> x, K min, K max) {
		if (x == null) { return true; }
		if (min != null && compare(x.key, min) <= 0) { return false; }
		if (max != null && compare(x.key, max) >= 0) { return false; }
		return isBST(x.left, min, x.key) && isBST(x.right, x.key, max);
	}

	/**
	** Whether every node's size field is consistent with its children.
	*/
	public boolean countCheck() {
		return countCheck(root);
	}

	private static boolean countCheck(Node<?, ?> x) {
		if (x == null) { return true; }
		if (x.size != 1 + size(x.left) + size(x.right)) { return false; }
		return countCheck(x.left) && countCheck(x.right);
	}

	/**
	** Whether {@code rank(select(i)) == i} for every rank and {@code
	** select(rank(key)) == key} for every key.
	*/
	public boolean rankCheck() {
		// select() walks off the tree if the counts are wrong
		if (!countCheck()) { return false; }
		for (int i=0; i<size(); ++i) {
			if (i != rank(select(i))) { return false; }
		}
		for (K key: keys()) {
			if (compare(key, select(rank(key))) != 0) { return false; }
		}
		return true;
	}

	/**
	** Whether the tree has no red right links, and at most one red left link
	** in a row on any path.
	*/
	public boolean is23() {
		return is23(root);
	}

	private boolean is23(Node<K, V> x) {
		if (x == null) { return true; }
		if (isRed(x.right)) { return false; }
		if (x != root && isRed(x) && isRed(x.left)) { return false; }
		return is23(x.left) && is23(x.right);
	}

	/**
	** Whether every path from the root to a {@code null} link has the same
	** number of black links.
	*/
	public boolean isBalanced() {
		return isBalanced(root, blackHeight());
	}

	private static boolean isBalanced(Node<?, ?> x, int black) {
		if (x == null) { return black == 0; }
		if (!isRed(x)) { --black; }
		return isBalanced(x.left, black) && isBalanced(x.right, black);
	}

	/*========================================================================
	  views
	 ========================================================================*/

	// TODO maybe make this a WeakReference?
	private Set<Map.Entry<K, V>> entrySet = null;
	@Override public Set<Map.Entry<K, V>> entrySet() {
		if (entrySet == null) {
			entrySet = new AbstractSet<Map.Entry<K, V>>() {

				@Override public int size() { return LLRBTreeMap.this.size(); }

				@Override public Iterator<Map.Entry<K, V>> iterator() {
					return new EntryIterator();
				}

				@Override public void clear() {
					LLRBTreeMap.this.clear();
				}

				@Override public boolean contains(Object o) {
					if (!(o instanceof Map.Entry)) { return false; }
					Map.Entry<?, ?> e = (Map.Entry<?, ?>)o;
					if (e.getKey() == null) { return false; }
					Object value = LLRBTreeMap.this.get(e.getKey());
					return value != null && value.equals(e.getValue());
				}

				@Override public boolean remove(Object o) {
					if (contains(o)) {
						Map.Entry<?, ?> e = (Map.Entry<?, ?>)o;
						LLRBTreeMap.this.remove(e.getKey());
						return true;
					}
					return false;
				}

			};
		}
		return entrySet;
	}

	/**
	** An entry handed out by the {@link #entrySet()} iterator. Setting its
	** value writes through to the map, as long as the mapping is still there.
	** Once the entry has been removed by its iterator, or its key deleted from
	** the map, only the entry itself is updated; the key is never re-inserted.
	*/
	private class WriteThroughEntry extends AbstractMap.SimpleEntry<K, V> {

		boolean detached = false;

		WriteThroughEntry(Node<K, V> node) {
			super(node.key, node.val);
		}

		@Override public V setValue(V value) {
			if (value == null) {
				throw new IllegalArgumentException("null values are not supported; use delete() to remove a key");
			}
			if (!detached) {
				// deletion may move a key to another node, so look it up again
				Node<K, V> node = getNode(getKey());
				if (node != null) { node.val = value; }
			}
			return super.setValue(value);
		}

	}

	/**
	** In-order iterator. The stack holds the nodes whose keys are still to be
	** returned, and whose right subtrees are still to be visited. After a
	** {@link #remove()} the tree may have been restructured, so the stack is
	** rebuilt by seeking past the key that was removed.
	*/
	private class EntryIterator implements Iterator<Map.Entry<K, V>> {

		final Deque<Node<K, V>> stack = new ArrayDeque<Node<K, V>>();
		int expectedModCount = modCount;
		WriteThroughEntry last = null;

		EntryIterator() {
			pushLeft(root);
		}

		private void pushLeft(Node<K, V> x) {
			for (; x != null; x = x.left) { stack.push(x); }
		}

		private void seekPast(K key) {
			stack.clear();
			Node<K, V> x = root;
			while (x != null) {
				if (compare(key, x.key) < 0) {
					stack.push(x);
					x = x.left;
				} else {
					x = x.right;
				}
			}
		}

		@Override public boolean hasNext() {
			return !stack.isEmpty();
		}

		@Override public Map.Entry<K, V> next() {
			if (modCount != expectedModCount) { throw new ConcurrentModificationException(); }
			if (stack.isEmpty()) { throw new NoSuchElementException(); }
			Node<K, V> x = stack.pop();
			pushLeft(x.right);
			return last = new WriteThroughEntry(x);
		}

		@Override public void remove() {
			if (last == null) {
				throw new IllegalStateException("Iteration has not yet begun, or the element has already been removed.");
			}
			if (modCount != expectedModCount) { throw new ConcurrentModificationException(); }
			K key = last.getKey();
			LLRBTreeMap.this.delete(key);
			expectedModCount = modCount;
			last.detached = true;
			seekPast(key);
			last = null;
		}

	}

}
