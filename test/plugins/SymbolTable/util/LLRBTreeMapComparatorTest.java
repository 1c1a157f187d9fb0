/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.SymbolTable.util;

import java.util.Arrays;
import java.util.Collections;

/**
** Runs the view tests against a map ordered by an explicit comparator.
*/
public class LLRBTreeMapComparatorTest extends OrderedMapTestSkeleton {

	@Override public LLRBTreeMap<String, Integer> makeTestMap() {
		return new LLRBTreeMap<String, Integer>(Collections.<String>reverseOrder());
	}

	public void testReverseOrder() {
		LLRBTreeMap<String, Integer> map = makeTestMap();
		for (String k: Arrays.asList("b", "d", "a", "e", "c")) {
			map.put(k, (int)k.charAt(0));
			map.verifyTreeIntegrity();
		}
		assertEquals(Arrays.asList("e", "d", "c", "b", "a"), map.keys());
		assertEquals("e", map.min());
		assertEquals("a", map.max());
		assertEquals(1, map.rank("d"));
		assertEquals("c", map.select(2));
		// floor is the greatest key not after the argument, in comparator order
		assertEquals("d", map.floor("cc"));
		assertEquals("c", map.ceil("cc"));
		assertEquals(Arrays.asList("d", "c", "b"), map.rangeKeys("d", "b"));
	}

	public void testCaseInsensitiveKeys() {
		LLRBTreeMap<String, Integer> map = new LLRBTreeMap<String, Integer>(String.CASE_INSENSITIVE_ORDER);
		map.put("Apple", 1);
		map.put("APPLE", 2);
		map.put("banana", 3);
		assertEquals(2, map.size());
		assertEquals(Integer.valueOf(2), map.get("apple"));
		// the first key inserted is kept
		assertEquals("Apple", map.min());
		map.delete("BANANA");
		assertEquals(1, map.size());
		map.verifyTreeIntegrity();
	}

}
