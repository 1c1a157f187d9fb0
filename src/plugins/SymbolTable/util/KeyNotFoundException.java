/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.SymbolTable.util;

import java.util.NoSuchElementException;

/**
** Thrown by {@link LLRBTreeMap#floor(Object)} and {@link
** LLRBTreeMap#ceil(Object)} when the table is not empty, but none of its
** keys lie on the requested side of the search key.
*/
public class KeyNotFoundException extends NoSuchElementException {

	/**
	** The key that was searched for.
	*/
	final Object key;

	public KeyNotFoundException(String s, Object k) {
		super(s);
		key = k;
	}

	public Object getKey() { return key; }

}
