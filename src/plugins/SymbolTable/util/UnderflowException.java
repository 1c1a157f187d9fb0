/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.SymbolTable.util;

import java.util.NoSuchElementException;

/**
** Thrown when an operation needs at least one entry, but the table it was
** called on is empty.
**
** @see LLRBTreeMap#min()
** @see LLRBTreeMap#deleteMin()
*/
public class UnderflowException extends NoSuchElementException {

	public UnderflowException(String s) {
		super(s);
	}

	public UnderflowException() {
		this("symbol table underflow");
	}

}
