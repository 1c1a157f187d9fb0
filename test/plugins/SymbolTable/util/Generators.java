/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.SymbolTable.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
** Seeded random data for the map tests.
*/
final public class Generators {

	final public static Random rand;

	static {
		long seed = System.currentTimeMillis();
		rand = new Random(seed);
		System.err.println("Generators.rand initialised with seed " + seed);
	}

	private Generators() {}

	public static String rndStr() {
		return UUID.randomUUID().toString();
	}

	public static String rndKey() {
		return rndStr().substring(0,8);
	}

	/**
	** Returns the integers {@code [0, n)} in random order.
	*/
	public static List<Integer> shuffled(int n) {
		List<Integer> xs = new ArrayList<Integer>(n);
		for (int i=0; i<n; ++i) { xs.add(i); }
		Collections.shuffle(xs, rand);
		return xs;
	}

}
