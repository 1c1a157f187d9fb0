/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.SymbolTable.client;

import junit.framework.TestCase;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Map;

public class FrequencyCounterTest extends TestCase {

	final public static String TINY_TALE =
		"it was the best of times it was the worst of times\n" +
		"it was the age of wisdom it was the age of foolishness\n" +
		"\n" +
		"  it was the epoch of belief it was the epoch of incredulity\n" +
		"it was the season of light it was the season of darkness\n" +
		"it was the spring of hope it was the winter of despair\n";

	public void testCountAll() throws IOException {
		FrequencyCounter fc = new FrequencyCounter(1);
		fc.count(new StringReader(TINY_TALE));
		assertEquals(60, fc.words());
		assertEquals(20, fc.distinct());
		// "it", "of", "the" and "was" all occur 10 times; ties go to the first
		Map.Entry<String, Integer> max = fc.mostFrequent();
		assertEquals("it", max.getKey());
		assertEquals(10, (int)max.getValue());
		fc.table().verifyTreeIntegrity();
	}

	public void testMinLength() throws IOException {
		FrequencyCounter fc = new FrequencyCounter(8);
		fc.count(new StringReader(TINY_TALE));
		assertEquals(Arrays.asList("darkness", "foolishness", "incredulity"), fc.table().keys());
		assertEquals(3, fc.words());
		assertEquals("darkness", fc.mostFrequent().getKey());
	}

	public void testAccumulates() throws IOException {
		FrequencyCounter fc = new FrequencyCounter(3);
		fc.count(new StringReader("age age wisdom"));
		fc.count(new StringReader("wisdom wisdom"));
		assertEquals(5, fc.words());
		assertEquals(2, fc.distinct());
		assertEquals("wisdom", fc.mostFrequent().getKey());
		assertEquals(Integer.valueOf(2), fc.table().get("age"));
	}

	public void testEmptyInput() throws IOException {
		FrequencyCounter fc = new FrequencyCounter(1);
		fc.count(new StringReader(""));
		assertNull(fc.mostFrequent());
		Map<String, Object> report = fc.report();
		assertEquals(0, report.get("words"));
		assertNull(report.get("word"));
		assertEquals(0, report.get("count"));
	}

	@SuppressWarnings("unchecked")
	public void testReportIsYaml() throws IOException {
		FrequencyCounter fc = new FrequencyCounter(6);
		fc.count(new StringReader(TINY_TALE));
		StringWriter w = new StringWriter();
		fc.writeReport(w);

		Map<String, Object> report = (Map<String, Object>)new Yaml().load(w.toString());
		assertEquals(fc.words(), report.get("words"));
		assertEquals(fc.distinct(), report.get("distinct"));
		assertEquals("season", report.get("word"));
		assertEquals(2, report.get("count"));
	}

	public void testNegativeMinLength() {
		try {
			new FrequencyCounter(-1);
			fail("expected IllegalArgumentException");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

}
