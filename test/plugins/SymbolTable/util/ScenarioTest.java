/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.SymbolTable.util;

import junit.framework.TestCase;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
** Replays the scenarios described in {@code scenarios.yml}.
*/
public class ScenarioTest extends TestCase {

	@SuppressWarnings("unchecked")
	private static List<Map<String, Object>> loadScenarios() throws IOException {
		InputStream is = ScenarioTest.class.getResourceAsStream("scenarios.yml");
		assertNotNull("scenarios.yml not on the classpath", is);
		try {
			Map<String, Object> doc = (Map<String, Object>)new Yaml().load(is);
			return (List<Map<String, Object>>)doc.get("scenarios");
		} finally {
			is.close();
		}
	}

	@SuppressWarnings("unchecked")
	private static void replay(Map<String, Object> scenario) {
		String name = (String)scenario.get("name");
		LLRBTreeMap<String, Integer> map = new LLRBTreeMap<String, Integer>();

		for (List<Object> pair: (List<List<Object>>)scenario.get("put")) {
			map.put((String)pair.get(0), (Integer)pair.get(1));
			map.verifyTreeIntegrity();
		}
		for (String key: (List<String>)scenario.get("delete")) {
			map.delete(key);
			map.verifyTreeIntegrity();
		}

		Map<String, Object> expect = (Map<String, Object>)scenario.get("expect");
		assertEquals(name, expect.get("size"), map.size());
		assertEquals(name, expect.get("keys"), map.keys());
		for (Map.Entry<String, Integer> en: ((Map<String, Integer>)expect.get("get")).entrySet()) {
			assertEquals(name, en.getValue(), map.get(en.getKey()));
		}
		for (String key: (List<String>)expect.get("absent")) {
			assertFalse(name, map.contains(key));
		}
		for (Map.Entry<String, Integer> en: ((Map<String, Integer>)expect.get("rank")).entrySet()) {
			assertEquals(name, en.getValue().intValue(), map.rank(en.getKey()));
		}
		for (Map.Entry<Integer, String> en: ((Map<Integer, String>)expect.get("select")).entrySet()) {
			assertEquals(name, en.getValue(), map.select(en.getKey()));
		}
		for (Map.Entry<String, String> en: ((Map<String, String>)expect.get("floor")).entrySet()) {
			assertEquals(name, en.getValue(), map.floor(en.getKey()));
		}
		for (Map.Entry<String, String> en: ((Map<String, String>)expect.get("ceil")).entrySet()) {
			assertEquals(name, en.getValue(), map.ceil(en.getKey()));
		}
		assertTrue(name, map.check());
	}

	public void testScenarios() throws IOException {
		List<Map<String, Object>> scenarios = loadScenarios();
		assertFalse(scenarios.isEmpty());
		for (Map<String, Object> scenario: scenarios) {
			replay(scenario);
		}
	}

}
