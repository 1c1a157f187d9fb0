/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.SymbolTable.client;

import plugins.SymbolTable.util.LLRBTreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
** Reads a list of words and reports the most frequently occurring word that
** is at least a given number of characters long.
**
**   % java plugins.SymbolTable.client.FrequencyCounter 8 < tale.txt
**   words: 14350
**   distinct: 5126
**   word: business
**   count: 122
**
** The report is a YAML document. Ties go to the word that sorts first.
*/
public class FrequencyCounter {

	final private static Logger logger = LoggerFactory.getLogger(FrequencyCounter.class);

	/**
	** Words shorter than this are ignored.
	*/
	final public int minLength;

	final protected LLRBTreeMap<String, Integer> table = new LLRBTreeMap<String, Integer>();

	protected int words = 0;

	public FrequencyCounter(int minlen) {
		if (minlen < 0) {
			throw new IllegalArgumentException("Minimum length must be non-negative.");
		}
		minLength = minlen;
	}

	/**
	** Tallies the whitespace-separated words read from the given reader. Can
	** be called more than once to accumulate counts over several inputs.
	*/
	public void count(Reader in) throws IOException {
		BufferedReader br = new BufferedReader(in);
		String line;
		int lines = 0;
		while ((line = br.readLine()) != null) {
			++lines;
			for (String word: line.split("\\s+")) {
				if (word.isEmpty() || word.length() < minLength) { continue; }
				++words;
				Integer c = table.get(word);
				table.put(word, (c == null)? 1: c + 1);
			}
		}
		logger.debug("Read {} lines, {} words so far", lines, words);
	}

	public int words() {
		return words;
	}

	public int distinct() {
		return table.size();
	}

	public LLRBTreeMap<String, Integer> table() {
		return table;
	}

	/**
	** Returns the word with the highest count, or {@code null} if no words
	** have been counted.
	*/
	public Map.Entry<String, Integer> mostFrequent() {
		Map.Entry<String, Integer> max = null;
		for (Map.Entry<String, Integer> en: table.entrySet()) {
			if (max == null || en.getValue() > max.getValue()) {
				max = en;
			}
		}
		return max;
	}

	/**
	** Returns the report as an insertion-ordered map, ready to be dumped.
	*/
	public Map<String, Object> report() {
		Map<String, Object> report = new LinkedHashMap<String, Object>();
		report.put("words", words);
		report.put("distinct", distinct());
		Map.Entry<String, Integer> max = mostFrequent();
		report.put("word", (max == null)? null: max.getKey());
		report.put("count", (max == null)? 0: max.getValue());
		return report;
	}

	public void writeReport(Writer w) throws IOException {
		DumperOptions opt = new DumperOptions();
		opt.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
		new Yaml(opt).dump(report(), w);
		w.flush();
	}

	private static void usage() {
		System.err.println("Usage: FrequencyCounter <minLength> [file]");
		System.exit(1);
	}

	public static void main(String[] args) {
		if (args.length < 1 || args.length > 2) { usage(); }

		int minlen = -1;
		try {
			minlen = Integer.parseInt(args[0]);
		} catch (NumberFormatException e) {
			logger.error("Not a number: {}", args[0]);
			usage();
		}
		if (minlen < 0) { usage(); }

		FrequencyCounter counter = new FrequencyCounter(minlen);
		try {
			InputStream is = (args.length == 2)? new FileInputStream(args[1]): System.in;
			try {
				counter.count(new InputStreamReader(is, StandardCharsets.UTF_8));
			} finally {
				if (is != System.in) { is.close(); }
			}
			logger.info("Counted {} words, {} distinct", counter.words(), counter.distinct());
			counter.writeReport(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
		} catch (IOException e) {
			logger.error("Could not read input", e);
			System.exit(2);
		}
	}

}
