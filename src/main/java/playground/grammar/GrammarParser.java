package playground.grammar;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Splitter;

/**
 * Parser for the textual grammar notation:
 *
 * <pre>
 * Grammar      ::= Production+
 * Production   ::= Head Arrow Alternatives
 * Arrow        ::= "→" | "->"
 * Alternatives ::= Sequence ( "|" Sequence )*
 * Sequence     ::= Symbol+ | Epsilon | (nothing)
 * Epsilon      ::= "ε" | "epsilon" | "ɛ"
 * </pre>
 *
 * One production per line, blank lines and lines starting with {@code #} are ignored.
 */
public class GrammarParser {

	public static final String ARROW = "→";

	private static final String ASCII_ARROW = "->";

	private static final Splitter ALTERNATIVE_SPLITTER = Splitter.on('|').trimResults();

	private static final Splitter SYMBOL_SPLITTER = Splitter.onPattern("\\s+").omitEmptyStrings();

	private GrammarParser() {
	}

	/**
	 * Parse the passed grammar text.
	 *
	 * @throws GrammarSyntaxError if a line has no arrow or the head isn't a single symbol
	 */
	public static Grammar parse(String text){
		return toBuilder(text).toGrammar();
	}

	public static GrammarBuilder toBuilder(String text){
		// literal "\n" sequences come from JSON encoded grammars
		String normalized = text.replace("\\n", "\n").replace(ASCII_ARROW, ARROW);
		String[] lines = normalized.split("\\r?\\n|\\r");
		GrammarBuilder builder = new GrammarBuilder();
		for (int i = 0; i < lines.length; i++){
			String line = lines[i].trim();
			if (line.isEmpty() || line.startsWith("#")){
				continue;
			}
			int arrow = line.indexOf(ARROW);
			if (arrow == -1){
				throw new GrammarSyntaxError(i + 1,
						String.format("A production needs an arrow '%s' or '%s': %s", ARROW, ASCII_ARROW, line));
			}
			String head = line.substring(0, arrow).trim();
			if (head.isEmpty() || head.chars().anyMatch(Character::isWhitespace)){
				throw new GrammarSyntaxError(i + 1,
						String.format("The head of a production has to be a single symbol, found '%s'", head));
			}
			for (String alternative : ALTERNATIVE_SPLITTER.split(line.substring(arrow + ARROW.length()))){
				List<String> symbols = new ArrayList<>(SYMBOL_SPLITTER.splitToList(alternative));
				if (symbols.isEmpty()){
					symbols.add(Epsilon.INSTANCE.name);
				}
				builder.add(head, symbols);
			}
		}
		return builder;
	}

	/**
	 * Inverse of {@link #parse(String)}: one line per group of consecutive productions with the same head.
	 */
	public static String format(Grammar grammar){
		List<String> lines = new ArrayList<>();
		NonTerminal currentHead = null;
		List<String> alternatives = new ArrayList<>();
		for (Production production : grammar.getProductions()){
			if (!production.head.equals(currentHead)){
				if (currentHead != null){
					lines.add(currentHead + " " + ARROW + " " + String.join(" | ", alternatives));
				}
				currentHead = production.head;
				alternatives = new ArrayList<>();
			}
			alternatives.add(production.formatRightSide());
		}
		if (currentHead != null){
			lines.add(currentHead + " " + ARROW + " " + String.join(" | ", alternatives));
		}
		return String.join("\n", lines);
	}
}
