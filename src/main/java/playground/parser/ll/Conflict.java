package playground.parser.ll;

import java.util.List;

import com.google.common.collect.ImmutableList;

import playground.grammar.NonTerminal;
import playground.grammar.Production;
import playground.grammar.Terminal;

/**
 * A cell of the LL(1) table with more than one candidate production, together with an explanation
 * and a suggestion how to remove it.
 */
public class Conflict {

	public enum Kind {
		/**
		 * Several non nullable alternatives share the terminal in their first sets
		 */
		FIRST_FIRST("FIRST/FIRST"),
		/**
		 * A nullable alternative gets the terminal via the follow set, another one via its first set
		 */
		FIRST_FOLLOW("FIRST/FOLLOW");

		public final String label;

		Kind(String label) {
			this.label = label;
		}

		@Override
		public String toString() {
			return label;
		}
	}

	public final Kind kind;
	public final NonTerminal nonTerminal;
	public final Terminal terminal;
	public final List<Production> productions;
	public final String description;
	public final String suggestion;

	public Conflict(Kind kind, NonTerminal nonTerminal, Terminal terminal, List<Production> productions,
	                String description, String suggestion) {
		this.kind = kind;
		this.nonTerminal = nonTerminal;
		this.terminal = terminal;
		this.productions = ImmutableList.copyOf(productions);
		this.description = description;
		this.suggestion = suggestion;
	}

	@Override
	public String toString() {
		return kind + " conflict at (" + nonTerminal + ", " + terminal + "): " + productions;
	}
}
