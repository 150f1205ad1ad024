package playground.parser.ll;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import playground.grammar.Grammar;
import playground.grammar.NonTerminal;
import playground.grammar.Production;
import playground.grammar.Symbol;
import playground.grammar.Terminal;
import playground.util.Utils;

import static playground.util.Utils.quote;

/**
 * Finds the cells of an LL(1) table with more than one production, classifies them and suggests fixes.
 */
public class ConflictDetector {

	private static final Logger LOG = LoggerFactory.getLogger(ConflictDetector.class);

	private final LLParserTable table;
	private final Grammar grammar;

	public ConflictDetector(LLParserTable table) {
		this.table = table;
		this.grammar = table.grammar;
	}

	public static List<Conflict> detect(LLParserTable table){
		return new ConflictDetector(table).detect();
	}

	/**
	 * @return conflicts sorted by non terminal and terminal
	 */
	public List<Conflict> detect(){
		List<Conflict> conflicts = new ArrayList<>();
		for (Table.Cell<NonTerminal, Terminal, List<Production>> cell : table.cells()){
			if (cell.getValue().size() > 1){
				conflicts.add(classify(cell.getRowKey(), cell.getColumnKey(), cell.getValue()));
			}
		}
		if (!conflicts.isEmpty()){
			LOG.warn("Grammar is not LL(1), found {} conflicts", conflicts.size());
		}
		return conflicts;
	}

	/**
	 * FIRST/FOLLOW if the candidates split into nullable and non nullable productions, FIRST/FIRST otherwise.
	 */
	Conflict classify(NonTerminal nonTerminal, Terminal terminal, List<Production> productions){
		List<Production> nullable = new ArrayList<>();
		List<Production> nonNullable = new ArrayList<>();
		for (Production production : productions){
			if (grammar.isProductionNullable(production)){
				nullable.add(production);
			} else {
				nonNullable.add(production);
			}
		}
		if (!nullable.isEmpty() && !nonNullable.isEmpty()){
			String description = String.format("FIRST/FOLLOW conflict for %s with terminal %s: the nullable production " +
					"%s derives %s via FOLLOW(%s) while %s derives it via its FIRST set, both land in the same cell.",
					nonTerminal, quote(terminal), nullable.get(0), quote(terminal), nonTerminal, nonNullable.get(0));
			return new Conflict(Conflict.Kind.FIRST_FOLLOW, nonTerminal, terminal, productions, description,
					suggestFirstFollowFix(nonTerminal, terminal, nullable.get(0)));
		}
		String description = String.format("FIRST/FIRST conflict for %s with terminal %s: several productions start " +
				"with symbols that derive %s.", nonTerminal, quote(terminal), quote(terminal));
		return new Conflict(Conflict.Kind.FIRST_FIRST, nonTerminal, terminal, productions, description,
				suggestFirstFirstFix(nonTerminal, productions));
	}

	/**
	 * Longest prefix that all bodies share position by position
	 */
	static List<Symbol> commonPrefix(List<Production> productions){
		List<Symbol> prefix = new ArrayList<>();
		int minLength = Integer.MAX_VALUE;
		for (Production production : productions){
			minLength = Math.min(minLength, production.body.size());
		}
		for (int i = 0; i < minLength; i++){
			Symbol symbol = productions.get(0).body.get(i);
			for (Production production : productions){
				if (!production.body.get(i).equals(symbol)){
					return prefix;
				}
			}
			prefix.add(symbol);
		}
		return prefix;
	}

	private String suggestFirstFirstFix(NonTerminal nonTerminal, List<Production> productions){
		List<Symbol> prefix = commonPrefix(productions);
		if (prefix.isEmpty()){
			return String.format("The productions of %s are ambiguous on their first symbols. Consider restructuring " +
					"the grammar to remove the ambiguity or use a different grammar that is LL(1).", nonTerminal);
		}
		String prefixStr = Utils.join(prefix, " ");
		String auxiliary = grammar.freshNonTerminalName(nonTerminal.name);
		List<String> suffixes = new ArrayList<>();
		for (Production production : productions){
			List<Symbol> suffix = production.body.subList(prefix.size(), production.body.size());
			suffixes.add(suffix.isEmpty() ? "ε" : Utils.join(suffix, " "));
		}
		return String.format("Left factor the common prefix %s into a new non terminal %s:\n" +
				"  %s → %s %s\n" +
				"  %s → %s", quote(prefixStr), auxiliary, nonTerminal, prefixStr, auxiliary, auxiliary,
				String.join(" | ", suffixes));
	}

	private String suggestFirstFollowFix(NonTerminal nonTerminal, Terminal terminal, Production nullable){
		return String.format("%s can derive ε through %s, and %s is both in FOLLOW(%s) and in the FIRST set of " +
				"another alternative. Consider:\n" +
				"  1. removing the ε alternative if possible\n" +
				"  2. restructuring the grammar so that FIRST and FOLLOW of %s are disjoint on %s",
				nonTerminal, nullable, quote(terminal), nonTerminal, nonTerminal, quote(terminal));
	}
}
