package playground.report;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Table;
import org.json.JSONArray;
import org.json.JSONObject;

import playground.GrammarAnalysis;
import playground.grammar.Grammar;
import playground.grammar.NonTerminal;
import playground.grammar.Production;
import playground.grammar.Symbol;
import playground.grammar.Terminal;
import playground.parser.ll.Conflict;

/**
 * Renders a {@link GrammarAnalysis} as JSON or as plain text.
 *
 * Sets are rendered as sorted lists of spellings, ε and the end marker as {@code ε} and {@code $}.
 */
public class AnalysisReport {

	private final GrammarAnalysis analysis;
	private final Grammar grammar;

	public AnalysisReport(GrammarAnalysis analysis) {
		this.analysis = analysis;
		this.grammar = analysis.grammar;
	}

	static List<String> sortedNames(Collection<? extends Symbol> symbols){
		List<String> names = new ArrayList<>();
		for (Symbol symbol : symbols){
			names.add(symbol.name);
		}
		Collections.sort(names);
		return names;
	}

	private static List<String> productionStrings(List<Production> productions){
		List<String> ret = new ArrayList<>();
		for (Production production : productions){
			ret.add(production.toString());
		}
		return ret;
	}

	private List<NonTerminal> sortedNonTerminals(){
		List<NonTerminal> nonTerminals = new ArrayList<>(grammar.getNonTerminals());
		Collections.sort(nonTerminals);
		return nonTerminals;
	}

	public JSONObject toJson(){
		JSONObject grammarJson = new JSONObject()
				.put("terminals", new JSONArray(sortedNames(grammar.getTerminals())))
				.put("non_terminals", new JSONArray(sortedNames(grammar.getNonTerminals())))
				.put("start_symbol", grammar.getStart() == null ? JSONObject.NULL : grammar.getStart().name)
				.put("productions", new JSONArray(productionStrings(grammar.getProductions())));
		List<Symbol> nullable = new ArrayList<>();
		for (Symbol symbol : grammar.calculateNullable()){
			if (symbol.isNonTerminal()){
				nullable.add(symbol);
			}
		}
		Map<Symbol, Set<Symbol>> first = grammar.calculateFirst1Set();
		Map<NonTerminal, Set<Terminal>> follow = grammar.calculateFollow1Set();
		JSONObject firstJson = new JSONObject();
		JSONObject followJson = new JSONObject();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			firstJson.put(nonTerminal.name, new JSONArray(sortedNames(first.getOrDefault(nonTerminal, Set.of()))));
			followJson.put(nonTerminal.name, new JSONArray(sortedNames(follow.getOrDefault(nonTerminal, Set.of()))));
		}
		JSONObject tableJson = new JSONObject();
		for (Table.Cell<NonTerminal, Terminal, List<Production>> cell : analysis.table.cells()){
			tableJson.put(cell.getRowKey().name + "," + cell.getColumnKey().name,
					new JSONArray(productionStrings(cell.getValue())));
		}
		JSONArray conflictsJson = new JSONArray();
		for (Conflict conflict : analysis.conflicts){
			conflictsJson.put(new JSONObject()
					.put("type", conflict.kind.label)
					.put("non_terminal", conflict.nonTerminal.name)
					.put("terminal", conflict.terminal.name)
					.put("productions", new JSONArray(productionStrings(conflict.productions)))
					.put("description", conflict.description)
					.put("suggestion", conflict.suggestion));
		}
		return new JSONObject()
				.put("grammar", grammarJson)
				.put("nullable", new JSONArray(sortedNames(nullable)))
				.put("first_sets", firstJson)
				.put("follow_sets", followJson)
				.put("ll1_table", tableJson)
				.put("conflicts", conflictsJson)
				.put("is_ll1", analysis.isLL1())
				.put("validation_errors", new JSONArray(analysis.validationErrors));
	}

	public String toText(){
		StringBuilder builder = new StringBuilder();
		builder.append(grammar.longDescription()).append("\n");
		for (String error : analysis.validationErrors){
			builder.append("Validation error: ").append(error).append("\n");
		}
		builder.append("\nFIRST sets:\n");
		for (NonTerminal nonTerminal : sortedNonTerminals()){
			builder.append(String.format("  FIRST(%s) = { %s }%n", nonTerminal,
					String.join(", ", sortedNames(grammar.calculateFirst1Set().getOrDefault(nonTerminal, Set.of())))));
		}
		builder.append("\nFOLLOW sets:\n");
		for (NonTerminal nonTerminal : sortedNonTerminals()){
			builder.append(String.format("  FOLLOW(%s) = { %s }%n", nonTerminal,
					String.join(", ", sortedNames(grammar.calculateFollow1Set().getOrDefault(nonTerminal, Set.of())))));
		}
		builder.append("\nLL(1) table:\n").append(analysis.table).append("\n");
		if (analysis.isLL1()){
			builder.append("\nThe grammar is LL(1).\n");
		} else {
			builder.append(String.format("%nThe grammar is not LL(1), %d conflicts:%n", analysis.conflicts.size()));
			for (Conflict conflict : analysis.conflicts){
				builder.append("\n").append(conflict.description).append("\n").append(conflict.suggestion).append("\n");
			}
		}
		return builder.toString();
	}
}
