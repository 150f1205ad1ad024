package playground.parser.ll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Table;
import com.google.common.collect.TreeBasedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import playground.grammar.Epsilon;
import playground.grammar.Grammar;
import playground.grammar.NonTerminal;
import playground.grammar.Production;
import playground.grammar.Symbol;
import playground.grammar.Terminal;

/**
 * LL(1) parser table: maps a non terminal and a lookahead terminal to the candidate productions.
 *
 * Cells keep their candidates in insertion order without duplicates, a cell with more than one
 * candidate is a conflict (see {@link ConflictDetector}).
 */
public class LLParserTable {

	private static final Logger LOG = LoggerFactory.getLogger(LLParserTable.class);

	public final Grammar grammar;

	private final Table<NonTerminal, Terminal, List<Production>> table = TreeBasedTable.create();

	public LLParserTable(Grammar grammar){
		this.grammar = grammar;
	}

	/**
	 * For every production A → β put it into the cells (A, t) for every t in FIRST(β) − {ε}
	 * and, if ε is in FIRST(β), for every t in FOLLOW(A).
	 */
	public static LLParserTable fromGrammar(Grammar grammar){
		LLParserTable llTable = new LLParserTable(grammar);
		Map<NonTerminal, Set<Terminal>> follow = grammar.calculateFollow1Set();
		for (Production production : grammar.getProductions()){
			Set<Symbol> first = grammar.calculateFirst1SetForTerm(production.body);
			for (Symbol symbol : first){
				if (!symbol.isEpsilon()){
					llTable.insertAction(production.head, (Terminal) symbol, production);
				}
			}
			if (first.contains(Epsilon.INSTANCE)){
				for (Terminal lookahead : follow.getOrDefault(production.head, Set.of())){
					llTable.insertAction(production.head, lookahead, production);
				}
			}
		}
		return llTable;
	}

	public void insertAction(NonTerminal nonTerminal, Terminal lookahead, Production executedProduction){
		List<Production> cell = table.get(nonTerminal, lookahead);
		if (cell == null){
			cell = new ArrayList<>();
			table.put(nonTerminal, lookahead, cell);
		}
		if (cell.contains(executedProduction)){
			return;
		}
		if (!cell.isEmpty()){
			LOG.debug("Conflict between {} and {} at lookahead token {}", cell, executedProduction, lookahead);
		}
		cell.add(executedProduction);
	}

	/**
	 * @return candidates of the cell in insertion order, empty if there's no entry
	 */
	public List<Production> get(NonTerminal nonTerminal, Terminal lookahead){
		List<Production> cell = table.get(nonTerminal, lookahead);
		return cell == null ? List.of() : Collections.unmodifiableList(cell);
	}

	/**
	 * Terminals that have an entry in the row of the passed non terminal, sorted
	 */
	public Set<Terminal> expectedTerminals(NonTerminal nonTerminal){
		return Collections.unmodifiableSet(table.row(nonTerminal).keySet());
	}

	/**
	 * All non empty cells, sorted by non terminal and then by terminal
	 */
	public Set<Table.Cell<NonTerminal, Terminal, List<Production>>> cells(){
		return Collections.unmodifiableSet(table.cellSet());
	}

	/**
	 * Is no cell of the table occupied by more than one production?
	 */
	public boolean isLL1(){
		for (List<Production> cell : table.values()){
			if (cell.size() > 1){
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		boolean firstRow = true;
		for (NonTerminal nonTerminal : table.rowKeySet()){
			if (!firstRow){
				builder.append("\n");
			}
			firstRow = false;
			builder.append(nonTerminal).append(" = {");
			for (Map.Entry<Terminal, List<Production>> entry : table.row(nonTerminal).entrySet()){
				builder.append(" ").append(entry.getKey()).append(" = {");
				for (Production production : entry.getValue()){
					builder.append(" ").append(production);
				}
				builder.append(" }");
			}
			builder.append(" }");
		}
		return builder.toString();
	}
}
