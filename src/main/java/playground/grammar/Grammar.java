package playground.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import static playground.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals, productions and a start symbol.
 *
 * The nullable set and the first and follow sets are populated exactly once by the {@link SetSolver},
 * the calculate methods run it on demand.
 *
 * Use the {@link GrammarBuilder} or the {@link GrammarParser} to build a grammar instance properly.
 */
public class Grammar implements Serializable {

	private final Set<Terminal> terminals;

	private final Set<NonTerminal> nonTerminals;

	private final List<Production> productions;

	/**
	 * Might be null for malformed grammars, {@link #validate()} reports this.
	 */
	private final NonTerminal start;

	private Set<Symbol> nullable;
	private Map<Symbol, Set<Symbol>> firstSets;
	private Map<NonTerminal, Set<Terminal>> followSets;

	/**
	 * Create a new Grammar object, nothing is checked here, use {@link #validate()} for this.
	 *
	 * @param terminals declared terminals
	 * @param nonTerminals declared non terminals
	 * @param start start non terminal
	 * @param productions productions in declaration order
	 */
	public Grammar(Set<Terminal> terminals, Set<NonTerminal> nonTerminals, NonTerminal start,
	               List<Production> productions) {
		this.terminals = ImmutableSet.copyOf(terminals);
		this.nonTerminals = ImmutableSet.copyOf(nonTerminals);
		this.start = start;
		this.productions = ImmutableList.copyOf(productions);
	}

	public Set<Terminal> getTerminals(){
		return terminals;
	}

	public Set<NonTerminal> getNonTerminals(){
		return nonTerminals;
	}

	public List<Production> getProductions(){
		return productions;
	}

	public NonTerminal getStart(){
		return start;
	}

	public List<Production> getProductionsOf(NonTerminal nonTerminal) {
		List<Production> ret = new ArrayList<>();
		for (Production production : productions) {
			if (production.head.equals(nonTerminal)) {
				ret.add(production);
			}
		}
		return ret;
	}

	/**
	 * Checks the structure of the grammar, every check is independent of the others.
	 *
	 * @return list of error messages, empty if the grammar is well formed
	 */
	public List<String> validate(){
		List<String> errors = new ArrayList<>();
		if (start == null){
			errors.add("No start symbol defined");
		} else if (!nonTerminals.contains(start)){
			errors.add(String.format("Start symbol '%s' is not a declared non terminal", start));
		}
		if (productions.isEmpty()){
			errors.add("No productions defined");
		}
		for (NonTerminal nonTerminal : nonTerminals){
			if (getProductionsOf(nonTerminal).isEmpty()){
				errors.add(String.format("Non terminal '%s' has no productions", nonTerminal));
			}
		}
		for (Production production : productions){
			if (!nonTerminals.contains(production.head)){
				errors.add(String.format("Production head '%s' is not a declared non terminal", production.head));
			}
			for (Symbol symbol : production.body){
				if (symbol.isEpsilon()){
					continue;
				}
				if (!terminals.contains(symbol) && !nonTerminals.contains(symbol)){
					errors.add(String.format("Symbol '%s' in production '%s' is not defined", symbol, production));
				}
			}
		}
		return errors;
	}

	public boolean isSolved(){
		return firstSets != null;
	}

	void attachSets(Set<Symbol> nullable, Map<Symbol, Set<Symbol>> firstSets,
	                Map<NonTerminal, Set<Terminal>> followSets){
		Preconditions.checkState(!isSolved(), "The sets of this grammar are already computed");
		this.nullable = Collections.unmodifiableSet(nullable);
		this.firstSets = Collections.unmodifiableMap(firstSets);
		this.followSets = Collections.unmodifiableMap(followSets);
	}

	private void ensureSolved(){
		if (!isSolved()){
			new SetSolver(this).solve();
		}
	}

	/**
	 * Calculate the symbols that can derive ε (always contains ε itself).
	 */
	public Set<Symbol> calculateNullable(){
		ensureSolved();
		return nullable;
	}

	/**
	 * Calculate the first(k=1) sets for every terminal, non terminal, ε and $.
	 */
	public Map<Symbol, Set<Symbol>> calculateFirst1Set(){
		ensureSolved();
		return firstSets;
	}

	/**
	 * Calculate the follow(k=1) sets for all non terminals.
	 */
	public Map<NonTerminal, Set<Terminal>> calculateFollow1Set(){
		ensureSolved();
		return followSets;
	}

	public Set<Symbol> calculateFirst1SetForTerm(List<Symbol> term){
		ensureSolved();
		return SetSolver.firstOfSequence(term, firstSets, nullable);
	}

	/**
	 * Can the body of this production be derived to ε?
	 */
	public boolean isProductionNullable(Production production){
		if (production.isEpsilonProduction()){
			return true;
		}
		Set<Symbol> nullable = calculateNullable();
		for (Symbol symbol : production.body){
			if (!nullable.contains(symbol)){
				return false;
			}
		}
		return true;
	}

	/**
	 * Name for a new auxiliary non terminal based on the passed one, primes are appended until the name is unused.
	 */
	public String freshNonTerminalName(String base){
		Set<String> names = new HashSet<>();
		for (NonTerminal nonTerminal : nonTerminals) {
			names.add(nonTerminal.name);
		}
		for (Terminal terminal : terminals) {
			names.add(terminal.name);
		}
		String name = base + "'";
		while (names.contains(name)) {
			name += "'";
		}
		return name;
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + join(new ArrayList<>(nonTerminals), ", ") + "\n" +
				"Terminals: " + join(new ArrayList<>(terminals), ", ") + "\n" +
				"Productions: \n" + join(productions, "\n");
	}

	@Override
	public String toString() {
		return GrammarParser.format(this);
	}
}
