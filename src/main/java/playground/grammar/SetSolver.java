package playground.grammar;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the nullable symbols, the first(1) and the follow(1) sets of a grammar
 * with fixed point iterations and stores them in the grammar.
 *
 * Every iteration stops after the first pass that didn't grow any set. Sets only grow and are bounded by the
 * number of symbols, so no iteration cap is needed.
 */
public class SetSolver {

	private static final Logger LOG = LoggerFactory.getLogger(SetSolver.class);

	private final Grammar grammar;

	private final Set<Symbol> nullable = new LinkedHashSet<>();
	private final Map<Symbol, Set<Symbol>> first = new HashMap<>();
	private final Map<NonTerminal, Set<Terminal>> follow = new HashMap<>();

	public SetSolver(Grammar grammar) {
		this.grammar = grammar;
	}

	/**
	 * Compute all sets and attach them to the grammar.
	 *
	 * @throws IllegalStateException if the grammar's sets are already computed
	 */
	public void solve(){
		calculateNullable();
		calculateFirst();
		calculateFollow();
		grammar.attachSets(nullable, first, follow);
	}

	private void calculateNullable(){
		nullable.add(Epsilon.INSTANCE);
		int passes = 0;
		boolean somethingChanged;
		do {
			somethingChanged = false;
			passes++;
			for (Production production : grammar.getProductions()){
				if (nullable.contains(production.head)){
					continue;
				}
				if (nullable.containsAll(production.body)){
					somethingChanged = nullable.add(production.head) || somethingChanged;
				}
			}
		} while (somethingChanged);
		LOG.debug("Nullable set {} after {} passes", nullable, passes);
	}

	private void calculateFirst(){
		for (Terminal terminal : grammar.getTerminals()){
			first.put(terminal, new LinkedHashSet<>(Set.of(terminal)));
		}
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			first.put(nonTerminal, new LinkedHashSet<>());
		}
		first.put(Epsilon.INSTANCE, new LinkedHashSet<>(Set.of(Epsilon.INSTANCE)));
		first.put(EndMarker.INSTANCE, new LinkedHashSet<>(Set.of(EndMarker.INSTANCE)));
		int passes = 0;
		boolean firstChanged;
		do {
			firstChanged = false;
			passes++;
			for (Production production : grammar.getProductions()){
				Set<Symbol> headSet = first.computeIfAbsent(production.head, k -> new LinkedHashSet<>());
				if (headSet.addAll(firstOfSequence(production.body, first, nullable))){
					firstChanged = true;
				}
			}
		} while (firstChanged);
		LOG.debug("First sets stable after {} passes", passes);
	}

	/**
	 * If A is the start non terminal, put $ into FOLLOW(A).
	 * For each production X → αBβ with non empty β put FIRST(β) − {ε} into FOLLOW(B),
	 * and if ε is in FIRST(β) then put FOLLOW(X) into FOLLOW(B).
	 * For each production X → αB put FOLLOW(X) into FOLLOW(B).
	 */
	private void calculateFollow(){
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			follow.put(nonTerminal, new LinkedHashSet<>());
		}
		if (grammar.getStart() != null){
			follow.computeIfAbsent(grammar.getStart(), k -> new LinkedHashSet<>()).add(EndMarker.INSTANCE);
		}
		int passes = 0;
		boolean followChanged;
		do {
			followChanged = false;
			passes++;
			for (Production production : grammar.getProductions()){
				List<Symbol> body = production.body;
				for (int i = 0; i < body.size(); i++){
					if (!body.get(i).isNonTerminal()){
						continue;
					}
					Set<Terminal> followSet = follow.computeIfAbsent((NonTerminal) body.get(i), k -> new LinkedHashSet<>());
					Set<Terminal> headFollow = follow.getOrDefault(production.head, Set.of());
					List<Symbol> rest = body.subList(i + 1, body.size());
					if (rest.isEmpty()){
						followChanged = followSet.addAll(headFollow) || followChanged;
						continue;
					}
					Set<Symbol> firstOfRest = firstOfSequence(rest, first, nullable);
					for (Symbol symbol : firstOfRest){
						if (!symbol.isEpsilon()){
							followChanged = followSet.add((Terminal) symbol) || followChanged;
						}
					}
					if (firstOfRest.contains(Epsilon.INSTANCE)){
						followChanged = followSet.addAll(headFollow) || followChanged;
					}
				}
			}
		} while (followChanged);
		LOG.debug("Follow sets stable after {} passes", passes);
	}

	/**
	 * FIRST of a sequence of symbols: the first sets without ε of the leading symbols up to and including the first
	 * symbol that isn't nullable, plus ε if every symbol is nullable. FIRST([]) = {ε}.
	 *
	 * @param sequence symbols
	 * @param first first sets of single symbols (possibly still growing)
	 * @param nullable nullable symbols
	 * @return new mutable set
	 */
	static Set<Symbol> firstOfSequence(List<Symbol> sequence, Map<Symbol, Set<Symbol>> first, Set<Symbol> nullable){
		Set<Symbol> result = new LinkedHashSet<>();
		for (Symbol symbol : sequence){
			if (symbol.isEpsilon()){
				// ε derives nothing, it only matters if every symbol is nullable
				continue;
			}
			Set<Symbol> symbolFirst = first.get(symbol);
			if (symbolFirst == null){
				// undeclared symbol of a malformed grammar
				if (symbol.isTerminal() || symbol.isEndMarker()){
					result.add(symbol);
				}
				return result;
			}
			for (Symbol s : symbolFirst){
				if (!s.isEpsilon()){
					result.add(s);
				}
			}
			if (!nullable.contains(symbol)){
				return result;
			}
		}
		result.add(Epsilon.INSTANCE);
		return result;
	}
}
