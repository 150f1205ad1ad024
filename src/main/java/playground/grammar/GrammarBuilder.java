package playground.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

import playground.PlaygroundException;

/**
 * Allows the simple creation of grammars.
 *
 * Symbols are passed by their spelling. Every head of a production is a non terminal, the other spellings are
 * classified with {@link #isTerminalName(String)} unless they are declared explicitly.
 * The empty string and the spellings in {@link #EPSILON_SPELLINGS} stand for ε.
 */
public class GrammarBuilder {

	public static final Set<String> EPSILON_SPELLINGS = ImmutableSet.of("ε", "epsilon", "ɛ");

	private static final Set<String> OPERATORS = ImmutableSet.of(
			":=", "==", "!=", "<=", ">=", "->", "=>", "++", "--", "&&", "||");

	private final List<String> heads = new ArrayList<>();
	private final List<List<String>> bodies = new ArrayList<>();
	private final Set<String> declaredTerminals = new LinkedHashSet<>();
	private final Set<String> declaredNonTerminals = new LinkedHashSet<>();

	/**
	 * Adds a new production.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right spellings of the right hand side, no symbols or a single ε spelling for an epsilon production
	 */
	public GrammarBuilder add(String left, String... right){
		return add(left, List.of(right));
	}

	public GrammarBuilder add(String left, List<String> right){
		if (declaredTerminals.contains(left)){
			throw new PlaygroundException(String.format("Ambiguity while building the grammar: '%s' is declared as a " +
					"terminal and therefore can't be used as a non terminal name", left));
		}
		heads.add(left);
		bodies.add(new ArrayList<>(right));
		return this;
	}

	/**
	 * Declare spellings as terminals, bypassing the spelling heuristic.
	 */
	public GrammarBuilder terminals(String... names){
		for (String name : names){
			if (heads.contains(name)){
				throw new PlaygroundException(String.format("'%s' is the head of a production and can't be a terminal", name));
			}
			declaredTerminals.add(name);
		}
		return this;
	}

	/**
	 * Declare spellings as non terminals, even if they never appear as the head of a production.
	 */
	public GrammarBuilder nonTerminals(String... names){
		declaredNonTerminals.addAll(List.of(names));
		return this;
	}

	public static boolean isEpsilon(String name){
		return name.isEmpty() || EPSILON_SPELLINGS.contains(name);
	}

	/**
	 * Spelling heuristic for symbols that aren't production heads: quoted strings, single non alphabetic characters,
	 * common operators and everything starting with a lower case or non alphabetic character are terminals.
	 */
	public static boolean isTerminalName(String name){
		if (isEpsilon(name)){
			return false;
		}
		if (name.length() >= 2 && ((name.startsWith("'") && name.endsWith("'"))
				|| (name.startsWith("\"") && name.endsWith("\"")))){
			return true;
		}
		if (name.length() == 1 && !Character.isLetter(name.charAt(0))){
			return true;
		}
		if (OPERATORS.contains(name)){
			return true;
		}
		char first = name.charAt(0);
		return Character.isLowerCase(first) || !Character.isLetter(first);
	}

	/**
	 * Create the grammar, the start symbol is the head of the first production.
	 */
	public Grammar toGrammar(){
		return toGrammar(heads.isEmpty() ? null : heads.get(0));
	}

	/**
	 * Create the grammar
	 *
	 * @param start name of the start non terminal, might be null (resulting in an invalid grammar)
	 */
	public Grammar toGrammar(String start){
		Map<String, Symbol> symbols = new LinkedHashMap<>();
		for (String head : heads){
			symbols.computeIfAbsent(head, NonTerminal::new);
		}
		for (String name : declaredNonTerminals){
			symbols.computeIfAbsent(name, NonTerminal::new);
		}
		for (List<String> body : bodies){
			for (String name : body){
				if (isEpsilon(name) || symbols.containsKey(name)){
					continue;
				}
				if (declaredTerminals.contains(name) || isTerminalName(name)){
					symbols.put(name, new Terminal(name));
				} else {
					symbols.put(name, new NonTerminal(name));
				}
			}
		}
		for (String name : declaredTerminals){
			symbols.computeIfAbsent(name, Terminal::new);
		}
		Set<Terminal> terminals = new LinkedHashSet<>();
		Set<NonTerminal> nonTerminals = new LinkedHashSet<>();
		for (Symbol symbol : symbols.values()){
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal) symbol);
			} else {
				terminals.add((Terminal) symbol);
			}
		}
		List<Production> productions = new ArrayList<>();
		for (int i = 0; i < heads.size(); i++){
			List<Symbol> body = new ArrayList<>();
			for (String name : bodies.get(i)){
				body.add(isEpsilon(name) ? Epsilon.INSTANCE : symbols.get(name));
			}
			if (body.isEmpty()){
				body.add(Epsilon.INSTANCE);
			}
			productions.add(new Production(i, (NonTerminal) symbols.get(heads.get(i)), body));
		}
		NonTerminal startSymbol = null;
		if (start != null){
			Symbol symbol = symbols.get(start);
			startSymbol = symbol instanceof NonTerminal ? (NonTerminal) symbol : new NonTerminal(start);
		}
		return new Grammar(terminals, nonTerminals, startSymbol, productions);
	}
}
