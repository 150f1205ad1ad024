package playground.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.junit.jupiter.api.function.Executable;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Collects checks on the sets of a grammar and runs them together with {@code assertAll}
 */
public class GrammarMatcher {

	private final Grammar grammar;
	private final List<Executable> testers = new ArrayList<>();

	public GrammarMatcher(Grammar grammar) {
		this.grammar = grammar;
	}

	public static GrammarMatcher parse(String grammar){
		return new GrammarMatcher(GrammarParser.parse(grammar));
	}

	private static Set<String> names(Set<? extends Symbol> symbols){
		Set<String> ret = new TreeSet<>();
		for (Symbol symbol : symbols){
			ret.add(symbol.name);
		}
		return ret;
	}

	private static Set<String> expected(String... names){
		return new TreeSet<>(List.of(names));
	}

	public GrammarMatcher first(String nonTerminal, String... expected){
		testers.add(() -> assertEquals(expected(expected),
				names(grammar.calculateFirst1Set().get(new NonTerminal(nonTerminal))),
				String.format("FIRST(%s)", nonTerminal)));
		return this;
	}

	public GrammarMatcher follow(String nonTerminal, String... expected){
		testers.add(() -> assertEquals(expected(expected),
				names(grammar.calculateFollow1Set().get(new NonTerminal(nonTerminal))),
				String.format("FOLLOW(%s)", nonTerminal)));
		return this;
	}

	public GrammarMatcher nullable(String... nonTerminals){
		for (String nonTerminal : nonTerminals){
			testers.add(() -> assertTrue(grammar.calculateNullable().contains(new NonTerminal(nonTerminal)),
					String.format("%s should be nullable", nonTerminal)));
		}
		return this;
	}

	public GrammarMatcher notNullable(String... nonTerminals){
		for (String nonTerminal : nonTerminals){
			testers.add(() -> assertFalse(grammar.calculateNullable().contains(new NonTerminal(nonTerminal)),
					String.format("%s shouldn't be nullable", nonTerminal)));
		}
		return this;
	}

	public GrammarMatcher terminals(String... expected){
		testers.add(() -> assertEquals(expected(expected), names(grammar.getTerminals()), "terminals"));
		return this;
	}

	public GrammarMatcher nonTerminals(String... expected){
		testers.add(() -> assertEquals(expected(expected), names(grammar.getNonTerminals()), "non terminals"));
		return this;
	}

	public GrammarMatcher valid(){
		testers.add(() -> assertEquals(List.of(), grammar.validate(), "grammar should be valid"));
		return this;
	}

	public void run(){
		assertAll(testers.toArray(new Executable[0]));
	}
}
