package playground.grammar;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import playground.PlaygroundException;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

	@Test
	public void testValidGrammar(){
		assertEquals(List.of(), GrammarParser.parse("S → a S | ε").validate());
	}

	@Test
	public void testEmptyGrammar(){
		List<String> errors = GrammarParser.parse("# nothing here").validate();
		assertTrue(errors.contains("No start symbol defined"), errors.toString());
		assertTrue(errors.contains("No productions defined"), errors.toString());
	}

	@Test
	public void testUnknownStartSymbol(){
		Grammar grammar = new GrammarBuilder().add("S", "a").toGrammar("X");
		assertEquals(List.of("Start symbol 'X' is not a declared non terminal"), grammar.validate());
	}

	@Test
	public void testDanglingSymbol(){
		Grammar grammar = new Grammar(Set.of(new Terminal("a")), Set.of(new NonTerminal("S")), new NonTerminal("S"),
				List.of(new Production(0, new NonTerminal("S"), List.of(new Terminal("a"), new Terminal("b")))));
		assertEquals(List.of("Symbol 'b' in production 'S → a b' is not defined"), grammar.validate());
	}

	@Test
	public void testUndeclaredHead(){
		Grammar grammar = new Grammar(Set.of(new Terminal("a")), Set.of(new NonTerminal("S")), new NonTerminal("S"),
				List.of(new Production(0, new NonTerminal("S"), List.of(new Terminal("a"))),
						new Production(1, new NonTerminal("T"), List.of(new Terminal("a")))));
		assertEquals(List.of("Production head 'T' is not a declared non terminal"), grammar.validate());
	}

	@Test
	public void testExplicitDeclarations(){
		Grammar grammar = new GrammarBuilder()
				.terminals("Plus", "ID")
				.nonTerminals("expr")
				.add("expr", "ID", "Plus", "expr")
				.add("expr", "ID")
				.toGrammar();
		new GrammarMatcher(grammar).terminals("Plus", "ID").nonTerminals("expr").valid().run();
	}

	@Test
	public void testTerminalAsHead(){
		assertThrows(PlaygroundException.class, () -> new GrammarBuilder().terminals("a").add("a", "b"));
		assertThrows(PlaygroundException.class, () -> new GrammarBuilder().add("a", "b").terminals("a"));
	}

	@Test
	public void testFreshNonTerminalName(){
		Grammar grammar = GrammarParser.parse("S → a S' | b\nS' → c\nS'' → d");
		assertEquals("S'''", grammar.freshNonTerminalName("S"));
		assertEquals("A'", grammar.freshNonTerminalName("A"));
	}

	@Test
	public void testEndMarkerIsNotADeclaredDollar(){
		Grammar grammar = GrammarParser.parse("S → $");
		assertTrue(grammar.getTerminals().contains(new Terminal("$")));
		assertNotEquals(new Terminal("$"), EndMarker.INSTANCE);
	}

	@Test
	public void testEmptyBodyIsRejected(){
		assertThrows(IllegalArgumentException.class, () -> new Production(0, new NonTerminal("S"), List.of()));
	}
}
