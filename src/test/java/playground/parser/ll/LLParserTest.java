package playground.parser.ll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import playground.grammar.GrammarParser;
import playground.grammar.NonTerminal;
import playground.parser.TreeNode;
import playground.util.ParserError;

import static org.junit.jupiter.api.Assertions.*;

public class LLParserTest {

	private static final String EXPRESSIONS = "E → T E'\nE' → + T E' | ε\nT → id";

	private static Derivation parse(String grammar, String input){
		return new LLParser(LLParserTable.fromGrammar(GrammarParser.parse(grammar)), input).parse();
	}

	private static List<String> actions(Derivation derivation){
		List<String> actions = new ArrayList<>();
		for (ParseStep step : derivation.steps){
			actions.add(step.action);
		}
		return actions;
	}

	@Test
	public void testSimpleExpression(){
		Derivation derivation = parse(EXPRESSIONS, "id + id");
		assertTrue(derivation.isAccepted(), derivation.getError());
		TreeNode tree = derivation.getTree();
		assertEquals(List.of("id", "+", "id"), tree.getMatchedValues());
		assertEquals("E", tree.symbol);
		assertEquals(Integer.valueOf(0), tree.getProduction());
		assertEquals(List.of(
				"Apply: E → T E'",
				"Apply: T → id",
				"Match 'id'",
				"Apply: E' → + T E'",
				"Match '+'",
				"Apply: T → id",
				"Match 'id'",
				"Apply: E' → ε",
				"Skip ε",
				"Accept"), actions(derivation));
	}

	@Test
	public void testTraceRecordsStackBeforeAction(){
		Derivation derivation = parse(EXPRESSIONS, "id");
		ParseStep first = derivation.steps.get(0);
		assertAll(
				() -> assertEquals(1, first.step),
				() -> assertEquals(List.of("$", "E"), first.stack),
				() -> assertEquals(List.of("id", "$"), first.input),
				() -> assertEquals(List.of("$", "E'", "T"), derivation.steps.get(1).stack),
				() -> assertEquals(List.of("$"), derivation.steps.get(derivation.steps.size() - 1).stack),
				() -> assertEquals(List.of("$"), derivation.steps.get(derivation.steps.size() - 1).input)
		);
	}

	@Test
	public void testTreeShape(){
		TreeNode tree = parse(EXPRESSIONS, "id").getTree();
		assertEquals("(E (T id) (E' ε))", tree.toString());
		TreeNode epsilon = tree.children().get(1).children().get(0);
		assertTrue(epsilon.isEpsilon());
		assertTrue(epsilon.isTerminal());
		assertFalse(epsilon.hasValue());
	}

	@Test
	public void testIdentifierValues(){
		Derivation derivation = parse(EXPRESSIONS, "x + y1");
		assertTrue(derivation.isAccepted(), derivation.getError());
		assertEquals("x + y1", derivation.getTree().getMatchedString());
	}

	@Test
	public void testMissingTableEntry(){
		Derivation derivation = parse(EXPRESSIONS, "id id");
		assertFalse(derivation.isAccepted());
		ParserError error = derivation.getParserError();
		assertAll(
				() -> assertEquals(List.of("+", "$"), error.expected),
				() -> assertEquals(new NonTerminal("E'"), error.stackSymbol),
				() -> assertEquals("id", error.errorToken.value),
				() -> assertEquals(4, error.errorLocation.column),
				() -> assertTrue(derivation.getError().contains("expected one of [+, $]"), derivation.getError()),
				() -> assertEquals(3, derivation.steps.size()),
				() -> assertThrows(IllegalStateException.class, derivation::getTree)
		);
	}

	@Test
	public void testTerminalMismatch(){
		Derivation derivation = parse("S → a b", "a c");
		assertFalse(derivation.isAccepted());
		assertTrue(derivation.getError().contains("Expected 'b', got 'c'"), derivation.getError());
		assertEquals(List.of(), derivation.getParserError().expected);
	}

	@Test
	public void testTrailingInput(){
		Derivation derivation = parse("S → a", "a a");
		assertFalse(derivation.isAccepted());
		assertTrue(derivation.getError().contains("Expected end of input, got 'a'"), derivation.getError());
	}

	@Test
	public void testEmptyInput(){
		assertTrue(parse("S → a S | ε", "").isAccepted());
		Derivation derivation = parse("S → a", "");
		assertFalse(derivation.isAccepted());
		assertEquals(List.of("a"), derivation.getParserError().expected);
	}

	@Test
	public void testConflictsUseLowestProduction(){
		Derivation derivation = parse("S → a B | a C\nB → b\nC → c", "a b");
		assertTrue(derivation.isAccepted(), derivation.getError());
		assertEquals("Apply: S → a B", derivation.steps.get(0).action);
		assertFalse(parse("S → a B | a C\nB → b\nC → c", "a c").isAccepted());
	}

	@Test
	public void testStepLimitOnLeftRecursion(){
		Derivation derivation = parse("E → E + T | T\nT → id", "id");
		assertFalse(derivation.isAccepted());
		assertTrue(derivation.getError().contains("Step limit"), derivation.getError());
		// 10 * (1 token + $) * (5 body symbols + 1)
		assertEquals(120, derivation.steps.size());
	}

	@Test
	public void testManyNullableSymbolsPerProduction(){
		String bs = String.join(" ", Collections.nCopies(25, "B"));
		String grammar = "S → a S " + bs + " | ε\nB → C\nC → D\nD → ε";
		LLParserTable table = LLParserTable.fromGrammar(GrammarParser.parse(grammar));
		assertTrue(table.isLL1());
		for (String input : List.of("a", "a a", "a a a a a")){
			Derivation derivation = new LLParser(table, input).parse();
			assertTrue(derivation.isAccepted(), input + ": " + derivation.getError());
		}
	}

	@Test
	public void testStepLimitScalesWithBodySymbols(){
		String bs = String.join(" ", Collections.nCopies(25, "B"));
		// 27 + 1 + 1 + 1 + 1 body symbols
		assertEquals(10 * 3 * 32, LLParser.calculateStepLimit(3,
				GrammarParser.parse("S → a S " + bs + " | ε\nB → C\nC → D\nD → ε")));
	}

	@Test
	public void testParseOnlyOnce(){
		LLParser parser = new LLParser(LLParserTable.fromGrammar(GrammarParser.parse("S → a")), "a");
		assertEquals(LLParser.State.PARSING, parser.getState());
		parser.parse();
		assertEquals(LLParser.State.ACCEPTED, parser.getState());
		assertThrows(IllegalStateException.class, parser::parse);
	}
}
