package playground.lexer;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import playground.grammar.EndMarker;
import playground.grammar.Grammar;
import playground.grammar.GrammarParser;
import playground.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.*;

public class TerminalLexerTest {

	private static final Grammar GRAMMAR = GrammarParser.parse("S → if E | iffy\nE → id | <= | < | number");

	private static List<String> types(String input){
		List<String> types = new ArrayList<>();
		for (Token token : new TerminalLexer(GRAMMAR, input).tokens()){
			types.add(token.toSimpleString());
		}
		return types;
	}

	private static List<String> values(String input){
		List<String> values = new ArrayList<>();
		for (Token token : new TerminalLexer(GRAMMAR, input).tokens()){
			values.add(token.value);
		}
		return values;
	}

	@Test
	public void testEmptyInput(){
		List<Token> tokens = new TerminalLexer(GRAMMAR, "   ").tokens();
		assertEquals(1, tokens.size());
		assertTrue(tokens.get(0).isEndOfInput());
		assertEquals(EndMarker.INSTANCE, tokens.get(0).type);
	}

	@Test
	public void testLongestMatch(){
		assertEquals(List.of("iffy", "if", "<=", "<", "$"), types("iffy if <= <"));
		assertEquals(List.of("<=", "<", "$"), types("<=<"));
	}

	@Test
	public void testWordBoundary(){
		assertEquals(List.of("id", "$"), types("ifx"));
		assertEquals(List.of("ifx", "$"), values("ifx"));
		assertEquals(List.of("if", "<", "$"), types("if<"));
	}

	@Test
	public void testIdentifiersAndNumbers(){
		assertEquals(List.of("if", "id", "<=", "number", "$"), types("if x_1 <= 3.5"));
		assertEquals(List.of("if", "x_1", "<=", "3.5", "$"), values("if x_1 <= 3.5"));
		assertEquals(List.of("number", ".", "$"), types("3."));
	}

	@Test
	public void testUnknownCharacter(){
		List<Token> tokens = new TerminalLexer(GRAMMAR, "@").tokens();
		assertEquals(new Terminal("@"), tokens.get(0).type);
		assertEquals("@", tokens.get(0).value);
	}

	@Test
	public void testLocations(){
		List<Token> tokens = new TerminalLexer(GRAMMAR, "if\n  x").tokens();
		assertAll(
				() -> assertEquals(1, tokens.get(0).location.line),
				() -> assertEquals(1, tokens.get(0).location.column),
				() -> assertEquals(2, tokens.get(1).location.line),
				() -> assertEquals(3, tokens.get(1).location.column),
				() -> assertEquals(5, tokens.get(1).location.offset),
				() -> assertEquals(6, tokens.get(2).location.offset)
		);
	}

	@Test
	public void testPullInterface(){
		Lexer lexer = new TerminalLexer(GRAMMAR, "if x");
		assertEquals("if", lexer.cur().value);
		assertEquals("if", lexer.cur().value);
		assertEquals("x", lexer.next().value);
		assertTrue(lexer.next().isEndOfInput());
		assertTrue(lexer.next().isEndOfInput());
	}
}
