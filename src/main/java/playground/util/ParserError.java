package playground.util;

import java.util.List;

import com.google.common.collect.ImmutableList;

import playground.LocatedPlaygroundException;
import playground.grammar.Symbol;
import playground.lexer.Token;

/**
 * An error thrown after encountering a syntax error in the parsed sentence
 */
public class ParserError extends LocatedPlaygroundException {

	/**
	 * Symbol on top of the stack when the error occurred
	 */
	public final Symbol stackSymbol;

	/**
	 * Terminals the stack symbol has table entries for, empty unless the table had no entry
	 */
	public final List<String> expected;

	public ParserError(Token errorToken, Symbol stackSymbol, String message) {
		this(errorToken, stackSymbol, List.of(), message);
	}

	public ParserError(Token errorToken, Symbol stackSymbol, List<String> expected, String message) {
		super(errorToken, String.format("Error at %s: %s", errorToken.location, message));
		this.stackSymbol = stackSymbol;
		this.expected = ImmutableList.copyOf(expected);
	}
}
