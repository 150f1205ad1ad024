package playground.lexer;

import java.util.List;

/**
 * A simple interface for a pull lexer.
 */
public interface Lexer {

	/**
	 * Get the current token (calls next() if no token has been read before).
	 */
	Token cur();

	/**
	 * Read another token and return it, returns the end of input token again and again at the end.
	 */
	Token next();

	/**
	 * All tokens of the input, the last one being the end of input token.
	 */
	List<Token> tokens();
}
