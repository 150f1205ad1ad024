package playground.grammar;

import playground.PlaygroundException;

/**
 * Malformed grammar text, thrown before any set is computed.
 */
public class GrammarSyntaxError extends PlaygroundException {

	/**
	 * Line number (starting at 1) of the offending line in the normalized text
	 */
	public final int line;

	public GrammarSyntaxError(int line, String message) {
		super(String.format("Syntax error in line %d: %s", line, message));
		this.line = line;
	}
}
