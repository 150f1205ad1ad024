package playground.lexer;

import playground.grammar.EndMarker;
import playground.grammar.Terminal;

public class Token {

	/**
	 * Terminal this token is an instance of, {@link EndMarker#INSTANCE} for the end of input.
	 */
	public final Terminal type;

	/**
	 * Matched text.
	 */
	public final String value;

	public final Location location;

	public Token(Terminal type, String value, Location location){
		this.type = type;
		this.value = value;
		this.location = location;
	}

	public static Token endOfInput(Location location){
		return new Token(EndMarker.INSTANCE, EndMarker.INSTANCE.name, location);
	}

	public boolean isEndOfInput(){
		return type.isEndMarker();
	}

	@Override
	public String toString() {
		return type.name + location.toString() + "(" + value + ")";
	}

	public String toSimpleString(){
		return type.name;
	}

	public boolean isTerminal(Terminal terminal){
		return type.equals(terminal);
	}
}
