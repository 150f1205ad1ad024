package playground.lexer;

import java.io.Serializable;

/**
 * Position of a token in the input, lines and columns start at 1
 */
public class Location implements Serializable {

	public final int line;
	public final int column;
	/**
	 * Character offset from the start of the input
	 */
	public final int offset;

	public Location(int line, int column, int offset){
		this.line = line;
		this.column = column;
		this.offset = offset;
	}

	@Override
	public String toString() {
		return "[" + line + ":" + column + "]";
	}
}
