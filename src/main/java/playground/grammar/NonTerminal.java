package playground.grammar;

/**
 * A non terminal symbol, typically written with an upper case first letter.
 */
public class NonTerminal extends Symbol {

	public NonTerminal(String name) {
		super(name);
	}

	@Override
	public Kind kind() {
		return Kind.NON_TERMINAL;
	}
}
