package playground.grammar;

/**
 * The empty word. There's only a single instance.
 */
public final class Epsilon extends Symbol {

	public static final Epsilon INSTANCE = new Epsilon();

	private Epsilon() {
		super("ε");
	}

	@Override
	public Kind kind() {
		return Kind.EPSILON;
	}

	private Object readResolve() {
		return INSTANCE;
	}
}
