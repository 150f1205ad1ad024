package playground.grammar;

/**
 * End of input marker {@code $}.
 *
 * It's a terminal as far as the parser table and the follow sets are concerned, but it never equals a declared
 * terminal that happens to be spelled {@code $}, as its kind differs.
 */
public final class EndMarker extends Terminal {

	public static final EndMarker INSTANCE = new EndMarker();

	private EndMarker() {
		super("$");
	}

	@Override
	public Kind kind() {
		return Kind.END_MARKER;
	}

	private Object readResolve() {
		return INSTANCE;
	}
}
