package playground.grammar;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for terminal symbols, non terminal symbols, ε and the end of input marker.
 *
 * Two symbols are equal iff they have the same kind and the same name.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	public enum Kind {
		TERMINAL, NON_TERMINAL, EPSILON, END_MARKER
	}

	/**
	 * Spelling of the symbol as it appears in the grammar text
	 */
	public final String name;

	protected Symbol(String name) {
		this.name = Objects.requireNonNull(name);
	}

	public abstract Kind kind();

	public boolean isTerminal(){
		return kind() == Kind.TERMINAL;
	}

	public boolean isNonTerminal(){
		return kind() == Kind.NON_TERMINAL;
	}

	public boolean isEpsilon(){
		return kind() == Kind.EPSILON;
	}

	public boolean isEndMarker(){
		return kind() == Kind.END_MARKER;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind(), name);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Symbol)){
			return false;
		}
		Symbol other = (Symbol)obj;
		return other.kind() == kind() && other.name.equals(name);
	}

	@Override
	public int compareTo(Symbol o) {
		int cmp = kind().compareTo(o.kind());
		return cmp != 0 ? cmp : name.compareTo(o.name);
	}

	@Override
	public String toString() {
		return name;
	}
}
