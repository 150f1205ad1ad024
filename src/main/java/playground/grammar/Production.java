package playground.grammar;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A grammar production with a left and a right hand side.
 */
public class Production implements Serializable {

	/**
	 * Position of the production in the grammar's declaration order
	 */
	public final int index;
	/**
	 * Left hand side of the production
	 */
	public final NonTerminal head;
	/**
	 * Right hand side of the production, never empty: the right hand side of an epsilon production is {@code [ε]}
	 */
	public final List<Symbol> body;

	public Production(int index, NonTerminal head, List<Symbol> body) {
		Preconditions.checkArgument(!body.isEmpty(), "Production body of %s is empty, use [ε] instead", head);
		this.index = index;
		this.head = Objects.requireNonNull(head);
		this.body = ImmutableList.copyOf(body);
	}

	public String formatRightSide(){
		if (isEpsilonProduction()){
			return Epsilon.INSTANCE.name;
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < body.size(); i++) {
			builder.append(body.get(i));
			if (i < body.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return head + " → " + formatRightSide();
	}

	/**
	 * Is the right hand side just ε?
	 */
	public boolean isEpsilonProduction(){
		return body.size() == 1 && body.get(0).isEpsilon();
	}

	/**
	 * Same head and same right hand side, regardless of the index
	 */
	public boolean sameRule(Production other){
		return head.equals(other.head) && body.equals(other.body);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return other.index == index && sameRule(other);
	}

	@Override
	public int hashCode() {
		return Objects.hash(index, head, body);
	}
}
