package playground.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import playground.grammar.Symbol;

/**
 * Node of a derivation tree.
 *
 * Leaves that matched a token carry the token's text as value, expanded non terminal nodes carry the index of the
 * applied production.
 */
public class TreeNode {

	public final String symbol;

	public final Symbol.Kind kind;

	private final List<TreeNode> children = new ArrayList<>();

	private String value;

	private Integer production;

	public TreeNode(Symbol symbol){
		this.symbol = symbol.name;
		this.kind = symbol.kind();
	}

	public List<TreeNode> children(){
		return Collections.unmodifiableList(children);
	}

	public void addChild(TreeNode child){
		children.add(child);
	}

	/**
	 * Is this a terminal or an ε leaf?
	 */
	public boolean isTerminal(){
		return kind == Symbol.Kind.TERMINAL || kind == Symbol.Kind.EPSILON;
	}

	public boolean isEpsilon(){
		return kind == Symbol.Kind.EPSILON;
	}

	/**
	 * Matched text, null if this isn't a matched terminal leaf
	 */
	public String getValue(){
		return value;
	}

	public boolean hasValue(){
		return value != null;
	}

	public void setValue(String value){
		this.value = value;
	}

	/**
	 * Index of the applied production, null if this isn't an expanded non terminal
	 */
	public Integer getProduction(){
		return production;
	}

	public void setProduction(int production){
		this.production = production;
	}

	public <R> R accept(TreeVisitor<R> visitor){
		switch (kind){
			case NON_TERMINAL:
				return visitor.visitNonTerminal(this);
			case EPSILON:
				return visitor.visitEpsilon(this);
			default:
				return visitor.visitTerminal(this);
		}
	}

	/**
	 * Matched texts of the terminal leaves, from left to right
	 */
	public List<String> getMatchedValues(){
		List<String> values = new ArrayList<>();
		accept(new TreeVisitor<Void>() {
			@Override
			public Void visitNonTerminal(TreeNode node) {
				for (TreeNode child : node.children){
					child.accept(this);
				}
				return null;
			}

			@Override
			public Void visitTerminal(TreeNode node) {
				if (node.hasValue()){
					values.add(node.value);
				}
				return null;
			}

			@Override
			public Void visitEpsilon(TreeNode node) {
				return null;
			}
		});
		return values;
	}

	public String getMatchedString(){
		return String.join(" ", getMatchedValues());
	}

	@Override
	public String toString() {
		if (children.isEmpty()){
			return hasValue() && !value.equals(symbol) ? symbol + ":" + value : symbol;
		}
		StringBuilder builder = new StringBuilder();
		builder.append("(").append(symbol);
		for (TreeNode child : children){
			builder.append(" ");
			builder.append(child);
		}
		builder.append(")");
		return builder.toString();
	}

	public String toPrettyString(){
		return toPrettyString("", "  ");
	}

	public String toPrettyString(String indent, String incr){
		StringBuilder builder = new StringBuilder();
		builder.append(indent).append(symbol);
		if (hasValue()){
			builder.append(" ('").append(value).append("')");
		}
		for (TreeNode child : children){
			builder.append("\n").append(child.toPrettyString(indent + incr, incr));
		}
		return builder.toString();
	}
}
