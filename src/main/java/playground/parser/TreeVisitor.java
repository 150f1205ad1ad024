package playground.parser;

/**
 * Visitor over the nodes of a derivation tree, with one method per node category.
 *
 * @param <R> result type
 */
public interface TreeVisitor<R> {

	/**
	 * Node of a non terminal, its children are the body of the applied production (if it was expanded)
	 */
	R visitNonTerminal(TreeNode node);

	/**
	 * Leaf of a terminal, has a value if it matched a token
	 */
	R visitTerminal(TreeNode node);

	/**
	 * Leaf of an applied epsilon production
	 */
	R visitEpsilon(TreeNode node);
}
