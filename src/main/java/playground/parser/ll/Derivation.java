package playground.parser.ll;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import playground.parser.TreeNode;
import playground.util.ParserError;

/**
 * Outcome of parsing a sentence: the derivation tree and the trace, or an error and the trace up to it.
 */
public class Derivation {

	public final LLParser.State state;

	private final TreeNode tree;

	public final List<ParseStep> steps;

	private final String error;

	private final ParserError parserError;

	private Derivation(LLParser.State state, TreeNode tree, List<ParseStep> steps, String error, ParserError parserError) {
		this.state = state;
		this.tree = tree;
		this.steps = ImmutableList.copyOf(steps);
		this.error = error;
		this.parserError = parserError;
	}

	public static Derivation accepted(TreeNode tree, List<ParseStep> steps){
		return new Derivation(LLParser.State.ACCEPTED, tree, steps, null, null);
	}

	public static Derivation failed(ParserError parserError, List<ParseStep> steps){
		return new Derivation(LLParser.State.FAILED, null, steps, parserError.getMessage(), parserError);
	}

	/**
	 * The parser wasn't run at all, e.g. because the grammar is invalid.
	 */
	public static Derivation refused(String error){
		return new Derivation(LLParser.State.FAILED, null, List.of(), error, null);
	}

	public boolean isAccepted(){
		return state == LLParser.State.ACCEPTED;
	}

	/**
	 * @throws IllegalStateException if the parse failed
	 */
	public TreeNode getTree(){
		Preconditions.checkState(isAccepted(), "Derivation failed: %s", error);
		return tree;
	}

	/**
	 * Error message, null if the parse was accepted
	 */
	public String getError(){
		return error;
	}

	/**
	 * Error of the parser, null if the parse was accepted or the parser wasn't run
	 */
	public ParserError getParserError(){
		return parserError;
	}
}
