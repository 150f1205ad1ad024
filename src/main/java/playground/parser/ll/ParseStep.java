package playground.parser.ll;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * One step of a table driven parse, recorded for visualizations.
 */
public class ParseStep {

	/**
	 * Number of the step, starting at 1
	 */
	public final int step;

	/**
	 * Stack symbols before the step, bottom to top
	 */
	public final List<String> stack;

	/**
	 * Remaining input token types, including the end marker
	 */
	public final List<String> input;

	/**
	 * What the step did, e.g. {@code Match 'id'}, {@code Apply: E → T E'}, {@code Skip ε} or {@code Accept}
	 */
	public final String action;

	public ParseStep(int step, List<String> stack, List<String> input, String action) {
		this.step = step;
		this.stack = ImmutableList.copyOf(stack);
		this.input = ImmutableList.copyOf(input);
		this.action = action;
	}

	@Override
	public String toString() {
		return String.format("%3d  %-30s %-30s %s", step, String.join(" ", stack), String.join(" ", input), action);
	}
}
