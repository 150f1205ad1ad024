package playground.parser.ll;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import playground.Config;
import playground.grammar.EndMarker;
import playground.grammar.Grammar;
import playground.grammar.NonTerminal;
import playground.grammar.Production;
import playground.grammar.Symbol;
import playground.grammar.Terminal;
import playground.lexer.Lexer;
import playground.lexer.TerminalLexer;
import playground.lexer.Token;
import playground.parser.TreeNode;
import playground.util.ParserError;

import static playground.util.Utils.quote;

/**
 * Table driven LL(1) parser that builds a derivation tree and records every step.
 *
 * If a table cell holds more than one production the one with the lowest index is used, reporting such
 * conflicts is the job of the {@link ConflictDetector}. For a table with conflicts the number of steps is bounded by
 * {@code stepLimitFactor * (tokens + 1) * (body symbols of all productions + 1)} so that degenerate expansion loops
 * (e.g. left recursion) fail instead of running forever. A conflict free table always terminates and isn't bounded.
 */
public class LLParser {

	private static final Logger LOG = LoggerFactory.getLogger(LLParser.class);

	public enum State {
		PARSING, ACCEPTED, FAILED
	}

	private final Grammar grammar;
	private final LLParserTable table;
	private final List<Token> tokens;
	private final int stepLimit;
	private Token current;
	private int currentTokenNum = 0;
	private final ArrayList<StackFrame> stack = new ArrayList<>();
	private final List<ParseStep> steps = new ArrayList<>();
	private State state = State.PARSING;

	public LLParser(LLParserTable table, String input){
		this(new TerminalLexer(table.grammar, input), table);
	}

	public LLParser(Lexer lexer, LLParserTable table){
		this.grammar = table.grammar;
		this.table = table;
		this.tokens = lexer.tokens();
		this.current = tokens.get(0);
		this.stepLimit = table.isLL1() ? Integer.MAX_VALUE : calculateStepLimit(tokens.size(), grammar);
	}

	static int calculateStepLimit(int tokenCount, Grammar grammar){
		long bodySymbols = 0;
		for (Production production : grammar.getProductions()){
			bodySymbols += production.body.size();
		}
		return (int) Math.min(Integer.MAX_VALUE, (long) Config.stepLimitFactor() * tokenCount * (bodySymbols + 1));
	}

	public State getState(){
		return state;
	}

	private void advanceTokenNum(){
		if (currentTokenNum < tokens.size() - 1){
			currentTokenNum++;
		}
		current = tokens.get(currentTokenNum);
	}

	/**
	 * Parse the whole input, can only be called once per parser.
	 *
	 * @return accepted derivation with tree and trace, or a failed one with the parser error and the trace up to it
	 */
	public Derivation parse(){
		Preconditions.checkState(state == State.PARSING && steps.isEmpty(), "Parser already used");
		try {
			TreeNode root = run();
			state = State.ACCEPTED;
			return Derivation.accepted(root, steps);
		} catch (ParserError error) {
			state = State.FAILED;
			LOG.debug("Parse failed after {} steps: {}", steps.size(), error.getMessage());
			return Derivation.failed(error, steps);
		}
	}

	private TreeNode run(){
		NonTerminal start = grammar.getStart();
		Preconditions.checkState(start != null, "Grammar has no start symbol");
		TreeNode root = new TreeNode(start);
		stack.add(new StackFrame(EndMarker.INSTANCE, null));
		stack.add(new StackFrame(start, root));
		while (true) {
			StackFrame top = stack.get(stack.size() - 1);
			if (steps.size() >= stepLimit){
				throw new ParserError(current, top.symbol, String.format("Step limit of %d exceeded while expanding %s, " +
						"the grammar seems to expand without consuming input", stepLimit, top.symbol));
			}
			List<String> stackBefore = stackSymbols();
			List<String> input = remainingInput();
			pop();
			Symbol symbol = top.symbol;
			if (symbol.isEndMarker()){
				if (!current.isEndOfInput()){
					throw new ParserError(current, symbol, String.format("Expected end of input, got %s", quote(current.value)));
				}
				addStep(stackBefore, input, "Accept");
				return root;
			}
			if (symbol.isEpsilon()){
				addStep(stackBefore, input, "Skip ε");
				continue;
			}
			if (symbol.isTerminal()){
				if (!current.isTerminal((Terminal) symbol)){
					throw new ParserError(current, symbol, String.format("Expected %s, got %s at position %s",
							quote(symbol), quote(current.value), current.location));
				}
				addStep(stackBefore, input, "Match " + quote(symbol));
				top.node.setValue(current.value);
				advanceTokenNum();
				continue;
			}
			NonTerminal nonTerminal = (NonTerminal) symbol;
			List<Production> candidates = table.get(nonTerminal, current.type);
			if (candidates.isEmpty()){
				List<String> expected = new ArrayList<>();
				for (Terminal terminal : table.expectedTerminals(nonTerminal)){
					expected.add(terminal.name);
				}
				throw new ParserError(current, symbol, expected, String.format("No production for %s with lookahead %s, " +
						"expected one of %s", nonTerminal, quote(current.type), expected));
			}
			Production production = candidates.stream().min(Comparator.comparingInt(p -> p.index)).get();
			addStep(stackBefore, input, "Apply: " + production);
			top.node.setProduction(production.index);
			addToStack(top.node, production.body);
		}
	}

	private void addToStack(TreeNode parent, List<Symbol> rightHandSide){
		List<TreeNode> children = new ArrayList<>();
		for (Symbol symbol : rightHandSide){
			TreeNode child = new TreeNode(symbol);
			parent.addChild(child);
			children.add(child);
		}
		for (int i = rightHandSide.size() - 1; i >= 0; i--){
			stack.add(new StackFrame(rightHandSide.get(i), children.get(i)));
		}
	}

	private void addStep(List<String> stackBefore, List<String> input, String action){
		steps.add(new ParseStep(steps.size() + 1, stackBefore, input, action));
	}

	private List<String> stackSymbols(){
		List<String> symbols = new ArrayList<>(stack.size());
		for (StackFrame frame : stack){
			symbols.add(frame.symbol.name);
		}
		return symbols;
	}

	private List<String> remainingInput(){
		List<String> input = new ArrayList<>();
		for (Token token : tokens.subList(currentTokenNum, tokens.size())){
			input.add(token.toSimpleString());
		}
		return input;
	}

	private StackFrame pop(){
		return stack.remove(stack.size() - 1);
	}

	/**
	 * Stack symbol and the tree node it expands into, the end marker has no node
	 */
	private static class StackFrame {
		final Symbol symbol;
		final TreeNode node;

		StackFrame(Symbol symbol, TreeNode node) {
			this.symbol = symbol;
			this.node = node;
		}
	}
}
