package playground;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import playground.grammar.Grammar;
import playground.grammar.GrammarParser;
import playground.grammar.GrammarSyntaxError;
import playground.parser.ll.Conflict;
import playground.parser.ll.ConflictDetector;
import playground.parser.ll.Derivation;
import playground.parser.ll.LLParser;
import playground.parser.ll.LLParserTable;

/**
 * Complete LL(1) analysis of a grammar: validation, nullable/first/follow sets, the parser table and its conflicts.
 *
 * Sentences can be derived with {@link #derive(String)}. A grammar with validation errors is never used for
 * derivations, a grammar with conflicts only if the conflicts are acknowledged.
 */
public class GrammarAnalysis {

	private static final Logger LOG = LoggerFactory.getLogger(GrammarAnalysis.class);

	public final Grammar grammar;

	public final List<String> validationErrors;

	public final LLParserTable table;

	public final List<Conflict> conflicts;

	public GrammarAnalysis(Grammar grammar) {
		this.grammar = grammar;
		this.validationErrors = ImmutableList.copyOf(grammar.validate());
		if (!validationErrors.isEmpty()){
			LOG.warn("Grammar has {} validation errors: {}", validationErrors.size(), validationErrors);
		}
		this.table = LLParserTable.fromGrammar(grammar);
		this.conflicts = ImmutableList.copyOf(ConflictDetector.detect(table));
		LOG.debug("Analyzed grammar with {} productions, {} conflicts", grammar.getProductions().size(), conflicts.size());
	}

	/**
	 * Parse and analyze the passed grammar text.
	 *
	 * @throws GrammarSyntaxError if the text isn't a syntactically valid grammar
	 */
	public static GrammarAnalysis of(String grammarText){
		return new GrammarAnalysis(GrammarParser.parse(grammarText));
	}

	public boolean isValid(){
		return validationErrors.isEmpty();
	}

	public boolean isLL1(){
		return conflicts.isEmpty();
	}

	/**
	 * Derive the sentence, acknowledging conflicts only if configured to ({@code allowConflicts = yes}).
	 */
	public Derivation derive(String sentence){
		return derive(sentence, Config.allowConflicts());
	}

	/**
	 * Derive the sentence with the table driven parser.
	 *
	 * @param sentence input sentence
	 * @param acknowledgeConflicts run even if the table has conflicts, the production with the lowest index wins
	 * @return the derivation, a failed one if the grammar is invalid or has unacknowledged conflicts
	 */
	public Derivation derive(String sentence, boolean acknowledgeConflicts){
		if (!isValid()){
			return Derivation.refused("The grammar is invalid: " + String.join("; ", validationErrors));
		}
		if (!isLL1() && !acknowledgeConflicts){
			return Derivation.refused(String.format("The grammar is not LL(1), it has %d conflicts, " +
					"acknowledge them to derive with the first production of each conflicting cell", conflicts.size()));
		}
		return new LLParser(table, sentence).parse();
	}
}
