package playground;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import playground.grammar.GrammarSyntaxError;
import playground.parser.ll.Derivation;
import playground.report.AnalysisReport;
import playground.report.DerivationReport;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

/**
 * Analyze a grammar and optionally derive a sentence with it
 */
@Command(name = "grammar-playground", mixinStandardHelpOptions = true,
		description = "Computes FIRST/FOLLOW sets and the LL(1) table of a grammar and derives sentences")
public class PlaygroundCli implements Callable<Integer> {

	private static final Logger LOG = LoggerFactory.getLogger(PlaygroundCli.class);

	@Option(names = {"--grammar"}, description = "The grammar file, '-' reads it from standard input", required = true)
	private String grammarPath;

	@Option(names = {"--input"}, description = "Sentence to derive with the grammar")
	private String input = null;

	@Option(names = {"--json"}, description = "Print the reports as JSON")
	private boolean json = false;

	@Option(names = {"--trace"}, description = "Print every parser step of the derivation")
	private boolean trace = false;

	@Option(names = {"--allow-conflicts"}, description = "Derive even if the grammar is not LL(1)")
	private boolean allowConflicts = Config.allowConflicts();

	private static String read(String path) throws IOException {
		if (path.equals("-")){
			InputStream in = System.in;
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
		return Files.readString(Paths.get(path), StandardCharsets.UTF_8);
	}

	@Override
	public Integer call() throws Exception {
		GrammarAnalysis analysis;
		try {
			analysis = GrammarAnalysis.of(read(grammarPath));
		} catch (GrammarSyntaxError error){
			LOG.debug("Grammar could not be parsed", error);
			System.err.println(error.getMessage());
			return ExitCode.SOFTWARE;
		}
		Derivation derivation = input == null ? null : analysis.derive(input, allowConflicts);
		if (json){
			JSONObject result = new JSONObject().put("analysis", new AnalysisReport(analysis).toJson());
			if (derivation != null){
				result.put("derivation", new DerivationReport(derivation).toJson());
			}
			System.out.println(result.toString(2));
		} else {
			System.out.print(new AnalysisReport(analysis).toText());
			if (derivation != null){
				System.out.println();
				System.out.print(new DerivationReport(derivation).toText(trace));
			}
		}
		if (derivation != null && !derivation.isAccepted()){
			return ExitCode.SOFTWARE;
		}
		return ExitCode.OK;
	}
}
