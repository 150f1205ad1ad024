package playground;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.*;

public class PlaygroundCliTest {

	@TempDir
	Path tempDir;

	private Path grammarFile(String grammar) throws IOException {
		Path file = tempDir.resolve("grammar.txt");
		Files.writeString(file, grammar, StandardCharsets.UTF_8);
		return file;
	}

	private static int run(String... args){
		return new CommandLine(new PlaygroundCli()).execute(args);
	}

	@Test
	public void testAnalysisOnly() throws IOException {
		assertEquals(CommandLine.ExitCode.OK, run("--grammar", grammarFile("S → a S | ε").toString()));
	}

	@Test
	public void testAcceptedInput() throws IOException {
		Path file = grammarFile("E → T E'\nE' → + T E' | ε\nT → id");
		assertEquals(CommandLine.ExitCode.OK, run("--grammar", file.toString(), "--input", "id + id", "--trace"));
		assertEquals(CommandLine.ExitCode.OK, run("--grammar", file.toString(), "--input", "id", "--json"));
	}

	@Test
	public void testRejectedInput() throws IOException {
		Path file = grammarFile("E → T E'\nE' → + T E' | ε\nT → id");
		assertEquals(CommandLine.ExitCode.SOFTWARE, run("--grammar", file.toString(), "--input", "id id"));
	}

	@Test
	public void testConflicts() throws IOException {
		Path file = grammarFile("S → a B | a C\nB → b\nC → c");
		assertEquals(CommandLine.ExitCode.SOFTWARE, run("--grammar", file.toString(), "--input", "a b"));
		assertEquals(CommandLine.ExitCode.OK, run("--grammar", file.toString(), "--input", "a b", "--allow-conflicts"));
	}

	@Test
	public void testSyntaxError() throws IOException {
		assertEquals(CommandLine.ExitCode.SOFTWARE, run("--grammar", grammarFile("S a").toString()));
	}

	@Test
	public void testUsageError(){
		assertEquals(CommandLine.ExitCode.USAGE, run("--input", "a"));
	}
}
