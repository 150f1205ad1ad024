package playground;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@TempDir
	Path tempDir;

	private Map<String, String> read(String content) throws IOException {
		Path file = tempDir.resolve("playground.ini");
		Files.writeString(file, content, StandardCharsets.UTF_8);
		return Config.readConfig(file);
	}

	@Test
	public void testDefaults(){
		assertEquals(10, Config.stepLimitFactor());
		assertEquals("id", Config.identifierTerminal());
		assertEquals("number", Config.numberTerminal());
		assertFalse(Config.allowConflicts());
	}

	@Test
	public void testKnownKeys() throws IOException {
		Map<String, String> values = read("stepLimitFactor = 20\nidentifierTerminal = ident\nallowConflicts = yes\n");
		assertEquals(Map.of("stepLimitFactor", "20", "identifierTerminal", "ident", "allowConflicts", "yes"), values);
	}

	@Test
	public void testUnknownKeysAndOtherLinesAreIgnored() throws IOException {
		assertEquals(Map.of("numberTerminal", "num"), read("# comment\nfoo = bar\nnumberTerminal = num\nnonsense"));
	}

	@Test
	public void testInvalidStepLimitFactorIsDropped() throws IOException {
		assertEquals(Map.of(), read("stepLimitFactor = ten"));
		assertEquals(Map.of(), read("stepLimitFactor = 0"));
		assertEquals(Map.of(), read("stepLimitFactor = -3"));
	}
}
