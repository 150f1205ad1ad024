package playground;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global settings, read once from an ini like file with {@code key = value} lines.
 *
 * The file is {@code playground.ini} in the working directory unless the system property
 * {@code playground.config} names another one. Missing files leave the defaults untouched.
 */
public class Config {

	private static final Logger LOG = LoggerFactory.getLogger(Config.class);

	public static final String configFile = "playground.ini";

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("stepLimitFactor", "10");
		put("identifierTerminal", "id");
		put("numberTerminal", "number");
		put("allowConflicts", "no");
	}};

	private static int stepLimitFactor = 10;

	/**
	 * Factor of the derivation step ceiling for tables with conflicts,
	 * the ceiling is {@code factor * (tokens + 1) * (body symbols + 1)}.
	 */
	public static int stepLimitFactor(){
		return stepLimitFactor;
	}

	/** Terminal used for identifiers that don't spell a declared terminal */
	public static String identifierTerminal(){
		return config.get("identifierTerminal");
	}

	/** Terminal used for number literals */
	public static String numberTerminal(){
		return config.get("numberTerminal");
	}

	/** Derive sentences with grammars that have LL(1) conflicts without an explicit acknowledgement? */
	public static boolean allowConflicts(){
		return config.get("allowConflicts").equals("yes");
	}

	private static void loadConfig(){
		Path file = Paths.get(System.getProperty("playground.config", configFile));
		if (!Files.exists(file)){
			return;
		}
		config.putAll(readConfig(file));
		stepLimitFactor = Integer.parseInt(config.get("stepLimitFactor"));
	}

	/**
	 * Read the known keys of the passed file, values that aren't valid for their key are dropped with a warning.
	 */
	static Map<String, String> readConfig(Path file){
		Map<String, String> values = new HashMap<>();
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					String key = parts[0].trim();
					String value = parts[1].trim();
					if (!config.containsKey(key)){
						LOG.warn("Unknown config key \"{}\" in {}", key, file);
					} else if (key.equals("stepLimitFactor") && !isPositiveInt(value)){
						LOG.warn("stepLimitFactor has to be a positive integer, got \"{}\" in {}, using {}",
								value, file, config.get(key));
					} else {
						values.put(key, value);
					}
				}
			}
		} catch (IOException e) {
			LOG.error("Can't read config file {}, using defaults", file, e);
			return new HashMap<>();
		}
		return values;
	}

	private static boolean isPositiveInt(String value){
		try {
			return Integer.parseInt(value) > 0;
		} catch (NumberFormatException e) {
			return false;
		}
	}

	static {
		loadConfig();
	}
}
