package playground;

import picocli.CommandLine;

public final class Main {

	public static void main(final String... args) {
		final int exitCode = new CommandLine(new PlaygroundCli()).execute(args);
		System.exit(exitCode);
	}
}
