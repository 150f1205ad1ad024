package playground;

/**
 * Base class of all exceptions thrown by the grammar playground.
 */
public class PlaygroundException extends RuntimeException {

	public PlaygroundException(String message) {
		super(message);
	}
}
