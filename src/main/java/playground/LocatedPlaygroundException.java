package playground;

import playground.lexer.Location;
import playground.lexer.Token;

public class LocatedPlaygroundException extends PlaygroundException {

	public final Token errorToken;
	public final Location errorLocation;

	public LocatedPlaygroundException(Token errorToken, String message) {
		super(message);
		this.errorToken = errorToken;
		if (errorToken != null) {
			this.errorLocation = errorToken.location;
		} else {
			this.errorLocation = new Location(1, 1, 0);
		}
	}
}
