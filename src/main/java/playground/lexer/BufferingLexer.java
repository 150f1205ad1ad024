package playground.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lexer that reads the whole input at once.
 */
public abstract class BufferingLexer implements Lexer {

	private final List<Token> tokens = new ArrayList<>();
	private int index = 0;
	private Token curToken = null;
	private boolean initialized = false;

	/**
	 * Add all tokens via {@link #addToken(Token)}, without the end of input token
	 */
	protected abstract void initTokens();

	/**
	 * Location of the end of input token
	 */
	protected abstract Location endLocation();

	protected void addToken(Token token){
		tokens.add(token);
	}

	private void ensureInitialized(){
		if (!initialized){
			initialized = true;
			initTokens();
			tokens.add(Token.endOfInput(endLocation()));
		}
	}

	@Override
	public Token cur() {
		if (curToken == null){
			return next();
		}
		return curToken;
	}

	@Override
	public Token next() {
		ensureInitialized();
		if (index < tokens.size()){
			curToken = tokens.get(index++);
		}
		return curToken;
	}

	@Override
	public List<Token> tokens() {
		ensureInitialized();
		return Collections.unmodifiableList(tokens);
	}
}
