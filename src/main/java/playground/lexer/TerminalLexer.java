package playground.lexer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import playground.Config;
import playground.grammar.Grammar;
import playground.grammar.Terminal;

/**
 * Splits a sentence into tokens using the terminals of a grammar.
 *
 * Longer terminals are tried first. A terminal consisting of letters and digits only doesn't match if a letter or
 * digit follows directly (so {@code if} doesn't match the start of {@code iffy}). Input that no terminal matches is
 * lexed as an identifier, a number or a single character.
 */
public class TerminalLexer extends BufferingLexer {

	private final String input;
	private final List<Terminal> terminals;
	private final Terminal identifier;
	private final Terminal number;

	private int pos = 0;
	private int line = 1;
	private int lineStart = 0;

	public TerminalLexer(Grammar grammar, String input){
		this.input = input;
		this.terminals = new ArrayList<>(grammar.getTerminals());
		this.terminals.sort(Comparator.comparingInt((Terminal t) -> t.name.length()).reversed()
				.thenComparing(t -> t.name));
		this.identifier = new Terminal(Config.identifierTerminal());
		this.number = new Terminal(Config.numberTerminal());
	}

	@Override
	protected void initTokens() {
		while (true) {
			skipWhitespace();
			if (pos >= input.length()){
				return;
			}
			addToken(parseNextToken());
		}
	}

	@Override
	protected Location endLocation() {
		return location(input.length());
	}

	private Location location(int offset){
		return new Location(line, offset - lineStart + 1, offset);
	}

	private void skipWhitespace(){
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))){
			if (input.charAt(pos) == '\n'){
				line++;
				lineStart = pos + 1;
			}
			pos++;
		}
	}

	private Token parseNextToken(){
		int start = pos;
		for (Terminal terminal : terminals){
			if (!input.startsWith(terminal.name, pos)){
				continue;
			}
			int end = pos + terminal.name.length();
			if (terminal.isAlphanumeric() && end < input.length() && Character.isLetterOrDigit(input.charAt(end))){
				continue;
			}
			pos = end;
			return new Token(terminal, terminal.name, location(start));
		}
		char c = input.charAt(pos);
		if (Character.isLetter(c) || c == '_'){
			while (pos < input.length() && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')){
				pos++;
			}
			String word = input.substring(start, pos);
			Terminal type = identifier;
			for (Terminal terminal : terminals){
				if (terminal.name.equals(word)){
					type = terminal;
					break;
				}
			}
			return new Token(type, word, location(start));
		}
		if (Character.isDigit(c)){
			skipDigits();
			if (pos + 1 < input.length() && input.charAt(pos) == '.' && Character.isDigit(input.charAt(pos + 1))){
				pos++;
				skipDigits();
			}
			return new Token(number, input.substring(start, pos), location(start));
		}
		pos += Character.charCount(input.codePointAt(pos));
		String str = input.substring(start, pos);
		return new Token(new Terminal(str), str, location(start));
	}

	private void skipDigits(){
		while (pos < input.length() && Character.isDigit(input.charAt(pos))){
			pos++;
		}
	}
}
