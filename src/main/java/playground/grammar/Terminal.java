package playground.grammar;

/**
 * A terminal symbol, matched literally by its name
 */
public class Terminal extends Symbol {

	public Terminal(String name) {
		super(name);
	}

	@Override
	public Kind kind() {
		return Kind.TERMINAL;
	}

	/**
	 * Does the name consist only of letters and digits? Such terminals need a word boundary after a match.
	 */
	public boolean isAlphanumeric(){
		if (name.isEmpty()){
			return false;
		}
		for (int i = 0; i < name.length(); i++){
			if (!Character.isLetterOrDigit(name.charAt(i))){
				return false;
			}
		}
		return true;
	}
}
