package playground.util;

import java.util.List;

/**
 * Class with utility methods...
 */
public class Utils {

	private Utils() {
	}

	/**
	 * Joins the string representations of several objects passed via a list.
	 *
	 * @param strs passed list of objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(List<T> strs, String separator){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < strs.size(); i++){
			if (i != 0){
				builder.append(separator);
			}
			builder.append(strs.get(i));
		}
		return builder.toString();
	}

	/**
	 * Quote a symbol or token spelling for messages, {@code +} becomes {@code '+'}.
	 */
	public static String quote(Object obj){
		return "'" + obj + "'";
	}
}
