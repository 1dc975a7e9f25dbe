package migo.formatters;

/**
 * Strips characters that are not allowed in identifiers of the calculus.
 * Path separators become underscores.
 */
public class NameFilter {

	private NameFilter() {}

	public static String filter(String name) {
		StringBuilder sb = new StringBuilder(name.length());
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			switch (c) {
				case '(':
				case ')':
				case '*':
				case '"':
				case '-':
					break;
				case '/':
					sb.append('_');
					break;
				default:
					sb.append(c);
			}
		}
		return sb.toString();
	}

}
