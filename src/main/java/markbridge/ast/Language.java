package markbridge.ast;

/**
 * The two markup languages handled by the converter.
 */
public enum Language {
	LATEX("latex"),
	TYPST("typst");

	private final String id;

	Language(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}
}
