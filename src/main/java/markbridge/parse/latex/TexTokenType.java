package markbridge.parse.latex;

public enum TexTokenType {
	CONTROL_SEQ,
	BEGIN_GROUP,
	END_GROUP,
	PARAM,
	CHAR,
	SPACE,
	PAR,
	MATH_SHIFT,
	ALIGN_TAB,
	SUPERSCRIPT,
	SUBSCRIPT,
	ACTIVE,
	VERBATIM,
	COMMENT
}
