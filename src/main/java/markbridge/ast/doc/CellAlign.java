package markbridge.ast.doc;

public enum CellAlign {
	LEFT,
	CENTER,
	RIGHT
}
