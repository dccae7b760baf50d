package markbridge.transform;

public enum Associativity {
	LEFT,
	RIGHT,
	NONE
}
