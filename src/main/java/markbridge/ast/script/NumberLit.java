package markbridge.ast.script;

/**
 * Integer or float literal as written; {@code integral} distinguishes {@code 3} from {@code 3.0}.
 */
public record NumberLit(String text, boolean integral) implements Expr {
}
