package markbridge.ast.doc;

import markbridge.ast.script.CallArg;

import java.util.List;

/**
 * {@code #set}, {@code #show} or {@code #import} rule. {@code target} is the
 * element or module the rule names; {@code args} are a set rule's arguments.
 */
public record Directive(String keyword, String target, List<CallArg> args, String source) implements DocNode {
}
