package markbridge.eval;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Name bindings as a stack of scopes. Inner bindings shadow outer ones until
 * their scope is popped.
 */
public final class Environment {
	private final Deque<Map<String, Value>> scopes = new ArrayDeque<>();

	public Environment() {
		scopes.push(new HashMap<>());
	}

	private Environment(Deque<Map<String, Value>> scopes) {
		this.scopes.addAll(scopes);
	}

	public void push() {
		scopes.push(new HashMap<>());
	}

	public void pop() {
		if (scopes.size() == 1) {
			throw new IllegalStateException("cannot pop the outermost scope");
		}
		scopes.pop();
	}

	public void define(String name, Value value) {
		scopes.peek().put(name, value);
	}

	/** Innermost binding of {@code name}, or null. */
	public Value lookup(String name) {
		Iterator<Map<String, Value>> it = scopes.iterator();
		while (it.hasNext()) {
			Value v = it.next().get(name);
			if (v != null) {
				return v;
			}
		}
		return null;
	}

	public int depth() {
		return scopes.size();
	}

	/**
	 * Copy sharing the current scope maps, used as a function's defining scope.
	 * Later definitions in those scopes stay visible, which lets a function call
	 * itself.
	 */
	public Environment capture() {
		return new Environment(scopes);
	}
}
