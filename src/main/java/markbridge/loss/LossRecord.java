package markbridge.loss;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One construct that could not be translated faithfully. Immutable once created.
 *
 * {@code name}, {@code snippet} and {@code context} may be null.
 */
@JsonPropertyOrder({ "id", "kind", "name", "message", "snippet", "context" })
public record LossRecord(String id, LossKind kind, String name, String message, String snippet, String context) {
}
