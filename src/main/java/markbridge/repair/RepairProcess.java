package markbridge.repair;

import java.io.IOException;

/**
 * Produces a candidate replacement for a conversion output. Candidates are never
 * trusted: {@link RepairGate} decides whether one replaces the output.
 */
public interface RepairProcess {
	/**
	 * @return the candidate target text
	 * @throws IOException if the process cannot be run or gives no usable answer
	 */
	String repair(RepairRequest request) throws IOException;
}
