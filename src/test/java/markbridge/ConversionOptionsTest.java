package markbridge;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConversionOptionsTest {
	@Test
	void defaultsEnableEveryFeature() {
		ConversionOptions options = ConversionOptions.defaults();

		assertEquals(EnumSet.allOf(Feature.class), EnumSet.copyOf(options.features()));
		assertTrue(options.lossComments());
		assertEquals(ConversionOptions.DEFAULT_MAX_MACRO_DEPTH, options.maxMacroDepth());
	}

	@Test
	void readsProperties() {
		Properties props = new Properties();
		props.setProperty("features", "tables, references");
		props.setProperty("loss-comments", "false");
		props.setProperty("max-loop-iterations", "10");
		props.setProperty("repair-timeout-ms", "1500");
		ConversionOptions options = ConversionOptions.fromProperties(props);

		assertTrue(options.enabled(Feature.TABLES));
		assertFalse(options.enabled(Feature.GRAPHICS));
		assertFalse(options.lossComments());
		assertEquals(10, options.maxLoopIterations());
		assertEquals(Duration.ofMillis(1500), options.repairTimeout());
	}

	@Test
	void rejectsInvalidValues() {
		Properties props = new Properties();
		props.setProperty("math-only", "maybe");
		assertThrows(IllegalArgumentException.class, () -> ConversionOptions.fromProperties(props));

		Properties features = new Properties();
		features.setProperty("features", "tables,sound");
		assertThrows(IllegalArgumentException.class, () -> ConversionOptions.fromProperties(features));

		assertThrows(IllegalArgumentException.class, () -> ConversionOptions.builder().maxMacroDepth(0).build());
	}
}
