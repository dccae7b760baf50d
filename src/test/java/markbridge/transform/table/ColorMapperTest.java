package markbridge.transform.table;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class ColorMapperTest {
	@Test
	void mapsNamedColorsBothWays() {
		assertEquals("aqua", ColorMapper.toTypst("cyan"));
		assertEquals("cyan", ColorMapper.toLatex("aqua"));
		assertEquals("red", ColorMapper.toTypst(" red "));
	}

	@Test
	void mapsTintsToLightenAndDarken() {
		assertEquals("red.lighten(70%)", ColorMapper.toTypst("red!30"));
		assertEquals("blue.darken(60%)", ColorMapper.toTypst("blue!40!black"));
		assertEquals("red!80!black", ColorMapper.toLatex("red.darken(20%)"));
		assertEquals("green!75", ColorMapper.toLatex("green.lighten(25%)"));
	}

	@Test
	void mapsHexColors() {
		assertEquals("rgb(\"#1a2b3c\")", ColorMapper.toTypst("1A2B3C"));
		assertEquals("[HTML]{AABBCC}", ColorMapper.toLatex("rgb(\"#abc\")"));
	}

	@Test
	void colorsWithoutCounterpartAreNull() {
		assertNull(ColorMapper.toTypst("red!50!blue"));
		assertNull(ColorMapper.toTypst("mycustomcolor"));
		assertNull(ColorMapper.toLatex("gradient.linear(red, blue)"));
	}
}
