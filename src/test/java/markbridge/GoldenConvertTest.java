package markbridge;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GoldenConvertTest {
	@Test
	void convertsSampleLatexToExpectedTypst() throws Exception {
		Path latexPath = Path.of("src", "test", "resources", "golden", "sample.tex");
		Path expectedPath = Path.of("src", "test", "resources", "golden", "sample.typ");

		String latex = Files.readString(latexPath);
		String expected = Files.readString(expectedPath);
		ConversionResult result = new Converter().convert(latex, Direction.LATEX_TO_TYPST, ConversionOptions.defaults());

		assertEquals(normalize(expected), normalize(result.outputText()));
		assertTrue(result.lossReport().isEmpty(), result.lossReport().toString());
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
