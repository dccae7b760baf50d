package markbridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProjectConverterTest {
	@Test
	void convertsEachFileIntoTheOtherLanguageWithReport(@TempDir Path dir) throws Exception {
		Path in = dir.resolve("in");
		Path out = dir.resolve("out");
		Path tex = in.resolve(Path.of("chapters", "intro.tex"));
		Path typ = in.resolve("notes.typ");
		Files.createDirectories(tex.getParent());
		Files.writeString(tex, "\\section{Intro}\n\nText with \\foo and $x^2$.\n");
		Files.writeString(typ, "= Notes\n\nSome *bold* text.\n");
		Files.writeString(in.resolve("readme.txt"), "not a source file\n");

		ProjectConverter.Summary summary = new ProjectConverter().convertTree(in, out);

		assertEquals(List.of(Path.of("chapters", "intro.tex"), Path.of("notes.typ")), summary.converted());
		assertTrue(summary.failed().isEmpty());
		Path introTyp = out.resolve(Path.of("chapters", "intro.typ"));
		Path notesTex = out.resolve("notes.tex");
		assertTrue(Files.exists(introTyp), "expected intro.typ to be generated");
		assertTrue(Files.exists(notesTex), "expected notes.tex to be generated");
		assertFalse(Files.exists(out.resolve("readme.txt")));
		assertTrue(Files.readString(introTyp).contains("= Intro"));
		assertTrue(Files.readString(notesTex).contains("\\textbf{bold}"));

		JsonNode report = new ObjectMapper().readTree(out.resolve(Path.of("chapters", "intro.loss.json")).toFile());
		assertEquals("chapters/intro.tex", report.get("source").asText());
		assertEquals("chapters/intro.typ", report.get("output").asText());
		assertEquals("latex", report.get("report").get("source_lang").asText());
		assertEquals("typst", report.get("report").get("target_lang").asText());
		JsonNode loss = report.get("report").get("losses").get(0);
		assertEquals("L0001", loss.get("id").asText());
		assertEquals("unknown-command", loss.get("kind").asText());
		assertEquals(1, report.get("metrics").get("headings").asInt());
		assertEquals(1, report.get("metrics").get("loss_markers").asInt());
		assertTrue(report.get("table_coverage").isObject());
	}

	@Test
	void skipsFilesThatDoNotParse(@TempDir Path dir) throws Exception {
		Path in = dir.resolve("in");
		Path out = dir.resolve("out");
		Files.createDirectories(in);
		Files.writeString(in.resolve("bad.tex"), "\\begin{itemize}\n\\item never closed\n");
		Files.writeString(in.resolve("good.tex"), "Fine.\n");

		ProjectConverter.Summary summary = new ProjectConverter().convertTree(in, out);

		assertEquals(List.of(Path.of("bad.tex")), summary.failed());
		assertEquals(List.of(Path.of("good.tex")), summary.converted());
		assertFalse(Files.exists(out.resolve("bad.typ")));
		assertEquals("Fine.\n", Files.readString(out.resolve("good.typ")));
	}
}
