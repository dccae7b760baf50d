package markbridge.lint;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SubsetLintTest {
	private final SubsetLint lint = new SubsetLint();

	@Test
	void sourceInsideTheSubsetHasNoIssues() {
		List<SubsetLint.Issue> issues = lint.lint("= Title\n\n#let n = 3\nValue #n.\n\n#for i in range(n) [- #i]\n");

		assertTrue(issues.isEmpty(), issues.toString());
	}

	@Test
	void codeBlockIsReportedAtItsLineAndColumn() {
		List<SubsetLint.Issue> issues = lint.lint("Intro.\n\nText #{ let xs = (1, 2) } end.\n");

		assertEquals(1, issues.size(), issues.toString());
		SubsetLint.Issue issue = issues.get(0);
		assertEquals("code-block", issue.kind());
		assertEquals(3, issue.line());
		assertEquals(6, issue.column());
	}

	@Test
	void issuesFollowSourceOrder() {
		List<SubsetLint.Issue> issues = lint.lint("#if nope() [a]\n\n#{ 1 }\n");

		assertEquals(2, issues.size(), issues.toString());
		assertEquals("unresolved-conditional", issues.get(0).kind());
		assertEquals(1, issues.get(0).line());
		assertEquals("code-block", issues.get(1).kind());
		assertEquals(3, issues.get(1).line());
	}

	@Test
	void parseErrorCarriesItsPosition() {
		List<SubsetLint.Issue> issues = lint.lint("Fine.\n\n#strong[never closed\n");

		assertEquals("parse-error", issues.get(0).kind());
		assertTrue(issues.get(0).line() >= 3, issues.toString());
	}

	@Test
	void droppedSettingIsAWarningWithoutPosition() {
		List<SubsetLint.Issue> issues = lint.lint("#set page(flipped: true)\n\nHello.\n");

		assertEquals(1, issues.size(), issues.toString());
		assertEquals(SubsetLint.WARNING, issues.get(0).kind());
		assertEquals(0, issues.get(0).line());
		assertTrue(issues.get(0).toString().startsWith("warning: "), issues.get(0).toString());
	}

	@Test
	void lintsEveryTypstFileBelowRoot(@TempDir Path dir) throws Exception {
		Files.createDirectories(dir.resolve("chapters"));
		Files.writeString(dir.resolve("clean.typ"), "Just text.\n");
		Files.writeString(dir.resolve("chapters/loop.typ"), "#{ 1 }\n");
		Files.writeString(dir.resolve("notes.tex"), "\\foo\n");

		Map<Path, List<SubsetLint.Issue>> found = lint.lintTree(dir);

		assertEquals(1, found.size(), found.toString());
		List<SubsetLint.Issue> issues = found.get(Path.of("chapters", "loop.typ"));
		assertEquals(1, issues.size());
		assertEquals("1:1: code-block: " + issues.get(0).message(), issues.get(0).toString());
	}
}
