package markbridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import markbridge.parse.SourceParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Converts a tree of {@code .tex} and {@code .typ} files into a parallel tree.
 *
 * Each input produces one output file in the other language plus a
 * {@code <name>.loss.json} report. A file that fails to parse is skipped and
 * listed in the returned summary; the other files are still converted.
 */
public final class ProjectConverter {
	private static final Logger log = LoggerFactory.getLogger(ProjectConverter.class);
	static final String REPORT_SUFFIX = ".loss.json";

	private final Converter converter;
	private final ConversionOptions options;
	private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

	public ProjectConverter(Converter converter, ConversionOptions options) {
		this.converter = converter;
		this.options = options;
	}

	public ProjectConverter() {
		this(new Converter(), ConversionOptions.defaults());
	}

	public Summary convertTree(Path inputRoot, Path outputRoot) throws IOException {
		List<Path> files;
		try (Stream<Path> paths = Files.walk(inputRoot)) {
			files = paths
					.filter(Files::isRegularFile)
					.filter(p -> Direction.forExtension(p.getFileName().toString()) != null)
					.sorted()
					.toList();
		}
		List<Path> converted = new ArrayList<>();
		List<Path> failed = new ArrayList<>();
		for (Path file : files) {
			Path rel = inputRoot.relativize(file);
			try {
				convertOne(rel, file, outputRoot);
				converted.add(rel);
			} catch (SourceParseException ex) {
				log.warn("skipping {}: {}", rel, ex.getMessage());
				failed.add(rel);
			}
		}
		log.info("converted {} files, {} failed", converted.size(), failed.size());
		return new Summary(List.copyOf(converted), List.copyOf(failed));
	}

	private void convertOne(Path rel, Path file, Path outputRoot) throws IOException {
		String fileName = rel.getFileName().toString();
		Direction direction = Direction.forExtension(fileName);
		String base = fileName.substring(0, fileName.lastIndexOf('.'));
		String extension = direction == Direction.LATEX_TO_TYPST ? ".typ" : ".tex";
		Path outRel = rel.getParent() == null ? Path.of(base + extension) : rel.getParent().resolve(base + extension);
		Path outFile = outputRoot.resolve(outRel);

		String source = Files.readString(file);
		ConversionResult result = converter.convert(source, direction, options);

		Files.createDirectories(outFile.toAbsolutePath().getParent());
		Files.writeString(outFile, result.outputText());
		FileReport report = new FileReport(slashes(rel), slashes(outRel), result.lossReport(), result.metrics(),
				result.tableCoverage());
		mapper.writeValue(outFile.resolveSibling(base + REPORT_SUFFIX).toFile(), report);
		log.debug("{} -> {} ({} losses)", rel, outRel, result.lossReport().losses().size());
	}

	private static String slashes(Path path) {
		return path.toString().replace('\\', '/');
	}

	/** Relative paths of the inputs converted and of those that failed to parse. */
	public record Summary(List<Path> converted, List<Path> failed) {
	}
}
