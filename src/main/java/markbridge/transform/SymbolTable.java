package markbridge.transform;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bidirectional LaTeX ↔ Typst symbol dictionary.
 *
 * Lookups by Typst name return the first entry registered for that name, so the
 * resource lists the preferred LaTeX spelling first.
 */
public final class SymbolTable {
	private static final Logger log = LoggerFactory.getLogger(SymbolTable.class);
	private static final String RESOURCE = "/markbridge/symbols.json";

	private static volatile SymbolTable standard;

	private final Map<String, SymbolEntry> byLatex = new LinkedHashMap<>();
	private final Map<String, SymbolEntry> byTypst = new LinkedHashMap<>();

	public SymbolTable(Collection<SymbolEntry> entries) {
		for (SymbolEntry entry : entries) {
			byLatex.put(entry.latex(), entry);
			byTypst.putIfAbsent(entry.typst(), entry);
		}
	}

	/** Table loaded from the bundled resource; shared because it is immutable. */
	public static SymbolTable standard() {
		SymbolTable table = standard;
		if (table == null) {
			synchronized (SymbolTable.class) {
				table = standard;
				if (table == null) {
					table = load(new ObjectMapper());
					standard = table;
				}
			}
		}
		return table;
	}

	static SymbolTable load(ObjectMapper mapper) {
		try (InputStream in = SymbolTable.class.getResourceAsStream(RESOURCE)) {
			if (in == null) {
				throw new IllegalStateException("missing resource " + RESOURCE);
			}
			SymbolFile file = mapper.readValue(in, SymbolFile.class);
			log.debug("loaded {} symbol entries", file.symbols().size());
			return new SymbolTable(file.symbols());
		} catch (IOException e) {
			throw new UncheckedIOException("cannot read " + RESOURCE, e);
		}
	}

	public SymbolEntry byLatex(String name) {
		return byLatex.get(name);
	}

	public SymbolEntry byTypst(String name) {
		return byTypst.get(name);
	}

	public boolean hasLatex(String name) {
		return byLatex.containsKey(name);
	}

	public Collection<SymbolEntry> entries() {
		return byLatex.values();
	}

	record SymbolFile(List<SymbolEntry> symbols) {
	}
}
