package org.javai.formula.grammar;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for grammar definition YAML files.
 * <p>
 * A definition names the start symbol, the terminals and nonterminals, and lists the
 * productions with their stable ids and the AST builder that reduces each one:
 * <pre>
 * start: EXPR
 * terminals: [NUMBER, PLUS, ...]
 * nonterminals: [EXPR, TERM, ...]
 * productions:
 *   - id: 11
 *     left: ARITH_EXPR
 *     right: [ARITH_EXPR, PLUS, TERM]
 *     build: binary
 *     argument: "+"
 * </pre>
 */
public class GrammarParser {

	/**
	 * Classpath location of the formula expression grammar.
	 */
	public static final String FORMULA_GRAMMAR_RESOURCE = "META-INF/formula-grammar.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Parse the formula expression grammar shipped with the engine.
	 */
	public Grammar parseFormulaGrammar() {
		return parseResource(FORMULA_GRAMMAR_RESOURCE, GrammarParser.class.getClassLoader());
	}

	/**
	 * Parse a grammar definition from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 */
	public Grammar parseResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		InputStream is = loader.getResourceAsStream(resourcePath);
		if (is == null) {
			throw new IllegalArgumentException("Resource not found: " + resourcePath);
		}
		try (is) {
			return parse(is);
		} catch (IOException e) {
			throw GrammarException.invalidGrammar("Failed to read grammar resource: " + resourcePath, e);
		}
	}

	/**
	 * Parse a grammar definition from a path.
	 */
	public Grammar parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (GrammarException e) {
			throw e;
		} catch (Exception e) {
			throw GrammarException.invalidGrammar("Failed to parse grammar from path: " + path, e);
		}
	}

	/**
	 * Parse a grammar definition from an input stream.
	 */
	public Grammar parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildGrammar(data);
		} catch (GrammarException e) {
			throw e;
		} catch (Exception e) {
			throw GrammarException.invalidGrammar("Failed to parse grammar from input stream", e);
		}
	}

	/**
	 * Parse a grammar definition from a reader.
	 */
	public Grammar parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildGrammar(data);
		} catch (GrammarException e) {
			throw e;
		} catch (Exception e) {
			throw GrammarException.invalidGrammar("Failed to parse grammar from reader", e);
		}
	}

	/**
	 * Parse a grammar definition from a string.
	 */
	public Grammar parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildGrammar(data);
		} catch (GrammarException e) {
			throw e;
		} catch (Exception e) {
			throw GrammarException.invalidGrammar("Failed to parse grammar from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private Grammar buildGrammar(Map<String, Object> data) {
		if (data == null) {
			throw GrammarException.invalidGrammar("Grammar definition is empty");
		}
		Object start = data.get("start");
		if (!(start instanceof String startSymbol)) {
			throw GrammarException.invalidGrammar("Grammar definition is missing 'start'");
		}

		Grammar.Builder builder = Grammar.builder(startSymbol)
				.terminals(stringList(data.get("terminals"), "terminals"))
				.nonTerminals(stringList(data.get("nonterminals"), "nonterminals"));

		Object productionsObj = data.get("productions");
		if (!(productionsObj instanceof List<?> productionList)) {
			throw GrammarException.invalidGrammar("Grammar definition is missing 'productions'");
		}
		for (Object entry : productionList) {
			if (!(entry instanceof Map<?, ?>)) {
				throw GrammarException.invalidGrammar("Production entry must be a map: " + entry);
			}
			builder.production(buildProduction((Map<String, Object>) entry));
		}
		return builder.build();
	}

	private Production buildProduction(Map<String, Object> map) {
		Object id = map.get("id");
		Object left = map.get("left");
		if (!(id instanceof Integer) || !(left instanceof String)) {
			throw GrammarException.invalidGrammar("Production requires an integer 'id' and a 'left' symbol: " + map);
		}
		List<String> right = stringList(map.get("right"), "right");
		SemanticAction action = null;
		Object build = map.get("build");
		if (build != null) {
			Object argument = map.get("argument");
			action = new SemanticAction(String.valueOf(build), argument != null ? String.valueOf(argument) : null);
		}
		return new Production((Integer) id, (String) left, right, action);
	}

	private List<String> stringList(Object value, String field) {
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List<?> list)) {
			throw GrammarException.invalidGrammar("'" + field + "' must be a list");
		}
		List<String> result = new ArrayList<>();
		for (Object item : list) {
			result.add(String.valueOf(item));
		}
		return result;
	}
}
