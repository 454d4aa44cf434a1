package org.javai.formula.engine;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Limits and switches for a {@link ParserEngine}.
 * <p>
 * Can be loaded from YAML, using the component names as keys. Keys that are absent keep
 * their default:
 * <pre>
 * maxFormulaLength: 2000
 * strictMode: true
 * </pre>
 *
 * @param maxFormulaLength longest accepted formula text, in characters
 * @param maxVariables most variable bindings an evaluation context may hold
 * @param maxParsingDepth deepest syntax tree the parser builds; also bounds evaluation depth
 * @param maxParsingSteps most shift/reduce steps per parse
 * @param maxStackDepth highest parser state stack
 * @param maxTokenCount most tokens per formula, not counting EOF
 * @param strictMode disables coercion between numbers, booleans and strings
 * @param enableOptimization fold constant subtrees after parsing
 * @param enableCaching memoize subtree results during evaluation
 * @param maxFormulaSteps most steps run in one multi-step calculation or formula set
 */
public record EngineConfig(
		int maxFormulaLength,
		int maxVariables,
		int maxParsingDepth,
		int maxParsingSteps,
		int maxStackDepth,
		int maxTokenCount,
		boolean strictMode,
		boolean enableOptimization,
		boolean enableCaching,
		int maxFormulaSteps
) {

	public static final int DEFAULT_MAX_FORMULA_LENGTH = 5_000;
	public static final int DEFAULT_MAX_VARIABLES = 100;
	public static final int DEFAULT_MAX_PARSING_DEPTH = 256;
	public static final int DEFAULT_MAX_PARSING_STEPS = 1_000_000;
	public static final int DEFAULT_MAX_STACK_DEPTH = 1_024;
	public static final int DEFAULT_MAX_TOKEN_COUNT = 10_000;
	public static final int DEFAULT_MAX_FORMULA_STEPS = 50;

	private static final Set<String> KEYS = Set.of("maxFormulaLength", "maxVariables", "maxParsingDepth",
			"maxParsingSteps", "maxStackDepth", "maxTokenCount", "strictMode", "enableOptimization", "enableCaching",
			"maxFormulaSteps");

	public EngineConfig {
		requirePositive("maxFormulaLength", maxFormulaLength);
		requirePositive("maxParsingDepth", maxParsingDepth);
		requirePositive("maxParsingSteps", maxParsingSteps);
		requirePositive("maxStackDepth", maxStackDepth);
		requirePositive("maxTokenCount", maxTokenCount);
		requirePositive("maxFormulaSteps", maxFormulaSteps);
		if (maxVariables < 0) {
			throw new IllegalArgumentException("maxVariables must not be negative, got " + maxVariables);
		}
	}

	public static EngineConfig defaults() {
		return new EngineConfig(DEFAULT_MAX_FORMULA_LENGTH, DEFAULT_MAX_VARIABLES, DEFAULT_MAX_PARSING_DEPTH,
				DEFAULT_MAX_PARSING_STEPS, DEFAULT_MAX_STACK_DEPTH, DEFAULT_MAX_TOKEN_COUNT, false, true, true,
				DEFAULT_MAX_FORMULA_STEPS);
	}

	/**
	 * Load a configuration from YAML.
	 *
	 * @throws IllegalArgumentException if the document is not a map, names an unknown key, or
	 * holds a value of the wrong type or out of range
	 */
	public static EngineConfig fromYaml(InputStream inputStream) {
		try {
			return fromMap(new Yaml().load(inputStream));
		} catch (YAMLException e) {
			throw new IllegalArgumentException("Malformed engine configuration", e);
		}
	}

	public static EngineConfig fromYaml(Reader reader) {
		try {
			return fromMap(new Yaml().load(reader));
		} catch (YAMLException e) {
			throw new IllegalArgumentException("Malformed engine configuration", e);
		}
	}

	public static EngineConfig fromYaml(String yamlContent) {
		try {
			return fromMap(new Yaml().load(yamlContent));
		} catch (YAMLException e) {
			throw new IllegalArgumentException("Malformed engine configuration", e);
		}
	}

	public static EngineConfig fromYaml(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return fromYaml(reader);
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read engine configuration from " + path, e);
		}
	}

	/**
	 * Build a configuration from option name to value; absent options keep their default.
	 */
	public static EngineConfig fromMap(Object document) {
		if (document == null) {
			return defaults();
		}
		if (!(document instanceof Map<?, ?> map)) {
			throw new IllegalArgumentException("Engine configuration must be a map of options, got: " + document);
		}
		Map<String, Object> options = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			String key = String.valueOf(entry.getKey());
			if (!KEYS.contains(key)) {
				throw new IllegalArgumentException("Unknown engine configuration option: " + key);
			}
			options.put(key, entry.getValue());
		}
		EngineConfig d = defaults();
		return new EngineConfig(
				intOption(options, "maxFormulaLength", d.maxFormulaLength),
				intOption(options, "maxVariables", d.maxVariables),
				intOption(options, "maxParsingDepth", d.maxParsingDepth),
				intOption(options, "maxParsingSteps", d.maxParsingSteps),
				intOption(options, "maxStackDepth", d.maxStackDepth),
				intOption(options, "maxTokenCount", d.maxTokenCount),
				booleanOption(options, "strictMode", d.strictMode),
				booleanOption(options, "enableOptimization", d.enableOptimization),
				booleanOption(options, "enableCaching", d.enableCaching),
				intOption(options, "maxFormulaSteps", d.maxFormulaSteps));
	}

	public EngineConfig withMaxFormulaLength(int value) {
		return new EngineConfig(value, maxVariables, maxParsingDepth, maxParsingSteps, maxStackDepth, maxTokenCount,
				strictMode, enableOptimization, enableCaching, maxFormulaSteps);
	}

	public EngineConfig withMaxVariables(int value) {
		return new EngineConfig(maxFormulaLength, value, maxParsingDepth, maxParsingSteps, maxStackDepth, maxTokenCount,
				strictMode, enableOptimization, enableCaching, maxFormulaSteps);
	}

	public EngineConfig withMaxParsingDepth(int value) {
		return new EngineConfig(maxFormulaLength, maxVariables, value, maxParsingSteps, maxStackDepth, maxTokenCount,
				strictMode, enableOptimization, enableCaching, maxFormulaSteps);
	}

	public EngineConfig withMaxParsingSteps(int value) {
		return new EngineConfig(maxFormulaLength, maxVariables, maxParsingDepth, value, maxStackDepth, maxTokenCount,
				strictMode, enableOptimization, enableCaching, maxFormulaSteps);
	}

	public EngineConfig withMaxStackDepth(int value) {
		return new EngineConfig(maxFormulaLength, maxVariables, maxParsingDepth, maxParsingSteps, value, maxTokenCount,
				strictMode, enableOptimization, enableCaching, maxFormulaSteps);
	}

	public EngineConfig withMaxTokenCount(int value) {
		return new EngineConfig(maxFormulaLength, maxVariables, maxParsingDepth, maxParsingSteps, maxStackDepth, value,
				strictMode, enableOptimization, enableCaching, maxFormulaSteps);
	}

	public EngineConfig withStrictMode(boolean value) {
		return new EngineConfig(maxFormulaLength, maxVariables, maxParsingDepth, maxParsingSteps, maxStackDepth,
				maxTokenCount, value, enableOptimization, enableCaching, maxFormulaSteps);
	}

	public EngineConfig withOptimization(boolean value) {
		return new EngineConfig(maxFormulaLength, maxVariables, maxParsingDepth, maxParsingSteps, maxStackDepth,
				maxTokenCount, strictMode, value, enableCaching, maxFormulaSteps);
	}

	public EngineConfig withCaching(boolean value) {
		return new EngineConfig(maxFormulaLength, maxVariables, maxParsingDepth, maxParsingSteps, maxStackDepth,
				maxTokenCount, strictMode, enableOptimization, value, maxFormulaSteps);
	}

	public EngineConfig withMaxFormulaSteps(int value) {
		return new EngineConfig(maxFormulaLength, maxVariables, maxParsingDepth, maxParsingSteps, maxStackDepth,
				maxTokenCount, strictMode, enableOptimization, enableCaching, value);
	}

	private static int intOption(Map<String, Object> options, String key, int defaultValue) {
		Object value = options.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (!(value instanceof Integer number)) {
			throw new IllegalArgumentException("Option '" + key + "' must be an integer, got: " + value);
		}
		return number;
	}

	private static boolean booleanOption(Map<String, Object> options, String key, boolean defaultValue) {
		Object value = options.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (!(value instanceof Boolean flag)) {
			throw new IllegalArgumentException("Option '" + key + "' must be true or false, got: " + value);
		}
		return flag;
	}

	private static void requirePositive(String name, int value) {
		if (value <= 0) {
			throw new IllegalArgumentException(name + " must be positive, got " + value);
		}
	}
}
