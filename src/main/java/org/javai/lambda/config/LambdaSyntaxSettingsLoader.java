package org.javai.lambda.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link LambdaSyntaxSettings} from YAML:
 * <pre>
 * lambda:
 *   association: left
 *   max_nesting_depth: 128
 *   token_separator: "_"
 *   indent_marker: "----"
 * </pre>
 * Missing keys keep their defaults.
 */
public class LambdaSyntaxSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(LambdaSyntaxSettingsLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/lambda-syntax.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load settings from a YAML file.
	 */
	public LambdaSyntaxSettings load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		} catch (Exception e) {
			throw new IllegalArgumentException("Failed to load settings from path: " + path, e);
		}
	}

	/**
	 * Load settings from a YAML stream.
	 */
	public LambdaSyntaxSettings load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (Exception e) {
			throw new IllegalArgumentException("Failed to load settings from input stream", e);
		}
	}

	/**
	 * Load settings from a YAML string.
	 */
	public LambdaSyntaxSettings loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (Exception e) {
			throw new IllegalArgumentException("Failed to load settings from string", e);
		}
	}

	/**
	 * Load {@value #DEFAULT_RESOURCE} from the class path, or the defaults if it is absent.
	 */
	public LambdaSyntaxSettings loadDefault(ClassLoader loader) {
		InputStream stream = loader.getResourceAsStream(DEFAULT_RESOURCE);
		if (stream == null) {
			logger.debug("No {} on the class path; using default settings", DEFAULT_RESOURCE);
			return LambdaSyntaxSettings.defaults();
		}
		try (InputStream in = stream) {
			return load(in);
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to close settings resource " + DEFAULT_RESOURCE, e);
		}
	}

	@SuppressWarnings("unchecked")
	private LambdaSyntaxSettings build(Object data) {
		LambdaSyntaxSettings defaults = LambdaSyntaxSettings.defaults();
		if (data == null) {
			return defaults;
		}
		if (!(data instanceof Map)) {
			throw new IllegalArgumentException("Settings must be a YAML mapping");
		}
		Object section = ((Map<String, Object>) data).get("lambda");
		if (section == null) {
			return defaults;
		}
		if (!(section instanceof Map)) {
			throw new IllegalArgumentException("'lambda' section must be a YAML mapping");
		}
		Map<String, Object> map = (Map<String, Object>) section;
		return new LambdaSyntaxSettings(
			toString(map.get("association"), defaults.associationMode()),
			toInt(map.get("max_nesting_depth"), defaults.maxNestingDepth()),
			toString(map.get("token_separator"), defaults.tokenSeparator()),
			toString(map.get("indent_marker"), defaults.indentMarker())
		);
	}

	private String toString(Object value, String fallback) {
		return value != null ? String.valueOf(value) : fallback;
	}

	private int toInt(Object value, int fallback) {
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		try {
			return Integer.parseInt(String.valueOf(value).trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Expected an integer but was '" + value + "'", e);
		}
	}
}
