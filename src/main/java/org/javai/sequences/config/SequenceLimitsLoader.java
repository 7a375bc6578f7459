package org.javai.sequences.config;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link SequenceLimits} from YAML.
 * <pre>
 * max_label_length: 64
 * max_indentation_level: 20
 * </pre>
 * Keys that are absent keep their default value. Unknown keys are ignored.
 */
public class SequenceLimitsLoader {

	private static final Logger logger = LoggerFactory.getLogger(SequenceLimitsLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/sequence-limits.yml";

	static final String MAX_LABEL_LENGTH = "max_label_length";
	static final String MAX_INDENTATION_LEVEL = "max_indentation_level";

	private static final Set<String> KNOWN_KEYS = Set.of(MAX_LABEL_LENGTH, MAX_INDENTATION_LEVEL);

	private final Yaml yaml = new Yaml();

	/**
	 * Parse limits from a YAML file.
	 *
	 * @throws IllegalStateException if the file cannot be read or holds invalid values
	 */
	public SequenceLimits parse(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try (var reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load sequence limits from path: " + path, e);
		}
	}

	/**
	 * Parse limits from a YAML stream.
	 *
	 * @throws IllegalStateException if the stream holds invalid YAML or invalid values
	 */
	public SequenceLimits parse(InputStream inputStream) {
		Objects.requireNonNull(inputStream, "inputStream must not be null");
		try {
			return build(yaml.load(inputStream));
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load sequence limits from input stream", e);
		}
	}

	/**
	 * Parse limits from a YAML string.
	 *
	 * @throws IllegalStateException if the string holds invalid YAML or invalid values
	 */
	public SequenceLimits parseString(String yamlContent) {
		Objects.requireNonNull(yamlContent, "yamlContent must not be null");
		try {
			return build(yaml.load(yamlContent));
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load sequence limits from string", e);
		}
	}

	/**
	 * Load limits from a classpath resource, falling back to {@link SequenceLimits#defaults()} when the
	 * resource does not exist.
	 *
	 * @throws IllegalStateException if the resource exists but cannot be parsed
	 */
	public SequenceLimits loadResourceOrDefaults(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				logger.info("No sequence limits found at '{}'; using defaults", resourcePath);
				return SequenceLimits.defaults();
			}
			SequenceLimits limits = parse(is);
			logger.debug("Loaded sequence limits from '{}': {}", resourcePath, limits);
			return limits;
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load sequence limits from resource: " + resourcePath, e);
		}
	}

	private SequenceLimits build(Object document) {
		if (document == null) {
			return SequenceLimits.defaults();
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new IllegalArgumentException("Sequence limits must be a YAML mapping");
		}
		for (Object key : data.keySet()) {
			if (!KNOWN_KEYS.contains(String.valueOf(key))) {
				logger.warn("Ignoring unknown sequence limit '{}'", key);
			}
		}
		return SequenceLimits.builder()
				.maxLabelLength(intValue(data, MAX_LABEL_LENGTH, SequenceLimits.DEFAULT_MAX_LABEL_LENGTH))
				.maxIndentationLevel(intValue(data, MAX_INDENTATION_LEVEL, SequenceLimits.DEFAULT_MAX_INDENTATION_LEVEL))
				.build();
	}

	private int intValue(Map<?, ?> data, String key, int defaultValue) {
		Object value = data.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Integer i) {
			return i;
		}
		throw new IllegalArgumentException("Sequence limit '" + key + "' must be an integer, got: " + value);
	}
}
