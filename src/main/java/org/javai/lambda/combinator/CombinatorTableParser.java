package org.javai.lambda.combinator;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.lambda.syntax.LambdaParser;
import org.javai.lambda.syntax.LambdaSyntaxException;
import org.javai.lambda.term.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads a combinator table from YAML:
 *
 * <pre>
 * combinators:
 *   - name: Identity
 *     expression: '\x.x'
 * church_numerals:
 *   max: 64
 * </pre>
 *
 * Expressions use the ordinary lambda syntax and must be closed.
 */
public class CombinatorTableParser {

	private static final Logger logger = LoggerFactory.getLogger(CombinatorTableParser.class);

	private final Yaml yaml = new Yaml();

	public CombinatorTable parse(InputStream inputStream) {
		Object data;
		try {
			data = yaml.load(inputStream);
		} catch (RuntimeException e) {
			throw new CombinatorTableException("Failed to read combinator table from input stream", e);
		}
		return build(data);
	}

	public CombinatorTable parse(Reader reader) {
		Object data;
		try {
			data = yaml.load(reader);
		} catch (RuntimeException e) {
			throw new CombinatorTableException("Failed to read combinator table from reader", e);
		}
		return build(data);
	}

	public CombinatorTable parseString(String yamlContent) {
		Object data;
		try {
			data = yaml.load(yamlContent);
		} catch (RuntimeException e) {
			throw new CombinatorTableException("Failed to read combinator table from string", e);
		}
		return build(data);
	}

	/**
	 * Loads a table from a classpath resource.
	 *
	 * @throws CombinatorTableException if the resource cannot be found or parsed
	 */
	public CombinatorTable parseResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new CombinatorTableException("Resource not found: " + resourcePath);
			}
			CombinatorTable table = parse(is);
			logger.debug("Loaded {} combinators from {}", table.combinators().size(), resourcePath);
			return table;
		} catch (IOException e) {
			throw new CombinatorTableException("Failed to read resource: " + resourcePath, e);
		}
	}

	@SuppressWarnings("unchecked")
	private CombinatorTable build(Object data) {
		if (!(data instanceof Map<?, ?> root)) {
			throw new CombinatorTableException("Combinator table must be a YAML mapping");
		}
		Object entries = root.get("combinators");
		if (!(entries instanceof List<?> list)) {
			throw new CombinatorTableException("Missing required 'combinators' list");
		}

		List<Combinator> combinators = new ArrayList<>();
		Set<String> names = new LinkedHashSet<>();
		for (Object entry : list) {
			if (!(entry instanceof Map<?, ?> map)) {
				throw new CombinatorTableException("Combinator entry must be a mapping: " + entry);
			}
			Combinator combinator = buildCombinator((Map<String, Object>) map);
			if (!names.add(combinator.name())) {
				throw new CombinatorTableException("Duplicate combinator name '" + combinator.name() + "'");
			}
			combinators.add(combinator);
		}

		return new CombinatorTable(combinators, buildMaxNumeral(root.get("church_numerals")));
	}

	private Combinator buildCombinator(Map<String, Object> map) {
		Object name = map.get("name");
		Object expression = map.get("expression");
		if (name == null || expression == null) {
			throw new CombinatorTableException("Combinator entry requires 'name' and 'expression': " + map);
		}
		Term term;
		try {
			term = LambdaParser.parse(String.valueOf(expression));
		} catch (LambdaSyntaxException e) {
			throw new CombinatorTableException(
					"Invalid expression for combinator '" + name + "': " + e.getMessage(), e);
		}
		try {
			return new Combinator(String.valueOf(name), term);
		} catch (IllegalArgumentException e) {
			throw new CombinatorTableException(e.getMessage(), e);
		}
	}

	private int buildMaxNumeral(Object numerals) {
		if (numerals == null) {
			return CombinatorTable.DEFAULT_MAX_CHURCH_NUMERAL;
		}
		if (!(numerals instanceof Map<?, ?> map)) {
			throw new CombinatorTableException("'church_numerals' must be a mapping");
		}
		Object max = map.get("max");
		if (max == null) {
			return CombinatorTable.DEFAULT_MAX_CHURCH_NUMERAL;
		}
		if (!(max instanceof Integer value)) {
			throw new CombinatorTableException("'church_numerals.max' must be an integer, found: " + max);
		}
		return value;
	}
}
