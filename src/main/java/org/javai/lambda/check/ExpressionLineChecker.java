package org.javai.lambda.check;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.lambda.config.LambdaSyntaxSettings;
import org.javai.lambda.syntax.AssociationMode;
import org.javai.lambda.syntax.LambdaTokenizer;
import org.javai.lambda.syntax.TokenizeResult;
import org.javai.lambda.tree.ParseTree;
import org.javai.lambda.tree.ParseTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks many expressions, one per line. Lines are independent: a rejected
 * line never affects the lines after it.
 */
public class ExpressionLineChecker {

	private static final Logger logger = LoggerFactory.getLogger(ExpressionLineChecker.class);

	private final LambdaSyntaxSettings settings;
	private final AssociationMode mode;
	private final ParseTreeBuilder treeBuilder;

	public ExpressionLineChecker() {
		this(LambdaSyntaxSettings.defaults());
	}

	public ExpressionLineChecker(LambdaSyntaxSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.mode = settings.resolvedAssociationMode();
		this.treeBuilder = new ParseTreeBuilder(settings.tokenSeparator(), settings.maxNestingDepth());
	}

	/**
	 * Reads a text file as lines, stripping surrounding whitespace from each.
	 */
	public static List<String> readLines(Path path) throws IOException {
		List<String> lines = new ArrayList<>();
		for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
			lines.add(line.strip());
		}
		return lines;
	}

	public TokenizeResult check(String line) {
		return new LambdaTokenizer(line, mode, settings.maxNestingDepth()).tryTokenize();
	}

	public List<LineReport> checkAll(List<String> lines) {
		List<LineReport> reports = new ArrayList<>(lines.size());
		int invalid = 0;
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			LineReport report = new LineReport(i + 1, line, check(line));
			if (!report.isValid()) {
				invalid++;
				logger.debug("Line {} rejected: {}", report.lineNumber(), report.error());
			}
			reports.add(report);
		}
		logger.info("Checked {} lines: {} valid, {} invalid", lines.size(), lines.size() - invalid, invalid);
		return reports;
	}

	public List<LineReport> checkFile(Path path) throws IOException {
		return checkAll(readLines(path));
	}

	/**
	 * Builds the parse tree of a report's tokens.
	 *
	 * @throws IllegalArgumentException if the report is for a rejected line
	 */
	public ParseTree buildTree(LineReport report) {
		if (!report.isValid()) {
			throw new IllegalArgumentException("Line " + report.lineNumber() + " is not valid: " + report.error());
		}
		return treeBuilder.build(report.tokens());
	}

	public static boolean allValid(List<LineReport> reports) {
		return reports.stream().allMatch(LineReport::isValid);
	}

	public static List<String> validLines(List<LineReport> reports) {
		return reports.stream().filter(LineReport::isValid).map(LineReport::input).toList();
	}

	public LambdaSyntaxSettings getSettings() {
		return settings;
	}
}
