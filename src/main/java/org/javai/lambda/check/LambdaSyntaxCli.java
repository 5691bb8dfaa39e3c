package org.javai.lambda.check;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import org.javai.lambda.config.LambdaSyntaxSettings;
import org.javai.lambda.config.LambdaSyntaxSettingsLoader;
import org.javai.lambda.syntax.LambdaSyntaxException;
import org.javai.lambda.tree.ParseTree;
import org.javai.lambda.tree.ParseTreeJsonEmitter;
import org.javai.lambda.tree.ParseTreePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: checks every line of a file and prints the tokens or
 * the diagnostic for each, optionally followed by parse trees of the valid lines.
 * <pre>
 * lambda-syntax &lt;file&gt; [--mode none|left|right] [--tree] [--json] [--config &lt;yaml&gt;]
 * </pre>
 * Exit status is 0 when every line is valid, 1 when some line is not, and 2 for
 * usage or I/O problems.
 */
public final class LambdaSyntaxCli {

	private static final Logger logger = LoggerFactory.getLogger(LambdaSyntaxCli.class);

	static final int EXIT_ALL_VALID = 0;
	static final int EXIT_INVALID_LINES = 1;
	static final int EXIT_USAGE = 2;

	private static final String USAGE =
			"Usage: lambda-syntax <file> [--mode none|left|right] [--tree] [--json] [--config <yaml>]";

	private LambdaSyntaxCli() {}

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err) {
		Path file = null;
		Path config = null;
		String mode = null;
		boolean tree = false;
		boolean json = false;

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			switch (arg) {
				case "--tree" -> tree = true;
				case "--json" -> json = true;
				case "--mode", "--config" -> {
					if (i + 1 >= args.length) {
						err.println("Missing value for " + arg);
						err.println(USAGE);
						return EXIT_USAGE;
					}
					String value = args[++i];
					if (arg.equals("--mode")) {
						mode = value;
					} else {
						config = Path.of(value);
					}
				}
				default -> {
					if (arg.startsWith("--") || file != null) {
						err.println("Unexpected argument: " + arg);
						err.println(USAGE);
						return EXIT_USAGE;
					}
					file = Path.of(arg);
				}
			}
		}
		if (file == null) {
			err.println(USAGE);
			return EXIT_USAGE;
		}

		List<LineReport> reports;
		try {
			LambdaSyntaxSettingsLoader loader = new LambdaSyntaxSettingsLoader();
			LambdaSyntaxSettings settings = config != null
					? loader.load(config)
					: loader.loadDefault(LambdaSyntaxCli.class.getClassLoader());
			if (mode != null) {
				settings = settings.withAssociationMode(mode);
			}
			ExpressionLineChecker checker = new ExpressionLineChecker(settings);
			reports = checker.checkFile(file);
			print(checker, reports, tree, json, out);
		} catch (IOException | IllegalArgumentException e) {
			logger.debug("Failed to check {}", file, e);
			err.println("Error: " + e.getMessage());
			return EXIT_USAGE;
		}

		return ExpressionLineChecker.allValid(reports) ? EXIT_ALL_VALID : EXIT_INVALID_LINES;
	}

	private static void print(ExpressionLineChecker checker, List<LineReport> reports, boolean tree, boolean json,
			PrintStream out) {
		LambdaSyntaxSettings settings = checker.getSettings();
		for (LineReport report : reports) {
			out.println(report.describe(settings.tokenSeparator()));
		}
		if (ExpressionLineChecker.allValid(reports)) {
			out.println("All lines are valid");
		}
		if (!tree && !json) {
			return;
		}
		ParseTreePrinter printer = new ParseTreePrinter(settings.indentMarker());
		for (LineReport report : reports) {
			if (!report.isValid()) {
				continue;
			}
			ParseTree parseTree;
			try {
				parseTree = checker.buildTree(report);
			} catch (LambdaSyntaxException e) {
				logger.warn("No parse tree for line {}: {}", report.lineNumber(), e.getError());
				out.println();
				out.println(e.getError().describe(report.input()));
				continue;
			}
			out.println();
			if (json) {
				out.println(ParseTreeJsonEmitter.emitString(parseTree));
			} else {
				out.print(printer.render(parseTree));
			}
		}
	}
}
