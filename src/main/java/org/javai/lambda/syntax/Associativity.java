package org.javai.lambda.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes the grouping of an application chain explicit.
 * <p>
 * Given the juxtaposed tokens {@code a b c d}:
 * <pre>
 * LEFT  -> ( ( ( a b ) c ) d )
 * RIGHT -> ( a ( b ( c d ) ) )
 * </pre>
 * Sequences of zero or one token are returned unchanged.
 */
public final class Associativity {

	private static final Logger logger = LoggerFactory.getLogger(Associativity.class);

	private Associativity() {
		// Utility class - no instantiation
	}

	/**
	 * Groups {@code tokens} according to {@code mode}. {@link AssociationMode#NONE}
	 * returns a copy of the input.
	 *
	 * @return a new list; the input is not modified
	 */
	public static List<LambdaToken> associate(List<LambdaToken> tokens, AssociationMode mode) {
		Objects.requireNonNull(tokens, "tokens must not be null");
		Objects.requireNonNull(mode, "mode must not be null");
		int size = tokens.size();
		if (size <= 1 || mode == AssociationMode.NONE) {
			return new ArrayList<>(tokens);
		}

		List<LambdaToken> grouped = new ArrayList<>(size + 2 * (size - 1));
		if (mode == AssociationMode.LEFT) {
			for (int i = 1; i < size; i++) {
				grouped.add(LambdaToken.OPEN_PAREN);
			}
			grouped.add(tokens.get(0));
			for (int i = 1; i < size; i++) {
				grouped.add(tokens.get(i));
				grouped.add(LambdaToken.CLOSE_PAREN);
			}
		} else {
			for (int i = 0; i < size - 1; i++) {
				grouped.add(LambdaToken.OPEN_PAREN);
				grouped.add(tokens.get(i));
			}
			grouped.add(tokens.get(size - 1));
			for (int i = 1; i < size; i++) {
				grouped.add(LambdaToken.CLOSE_PAREN);
			}
		}
		return grouped;
	}

	/**
	 * Groups {@code tokens} using a mode given by name. An unrecognised name logs a
	 * warning and returns the input unchanged.
	 */
	public static List<LambdaToken> associate(List<LambdaToken> tokens, String modeName) {
		Optional<AssociationMode> mode = AssociationMode.fromName(modeName);
		if (mode.isEmpty()) {
			logger.warn("Unknown association type: {}, using default grouping", modeName);
			return new ArrayList<>(tokens);
		}
		return associate(tokens, mode.get());
	}
}
