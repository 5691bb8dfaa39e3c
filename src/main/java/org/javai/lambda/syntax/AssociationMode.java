package org.javai.lambda.syntax;

import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * How application chains are grouped while tokenizing.
 */
public enum AssociationMode {

	/** Keep the implicit grouping of the input. */
	NONE,
	/** {@code a b c} becomes {@code ((a b) c)}. */
	LEFT,
	/** {@code a b c} becomes {@code (a (b c))}. */
	RIGHT;

	private static final Logger logger = LoggerFactory.getLogger(AssociationMode.class);

	/**
	 * Looks up a mode by its case-insensitive name ({@code none}, {@code left}, {@code right}).
	 * A null or blank name means {@link #NONE}.
	 */
	public static Optional<AssociationMode> fromName(String name) {
		if (name == null || name.isBlank()) {
			return Optional.of(NONE);
		}
		return switch (name.trim().toLowerCase(Locale.ROOT)) {
			case "none" -> Optional.of(NONE);
			case "left" -> Optional.of(LEFT);
			case "right" -> Optional.of(RIGHT);
			default -> Optional.empty();
		};
	}

	/**
	 * Resolves a configured mode name. Unknown names are not an error: a warning
	 * is logged and {@link #NONE} is used.
	 */
	public static AssociationMode parse(String name) {
		return fromName(name).orElseGet(() -> {
			logger.warn("Unknown association type: {}, using default grouping", name);
			return NONE;
		});
	}

	public String displayName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
