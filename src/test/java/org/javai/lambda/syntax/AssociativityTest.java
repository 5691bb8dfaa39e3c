package org.javai.lambda.syntax;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.apache.logging.log4j.Level;
import org.javai.lambda.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class AssociativityTest {

	private static List<LambdaToken> names(int count) {
		return IntStream.range(0, count)
				.mapToObj(i -> LambdaToken.identifier("v" + i))
				.collect(Collectors.toList());
	}

	@Test
	void leftNestsFromTheFront() {
		List<LambdaToken> grouped = Associativity.associate(LambdaTokens.of("a", "b", "c"), AssociationMode.LEFT);

		assertThat(grouped).isEqualTo(LambdaTokens.of("(", "(", "a", "b", ")", "c", ")"));
	}

	@Test
	void rightNestsFromTheBack() {
		List<LambdaToken> grouped = Associativity.associate(LambdaTokens.of("a", "b", "c"), AssociationMode.RIGHT);

		assertThat(grouped).isEqualTo(LambdaTokens.of("(", "a", "(", "b", "c", ")", ")"));
	}

	@Test
	void leftWithFourNames() {
		assertThat(LambdaTokens.join(
				Associativity.associate(LambdaTokens.of("a", "b", "c", "d"), AssociationMode.LEFT), " "))
				.isEqualTo("( ( ( a b ) c ) d )");
	}

	@Test
	void rightWithFourNames() {
		assertThat(LambdaTokens.join(
				Associativity.associate(LambdaTokens.of("a", "b", "c", "d"), AssociationMode.RIGHT), " "))
				.isEqualTo("( a ( b ( c d ) ) )");
	}

	@Test
	void pairIsWrappedOnce() {
		assertThat(Associativity.associate(LambdaTokens.of("f", "x"), AssociationMode.LEFT))
				.isEqualTo(LambdaTokens.of("(", "f", "x", ")"));
		assertThat(Associativity.associate(LambdaTokens.of("f", "x"), AssociationMode.RIGHT))
				.isEqualTo(LambdaTokens.of("(", "f", "x", ")"));
	}

	@ParameterizedTest
	@EnumSource(AssociationMode.class)
	void emptyAndSingletonSequencesAreUnchanged(AssociationMode mode) {
		assertThat(Associativity.associate(List.of(), mode)).isEmpty();
		assertThat(Associativity.associate(LambdaTokens.of("a"), mode)).isEqualTo(LambdaTokens.of("a"));
	}

	@Test
	void noneLeavesTheChainAlone() {
		assertThat(Associativity.associate(LambdaTokens.of("a", "b", "c"), AssociationMode.NONE))
				.isEqualTo(LambdaTokens.of("a", "b", "c"));
	}

	@Test
	void inputIsNotModified() {
		List<LambdaToken> input = new ArrayList<>(LambdaTokens.of("a", "b", "c"));

		Associativity.associate(input, AssociationMode.RIGHT);

		assertThat(input).isEqualTo(LambdaTokens.of("a", "b", "c"));
	}

	@ParameterizedTest
	@EnumSource(value = AssociationMode.class, names = {"LEFT", "RIGHT"})
	void bracketsAreBalancedAndNamesPreserved(AssociationMode mode) {
		for (int size = 0; size <= 12; size++) {
			List<LambdaToken> input = names(size);
			List<LambdaToken> grouped = Associativity.associate(input, mode);

			int depth = 0;
			for (LambdaToken token : grouped) {
				if (token.isType(LambdaToken.TokenType.OPEN_PAREN)) {
					depth++;
				} else if (token.isType(LambdaToken.TokenType.CLOSE_PAREN)) {
					depth--;
				}
				assertThat(depth).isGreaterThanOrEqualTo(0);
			}
			assertThat(depth).isZero();
			assertThat(grouped).filteredOn(LambdaToken::isIdentifier).containsExactlyElementsOf(input);
			assertThat(grouped).hasSize(size <= 1 ? size : size + 2 * (size - 1));
		}
	}

	@Test
	void longChainsDoNotRecurse() {
		List<LambdaToken> grouped = Associativity.associate(names(20_000), AssociationMode.LEFT);

		assertThat(grouped).hasSize(20_000 + 2 * 19_999);
	}

	@Test
	void modesCanBeGivenByName() {
		assertThat(Associativity.associate(LambdaTokens.of("a", "b", "c"), "right"))
				.isEqualTo(LambdaTokens.of("(", "a", "(", "b", "c", ")", ")"));
		assertThat(Associativity.associate(LambdaTokens.of("a", "b", "c"), "LEFT"))
				.isEqualTo(LambdaTokens.of("(", "(", "a", "b", ")", "c", ")"));
	}

	/**
	 * An unknown mode name is deliberately a soft failure: it warns and keeps the
	 * default grouping rather than throwing.
	 */
	@Test
	void unknownModeNameWarnsAndKeepsDefaultGrouping() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(Associativity.class, Level.WARN)) {
			List<LambdaToken> grouped = Associativity.associate(LambdaTokens.of("a", "b", "c"), "asdf");

			assertThat(grouped).isEqualTo(LambdaTokens.of("a", "b", "c"));
			assertThat(appender.events())
					.singleElement()
					.satisfies(event -> {
						assertThat(event.getLevel()).isEqualTo(Level.WARN);
						assertThat(event.getMessage().getFormattedMessage())
								.isEqualTo("Unknown association type: asdf, using default grouping");
					});
		}
	}
}
