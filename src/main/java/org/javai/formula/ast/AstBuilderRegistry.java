package org.javai.formula.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.formula.grammar.Grammar;
import org.javai.formula.grammar.Production;

/**
 * Maps every production of a grammar to exactly one {@link AstBuilder}.
 * <p>
 * Totality is checked once, when the registry is built: a grammar with a production that has
 * no builder never reaches the parser.
 */
public final class AstBuilderRegistry {

	private final Grammar grammar;
	private final Map<Integer, AstBuilder> builders;

	private AstBuilderRegistry(Grammar grammar, Map<Integer, AstBuilder> builders) {
		this.grammar = grammar;
		this.builders = Collections.unmodifiableMap(new LinkedHashMap<>(builders));
	}

	/**
	 * Create a registry from the semantic actions attached to the grammar's productions.
	 *
	 * @throws AstBuildException of kind {@code MISSING_BUILDER} if a production has no action
	 * or names an unknown builder
	 */
	public static AstBuilderRegistry forGrammar(Grammar grammar) {
		Builder builder = builder(grammar);
		for (Production production : grammar.productions()) {
			if (production.action() == null) {
				throw AstBuildException.missingBuilder("Production " + production.id() + " (" + production
						+ ") has no semantic action");
			}
			builder.register(production.id(), AstBuilders.resolve(production.action()));
		}
		return builder.build();
	}

	public static Builder builder(Grammar grammar) {
		return new Builder(grammar);
	}

	public Grammar grammar() {
		return grammar;
	}

	public Optional<AstBuilder> builderFor(int productionId) {
		return Optional.ofNullable(builders.get(productionId));
	}

	public AstBuilder requireBuilder(int productionId) {
		return builderFor(productionId).orElseThrow(() -> AstBuildException.missingBuilder(
				"No builder registered for production " + productionId));
	}

	/**
	 * Reduce the children of {@code production} with its builder.
	 */
	public ChildNode reduce(Production production, List<ChildNode> children) {
		return requireBuilder(production.id()).build(children);
	}

	public int size() {
		return builders.size();
	}

	public static final class Builder {

		private final Grammar grammar;
		private final Map<Integer, AstBuilder> builders = new LinkedHashMap<>();

		private Builder(Grammar grammar) {
			this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
		}

		/**
		 * @throws IllegalArgumentException if the grammar has no production with this id
		 * @throws IllegalStateException if a builder is already registered for it
		 */
		public Builder register(int productionId, AstBuilder builder) {
			Objects.requireNonNull(builder, "builder must not be null");
			if (grammar.production(productionId).isEmpty() || productionId == Grammar.AUGMENTED_PRODUCTION_ID) {
				throw new IllegalArgumentException("Grammar has no production with id " + productionId);
			}
			if (builders.putIfAbsent(productionId, builder) != null) {
				throw new IllegalStateException("A builder is already registered for production " + productionId);
			}
			return this;
		}

		/**
		 * @throws AstBuildException of kind {@code MISSING_BUILDER} if any production lacks a builder
		 */
		public AstBuilderRegistry build() {
			for (Production production : grammar.productions()) {
				if (!builders.containsKey(production.id())) {
					throw AstBuildException.missingBuilder("No builder registered for production "
							+ production.id() + " (" + production + ")");
				}
			}
			return new AstBuilderRegistry(grammar, builders);
		}
	}
}
