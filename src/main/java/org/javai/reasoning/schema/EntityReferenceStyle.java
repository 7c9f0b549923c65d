package org.javai.reasoning.schema;

/**
 * Concrete value shape a table uses to reference the scoped entity.
 */
public enum EntityReferenceStyle {
	/** The table has no entity reference column. */
	NONE,
	/** Bare identifier, e.g. {@code e4BwD8ZYDBccepXcJ.Ilo3w3}. */
	BARE_ID,
	/** Prefixed composite reference, e.g. {@code Patient/e4BwD8ZYDBccepXcJ.Ilo3w3}. */
	PREFIXED_REFERENCE,
	/** Both shapes were observed in sampled values. Only produced by empirical confirmation. */
	MIXED
}
