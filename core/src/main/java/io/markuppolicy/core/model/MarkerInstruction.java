package io.markuppolicy.core.model;

import io.markuppolicy.core.spi.MarkupNode;
import java.util.Objects;

/**
 * Outcome of diff-strategy classification: which marker, if any, the caller
 * writes onto the node before the differ runs.
 *
 * <p>
 * A sealed hierarchy with three variants:
 * <ul>
 * <li>{@link None}: plain markup, default diffing applies.</li>
 * <li>{@link SetIgnore}: the differ must leave the node alone; attribute-scoped
 * manual diffing happens elsewhere.</li>
 * <li>{@link SetKey}: the node pairs only with a node carrying the same key, so
 * any mismatch forces replacement.</li>
 * </ul>
 *
 * <p>
 * Instances are immutable. {@link #applyTo(MarkupNode)} is the only mutation
 * step and is the caller's responsibility.
 */
public sealed interface MarkerInstruction {

    /** Shared instance of {@link None}. */
    MarkerInstruction NONE = new None();

    /** Shared instance of {@link SetIgnore}. */
    MarkerInstruction SET_IGNORE = new SetIgnore();

    /**
     * Writes this instruction's marker onto the node.
     *
     * @param node the node that was classified
     */
    void applyTo(MarkupNode node);

    /** Creates a {@link SetKey} instruction for the given generated key. */
    static MarkerInstruction setKey(String key) {
        return new SetKey(key);
    }

    // ── Implementations ──

    /** No marker. */
    record None() implements MarkerInstruction {
        @Override
        public void applyTo(MarkupNode node) {
            // nothing to write
        }
    }

    /** Sets {@link MarkerAttributes#DIFF_IGNORE} to the empty string. */
    record SetIgnore() implements MarkerInstruction {
        @Override
        public void applyTo(MarkupNode node) {
            node.setAttribute(MarkerAttributes.DIFF_IGNORE, "");
        }
    }

    /**
     * Sets {@link MarkerAttributes#DIFF_KEY} to a generated key.
     *
     * @param key the generated key, never {@code null}
     */
    record SetKey(String key) implements MarkerInstruction {
        public SetKey {
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public void applyTo(MarkupNode node) {
            node.setAttribute(MarkerAttributes.DIFF_KEY, key);
        }
    }
}
