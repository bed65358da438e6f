package io.markuppolicy.core.engine;

import io.markuppolicy.core.model.MarkerAttributes;
import io.markuppolicy.core.model.MarkerInstruction;
import io.markuppolicy.core.policy.PolicyTables;
import io.markuppolicy.core.spi.MarkupNode;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks freshly rendered nodes so the differ knows how to reconcile them.
 *
 * <p>
 * Most components don't support ad hoc mutation and must be replaced rather
 * than diffed in place; a few (the diffable tags of {@link PolicyTables}) are
 * diffed manually on a known attribute list. Decision order:
 * <ol>
 * <li>no binding and a diffable tag → {@link MarkerInstruction.SetIgnore}: the
 * old node stays and is patched manually afterwards</li>
 * <li>a binding or a component tag → {@link MarkerInstruction.SetKey}: the node
 * pairs only with a node of the same key, so it is always replaced</li>
 * <li>anything else → {@link MarkerInstruction.None}: default diffing</li>
 * </ol>
 * Nodes with bindings are never diffed in place because the binding subsystem
 * discards all previously rendered nodes before the differ runs. A marker that
 * is already present is never rewritten, so classification is idempotent.
 *
 * <p>
 * Thread-safe: {@link #classify} reads the node and never mutates it.
 */
public final class DiffStrategyClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(DiffStrategyClassifier.class);

    private final PolicyTables tables;

    /** Creates a classifier over the built-in diffable-tag table. */
    public DiffStrategyClassifier() {
        this(PolicyTables.defaults());
    }

    public DiffStrategyClassifier(PolicyTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
    }

    /**
     * Decides which marker the node needs. The node is not modified.
     *
     * @param node        the node to classify
     * @param generateKey supplies a fresh unique key; called at most once, and
     *                    only when a key is actually needed
     * @return the instruction for the caller to apply
     */
    public MarkerInstruction classify(MarkupNode node, Supplier<String> generateKey) {
        String tagName = node.getTagName().toLowerCase(Locale.ROOT);
        boolean hasBinding = node.hasAttribute(MarkerAttributes.BINDING);

        if (!hasBinding && tables.isDiffableTag(tagName)) {
            return node.hasAttribute(MarkerAttributes.DIFF_IGNORE)
                    ? MarkerInstruction.NONE
                    : MarkerInstruction.SET_IGNORE;
        }
        if (hasBinding || tagName.startsWith(MarkerAttributes.COMPONENT_TAG_PREFIX)) {
            if (node.hasAttribute(MarkerAttributes.DIFF_KEY)) {
                return MarkerInstruction.NONE;
            }
            return MarkerInstruction.setKey(generateKey.get());
        }
        return MarkerInstruction.NONE;
    }

    /**
     * Classifies the node and applies the resulting instruction to it.
     *
     * @return the instruction that was applied
     */
    public MarkerInstruction mark(MarkupNode node, Supplier<String> generateKey) {
        MarkerInstruction instruction = classify(node, generateKey);
        instruction.applyTo(node);
        if (LOG.isDebugEnabled() && !(instruction instanceof MarkerInstruction.None)) {
            LOG.debug("diff.marked tag={} instruction={}", node.getTagName(), instruction.getClass().getSimpleName());
        }
        return instruction;
    }
}
