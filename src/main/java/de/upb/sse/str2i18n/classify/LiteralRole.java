package de.upb.sse.str2i18n.classify;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationMemberDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithArguments;
import com.github.javaparser.ast.stmt.SwitchEntry;
import de.upb.sse.str2i18n.rewrite.LocalizationCallShape;

/**
 * Structural position of a string literal, derived from its ancestors.
 */
public enum LiteralRole {
    /** Annotation member value or annotation member default: metadata, not user-facing text. */
    TAG,
    /** Label of a {@code case}, which must stay a compile-time constant. */
    CONSTANT_LABEL,
    /** Fallback text of an existing localization call. */
    FALLBACK_TEXT,
    CALL_ARGUMENT,
    PLAIN;

    public static LiteralRole of(LiteralStringValueExpr literal, LocalizationCallShape shape) {
        // annotation values can only hold constants, so any annotation ancestor is the tag itself
        if (literal.findAncestor(AnnotationExpr.class).isPresent()) return TAG;
        if (literal.findAncestor(AnnotationMemberDeclaration.class).isPresent()) return TAG;

        Node parent = literal.getParentNode().orElse(null);
        if (parent instanceof SwitchEntry
                && ((SwitchEntry) parent).getLabels().stream().anyMatch(label -> label == literal)) {
            return CONSTANT_LABEL;
        }

        if (shape.isFallbackSlot(literal)) return FALLBACK_TEXT;

        if (parent instanceof NodeWithArguments
                && ((NodeWithArguments<?>) parent).getArguments().stream().anyMatch(arg -> arg == literal)) {
            return CALL_ARGUMENT;
        }
        return PLAIN;
    }
}
