package de.upb.sse.str2i18n.classify;

import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import de.upb.sse.str2i18n.comments.CommentSpanIndex;
import de.upb.sse.str2i18n.rewrite.LocalizationCallShape;
import de.upb.sse.str2i18n.script.TargetScript;

/**
 * Decides whether a string literal may be replaced by a localization call.
 * <p>
 * Rules are checked in order, the first one that applies wins:
 * <ol>
 *     <li>annotation values are tags and never rewritten</li>
 *     <li>case labels must remain constants</li>
 *     <li>fallback text of an existing localization call is left alone, which keeps reruns stable</li>
 *     <li>literals without a target-script character are not messages</li>
 *     <li>literals lying inside a comment span are skipped</li>
 * </ol>
 */
public class LiteralClassifier {
    private final CommentSpanIndex comments;
    private final LocalizationCallShape shape;
    private final TargetScript script;

    public LiteralClassifier(CommentSpanIndex comments, LocalizationCallShape shape, TargetScript script) {
        this.comments = comments;
        this.shape = shape;
        this.script = script;
    }

    public Verdict classify(LiteralStringValueExpr literal) {
        return classify(literal, LiteralRole.of(literal, shape));
    }

    public Verdict classify(LiteralStringValueExpr literal, LiteralRole role) {
        if (role == LiteralRole.TAG) return Verdict.TAG_SLOT;
        if (role == LiteralRole.CONSTANT_LABEL) return Verdict.CONSTANT_SLOT;
        if (role == LiteralRole.FALLBACK_TEXT) return Verdict.ALREADY_WRAPPED;
        if (!script.containsAny(rawText(literal))) return Verdict.NO_TARGET_SCRIPT;
        if (comments.contains(literal)) return Verdict.IN_COMMENT;
        return Verdict.ELIGIBLE;
    }

    /**
     * Char literals are not strings and never candidates.
     */
    public static boolean isStringLiteral(LiteralStringValueExpr literal) {
        return literal instanceof StringLiteralExpr || literal instanceof TextBlockLiteralExpr;
    }

    /**
     * Literal text as written, delimiters included. Escapes are not resolved.
     */
    public static String rawText(LiteralStringValueExpr literal) {
        String quote = literal instanceof TextBlockLiteralExpr ? "\"\"\"" : "\"";
        return quote + literal.getValue() + quote;
    }
}
