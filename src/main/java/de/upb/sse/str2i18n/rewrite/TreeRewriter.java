package de.upb.sse.str2i18n.rewrite;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import de.upb.sse.str2i18n.classify.LiteralClassifier;
import de.upb.sse.str2i18n.classify.Verdict;
import de.upb.sse.str2i18n.comments.CommentSpanIndex;
import de.upb.sse.str2i18n.configuration.Str2I18nConfiguration;
import de.upb.sse.str2i18n.id.MessageIdGenerator;
import de.upb.sse.str2i18n.script.HanScript;
import de.upb.sse.str2i18n.script.TargetScript;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Replaces every eligible string literal of a compilation unit by a localization call
 * that carries the literal itself as fallback text.
 */
public class TreeRewriter {
    private static final Logger logger = Logger.getLogger(TreeRewriter.class.getName());

    private final LocalizationCallShape shape;
    private final MessageIdGenerator idGenerator;
    private final TargetScript script;

    public TreeRewriter(Str2I18nConfiguration config) {
        this(new LocalizationCallShape(config), new MessageIdGenerator(config), HanScript.INSTANCE);
    }

    public TreeRewriter(LocalizationCallShape shape, MessageIdGenerator idGenerator, TargetScript script) {
        this.shape = shape;
        this.idGenerator = idGenerator;
        this.script = script;
    }

    /**
     * Walks the literals of {@code cu} once, in document order, and rewrites the eligible ones in place.
     * Comments and imports are not touched.
     *
     * @return the messages that were rewritten, empty if the unit is unchanged
     */
    public RewriteResult rewrite(CompilationUnit cu) {
        LiteralClassifier classifier = new LiteralClassifier(CommentSpanIndex.of(cu), shape, script);

        // Snapshot before mutating: calls inserted below are never visited in this pass
        List<LiteralStringValueExpr> literals = cu.findAll(LiteralStringValueExpr.class, LiteralClassifier::isStringLiteral);
        literals.sort(Node.NODE_BY_BEGIN_POSITION);

        List<MessageRecord> messages = new ArrayList<>();
        for (LiteralStringValueExpr literal : literals) {
            Verdict verdict = classifier.classify(literal);
            if (!verdict.isEligible()) {
                logger.fine(() -> "Skipping " + LiteralClassifier.rawText(literal) + " at " + describe(literal) + ": " + verdict);
                continue;
            }
            replace(literal).ifPresent(messages::add);
        }

        if (!messages.isEmpty()) {
            logger.info("Localized " + messages.size() + " of " + literals.size() + " string literals");
        }
        return new RewriteResult(messages);
    }

    private Optional<MessageRecord> replace(LiteralStringValueExpr literal) {
        // the parent has to be captured first, building the call re-parents the literal
        Node parent = literal.getParentNode().orElse(null);
        if (parent == null) return Optional.empty();

        String rawText = LiteralClassifier.rawText(literal);
        String id = idGenerator.generate(rawText);
        Position begin = literal.getBegin().orElse(null);

        MethodCallExpr call = shape.build(id, literal);
        if (!parent.replace(literal, call)) {
            literal.setParentNode(parent);
            logger.warning("Cannot replace " + rawText + " at " + describe(literal)
                    + " inside " + parent.getClass().getSimpleName() + ", left unchanged");
            return Optional.empty();
        }
        // replacing clears the literal's parent, link it back to its fallback slot
        shape.attachFallback(call, literal);

        MessageRecord record = new MessageRecord(id, MessageIdGenerator.stripQuotes(rawText),
                begin == null ? -1 : begin.line, begin == null ? -1 : begin.column);
        logger.fine(() -> "Rewrote " + record);
        return Optional.of(record);
    }

    private static String describe(Node node) {
        return node.getBegin().map(p -> p.line + ":" + p.column).orElse("?");
    }
}
