package de.upb.sse.str2i18n.rewrite;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.*;
import de.upb.sse.str2i18n.configuration.Str2I18nConfiguration;

/**
 * Shape of the structured localization call. Builds replacements of the form
 * <pre>
 * I18n.localizer().mustLocalize(I18n.LocalizeConfig.builder()
 *     .messageId("id")
 *     .defaultMessage(I18n.Message.builder().id("id").other("original").build())
 *     .build())
 * </pre>
 * and recognizes the fallback-text slot of such a call. Both directions have to agree,
 * otherwise a second run would wrap the fallback text again.
 */
public class LocalizationCallShape {
    private static final String BUILDER = "builder";
    private static final String BUILD = "build";

    private final Str2I18nConfiguration config;

    public LocalizationCallShape(Str2I18nConfiguration config) {
        this.config = config;
    }

    /**
     * @param id       generated message id, used as lookup key and as fallback message id
     * @param fallback the original literal node, embedded as is
     */
    public MethodCallExpr build(String id, Expression fallback) {
        MethodCallExpr message = builderOf(config.getMessageType());
        message = new MethodCallExpr(message, config.getIdKey(), NodeList.nodeList(new StringLiteralExpr(id)));
        message = new MethodCallExpr(message, config.getFallbackKey(), NodeList.nodeList(fallback));
        message = new MethodCallExpr(message, BUILD);

        MethodCallExpr localizeConfig = builderOf(config.getConfigType());
        localizeConfig = new MethodCallExpr(localizeConfig, config.getMessageIdKey(), NodeList.nodeList(new StringLiteralExpr(id)));
        localizeConfig = new MethodCallExpr(localizeConfig, config.getDefaultMessageKey(), NodeList.nodeList(message));
        localizeConfig = new MethodCallExpr(localizeConfig, BUILD);

        MethodCallExpr localizer = new MethodCallExpr(qualifier(), config.getLocalizerMethod());
        return new MethodCallExpr(localizer, config.getLocalizeMethod(), NodeList.nodeList(localizeConfig));
    }

    /**
     * A literal passed to a call named like the fallback key (e.g. {@code .other("...")})
     * is taken to be the fallback text of an existing localization call.
     */
    public boolean isFallbackSlot(Expression literal) {
        Node parent = literal.getParentNode().orElse(null);
        if (!(parent instanceof MethodCallExpr)) return false;

        MethodCallExpr call = (MethodCallExpr) parent;
        if (!call.getNameAsString().equals(config.getFallbackKey())) return false;
        return call.getArguments().stream().anyMatch(arg -> arg == literal);
    }

    /**
     * Re-parents {@code fallback} to the fallback-key call inside {@code call}.
     * Needed once {@code call} has replaced the literal, which detaches the literal from its parent.
     */
    public void attachFallback(MethodCallExpr call, Expression fallback) {
        call.findFirst(MethodCallExpr.class, c -> c.getNameAsString().equals(config.getFallbackKey())
                        && c.getArguments().stream().anyMatch(arg -> arg == fallback))
                .ifPresent(fallback::setParentNode);
    }

    private MethodCallExpr builderOf(String nestedType) {
        return new MethodCallExpr(new FieldAccessExpr(qualifier(), nestedType), BUILDER);
    }

    private NameExpr qualifier() {
        return new NameExpr(config.getQualifier());
    }
}
