package de.upb.sse.str2i18n.classify;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import de.upb.sse.str2i18n.Str2I18n;
import de.upb.sse.str2i18n.comments.CommentSpanIndex;
import de.upb.sse.str2i18n.configuration.Str2I18nConfiguration;
import de.upb.sse.str2i18n.rewrite.LocalizationCallShape;
import de.upb.sse.str2i18n.script.HanScript;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LiteralClassifierTests {
    private static final String SOURCE =
            "package fixtures;\n" +
            "\n" +
            "import com.github.i18n.I18n;\n" +
            "\n" +
            "@Table(name = \"用户表\")\n" +
            "class Person {\n" +
            "    @JsonProperty(\"姓名\")\n" +
            "    String name = \"张三\";\n" +
            "    String greeting = I18n.localizer().mustLocalize(I18n.LocalizeConfig.builder().messageId(\"nhsj\")" +
            ".defaultMessage(I18n.Message.builder().id(\"nhsj\").other(\"你好世界\").build()).build());\n" +
            "\n" +
            "    String describe(String kind) {\n" +
            "        switch (kind) {\n" +
            "            case \"管理员\":\n" +
            "                return \"Admin\";\n" +
            "            default:\n" +
            "                log(\"未知类型\");\n" +
            "                return \"\";\n" +
            "        }\n" +
            "    }\n" +
            "}\n" +
            "\n" +
            "@interface Label {\n" +
            "    String value() default \"默认\";\n" +
            "}\n";

    private CompilationUnit cu;
    private LocalizationCallShape shape;
    private LiteralClassifier classifier;

    @BeforeEach
    void setup() throws Exception {
        cu = new Str2I18n().parse(SOURCE);
        shape = new LocalizationCallShape(new Str2I18nConfiguration());
        classifier = new LiteralClassifier(CommentSpanIndex.of(cu), shape, HanScript.INSTANCE);
    }

    private StringLiteralExpr literal(String value) {
        return cu.findFirst(StringLiteralExpr.class, l -> l.getValue().equals(value)).orElseThrow();
    }

    @Test
    @DisplayName("Annotation values are tags")
    void annotation_values_are_tags() {
        assertEquals(LiteralRole.TAG, LiteralRole.of(literal("姓名"), shape));
        assertEquals(Verdict.TAG_SLOT, classifier.classify(literal("姓名")));
        assertEquals(Verdict.TAG_SLOT, classifier.classify(literal("用户表")));
        assertEquals(Verdict.TAG_SLOT, classifier.classify(literal("默认")));
    }

    @Test
    @DisplayName("Case labels stay constants")
    void case_labels() {
        assertEquals(LiteralRole.CONSTANT_LABEL, LiteralRole.of(literal("管理员"), shape));
        assertEquals(Verdict.CONSTANT_SLOT, classifier.classify(literal("管理员")));
    }

    @Test
    @DisplayName("Fallback text of an existing localization call is already wrapped")
    void already_wrapped() {
        assertEquals(LiteralRole.FALLBACK_TEXT, LiteralRole.of(literal("你好世界"), shape));
        assertEquals(Verdict.ALREADY_WRAPPED, classifier.classify(literal("你好世界")));
    }

    @Test
    @DisplayName("Literals without Han characters are not messages")
    void no_target_script() {
        assertEquals(Verdict.NO_TARGET_SCRIPT, classifier.classify(literal("Admin")));
        assertEquals(Verdict.NO_TARGET_SCRIPT, classifier.classify(literal("")));
        assertEquals(Verdict.NO_TARGET_SCRIPT, classifier.classify(literal("nhsj")));
    }

    @Test
    @DisplayName("Plain literals and call arguments with Han characters are eligible")
    void eligible() {
        assertEquals(LiteralRole.PLAIN, LiteralRole.of(literal("张三"), shape));
        assertEquals(Verdict.ELIGIBLE, classifier.classify(literal("张三")));

        assertEquals(LiteralRole.CALL_ARGUMENT, LiteralRole.of(literal("未知类型"), shape));
        assertEquals(Verdict.ELIGIBLE, classifier.classify(literal("未知类型")));
    }

    @Test
    @DisplayName("A literal inside a recorded comment span is skipped")
    void inside_comment_span() {
        StringLiteralExpr literal = literal("张三");
        CommentSpanIndex covering = CommentSpanIndex.of(List.of(new CommentSpanIndex.CommentSpan(
                literal.getBegin().orElseThrow(), literal.getEnd().orElseThrow())));
        LiteralClassifier commented = new LiteralClassifier(covering, shape, HanScript.INSTANCE);

        assertEquals(Verdict.IN_COMMENT, commented.classify(literal));
        // a tag stays a tag even inside a comment
        assertEquals(Verdict.TAG_SLOT, commented.classify(literal("姓名")));
    }

    @Test
    @DisplayName("Text blocks are string literals, char literals are not")
    void text_blocks_and_chars() throws Exception {
        CompilationUnit unit = new Str2I18n().parse(
                "class T {\n" +
                "    String block = \"\"\"\n" +
                "        你好\n" +
                "        \"\"\";\n" +
                "    char c = '中';\n" +
                "}\n");
        LiteralClassifier blockClassifier = new LiteralClassifier(CommentSpanIndex.of(unit), shape, HanScript.INSTANCE);
        TextBlockLiteralExpr block = unit.findFirst(TextBlockLiteralExpr.class).orElseThrow();

        assertTrue(LiteralClassifier.isStringLiteral(block));
        assertTrue(LiteralClassifier.rawText(block).startsWith("\"\"\""));
        assertEquals(Verdict.ELIGIBLE, blockClassifier.classify(block));

        List<LiteralStringValueExpr> strings = unit.findAll(LiteralStringValueExpr.class, LiteralClassifier::isStringLiteral);
        assertEquals(1, strings.size());
    }
}
