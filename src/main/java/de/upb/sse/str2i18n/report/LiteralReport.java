package de.upb.sse.str2i18n.report;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import de.upb.sse.str2i18n.classify.LiteralClassifier;
import de.upb.sse.str2i18n.id.MessageIdGenerator;

import java.io.PrintStream;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only listing of the literals a rewrite would localize.
 */
public class LiteralReport {
    private final List<Entry> entries;

    private LiteralReport(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static LiteralReport collect(CompilationUnit cu, LiteralClassifier classifier) {
        List<Entry> entries = cu.findAll(LiteralStringValueExpr.class, LiteralClassifier::isStringLiteral).stream()
                .sorted(Node.NODE_BY_BEGIN_POSITION)
                .filter(literal -> classifier.classify(literal).isEligible())
                .map(literal -> new Entry(
                        MessageIdGenerator.stripQuotes(LiteralClassifier.rawText(literal)),
                        literal.getBegin().map(p -> p.line).orElse(-1),
                        literal.getBegin().map(p -> p.column).orElse(-1)))
                .collect(Collectors.toList());
        return new LiteralReport(entries);
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void print(PrintStream out) {
        if (entries.isEmpty()) {
            out.println("No string literals to localize");
            return;
        }
        out.println("Found " + entries.size() + " string literals to localize:");
        for (int i = 0; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            out.println((i + 1) + ". " + entry.text + " (" + entry.line + ":" + entry.column + ")");
        }
    }

    public static final class Entry {
        public final String text;
        public final int line;
        public final int column;

        public Entry(String text, int line, int column) {
            this.text = text;
            this.line = line;
            this.column = column;
        }
    }
}
