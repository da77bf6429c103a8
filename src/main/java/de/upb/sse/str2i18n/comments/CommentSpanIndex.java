package de.upb.sse.str2i18n.comments;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flat list of comment spans of one compilation unit.
 * Containment is decided on positions alone, independent of where the parser attached the comments.
 */
public final class CommentSpanIndex {
    private final List<CommentSpan> spans;

    private CommentSpanIndex(List<CommentSpan> spans) {
        this.spans = Collections.unmodifiableList(spans);
    }

    public static CommentSpanIndex of(CompilationUnit cu) {
        List<CommentSpan> spans = new ArrayList<>();
        for (Comment comment : cu.getAllComments()) {
            comment.getRange().ifPresent(r -> spans.add(new CommentSpan(r.begin, r.end)));
        }
        return new CommentSpanIndex(spans);
    }

    public static CommentSpanIndex of(List<CommentSpan> spans) {
        return new CommentSpanIndex(new ArrayList<>(spans));
    }

    public List<CommentSpan> getSpans() {
        return spans;
    }

    /**
     * Nodes without a range are never inside a comment.
     */
    public boolean contains(Node node) {
        return node.getRange().map(this::contains).orElse(false);
    }

    public boolean contains(Range range) {
        return contains(range.begin, range.end);
    }

    /**
     * @return true if {@code [begin, end]} lies completely inside one recorded comment
     */
    public boolean contains(Position begin, Position end) {
        for (CommentSpan span : spans) {
            if (span.encloses(begin, end)) return true;
        }
        return false;
    }

    public static final class CommentSpan {
        public final Position begin;
        public final Position end;

        public CommentSpan(Position begin, Position end) {
            this.begin = begin;
            this.end = end;
        }

        // Position compares by line, then column
        boolean encloses(Position from, Position to) {
            return from.compareTo(begin) >= 0 && to.compareTo(end) <= 0;
        }

        @Override
        public String toString() {
            return "[" + begin + " - " + end + "]";
        }
    }
}
