package de.upb.sse.str2i18n;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import de.upb.sse.str2i18n.classify.LiteralClassifier;
import de.upb.sse.str2i18n.comments.CommentSpanIndex;
import de.upb.sse.str2i18n.configuration.Str2I18nConfiguration;
import de.upb.sse.str2i18n.exceptions.MalformedSourceException;
import de.upb.sse.str2i18n.exceptions.SerializationFailureException;
import de.upb.sse.str2i18n.imports.ImportEnsurer;
import de.upb.sse.str2i18n.report.LiteralReport;
import de.upb.sse.str2i18n.rewrite.LocalizationCallShape;
import de.upb.sse.str2i18n.rewrite.RewriteResult;
import de.upb.sse.str2i18n.rewrite.TreeRewriter;
import de.upb.sse.str2i18n.script.HanScript;
import lombok.Getter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Localizes the string literals of one Java compilation unit:
 * parse, rewrite eligible literals, add the localization import if anything changed, print.
 */
public class Str2I18n {
    public static final int OK = 0;
    public static final int IO_FAILURE = 1;
    public static final int MALFORMED_INPUT = 2;
    public static final int SERIALIZATION_FAILURE = 3;

    private static final Logger logger = Logger.getLogger(Str2I18n.class.getName());

    @Getter private final Str2I18nConfiguration config;
    private final ImportEnsurer importEnsurer = new ImportEnsurer();

    public Str2I18n() {
        this(new Str2I18nConfiguration());
    }

    public Str2I18n(Str2I18nConfiguration config) {
        this.config = config;
    }

    /**
     * Localizes {@code inputFile} into {@code outputFile}. The output is only committed once it was printed completely.
     *
     * @return {@link #OK}, {@link #IO_FAILURE}, {@link #MALFORMED_INPUT} or {@link #SERIALIZATION_FAILURE}
     */
    public int localize(String inputFile, String outputFile) {
        String source;
        try {
            source = Files.readString(Paths.get(inputFile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Cannot read " + inputFile, e);
            return IO_FAILURE;
        }

        try {
            CompilationUnit cu = parse(source);
            System.out.println("Analyzing " + inputFile);
            report(cu).print(System.out);

            LocalizationOutcome outcome = transform(cu);
            commit(outcome.getOutput(), Paths.get(outputFile));
            logger.info("Wrote " + outputFile + " (" + outcome.getMessages().size() + " literals localized)");
            return OK;
        } catch (MalformedSourceException e) {
            logger.severe("Cannot parse " + inputFile + ": " + e.getMessage());
            return MALFORMED_INPUT;
        } catch (SerializationFailureException e) {
            logger.log(Level.SEVERE, "Cannot write " + outputFile, e);
            return SERIALIZATION_FAILURE;
        }
    }

    public LocalizationOutcome transform(String source) throws MalformedSourceException, SerializationFailureException {
        return transform(parse(source));
    }

    /**
     * Rewrites {@code cu} in place and prints it. The import is only added when a literal was rewritten.
     */
    public LocalizationOutcome transform(CompilationUnit cu) throws SerializationFailureException {
        RewriteResult result = new TreeRewriter(config).rewrite(cu);

        boolean importAdded = false;
        if (result.anyRewriteOccurred()) {
            importAdded = importEnsurer.ensure(cu, config.getImportPath());
        }
        return new LocalizationOutcome(result, importAdded, print(cu));
    }

    public CompilationUnit parse(String source) throws MalformedSourceException {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(config.getLanguageLevel());
        JavaParser jp = new JavaParser(parserConfig);

        ParseResult<CompilationUnit> parseResult = jp.parse(source);
        if (!parseResult.isSuccessful() || parseResult.getResult().isEmpty()) {
            List<String> problems = parseResult.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.toList());
            throw new MalformedSourceException("Source is not a valid compilation unit", problems);
        }

        CompilationUnit cu = parseResult.getResult().get();
        if (config.isPreserveFormatting()) {
            try {
                LexicalPreservingPrinter.setup(cu);
            } catch (RuntimeException e) {
                throw new MalformedSourceException("Cannot record the source layout", e);
            }
        }
        return cu;
    }

    public LiteralReport report(CompilationUnit cu) {
        LiteralClassifier classifier = new LiteralClassifier(
                CommentSpanIndex.of(cu), new LocalizationCallShape(config), HanScript.INSTANCE);
        return LiteralReport.collect(cu, classifier);
    }

    public String print(CompilationUnit cu) throws SerializationFailureException {
        try {
            return config.isPreserveFormatting() ? LexicalPreservingPrinter.print(cu) : cu.toString();
        } catch (RuntimeException e) {
            throw new SerializationFailureException("Cannot print the rewritten unit", e);
        }
    }

    /**
     * Writes to a sibling temporary file first and moves it over {@code target} afterwards.
     */
    private static void commit(String text, Path target) throws SerializationFailureException {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.writeString(temp, text, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            SerializationFailureException failure = new SerializationFailureException("Cannot commit " + target, e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }
}
