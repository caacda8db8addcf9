package com.contractbridge.core.scanner.base;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Base class for components that read Java source code with JavaParser.
 *
 * <p>Subclasses get a logger named after the concrete class and a parser accepting
 * Java 17 syntax, plus helpers for reading Spring-style annotation attributes.
 *
 * <p>A parser instance is not safe for concurrent use. Create one analyzer per thread.
 *
 * @since 1.0.0
 */
public abstract class AbstractJavaSourceAnalyzer {

    protected final Logger log;

    protected final JavaParser javaParser;

    protected AbstractJavaSourceAnalyzer() {
        this.log = LoggerFactory.getLogger(getClass());
        this.javaParser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    // ==================== Java File Parsing ====================

    /**
     * Parses a Java source file.
     *
     * <p>A file with syntax errors, or one the parser gives up on (for example by running
     * out of stack on a deeply nested expression), yields an empty result. Problems go to
     * the debug log so callers can move on to the next file.
     *
     * @param file Java source file
     * @return the compilation unit, or empty when the file does not parse
     * @throws IOException if the file cannot be read
     */
    protected Optional<CompilationUnit> parseJavaFile(Path file) throws IOException {
        String source = Files.readString(file);
        ParseResult<CompilationUnit> result;
        try {
            result = javaParser.parse(source);
        } catch (RuntimeException | StackOverflowError e) {
            log.debug("Skipping {}: parser failed with {}", file, e.toString());
            return Optional.empty();
        }

        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult();
        }
        log.debug("Skipping {}: {} parse problem(s)", file, result.getProblems().size());
        result.getProblems().forEach(problem -> log.debug("  - {}", problem.getVerboseMessage()));
        return Optional.empty();
    }

    // ==================== Annotation Utilities ====================

    /**
     * Looks up an annotation by its simple name, ignoring how it was imported.
     *
     * @param node class, method, parameter or field
     * @param annotationName simple name such as {@code GetMapping}
     * @return the first matching annotation
     */
    protected Optional<AnnotationExpr> findAnnotation(NodeWithAnnotations<?> node, String annotationName) {
        return node.getAnnotations().stream()
            .filter(ann -> ann.getNameAsString().equals(annotationName))
            .findFirst();
    }

    /**
     * Returns the expression given for an annotation attribute.
     *
     * <p>{@code @GetMapping("/users")} only answers for {@code value};
     * {@code @GetMapping(path = "/users")} answers for {@code path}; marker annotations
     * have no attributes.
     *
     * @param annotation annotation expression
     * @param attributeName attribute name
     * @return the attribute expression
     */
    protected Optional<Expression> getAnnotationAttribute(AnnotationExpr annotation, String attributeName) {
        if (annotation.isSingleMemberAnnotationExpr()) {
            return "value".equals(attributeName)
                ? Optional.of(annotation.asSingleMemberAnnotationExpr().getMemberValue())
                : Optional.empty();
        }
        if (annotation.isNormalAnnotationExpr()) {
            return annotation.asNormalAnnotationExpr().getPairs().stream()
                .filter(pair -> pair.getNameAsString().equals(attributeName))
                .map(MemberValuePair::getValue)
                .findFirst();
        }
        return Optional.empty();
    }

    /**
     * Strips one pair of matching double or single quotes.
     *
     * @param literal source text of a literal, may be null
     * @return the unquoted text, or the trimmed input when it is not quoted
     */
    protected String cleanStringLiteral(String literal) {
        if (literal == null) {
            return "";
        }
        String trimmed = literal.trim();
        if (trimmed.length() < 2) {
            return trimmed;
        }
        char first = trimmed.charAt(0);
        char last = trimmed.charAt(trimmed.length() - 1);
        boolean quoted = (first == '"' || first == '\'') && first == last;
        return quoted ? trimmed.substring(1, trimmed.length() - 1) : trimmed;
    }
}
