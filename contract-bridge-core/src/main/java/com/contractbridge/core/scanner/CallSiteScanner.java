package com.contractbridge.core.scanner;

import com.contractbridge.core.model.ApiCall;
import com.contractbridge.core.model.HttpMethod;
import com.contractbridge.core.scanner.base.AbstractJavaSourceAnalyzer;
import com.contractbridge.core.util.FileUtils;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ThisExpr;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Finds outbound HTTP calls in the main Java sources of a repository.
 *
 * <p>Test sources ({@code test}/{@code tests} directories, {@code *Test.java},
 * {@code *Tests.java}, {@code *IT.java}) and build or tool directories are not scanned.
 * Files that cannot be read or parsed are skipped.
 *
 * @see HttpClientVocabulary
 * @see UrlExpressions
 */
public class CallSiteScanner extends AbstractJavaSourceAnalyzer {

    private static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
        "test", "tests", "target", "build", ".git", ".gradle", ".mvn", ".idea", ".bridge", "node_modules");
    private static final List<String> TEST_FILE_SUFFIXES = List.of("Test.java", "Tests.java", "IT.java");
    private static final String JAVA_EXTENSION = ".java";

    private final Path repoRoot;

    public CallSiteScanner(Path repoRoot) {
        super();
        this.repoRoot = Objects.requireNonNull(repoRoot, "repoRoot must not be null");
    }

    /**
     * Scans the repository for API calls.
     *
     * @return calls ordered by file and position
     */
    public List<ApiCall> scan() {
        List<ApiCall> calls = new ArrayList<>();
        for (Path file : findSourceFiles()) {
            calls.addAll(scanFile(file));
        }
        log.debug("Found {} API call(s) under {}", calls.size(), repoRoot);
        return calls;
    }

    /**
     * Extracts the API calls of a single source file.
     *
     * @param file Java source file below the repository root
     * @return calls in source order, empty if the file cannot be parsed
     */
    public List<ApiCall> scanFile(Path file) {
        Optional<CompilationUnit> cu;
        try {
            cu = parseJavaFile(file);
        } catch (IOException e) {
            log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            return List.of();
        }
        if (cu.isEmpty()) {
            return List.of();
        }

        String sourceFile = FileUtils.relativePath(repoRoot, file);
        List<ApiCall> calls = new ArrayList<>();
        try {
            for (MethodCallExpr call : cu.get().findAll(MethodCallExpr.class)) {
                toApiCall(call, sourceFile).ifPresent(calls::add);
            }
        } catch (RuntimeException | StackOverflowError e) {
            log.debug("Skipping {}: cannot analyze call sites: {}", file, e.toString());
            return List.of();
        }
        return calls;
    }

    private Optional<ApiCall> toApiCall(MethodCallExpr call, String sourceFile) {
        Optional<HttpMethod> method = HttpClientVocabulary.httpMethodFor(call.getNameAsString());
        if (method.isEmpty() || !hasClientReceiver(call) || call.getArguments().isEmpty()) {
            return Optional.empty();
        }

        return UrlExpressions.extractUrl(call.getArgument(0))
            .map(url -> new ApiCall(
                method.get(),
                UrlExpressions.toPath(url),
                sourceFile,
                call.getBegin().map(position -> position.line).orElse(0)));
    }

    private boolean hasClientReceiver(MethodCallExpr call) {
        Optional<Expression> scope = call.getScope();
        if (scope.isEmpty()) {
            return false;
        }
        Expression receiver = scope.get();
        if (receiver instanceof NameExpr name) {
            return HttpClientVocabulary.isReceiver(name.getNameAsString());
        }
        // this.restTemplate.getForObject(...)
        if (receiver instanceof FieldAccessExpr field && field.getScope() instanceof ThisExpr) {
            return HttpClientVocabulary.isReceiver(field.getNameAsString());
        }
        return false;
    }

    private List<Path> findSourceFiles() {
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(repoRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(repoRoot) && EXCLUDED_DIRECTORIES.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isMainSource(file.getFileName().toString())) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Cannot access {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Failed to walk {}: {}", repoRoot, e.getMessage());
        }
        files.sort(Comparator.comparing(file -> FileUtils.relativePath(repoRoot, file)));
        return files;
    }

    private boolean isMainSource(String fileName) {
        return fileName.endsWith(JAVA_EXTENSION)
            && TEST_FILE_SUFFIXES.stream().noneMatch(fileName::endsWith);
    }
}
