package com.contractbridge.core.scanner;

import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads URL text out of call-site argument expressions and reduces it to a request path.
 *
 * <p>Supported expressions:
 * <ul>
 *   <li>string literals: {@code "https://api.example.com/users"}</li>
 *   <li>format calls: {@code String.format("/users/%d", id)} and
 *       {@code "/users/%s".formatted(id)}, where each format specifier becomes {@code {}}</li>
 *   <li>concatenation of two supported expressions: {@code "/users" + "/active"}</li>
 * </ul>
 * Anything else (variables, arbitrary method calls) is not extractable.
 */
public final class UrlExpressions {

    /** Placeholder standing for an interpolated value. */
    public static final String PLACEHOLDER = "{}";

    private static final Pattern FORMAT_SPECIFIER =
        Pattern.compile("%(\\d+\\$)?[-#+ 0,(<]*\\d*(\\.\\d+)?([tT])?[a-zA-Z%]");

    private UrlExpressions() {
        // Utility class
    }

    /**
     * Extracts the static URL text of an expression.
     *
     * @param expression first argument of a call
     * @return URL text, or empty if the expression is not extractable
     */
    public static Optional<String> extractUrl(Expression expression) {
        if (expression instanceof EnclosedExpr enclosed) {
            return extractUrl(enclosed.getInner());
        }
        if (expression instanceof StringLiteralExpr literal) {
            return Optional.of(literal.asString());
        }
        if (expression instanceof BinaryExpr binary && binary.getOperator() == BinaryExpr.Operator.PLUS) {
            Optional<String> left = extractUrl(binary.getLeft());
            Optional<String> right = extractUrl(binary.getRight());
            if (left.isPresent() && right.isPresent()) {
                return Optional.of(left.get() + right.get());
            }
            return Optional.empty();
        }
        if (expression instanceof MethodCallExpr call) {
            return extractFormatted(call);
        }
        return Optional.empty();
    }

    private static Optional<String> extractFormatted(MethodCallExpr call) {
        // String.format("/users/%s", id)
        if ("format".equals(call.getNameAsString())
                && call.getScope().filter(scope -> scope instanceof NameExpr name
                    && "String".equals(name.getNameAsString())).isPresent()
                && call.getArguments().isNonEmpty()
                && call.getArgument(0) instanceof StringLiteralExpr template) {
            return Optional.of(replaceSpecifiers(template.asString()));
        }
        // "/users/%s".formatted(id)
        if ("formatted".equals(call.getNameAsString())
                && call.getScope().filter(scope -> scope instanceof StringLiteralExpr).isPresent()) {
            return Optional.of(replaceSpecifiers(call.getScope().get().asStringLiteralExpr().asString()));
        }
        return Optional.empty();
    }

    private static String replaceSpecifiers(String template) {
        Matcher matcher = FORMAT_SPECIFIER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = switch (matcher.group()) {
                case "%%" -> "%";
                case "%n" -> "";
                default -> PLACEHOLDER;
            };
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Reduces a URL to its path.
     *
     * <p>{@code http://api.example.com/users?active=true} becomes {@code /users},
     * {@code users} becomes {@code /users}, and a bare host becomes {@code /}.
     *
     * @param url URL or path
     * @return path starting with {@code /}, without query or fragment
     */
    public static String toPath(String url) {
        String path = url;
        int schemeEnd = path.indexOf("://");
        if (schemeEnd >= 0) {
            String rest = path.substring(schemeEnd + 3);
            int slash = rest.indexOf('/');
            path = slash >= 0 ? rest.substring(slash) : "/";
        }
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int fragment = path.indexOf('#');
        if (fragment >= 0) {
            path = path.substring(0, fragment);
        }
        return path;
    }
}
