package com.e2eq.odata.query.filter;

import com.e2eq.odata.error.ODataException;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser turning an OData {@code $filter} expression into a {@link FilterNode}.
 * <pre>
 * filter     := andExpr EOF
 * andExpr    := orExpr ('and' orExpr)*
 * orExpr     := unary ('or' unary)*
 * unary      := 'not' unary | primary
 * primary    := '(' andExpr ')' | function | comparison
 * function   := (contains|startswith|endswith) '(' FIELD ',' STRING ')'
 *             | substringof '(' STRING ',' FIELD ')'
 * comparison := FIELD (eq|ne|gt|ge|lt|le) literal
 * literal    := STRING | NUMBER | true | false | null
 * </pre>
 * AND is the outermost connective, so {@code a or b and c} parses as {@code (a or b) and c}.
 * Instances are cheap and not thread safe; use one per expression.
 */
public class FilterParser {

    static final String SUPPORTED = "Supported operators: eq, ne, gt, ge, lt, le, and, or, not. "
            + "Supported functions: contains, startswith, endswith, substringof.";

    private static final String SUBSTRINGOF = "substringof";

    private final String raw;
    private List<FilterToken> tokens;
    private int index;

    private FilterParser(String raw) {
        this.raw = raw;
    }

    public static FilterNode parse(String raw) {
        if (StringUtils.isBlank(raw)) {
            throw ODataException.invalidFilter("Invalid $filter expression: expression is empty.");
        }
        return new FilterParser(raw.trim()).parseFilter();
    }

    private FilterNode parseFilter() {
        tokens = new FilterTokenizer(raw).tokenize();
        index = 0;
        FilterNode node = parseAnd();
        if (!peek().is(FilterToken.Type.EOF)) {
            throw unsupported("unexpected " + peek().describe());
        }
        return node;
    }

    private FilterNode parseAnd() {
        List<FilterNode> operands = new ArrayList<>();
        operands.add(parseOr());
        while (peek().isKeyword("and")) {
            next();
            operands.add(parseOr());
        }
        return FilterNode.and(operands);
    }

    private FilterNode parseOr() {
        List<FilterNode> operands = new ArrayList<>();
        operands.add(parseUnary());
        while (peek().isKeyword("or")) {
            next();
            operands.add(parseUnary());
        }
        return FilterNode.or(operands);
    }

    private FilterNode parseUnary() {
        if (peek().isKeyword("not")) {
            next();
            return new FilterNode.Not(parseUnary());
        }
        return parsePrimary();
    }

    private FilterNode parsePrimary() {
        FilterToken token = peek();
        if (token.is(FilterToken.Type.OPEN_PAREN)) {
            next();
            FilterNode inner = parseAnd();
            expect(FilterToken.Type.CLOSE_PAREN, "')'");
            return inner;
        }
        if (!token.is(FilterToken.Type.IDENTIFIER) || isLogicalKeyword(token)) {
            throw unsupported("expected a comparison or function but found " + token.describe());
        }
        if (peekAt(1).is(FilterToken.Type.OPEN_PAREN)) {
            return parseFunction();
        }
        return parseComparison();
    }

    private FilterNode parseFunction() {
        FilterToken nameToken = next();
        next(); // '('
        if (SUBSTRINGOF.equalsIgnoreCase(nameToken.text())) {
            String argument = expect(FilterToken.Type.STRING, "a quoted string").text();
            expect(FilterToken.Type.COMMA, "','");
            String field = expectField();
            expect(FilterToken.Type.CLOSE_PAREN, "')'");
            return new FilterNode.StringFunction(StringFunctionName.CONTAINS, field, argument);
        }
        StringFunctionName name = StringFunctionName.fromToken(nameToken.text())
                .orElseThrow(() -> unsupported("unknown function '" + nameToken.text() + "'"));
        String field = expectField();
        expect(FilterToken.Type.COMMA, "','");
        String argument = expect(FilterToken.Type.STRING, "a quoted string").text();
        expect(FilterToken.Type.CLOSE_PAREN, "')'");
        return new FilterNode.StringFunction(name, field, argument);
    }

    private FilterNode parseComparison() {
        String field = next().text();
        FilterToken opToken = peek();
        if (!opToken.is(FilterToken.Type.IDENTIFIER)) {
            throw unsupported("expected an operator after '" + field + "' but found " + opToken.describe());
        }
        ComparisonOperator operator = ComparisonOperator.fromToken(opToken.text())
                .orElseThrow(() -> unsupported("unknown operator '" + opToken.text() + "'"));
        next();
        return new FilterNode.Comparison(field, operator, parseLiteral());
    }

    private Object parseLiteral() {
        FilterToken token = next();
        switch (token.type()) {
            case STRING:
                return token.text();
            case NUMBER:
                return parseNumber(token.text());
            case IDENTIFIER:
                if ("true".equalsIgnoreCase(token.text())) {
                    return Boolean.TRUE;
                }
                if ("false".equalsIgnoreCase(token.text())) {
                    return Boolean.FALSE;
                }
                if ("null".equalsIgnoreCase(token.text())) {
                    return null;
                }
                throw unsupported("expected a literal value but found " + token.describe());
            default:
                throw unsupported("missing value, found " + token.describe());
        }
    }

    private static Object parseNumber(String text) {
        if (text.indexOf('.') >= 0) {
            return Double.valueOf(text);
        }
        try {
            return Long.valueOf(text);
        } catch (NumberFormatException e) {
            // beyond long range
            return Double.valueOf(text);
        }
    }

    private String expectField() {
        FilterToken token = peek();
        if (!token.is(FilterToken.Type.IDENTIFIER) || isLogicalKeyword(token)) {
            throw unsupported("expected a field name but found " + token.describe());
        }
        return next().text();
    }

    private FilterToken expect(FilterToken.Type type, String description) {
        FilterToken token = peek();
        if (!token.is(type)) {
            throw unsupported("expected " + description + " but found " + token.describe());
        }
        return next();
    }

    private static boolean isLogicalKeyword(FilterToken token) {
        return token.isKeyword("and") || token.isKeyword("or") || token.isKeyword("not");
    }

    private FilterToken peek() {
        return tokens.get(index);
    }

    private FilterToken peekAt(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private FilterToken next() {
        FilterToken token = tokens.get(index);
        if (index < tokens.size() - 1) {
            index++;
        }
        return token;
    }

    private ODataException unsupported(String reason) {
        return ODataException.invalidFilter(
                "Unsupported $filter expression: \"" + raw + "\" (" + reason + "). " + SUPPORTED);
    }
}
