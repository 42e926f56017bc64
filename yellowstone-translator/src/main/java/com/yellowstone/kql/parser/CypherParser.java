package com.yellowstone.kql.parser;

import com.yellowstone.kql.ast.And;
import com.yellowstone.kql.ast.Comparison;
import com.yellowstone.kql.ast.ComparisonOperator;
import com.yellowstone.kql.ast.Direction;
import com.yellowstone.kql.ast.Expression;
import com.yellowstone.kql.ast.FunctionCall;
import com.yellowstone.kql.ast.Literal;
import com.yellowstone.kql.ast.LiteralValue;
import com.yellowstone.kql.ast.MatchClause;
import com.yellowstone.kql.ast.NodePattern;
import com.yellowstone.kql.ast.Not;
import com.yellowstone.kql.ast.NullCheck;
import com.yellowstone.kql.ast.Or;
import com.yellowstone.kql.ast.OrderItem;
import com.yellowstone.kql.ast.PathExpression;
import com.yellowstone.kql.ast.PathFunction;
import com.yellowstone.kql.ast.PathLength;
import com.yellowstone.kql.ast.PropertyAccess;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.ast.ReturnClause;
import com.yellowstone.kql.ast.ReturnItem;
import com.yellowstone.kql.ast.SortDirection;
import com.yellowstone.kql.ast.VariableRef;
import com.yellowstone.kql.ast.WhereClause;
import com.yellowstone.kql.error.CypherSyntaxException;
import com.yellowstone.kql.error.LexicalException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for the supported read-only Cypher subset.
 *
 * <h2>Grammar:</h2>
 * <pre>{@code
 * Query        := MatchClause+ ('WHERE' Condition)? ReturnClause ';'? EOF
 * MatchClause  := 'OPTIONAL'? 'MATCH' PathExpr (',' PathExpr)*
 * PathExpr     := (IDENT '=')? (PathFunction '(' Pattern ')' | Pattern)
 * Pattern      := Node (Rel Node)*
 * Rel          := ('<-' | '-') ('[' IDENT? Types? Length? Props? ']')? ('->' | '-')
 * Length       := '*' INT? ('..' INT?)?
 * Condition    := Or;  Or := And ('OR' And)*;  And := Not ('AND' Not)*
 * Not          := 'NOT' Not | Comparison
 * Comparison   := Operand (CompOp Operand | 'IS' 'NOT'? 'NULL')?
 * ReturnClause := 'RETURN' 'DISTINCT'? Item (',' Item)*
 *                 ('ORDER' 'BY' Key (',' Key)*)?
 *                 ('LIMIT' INT ('SKIP' INT)? | 'SKIP' INT ('LIMIT' INT)?)?
 * }</pre>
 *
 * <p>The parser uses a single token of lookahead. Any deviation raises
 * {@link CypherSyntaxException} naming the expected construct and the token
 * found; no partial tree is ever returned.</p>
 */
public final class CypherParser {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        CypherParser.class);

    private final List<Token> tokens;

    private int index;

    /**
     * Creates a parser over an already tokenized query.
     *
     * @param tokens tokens ending with {@link TokenType#EOF}
     */
    public CypherParser(final List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Tokenize and parse a query.
     *
     * @param text the Cypher text
     * @return the query tree
     * @throws LexicalException if the text cannot be tokenized
     * @throws CypherSyntaxException if the tokens do not form a query
     */
    public static Query parse(final String text)
            throws LexicalException, CypherSyntaxException {
        List<Token> tokens = CypherLexer.tokenize(text);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Tokenized query into {} tokens", tokens.size());
        }
        return new CypherParser(tokens).parseQuery();
    }

    /**
     * Parse the token stream as a complete query.
     *
     * @return the query tree
     * @throws CypherSyntaxException if the tokens do not form a query
     */
    public Query parseQuery() throws CypherSyntaxException {
        index = 0;
        List<MatchClause> matches = new ArrayList<>();
        while (check(TokenType.MATCH) || check(TokenType.OPTIONAL)) {
            matches.add(parseMatchClause());
        }
        if (matches.isEmpty()) {
            throw error("MATCH");
        }
        WhereClause where = null;
        if (match(TokenType.WHERE)) {
            where = new WhereClause(parseCondition());
        }
        ReturnClause returnClause = parseReturnClause();
        match(TokenType.SEMICOLON);
        expect(TokenType.EOF, "end of query");
        return new Query(matches, where, returnClause);
    }

    private MatchClause parseMatchClause() throws CypherSyntaxException {
        boolean optional = match(TokenType.OPTIONAL);
        expect(TokenType.MATCH, "MATCH");
        List<PathExpression> paths = new ArrayList<>();
        do {
            paths.add(parsePathExpression());
        } while (match(TokenType.COMMA));
        return new MatchClause(paths, optional);
    }

    private PathExpression parsePathExpression() throws CypherSyntaxException {
        String pathVariable = null;
        PathFunction function = PathFunction.NONE;
        if (check(TokenType.IDENTIFIER)) {
            Token name = advance();
            Token functionName = name;
            if (match(TokenType.EQUALS)) {
                pathVariable = name.text();
                functionName = check(TokenType.IDENTIFIER) ? advance() : null;
            }
            if (functionName != null) {
                function = PathFunction.fromName(functionName.text());
                if (function == null) {
                    throw new CypherSyntaxException(functionName.position(),
                        "shortestPath or allShortestPaths",
                        functionName.describe());
                }
            }
        }
        if (function == PathFunction.NONE) {
            return parsePattern(pathVariable, function);
        }
        expect(TokenType.LPAREN, "'(' after " + function.cypherName());
        int start = peek().position();
        PathExpression path = parsePattern(pathVariable, function);
        expect(TokenType.RPAREN, "')' closing " + function.cypherName());
        if (path == null) {
            throw new CypherSyntaxException(start,
                "exactly one relationship inside " + function.cypherName(),
                "a pattern with a different number of hops");
        }
        return path;
    }

    /*
     * Returns null when a path function wraps a chain with a hop count other
     * than one; the caller reports it at the function position.
     */
    private PathExpression parsePattern(final String pathVariable,
            final PathFunction function) throws CypherSyntaxException {
        List<NodePattern> nodes = new ArrayList<>();
        List<RelationshipPattern> relationships = new ArrayList<>();
        nodes.add(parseNodePattern());
        while (check(TokenType.DASH) || check(TokenType.ARROW_LEFT)) {
            relationships.add(parseRelationshipPattern());
            nodes.add(parseNodePattern());
        }
        if (function != PathFunction.NONE && relationships.size() != 1) {
            return null;
        }
        return new PathExpression(pathVariable, function, nodes,
            relationships);
    }

    private NodePattern parseNodePattern() throws CypherSyntaxException {
        Token open = expect(TokenType.LPAREN, "'(' starting a node pattern");
        String variable = null;
        if (check(TokenType.IDENTIFIER)) {
            variable = advance().text();
        }
        List<String> labels = new ArrayList<>();
        while (match(TokenType.COLON)) {
            labels.add(expectName("label"));
        }
        Map<String, LiteralValue> properties = check(TokenType.LBRACE)
            ? parseProperties() : Map.of();
        expect(TokenType.RPAREN, "')' closing the node pattern");
        return new NodePattern(variable, labels, properties, open.position());
    }

    private RelationshipPattern parseRelationshipPattern()
            throws CypherSyntaxException {
        Token first = advance();
        boolean pointsLeft = first.type() == TokenType.ARROW_LEFT;
        String variable = null;
        List<String> types = new ArrayList<>();
        Map<String, LiteralValue> properties = Map.of();
        PathLength length = null;
        if (match(TokenType.LBRACKET)) {
            if (check(TokenType.IDENTIFIER)) {
                variable = advance().text();
            }
            if (match(TokenType.COLON)) {
                types.add(expectName("relationship type"));
                while (match(TokenType.PIPE)) {
                    match(TokenType.COLON);
                    types.add(expectName("relationship type"));
                }
            }
            if (check(TokenType.STAR)) {
                length = parseLength();
            }
            if (check(TokenType.LBRACE)) {
                properties = parseProperties();
            }
            expect(TokenType.RBRACKET, "']' closing the relationship");
        }
        boolean pointsRight;
        if (match(TokenType.ARROW_RIGHT)) {
            pointsRight = true;
        } else {
            expect(TokenType.DASH, "'-' or '->' ending the relationship");
            pointsRight = false;
        }
        if (pointsLeft && pointsRight) {
            throw new CypherSyntaxException(first.position(),
                "a relationship with at most one arrow head", "'<-...->'");
        }
        Direction direction = pointsLeft ? Direction.INCOMING
            : pointsRight ? Direction.OUTGOING : Direction.EITHER;
        return new RelationshipPattern(variable, types, direction, properties,
            length, first.position());
    }

    private PathLength parseLength() throws CypherSyntaxException {
        Token star = advance();
        Integer min = null;
        Integer max = null;
        boolean range = false;
        if (check(TokenType.INTEGER)) {
            min = parseHopCount(advance());
        }
        if (match(TokenType.DOTDOT)) {
            range = true;
            if (check(TokenType.INTEGER)) {
                max = parseHopCount(advance());
            }
        }
        try {
            if (!range) {
                return min == null ? PathLength.unbounded()
                    : PathLength.fixed(min);
            }
            return new PathLength(min, max);
        } catch (IllegalArgumentException e) {
            throw new CypherSyntaxException(star.position(),
                "a path length with minimum not above maximum",
                "'" + star.text() + (min == null ? "" : min) + ".."
                    + (max == null ? "" : max) + "'");
        }
    }

    private int parseHopCount(final Token token) throws CypherSyntaxException {
        try {
            return Integer.parseInt(token.text());
        } catch (NumberFormatException e) {
            throw new CypherSyntaxException(token.position(),
                "a hop count within integer range", token.describe());
        }
    }

    private Map<String, LiteralValue> parseProperties()
            throws CypherSyntaxException {
        expect(TokenType.LBRACE, "'{'");
        Map<String, LiteralValue> properties = new LinkedHashMap<>();
        if (!check(TokenType.RBRACE)) {
            do {
                Token keyToken = peek();
                String key = expectName("property name");
                expect(TokenType.COLON, "':' after property name");
                if (properties.put(key, parseLiteralValue()) != null) {
                    throw new CypherSyntaxException(keyToken.position(),
                        "distinct property names", "duplicate '" + key + "'");
                }
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RBRACE, "'}' closing the property map");
        return properties;
    }

    private LiteralValue parseLiteralValue() throws CypherSyntaxException {
        Token token = peek();
        switch (token.type()) {
            case STRING -> {
                advance();
                return new LiteralValue.StringValue(token.text());
            }
            case INTEGER, FLOAT -> {
                advance();
                return number(token, false);
            }
            case DASH -> {
                advance();
                Token number = peek();
                if (number.type() != TokenType.INTEGER
                        && number.type() != TokenType.FLOAT) {
                    throw error("a number after '-'");
                }
                advance();
                return number(number, true);
            }
            case TRUE -> {
                advance();
                return new LiteralValue.BooleanValue(true);
            }
            case FALSE -> {
                advance();
                return new LiteralValue.BooleanValue(false);
            }
            case NULL -> {
                advance();
                return LiteralValue.NullValue.INSTANCE;
            }
            default -> throw error("a literal value");
        }
    }

    private LiteralValue number(final Token token, final boolean negative)
            throws CypherSyntaxException {
        String text = negative ? "-" + token.text() : token.text();
        try {
            if (token.type() == TokenType.INTEGER) {
                return new LiteralValue.IntegerValue(Long.parseLong(text));
            }
            return new LiteralValue.FloatValue(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw new CypherSyntaxException(token.position(),
                "a number within range", token.describe());
        }
    }

    private Expression parseCondition() throws CypherSyntaxException {
        Expression left = parseAnd();
        while (match(TokenType.OR)) {
            left = new Or(left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() throws CypherSyntaxException {
        Expression left = parseNot();
        while (match(TokenType.AND)) {
            left = new And(left, parseNot());
        }
        return left;
    }

    private Expression parseNot() throws CypherSyntaxException {
        if (match(TokenType.NOT)) {
            return new Not(parseNot());
        }
        return parseComparison();
    }

    private Expression parseComparison() throws CypherSyntaxException {
        Expression left = parseOperand();
        if (match(TokenType.IS)) {
            boolean negated = match(TokenType.NOT);
            expect(TokenType.NULL, "NULL");
            return new NullCheck(left, negated);
        }
        ComparisonOperator operator = comparisonOperator();
        if (operator == null) {
            return left;
        }
        return new Comparison(operator, left, parseOperand());
    }

    private ComparisonOperator comparisonOperator()
            throws CypherSyntaxException {
        ComparisonOperator operator = switch (peek().type()) {
            case EQUALS -> ComparisonOperator.EQUALS;
            case NOT_EQUALS -> ComparisonOperator.NOT_EQUALS;
            case LESS_THAN -> ComparisonOperator.LESS_THAN;
            case GREATER_THAN -> ComparisonOperator.GREATER_THAN;
            case LESS_THAN_OR_EQUAL -> ComparisonOperator.LESS_THAN_OR_EQUAL;
            case GREATER_THAN_OR_EQUAL ->
                ComparisonOperator.GREATER_THAN_OR_EQUAL;
            case CONTAINS -> ComparisonOperator.CONTAINS;
            case STARTS -> ComparisonOperator.STARTS_WITH;
            case ENDS -> ComparisonOperator.ENDS_WITH;
            default -> null;
        };
        if (operator == null) {
            return null;
        }
        advance();
        if (operator == ComparisonOperator.STARTS_WITH
                || operator == ComparisonOperator.ENDS_WITH) {
            expect(TokenType.WITH, "WITH");
        }
        return operator;
    }

    private Expression parseOperand() throws CypherSyntaxException {
        Token token = peek();
        switch (token.type()) {
            case LPAREN -> {
                advance();
                Expression inner = parseCondition();
                expect(TokenType.RPAREN, "')' closing the expression");
                return inner;
            }
            case STRING, INTEGER, FLOAT, DASH, TRUE, FALSE, NULL -> {
                return new Literal(parseLiteralValue());
            }
            case IDENTIFIER -> {
                advance();
                if (match(TokenType.LPAREN)) {
                    return parseFunctionCall(token);
                }
                if (match(TokenType.DOT)) {
                    return new PropertyAccess(token.text(),
                        expectName("property name"), token.position());
                }
                return new VariableRef(token.text(), token.position());
            }
            default -> throw error("an expression");
        }
    }

    private Expression parseFunctionCall(final Token name)
            throws CypherSyntaxException {
        if (match(TokenType.STAR)) {
            expect(TokenType.RPAREN, "')' after '*'");
            return new FunctionCall(name.text(), false, true, List.of(),
                name.position());
        }
        boolean distinct = match(TokenType.DISTINCT);
        List<Expression> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                arguments.add(parseCondition());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RPAREN, "')' closing the argument list");
        return new FunctionCall(name.text(), distinct, false, arguments,
            name.position());
    }

    private ReturnClause parseReturnClause() throws CypherSyntaxException {
        expect(TokenType.RETURN, "RETURN");
        boolean distinct = match(TokenType.DISTINCT);
        List<ReturnItem> items = new ArrayList<>();
        do {
            if (match(TokenType.STAR)) {
                items.add(ReturnItem.all());
            } else {
                Expression expression = parseCondition();
                String alias = null;
                if (match(TokenType.AS)) {
                    alias = expect(TokenType.IDENTIFIER, "alias after AS")
                        .text();
                }
                items.add(ReturnItem.of(expression, alias));
            }
        } while (match(TokenType.COMMA));

        List<OrderItem> orderBy = new ArrayList<>();
        if (match(TokenType.ORDER)) {
            expect(TokenType.BY, "BY after ORDER");
            do {
                Expression key = parseCondition();
                SortDirection direction = SortDirection.ASC;
                if (match(TokenType.DESC)) {
                    direction = SortDirection.DESC;
                } else {
                    match(TokenType.ASC);
                }
                orderBy.add(new OrderItem(key, direction));
            } while (match(TokenType.COMMA));
        }

        Long limit = null;
        Long skip = null;
        if (match(TokenType.LIMIT)) {
            limit = parseCount("LIMIT");
            if (match(TokenType.SKIP)) {
                skip = parseCount("SKIP");
            }
        } else if (match(TokenType.SKIP)) {
            skip = parseCount("SKIP");
            if (match(TokenType.LIMIT)) {
                limit = parseCount("LIMIT");
            }
        }
        return new ReturnClause(items, distinct, orderBy, limit, skip);
    }

    private long parseCount(final String keyword)
            throws CypherSyntaxException {
        Token token = expect(TokenType.INTEGER,
            "a non-negative integer after " + keyword);
        try {
            return Long.parseLong(token.text());
        } catch (NumberFormatException e) {
            throw new CypherSyntaxException(token.position(),
                "a count within range", token.describe());
        }
    }

    private String expectName(final String what) throws CypherSyntaxException {
        Token token = peek();
        if (token.type() == TokenType.IDENTIFIER || token.type().isKeyword()) {
            advance();
            return token.text();
        }
        throw error(what);
    }

    private Token expect(final TokenType type, final String what)
            throws CypherSyntaxException {
        if (!check(type)) {
            throw error(what);
        }
        return advance();
    }

    private CypherSyntaxException error(final String expected) {
        Token token = peek();
        return new CypherSyntaxException(token.position(), expected,
            token.describe());
    }

    private boolean match(final TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(final TokenType type) {
        return peek().type() == type;
    }

    private Token peek() {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    private Token advance() {
        Token token = peek();
        if (index < tokens.size() - 1) {
            index++;
        }
        return token;
    }
}
