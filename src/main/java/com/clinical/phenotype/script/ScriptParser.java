package com.clinical.phenotype.script;

import com.clinical.phenotype.core.model.SourcePosition;
import com.clinical.phenotype.script.ast.Call;
import com.clinical.phenotype.script.ast.ExpressionNode;
import com.clinical.phenotype.script.ast.Operator;
import com.clinical.phenotype.script.ast.ParamNode;
import com.clinical.phenotype.script.ast.Script;
import com.clinical.phenotype.script.ast.Statement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for phenotype scripts.
 *
 * <p>Parsing is a pure function of the text: the parser reads tokens from a {@link ScriptLexer},
 * builds a {@link Script} and fails with {@link PhenotypeSyntaxException} on the first deviation
 * from the grammar. Names are not resolved here; that is the binder's job.</p>
 *
 * <pre>
 * Script script = ScriptParser.parse(text);
 * </pre>
 */
public class ScriptParser {

    private static final Set<String> SINGLETON_STATEMENTS =
            Set.of("version", "description", "datamodel", "context", "limit");

    private final List<Token> tokens;
    private int current = 0;

    public ScriptParser(String source) {
        this.tokens = new ScriptLexer(source).tokenize();
    }

    /**
     * Convenience for {@code new ScriptParser(source).parseScript()}.
     */
    public static Script parse(String source) {
        return new ScriptParser(source).parseScript();
    }

    public Script parseScript() {
        List<Statement> statements = new ArrayList<>();
        Set<String> seenSingletons = new HashSet<>();
        boolean phenotypeSeen = false;

        while (!peek().is(TokenType.EOF)) {
            Token keyword = peek();
            Statement statement = statement();
            if (statement instanceof Statement.Phenotype phenotype) {
                if (phenotypeSeen) {
                    throw new PhenotypeSyntaxException("duplicate 'phenotype' statement", keyword.position());
                }
                phenotypeSeen = true;
                if (phenotype.version() != null && !seenSingletons.add("version")) {
                    throw new PhenotypeSyntaxException("duplicate 'version' statement", keyword.position());
                }
            } else if (SINGLETON_STATEMENTS.contains(keyword.text()) && !seenSingletons.add(keyword.text())) {
                throw new PhenotypeSyntaxException("duplicate '" + keyword.text() + "' statement",
                        keyword.position());
            }
            statements.add(statement);
        }
        if (!phenotypeSeen) {
            throw new PhenotypeSyntaxException("'phenotype' statement", peek().describe(), peek().position());
        }
        return new Script(statements);
    }

    // ---- statements ----

    private Statement statement() {
        Token keyword = expect(TokenType.IDENTIFIER, "statement keyword");
        SourcePosition pos = keyword.position();
        Statement statement = switch (keyword.text()) {
            case "phenotype" -> {
                String name = expect(TokenType.STRING, "phenotype name").text();
                String version = matchKeyword("version") ? expect(TokenType.STRING, "version string").text() : null;
                yield new Statement.Phenotype(name, version, pos);
            }
            case "version" -> new Statement.Version(expect(TokenType.STRING, "version string").text(), pos);
            case "description" -> new Statement.Description(expect(TokenType.STRING, "description string").text(), pos);
            case "datamodel" -> {
                String name = expect(TokenType.IDENTIFIER, "data model name").text();
                String version = matchKeyword("version") ? expect(TokenType.STRING, "version string").text() : null;
                yield new Statement.DataModel(name, version, pos);
            }
            case "include" -> {
                String library = expect(TokenType.IDENTIFIER, "library name").text();
                String version = matchKeyword("version") ? expect(TokenType.STRING, "version string").text() : null;
                expectKeyword("called");
                String alias = expect(TokenType.IDENTIFIER, "library alias").text();
                yield new Statement.Include(library, version, alias, pos);
            }
            case "codesystem" -> {
                String name = declarationName();
                yield new Statement.CodeSystem(name, expect(TokenType.STRING, "code system URI").text(), pos);
            }
            case "termset" -> termSet(pos);
            case "documentset" -> {
                String name = declarationName();
                yield new Statement.DocumentSet(name, call(), pos);
            }
            case "cohort" -> {
                String name = declarationName();
                yield new Statement.Cohort(name, call(), pos);
            }
            case "context" -> new Statement.Context(expect(TokenType.IDENTIFIER, "'Patient' or 'Document'").text(), pos);
            case "define" -> define(pos);
            case "debug" -> new Statement.Debug(pos);
            case "limit" -> {
                Token number = expect(TokenType.NUMBER, "document limit");
                if (number.text().contains(".")) {
                    throw new PhenotypeSyntaxException("integer document limit", number.describe(), number.position());
                }
                yield new Statement.Limit(Integer.parseInt(number.text()), pos);
            }
            default -> throw new PhenotypeSyntaxException("statement keyword", keyword.describe(), pos);
        };
        expect(TokenType.SEMICOLON, "';'");
        return statement;
    }

    private Statement.TermSet termSet(SourcePosition pos) {
        String name = declarationName();
        if (match(TokenType.LEFT_BRACKET)) {
            List<String> terms = new ArrayList<>();
            terms.add(expect(TokenType.STRING, "term string").text());
            while (match(TokenType.COMMA)) {
                terms.add(expect(TokenType.STRING, "term string").text());
            }
            expect(TokenType.RIGHT_BRACKET, "']'");
            return new Statement.TermSet(name, terms, null, pos);
        }
        return new Statement.TermSet(name, List.of(), call(), pos);
    }

    private Statement.Define define(SourcePosition pos) {
        boolean isFinal = matchKeyword("final");
        String name = declarationName();
        if (peek().is(TokenType.IDENTIFIER) && peek(1).is(TokenType.DOT)
                && peek(2).is(TokenType.IDENTIFIER) && peek(3).is(TokenType.LEFT_PAREN)) {
            return new Statement.Define(name, isFinal, call(), null, pos);
        }
        matchKeyword("where");
        return new Statement.Define(name, isFinal, null, expression(), pos);
    }

    private String declarationName() {
        String name = expect(TokenType.IDENTIFIER, "declaration name").text();
        expect(TokenType.COLON, "':'");
        return name;
    }

    // ---- calls and parameters ----

    private Call call() {
        Token qualifier = expect(TokenType.IDENTIFIER, "qualified call");
        expect(TokenType.DOT, "'.'");
        String function = expect(TokenType.IDENTIFIER, "function name").text();
        expect(TokenType.LEFT_PAREN, "'('");
        List<ParamNode> arguments = new ArrayList<>();
        if (!peek().is(TokenType.RIGHT_PAREN)) {
            arguments.add(param());
            while (match(TokenType.COMMA)) {
                arguments.add(param());
            }
        }
        expect(TokenType.RIGHT_PAREN, "')'");
        return new Call(qualifier.text(), function, arguments, qualifier.position());
    }

    private ParamNode param() {
        Token token = peek();
        SourcePosition pos = token.position();
        switch (token.type()) {
            case STRING:
                advance();
                return new ParamNode.Literal(token.text(), pos);
            case NUMBER:
                advance();
                return new ParamNode.Literal(Double.parseDouble(token.text()), pos);
            case MINUS:
                advance();
                Token number = expect(TokenType.NUMBER, "number");
                return new ParamNode.Literal(-Double.parseDouble(number.text()), pos);
            case IDENTIFIER:
                advance();
                if (token.text().equals("true") || token.text().equals("false")) {
                    return new ParamNode.Literal(Boolean.parseBoolean(token.text()), pos);
                }
                return new ParamNode.Identifier(token.text(), pos);
            case LEFT_BRACKET: {
                advance();
                List<ParamNode> items = new ArrayList<>();
                if (!peek().is(TokenType.RIGHT_BRACKET)) {
                    items.add(param());
                    while (match(TokenType.COMMA)) {
                        items.add(param());
                    }
                }
                expect(TokenType.RIGHT_BRACKET, "']'");
                return new ParamNode.ListNode(items, pos);
            }
            case LEFT_BRACE: {
                advance();
                Map<String, ParamNode> entries = new LinkedHashMap<>();
                if (!peek().is(TokenType.RIGHT_BRACE)) {
                    do {
                        Token key = peek();
                        if (!key.is(TokenType.IDENTIFIER) && !key.is(TokenType.STRING)) {
                            throw new PhenotypeSyntaxException("parameter name", key.describe(), key.position());
                        }
                        advance();
                        expect(TokenType.COLON, "':'");
                        if (entries.put(key.text(), param()) != null) {
                            throw new PhenotypeSyntaxException("duplicate parameter '" + key.text() + "'",
                                    key.position());
                        }
                    } while (match(TokenType.COMMA));
                }
                expect(TokenType.RIGHT_BRACE, "'}'");
                return new ParamNode.ObjectNode(entries, pos);
            }
            default:
                throw new PhenotypeSyntaxException("parameter value", token.describe(), pos);
        }
    }

    // ---- expressions ----

    private ExpressionNode expression() {
        return or();
    }

    private ExpressionNode or() {
        ExpressionNode left = and();
        while (peek().isKeywordIgnoreCase("OR")) {
            SourcePosition pos = advance().position();
            left = new ExpressionNode.Binary(Operator.OR, left, and(), pos);
        }
        return left;
    }

    private ExpressionNode and() {
        ExpressionNode left = not();
        while (true) {
            if (peek().isKeywordIgnoreCase("AND")) {
                SourcePosition pos = advance().position();
                left = new ExpressionNode.Binary(Operator.AND, left, not(), pos);
            } else if (peek().isKeywordIgnoreCase("NOT")) {
                SourcePosition pos = advance().position();
                left = new ExpressionNode.Binary(Operator.DIFFERENCE, left, not(), pos);
            } else {
                return left;
            }
        }
    }

    private ExpressionNode not() {
        if (peek().isKeywordIgnoreCase("NOT")) {
            SourcePosition pos = advance().position();
            return new ExpressionNode.Not(not(), pos);
        }
        return comparison();
    }

    private ExpressionNode comparison() {
        ExpressionNode left = additive();
        Operator operator = switch (peek().type()) {
            case GREATER -> Operator.GREATER;
            case LESS -> Operator.LESS;
            case GREATER_EQUAL -> Operator.GREATER_EQUAL;
            case LESS_EQUAL -> Operator.LESS_EQUAL;
            case EQUAL -> Operator.EQUAL;
            case NOT_EQUAL -> Operator.NOT_EQUAL;
            default -> null;
        };
        if (operator == null) {
            return left;
        }
        SourcePosition pos = advance().position();
        return new ExpressionNode.Binary(operator, left, additive(), pos);
    }

    private ExpressionNode additive() {
        ExpressionNode left = term();
        while (peek().is(TokenType.PLUS) || peek().is(TokenType.MINUS)) {
            Token op = advance();
            Operator operator = op.is(TokenType.PLUS) ? Operator.ADD : Operator.SUBTRACT;
            left = new ExpressionNode.Binary(operator, left, term(), op.position());
        }
        return left;
    }

    private ExpressionNode term() {
        ExpressionNode left = unary();
        while (peek().is(TokenType.STAR) || peek().is(TokenType.SLASH)) {
            Token op = advance();
            Operator operator = op.is(TokenType.STAR) ? Operator.MULTIPLY : Operator.DIVIDE;
            left = new ExpressionNode.Binary(operator, left, unary(), op.position());
        }
        return left;
    }

    private ExpressionNode unary() {
        if (peek().is(TokenType.MINUS)) {
            SourcePosition pos = advance().position();
            return new ExpressionNode.Negate(unary(), pos);
        }
        return primary();
    }

    private ExpressionNode primary() {
        Token token = peek();
        SourcePosition pos = token.position();
        switch (token.type()) {
            case NUMBER:
                advance();
                return new ExpressionNode.Literal(Double.parseDouble(token.text()), pos);
            case STRING:
                advance();
                return new ExpressionNode.Literal(token.text(), pos);
            case LEFT_PAREN: {
                advance();
                ExpressionNode inner = expression();
                expect(TokenType.RIGHT_PAREN, "')'");
                return inner;
            }
            case IDENTIFIER:
                if (isReservedInExpression(token)) {
                    throw new PhenotypeSyntaxException("expression operand", token.describe(), pos);
                }
                advance();
                if (token.text().equals("true") || token.text().equals("false")) {
                    return new ExpressionNode.Literal(Boolean.parseBoolean(token.text()), pos);
                }
                String field = null;
                if (match(TokenType.DOT)) {
                    field = expect(TokenType.IDENTIFIER, "field name").text();
                }
                return new ExpressionNode.Reference(token.text(), field, pos);
            default:
                throw new PhenotypeSyntaxException("expression operand", token.describe(), pos);
        }
    }

    private static boolean isReservedInExpression(Token token) {
        return token.isKeywordIgnoreCase("AND") || token.isKeywordIgnoreCase("OR")
                || token.isKeywordIgnoreCase("NOT");
    }

    // ---- token helpers ----

    private Token peek() {
        return tokens.get(current);
    }

    private Token peek(int offset) {
        int i = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (!token.is(TokenType.EOF)) {
            current++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String description) {
        Token token = peek();
        if (!token.is(type)) {
            throw new PhenotypeSyntaxException(description, token.describe(), token.position());
        }
        return advance();
    }

    private void expectKeyword(String keyword) {
        Token token = peek();
        if (!token.isKeyword(keyword)) {
            throw new PhenotypeSyntaxException("'" + keyword + "'", token.describe(), token.position());
        }
        advance();
    }
}
