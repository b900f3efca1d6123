package org.csu.cpy.compiler.parser;

import org.csu.cpy.common.exception.ParseException;
import org.csu.cpy.common.exception.UnexpectedEndOfInputException;
import org.csu.cpy.compiler.lexer.Token;
import org.csu.cpy.compiler.lexer.TokenType;
import org.csu.cpy.compiler.parser.ast.*;
import org.csu.cpy.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.cpy.compiler.parser.ast.expression.LiteralNode;
import org.csu.cpy.compiler.parser.ast.expression.UnaryExpressionNode;
import org.csu.cpy.compiler.parser.ast.statement.*;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)
 *
 * 表达式优先级从低到高: || , && , ! , 比较(&lt; &gt;) , 加减 , 乘除。
 * 二元运算全部左结合。这个层次与 Python 的运算符优先级一致，
 * 因此代码生成时不需要重新加括号 (Python 的链式比较 a &lt; b &lt; c 除外)。
 *
 * 每个 Parser 实例只解析一个 Token 列表，用完即弃。
 *
 * 为了让解析和代码生成的递归深度有上限，代码块最多嵌套 {@value #MAX_BLOCK_DEPTH} 层，
 * 单个表达式最多包含 {@value #MAX_EXPRESSION_OPERATORS} 个运算符，超出时报告语法错误。
 */
public class Parser {

    public static final int MAX_BLOCK_DEPTH = 200;
    public static final int MAX_EXPRESSION_OPERATORS = 500;

    private final List<Token> tokens;
    private int position = 0;
    private int blockDepth = 0;        // 当前代码块嵌套层数
    private int expressionOperators = 0; // 当前表达式中已读到的运算符个数

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * program := INCLUDE_DIRECTIVE* statement+ EOF
     */
    public ProgramNode parse() {
        List<IncludeNode> includes = new ArrayList<>();
        while (match(TokenType.INCLUDE_DIRECTIVE)) {
            Token directive = previous();
            includes.add(new IncludeNode(directive.lexeme(), (String) directive.value()));
        }

        List<StatementNode> statements = new ArrayList<>();
        do {
            statements.add(parseStatement());
        } while (!isAtEnd());

        return new ProgramNode(includes, new BlockNode(statements));
    }

    private StatementNode parseStatement() {
        if (check(TokenType.INT) || check(TokenType.FLOAT)) {
            return parseDeclarationOrFunction();
        }
        if (check(TokenType.IDENTIFIER)) {
            return parseAssignmentOrIncrement();
        }
        if (match(TokenType.IF)) {
            return parseIfStatement();
        }
        if (match(TokenType.FOR)) {
            return parseForStatement();
        }
        if (match(TokenType.WHILE)) {
            return parseWhileStatement();
        }
        if (match(TokenType.CLASS)) {
            return parseClassDefinition();
        }
        if (match(TokenType.COUT)) {
            return parseOutputStatement();
        }
        if (match(TokenType.RETURN)) {
            return parseReturnStatement();
        }
        throw error("a statement (declaration, assignment, if, for, while, class, cout or return)");
    }

    private StatementNode parseDeclarationOrFunction() {
        Token typeToken = advance();
        Token nameToken = consume(TokenType.IDENTIFIER, "identifier after '" + typeToken.lexeme() + "'");
        // 只有 int 可以引出函数定义
        if (typeToken.type() == TokenType.INT && match(TokenType.LPAREN)) {
            return parseFunctionDefinition(nameToken);
        }
        return finishDeclaration(typeToken, nameToken);
    }

    private DeclarationNode parseDeclaration() {
        Token typeToken;
        if (check(TokenType.INT) || check(TokenType.FLOAT)) {
            typeToken = advance();
        } else {
            throw error("field declaration ('int' or 'float')");
        }
        Token nameToken = consume(TokenType.IDENTIFIER, "identifier after '" + typeToken.lexeme() + "'");
        return finishDeclaration(typeToken, nameToken);
    }

    private DeclarationNode finishDeclaration(Token typeToken, Token nameToken) {
        ExpressionNode initializer = null;
        if (match(TokenType.EQUAL)) {
            initializer = parseExpression();
        } else if (!check(TokenType.SEMICOLON)) {
            throw error("'=' or ';' after variable name");
        }
        consume(TokenType.SEMICOLON, "';' at the end of the declaration");
        return new DeclarationNode(typeToken, nameToken.lexeme(), initializer);
    }

    private FunctionDefinitionNode parseFunctionDefinition(Token nameToken) {
        List<ParamNode> params = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                consume(TokenType.INT, "'int' parameter type");
                params.add(new ParamNode(consume(TokenType.IDENTIFIER, "parameter name").lexeme()));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "')' after parameter list");
        BlockNode body = parseBlock();
        return new FunctionDefinitionNode(nameToken.lexeme(), params, body);
    }

    private StatementNode parseAssignmentOrIncrement() {
        Token nameToken = advance();
        if (match(TokenType.EQUAL)) {
            ExpressionNode value = parseExpression();
            consume(TokenType.SEMICOLON, "';' at the end of the assignment");
            return new AssignmentNode(nameToken.lexeme(), value);
        }
        if (match(TokenType.PLUS_PLUS)) {
            consume(TokenType.SEMICOLON, "';' after '++'");
            return new IncrementNode(nameToken.lexeme());
        }
        throw error("'=' or '++' after '" + nameToken.lexeme() + "'");
    }

    private IfStatementNode parseIfStatement() {
        consume(TokenType.LPAREN, "'(' after 'if'");
        ExpressionNode condition = parseExpression();
        consume(TokenType.RPAREN, "')' after if condition");
        BlockNode thenBlock = parseBlock();
        BlockNode elseBlock = null;
        if (match(TokenType.ELSE)) {
            elseBlock = parseBlock();
        }
        return new IfStatementNode(condition, thenBlock, elseBlock);
    }

    /**
     * for (int i = expr; comparison; i++) block
     */
    private ForStatementNode parseForStatement() {
        consume(TokenType.LPAREN, "'(' after 'for'");
        consume(TokenType.INT, "'int' loop variable declaration");
        Token variable = consume(TokenType.IDENTIFIER, "loop variable name");
        consume(TokenType.EQUAL, "'=' after loop variable");
        ExpressionNode initializer = parseExpression();
        consume(TokenType.SEMICOLON, "';' after loop initializer");

        Token conditionStart = peek();
        ExpressionNode condition = parseExpression();
        if (!(condition instanceof BinaryExpressionNode comparison) || !isComparison(comparison.operator())) {
            throw new ParseException(conditionStart, "a comparison ('<' or '>') as the loop condition");
        }
        consume(TokenType.SEMICOLON, "';' after loop condition");

        consume(TokenType.IDENTIFIER, "loop variable in the update clause");
        consume(TokenType.PLUS_PLUS, "'++' in the update clause");
        consume(TokenType.RPAREN, "')' after for header");
        BlockNode body = parseBlock();
        return new ForStatementNode(variable.lexeme(), initializer, comparison, body);
    }

    private WhileStatementNode parseWhileStatement() {
        consume(TokenType.LPAREN, "'(' after 'while'");
        ExpressionNode condition = parseExpression();
        consume(TokenType.RPAREN, "')' after while condition");
        return new WhileStatementNode(condition, parseBlock());
    }

    private ClassDefinitionNode parseClassDefinition() {
        Token nameToken = consume(TokenType.IDENTIFIER, "class name");
        consume(TokenType.LBRACE, "'{' after class name");
        List<DeclarationNode> fields = new ArrayList<>();
        do {
            fields.add(parseDeclaration());
        } while (!check(TokenType.RBRACE) && !isAtEnd());
        consume(TokenType.RBRACE, "'}' after class body");
        consume(TokenType.SEMICOLON, "';' after class definition");
        return new ClassDefinitionNode(nameToken.lexeme(), fields);
    }

    /**
     * cout &lt;&lt; expr (&lt;&lt; expr)? (&lt;&lt; endl)? ;
     */
    private OutputStatementNode parseOutputStatement() {
        consume(TokenType.SHIFT_LEFT, "'<<' after 'cout'");
        List<ExpressionNode> values = new ArrayList<>();
        values.add(parseExpression());
        boolean endLine = false;
        if (match(TokenType.SHIFT_LEFT)) {
            if (match(TokenType.ENDL)) {
                endLine = true;
            } else {
                values.add(parseExpression());
                if (match(TokenType.SHIFT_LEFT)) {
                    consume(TokenType.ENDL, "'endl' at the end of the output chain");
                    endLine = true;
                }
            }
        }
        consume(TokenType.SEMICOLON, "';' at the end of the output statement");
        return new OutputStatementNode(values, endLine);
    }

    private ReturnStatementNode parseReturnStatement() {
        ExpressionNode value = parseExpression();
        consume(TokenType.SEMICOLON, "';' after return value");
        return new ReturnStatementNode(value);
    }

    /**
     * block := '{' statement+ '}'
     */
    private BlockNode parseBlock() {
        Token open = consume(TokenType.LBRACE, "'{' to open a block");
        if (++blockDepth > MAX_BLOCK_DEPTH) {
            throw new ParseException(open, "blocks nested at most " + MAX_BLOCK_DEPTH + " levels deep");
        }
        List<StatementNode> statements = new ArrayList<>();
        do {
            statements.add(parseStatement());
        } while (!check(TokenType.RBRACE) && !isAtEnd());
        consume(TokenType.RBRACE, "'}' to close the block");
        blockDepth--;
        return new BlockNode(statements);
    }

    // --- 表达式 ---

    private ExpressionNode parseExpression() {
        expressionOperators = 0;
        return parseOrExpression();
    }

    private ExpressionNode parseOrExpression() {
        ExpressionNode left = parseAndExpression();
        while (match(TokenType.OR)) {
            Token operator = countOperator();
            ExpressionNode right = parseAndExpression();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseAndExpression() {
        ExpressionNode left = parseNotExpression();
        while (match(TokenType.AND)) {
            Token operator = countOperator();
            ExpressionNode right = parseNotExpression();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseNotExpression() {
        if (match(TokenType.NOT)) {
            Token operator = countOperator();
            return new UnaryExpressionNode(operator, parseNotExpression());
        }
        return parseComparison();
    }

    private ExpressionNode parseComparison() {
        ExpressionNode left = parseAdditive();
        while (match(TokenType.LESS, TokenType.GREATER)) {
            Token operator = countOperator();
            ExpressionNode right = parseAdditive();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseAdditive() {
        ExpressionNode left = parseMultiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = countOperator();
            ExpressionNode right = parseMultiplicative();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseMultiplicative() {
        ExpressionNode left = parsePrimaryExpression();
        while (match(TokenType.ASTERISK, TokenType.SLASH)) {
            Token operator = countOperator();
            ExpressionNode right = parsePrimaryExpression();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parsePrimaryExpression() {
        if (match(TokenType.NUMBER, TokenType.IDENTIFIER, TokenType.STRING)) {
            return new LiteralNode(previous());
        }
        throw error("an expression (a number, an identifier or a string)");
    }

    /**
     * 记录刚读到的运算符；运算符个数决定了表达式树的高度
     */
    private Token countOperator() {
        Token operator = previous();
        if (++expressionOperators > MAX_EXPRESSION_OPERATORS) {
            throw new ParseException(operator, "at most " + MAX_EXPRESSION_OPERATORS + " operators in one expression");
        }
        return operator;
    }

    private boolean isComparison(Token operator) {
        return operator.type() == TokenType.LESS || operator.type() == TokenType.GREATER;
    }

    // --- 辅助方法 ---

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(message);
    }

    /**
     * 在当前位置报告语法错误；已经到达输入末尾时报告 UnexpectedEndOfInput
     */
    private ParseException error(String expected) {
        if (isAtEnd()) {
            return new UnexpectedEndOfInputException(peek(), expected);
        }
        return new ParseException(peek(), expected);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
