package org.csu.cpy.compiler.codegen;

import org.csu.cpy.common.exception.CodeGenerationException;
import org.csu.cpy.compiler.lexer.Token;
import org.csu.cpy.compiler.lexer.TokenType;
import org.csu.cpy.compiler.parser.ast.*;
import org.csu.cpy.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.cpy.compiler.parser.ast.expression.LiteralNode;
import org.csu.cpy.compiler.parser.ast.expression.UnaryExpressionNode;
import org.csu.cpy.compiler.parser.ast.statement.*;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 代码生成器
 * 自底向上遍历一次 AST，输出 Python 源码。
 *
 * 语句生成带缩进、以换行结尾的文本；表达式生成不带缩进和换行的行内片段。
 * 缩进深度作为参数向下传递，不保存在字段中。
 * 表达式不会重新加括号，正确性依赖于 Python 与源语言的运算符优先级一致。
 */
public class CodeGenerator {

    // 17 位有效数字足以唯一确定任意 double
    private static final int MAX_DOUBLE_DIGITS = 17;

    private static final Map<TokenType, String> OPERATORS = new EnumMap<>(TokenType.class);

    static {
        OPERATORS.put(TokenType.PLUS, "+");
        OPERATORS.put(TokenType.MINUS, "-");
        OPERATORS.put(TokenType.ASTERISK, "*");
        OPERATORS.put(TokenType.SLASH, "/");
        OPERATORS.put(TokenType.LESS, "<");
        OPERATORS.put(TokenType.GREATER, ">");
        OPERATORS.put(TokenType.AND, "and");
        OPERATORS.put(TokenType.OR, "or");
    }

    private final String indentUnit;

    public CodeGenerator(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public String generate(ProgramNode program) {
        // #include 在 Python 中没有对应物，直接丢弃
        return generateBlock(program.statements(), 0);
    }

    private String generateBlock(BlockNode block, int depth) {
        StringBuilder sb = new StringBuilder();
        for (StatementNode statement : block.statements()) {
            sb.append(generateStatement(statement, depth));
        }
        return sb.toString();
    }

    private String generateStatement(StatementNode node, int depth) {
        String indent = indentUnit.repeat(depth);

        if (node instanceof DeclarationNode declaration) {
            String value = declaration.hasInitializer() ? generateExpression(declaration.initializer()) : "0";
            return indent + declaration.name() + " = " + value + "\n";
        }
        if (node instanceof AssignmentNode assignment) {
            return indent + assignment.name() + " = " + generateExpression(assignment.value()) + "\n";
        }
        if (node instanceof IncrementNode increment) {
            return indent + increment.name() + " = " + increment.name() + " + 1\n";
        }
        if (node instanceof IfStatementNode ifStatement) {
            return generateIf(ifStatement, depth);
        }
        if (node instanceof ForStatementNode forStatement) {
            // 步长固定为 1；上界直接取条件的右操作数，不区分 < 与 >
            return indent + "for " + forStatement.variable() + " in range("
                    + generateExpression(forStatement.initializer()) + ", "
                    + generateExpression(forStatement.condition().right()) + "):\n"
                    + generateBlock(forStatement.body(), depth + 1);
        }
        if (node instanceof WhileStatementNode whileStatement) {
            return indent + "while " + generateExpression(whileStatement.condition()) + ":\n"
                    + generateBlock(whileStatement.body(), depth + 1);
        }
        if (node instanceof FunctionDefinitionNode function) {
            String params = function.params().stream()
                    .map(ParamNode::name)
                    .collect(Collectors.joining(", "));
            return indent + "def " + function.name() + "(" + params + "):\n"
                    + generateBlock(function.body(), depth + 1);
        }
        if (node instanceof ClassDefinitionNode classDefinition) {
            return generateClass(classDefinition, depth);
        }
        if (node instanceof OutputStatementNode output) {
            return indent + generateOutput(output) + "\n";
        }
        if (node instanceof ReturnStatementNode returnStatement) {
            return indent + "return " + generateExpression(returnStatement.value()) + "\n";
        }
        throw new CodeGenerationException("unsupported statement node " + node.getClass().getSimpleName());
    }

    private String generateIf(IfStatementNode node, int depth) {
        String indent = indentUnit.repeat(depth);
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append("if ").append(generateExpression(node.condition())).append(":\n");
        sb.append(generateBlock(node.thenBlock(), depth + 1));
        if (node.hasElse()) {
            sb.append(indent).append("else:\n");
            sb.append(generateBlock(node.elseBlock(), depth + 1));
        }
        return sb.toString();
    }

    /**
     * 只生成一个无参的 __init__，把所有字段置 0，字段的初始值表达式被忽略
     */
    private String generateClass(ClassDefinitionNode node, int depth) {
        String indent = indentUnit.repeat(depth);
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append("class ").append(node.name()).append(":\n");
        sb.append(indent).append(indentUnit).append("def __init__(self):\n");
        for (DeclarationNode field : node.fields()) {
            sb.append(indent).append(indentUnit).append(indentUnit)
                    .append("self.").append(field.name()).append(" = 0\n");
        }
        return sb.toString();
    }

    private String generateOutput(OutputStatementNode node) {
        List<ExpressionNode> values = node.values();
        String end = node.endLine() ? "'\\n'" : "''";
        String args = values.stream()
                .map(this::generateExpression)
                .collect(Collectors.joining(", "));
        // cout 连续输出时没有分隔符
        String separator = values.size() > 1 ? ", sep=''" : "";
        return "print(" + args + separator + ", end=" + end + ")";
    }

    private String generateExpression(ExpressionNode node) {
        if (node instanceof BinaryExpressionNode binary) {
            String operator = OPERATORS.get(binary.operator().type());
            if (operator == null) {
                throw new CodeGenerationException("unsupported binary operator " + binary.operator().lexeme());
            }
            return generateExpression(binary.left()) + " " + operator + " " + generateExpression(binary.right());
        }
        if (node instanceof UnaryExpressionNode unary) {
            return "not " + generateExpression(unary.operand());
        }
        if (node instanceof LiteralNode literal) {
            return generateLiteral(literal.literal());
        }
        throw new CodeGenerationException("unsupported expression node " + node.getClass().getSimpleName());
    }

    private String generateLiteral(Token token) {
        Object value = token.value();
        if (value instanceof Double number) {
            return formatFloat(number);
        }
        // 整数 (BigInteger)、标识符和字符串 (含引号) 原样输出
        return String.valueOf(value);
    }

    /**
     * 按 Python repr(float) 的规则格式化小数:
     * 取能还原出同一个 double 的最短十进制数字，
     * 十进制指数在 [-4, 16) 内时使用定点形式 (至少一位小数)，否则使用 1e+16 / 1.5e-05 形式的科学计数法
     */
    static String formatFloat(double number) {
        if (Double.isInfinite(number)) {
            return number > 0 ? "inf" : "-inf";
        }
        if (number == 0.0) {
            return "0.0";
        }
        BigDecimal shortest = shortestDecimal(number).abs();
        String sign = number < 0 ? "-" : "";
        int exponent = shortest.precision() - shortest.scale() - 1;
        if (exponent >= -4 && exponent < 16) {
            String plain = shortest.toPlainString();
            return sign + (plain.contains(".") ? plain : plain + ".0");
        }
        String digits = shortest.unscaledValue().toString();
        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        String exponentSign = exponent < 0 ? "-" : "+";
        return sign + mantissa + "e" + exponentSign + String.format("%02d", Math.abs(exponent));
    }

    /**
     * 从 1 位有效数字开始逐位尝试，返回第一个能精确还原 number 的舍入结果
     */
    private static BigDecimal shortestDecimal(double number) {
        BigDecimal exact = new BigDecimal(number);
        for (int precision = 1; precision < MAX_DOUBLE_DIGITS; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == number) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(MAX_DOUBLE_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }
}
