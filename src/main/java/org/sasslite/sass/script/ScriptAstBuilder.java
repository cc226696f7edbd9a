package org.sasslite.sass.script;

import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ANTLR visitor that converts the SassScript parse tree to {@link SassExpression} records.
 */
public class ScriptAstBuilder extends SassScriptBaseVisitor<SassExpression> {

    private static final Pattern NUMBER = Pattern.compile("^([0-9]*\\.?[0-9]+)(.*)$");
    private static final Pattern ESCAPE = Pattern.compile("\\\\(.)");

    // ========================================
    // LISTS
    // ========================================

    @Override
    public SassExpression visitExpression(SassScriptParser.ExpressionContext ctx) {
        List<SassScriptParser.SpaceListContext> items = ctx.spaceList();
        if (items.size() == 1) {
            return visit(items.get(0));
        }
        return new ListExpression(visitAll(items), ListExpression.Separator.COMMA);
    }

    @Override
    public SassExpression visitSpaceList(SassScriptParser.SpaceListContext ctx) {
        List<SassScriptParser.OrExpressionContext> items = ctx.orExpression();
        if (items.size() == 1) {
            return visit(items.get(0));
        }
        return new ListExpression(visitAll(items), ListExpression.Separator.SPACE);
    }

    // ========================================
    // BINARY OPERATORS
    // ========================================

    @Override
    public SassExpression visitOrExpression(SassScriptParser.OrExpressionContext ctx) {
        return foldLeft(ctx);
    }

    @Override
    public SassExpression visitAndExpression(SassScriptParser.AndExpressionContext ctx) {
        return foldLeft(ctx);
    }

    @Override
    public SassExpression visitEqualityExpression(SassScriptParser.EqualityExpressionContext ctx) {
        return foldLeft(ctx);
    }

    @Override
    public SassExpression visitRelationalExpression(SassScriptParser.RelationalExpressionContext ctx) {
        return foldLeft(ctx);
    }

    @Override
    public SassExpression visitAdditiveExpression(SassScriptParser.AdditiveExpressionContext ctx) {
        return foldLeft(ctx);
    }

    @Override
    public SassExpression visitMultiplicativeExpression(SassScriptParser.MultiplicativeExpressionContext ctx) {
        return foldLeft(ctx);
    }

    /**
     * Children of a precedence level alternate operand, operator, operand...
     */
    private SassExpression foldLeft(ParserRuleContext ctx) {
        SassExpression result = visit(ctx.getChild(0));
        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            Operator op = Operator.fromSymbol(ctx.getChild(i).getText());
            result = new BinaryOperation(op, result, visit(ctx.getChild(i + 1)));
        }
        return result;
    }

    // ========================================
    // UNARY AND PRIMARY
    // ========================================

    @Override
    public SassExpression visitUnaryOperation(SassScriptParser.UnaryOperationContext ctx) {
        Operator op = ctx.MINUS() != null ? Operator.MINUS : Operator.NOT;
        return new UnaryOperation(op, visit(ctx.unaryExpression()));
    }

    @Override
    public SassExpression visitPrimaryExpression(SassScriptParser.PrimaryExpressionContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public SassExpression visitParenthesized(SassScriptParser.ParenthesizedContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public SassExpression visitFunctionCall(SassScriptParser.FunctionCallContext ctx) {
        return new FunctionCall(ctx.IDENTIFIER().getText(), visitAll(ctx.spaceList()));
    }

    @Override
    public SassExpression visitVariable(SassScriptParser.VariableContext ctx) {
        return new VariableReference(ctx.VARIABLE().getText().substring(1));
    }

    @Override
    public SassExpression visitNumber(SassScriptParser.NumberContext ctx) {
        Matcher m = NUMBER.matcher(ctx.NUMBER().getText());
        if (!m.matches()) {
            throw new IllegalStateException("Lexer produced malformed number: " + ctx.getText());
        }
        return new NumberLiteral(Double.parseDouble(m.group(1)), m.group(2));
    }

    @Override
    public SassExpression visitColor(SassScriptParser.ColorContext ctx) {
        return new ColorLiteral(ctx.COLOR().getText());
    }

    @Override
    public SassExpression visitString(SassScriptParser.StringContext ctx) {
        String raw = ctx.STRING().getText();
        String body = raw.substring(1, raw.length() - 1);
        return StringLiteral.quoted(ESCAPE.matcher(body).replaceAll("$1"));
    }

    @Override
    public SassExpression visitBoolean(SassScriptParser.BooleanContext ctx) {
        return new BooleanLiteral(Boolean.parseBoolean(ctx.BOOLEAN().getText()));
    }

    @Override
    public SassExpression visitIdentifier(SassScriptParser.IdentifierContext ctx) {
        return StringLiteral.unquoted(ctx.IDENTIFIER().getText());
    }

    private List<SassExpression> visitAll(List<? extends ParserRuleContext> contexts) {
        List<SassExpression> result = new ArrayList<>(contexts.size());
        for (ParserRuleContext ctx : contexts) {
            result.add(visit(ctx));
        }
        return result;
    }
}
