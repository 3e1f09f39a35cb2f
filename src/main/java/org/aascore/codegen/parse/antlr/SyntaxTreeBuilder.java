package org.aascore.codegen.parse.antlr;

import org.aascore.codegen.common.MetaModelParseException;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.syntax.Arguments;
import org.aascore.codegen.parse.syntax.Arguments.Parameter;
import org.aascore.codegen.parse.syntax.Expr;
import org.aascore.codegen.parse.syntax.Module;
import org.aascore.codegen.parse.syntax.Stmt;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that builds the host syntax tree from the parse tree.
 *
 * The parse tree mirrors the grammar rules; the host tree is the smaller set
 * of statement and expression nodes the model builder works with. Each node
 * keeps the code point span of the rule it came from.
 */
public class SyntaxTreeBuilder extends MetaModelParserBaseVisitor<Object> {

    // ------------------------------------------------------------------ Module

    @Override
    public Module visitModule(MetaModelParser.ModuleContext ctx) {
        List<Stmt> body = new ArrayList<>();
        for (MetaModelParser.StatementContext statementCtx : ctx.statement()) {
            body.addAll(statements(statementCtx));
        }
        return new Module(body, span(ctx));
    }

    private List<Stmt> statements(MetaModelParser.StatementContext ctx) {
        if (ctx.simpleStatements() != null) {
            return simpleStatements(ctx.simpleStatements());
        }
        return List.of(compoundStatement(ctx.compoundStatement()));
    }

    private List<Stmt> simpleStatements(MetaModelParser.SimpleStatementsContext ctx) {
        List<Stmt> result = new ArrayList<>();
        for (MetaModelParser.SmallStatementContext smallCtx : ctx.smallStatement()) {
            result.add((Stmt) visit(smallCtx));
        }
        return result;
    }

    private List<Stmt> suite(MetaModelParser.SuiteContext ctx) {
        if (ctx.simpleStatements() != null) {
            return simpleStatements(ctx.simpleStatements());
        }
        List<Stmt> result = new ArrayList<>();
        for (MetaModelParser.StatementContext statementCtx : ctx.statement()) {
            result.addAll(statements(statementCtx));
        }
        return result;
    }

    // ------------------------------------------------------------------ Simple statements

    @Override
    public Stmt visitPassStatement(MetaModelParser.PassStatementContext ctx) {
        return new Stmt.Pass(span(ctx));
    }

    @Override
    public Stmt visitBreakStatement(MetaModelParser.BreakStatementContext ctx) {
        return new Stmt.Break(span(ctx));
    }

    @Override
    public Stmt visitContinueStatement(MetaModelParser.ContinueStatementContext ctx) {
        return new Stmt.Continue(span(ctx));
    }

    @Override
    public Stmt visitReturnStatement(MetaModelParser.ReturnStatementContext ctx) {
        Expr value = ctx.testList() == null ? null : testList(ctx.testList());
        return new Stmt.Return(value, span(ctx));
    }

    @Override
    public Stmt visitRaiseStatement(MetaModelParser.RaiseStatementContext ctx) {
        List<MetaModelParser.TestContext> tests = ctx.test();
        Expr exception = tests.isEmpty() ? null : test(tests.get(0));
        Expr cause = tests.size() > 1 ? test(tests.get(1)) : null;
        return new Stmt.Raise(exception, cause, span(ctx));
    }

    @Override
    public Stmt visitAssertStatement(MetaModelParser.AssertStatementContext ctx) {
        List<MetaModelParser.TestContext> tests = ctx.test();
        Expr message = tests.size() > 1 ? test(tests.get(1)) : null;
        return new Stmt.Assert(test(tests.get(0)), message, span(ctx));
    }

    @Override
    public Stmt visitImportStatement(MetaModelParser.ImportStatementContext ctx) {
        List<Stmt.Alias> names = new ArrayList<>();
        for (MetaModelParser.DottedAsNameContext aliasCtx : ctx.dottedAsName()) {
            String asName = aliasCtx.NAME() == null ? null : aliasCtx.NAME().getText();
            names.add(new Stmt.Alias(aliasCtx.dottedName().getText(), asName, span(aliasCtx)));
        }
        return new Stmt.Import(names, span(ctx));
    }

    @Override
    public Stmt visitImportFromStatement(MetaModelParser.ImportFromStatementContext ctx) {
        MetaModelParser.ImportModuleContext moduleCtx = ctx.importModule();
        String module = moduleCtx.dottedName() == null ? null : moduleCtx.dottedName().getText();
        int level = moduleCtx.DOT().size();

        List<Stmt.Alias> names = new ArrayList<>();
        MetaModelParser.ImportTargetsContext targetsCtx = ctx.importTargets();
        if (targetsCtx.STAR() != null) {
            names.add(new Stmt.Alias("*", null, span(targetsCtx)));
        } else {
            for (MetaModelParser.ImportAliasContext aliasCtx : targetsCtx.importAlias()) {
                String asName = aliasCtx.NAME().size() > 1 ? aliasCtx.NAME(1).getText() : null;
                names.add(new Stmt.Alias(aliasCtx.NAME(0).getText(), asName, span(aliasCtx)));
            }
        }
        return new Stmt.ImportFrom(module, names, level, span(ctx));
    }

    @Override
    public Stmt visitAnnotatedAssignment(MetaModelParser.AnnotatedAssignmentContext ctx) {
        MetaModelParser.TestListContext targetCtx = ctx.testList(0);
        Expr target = testList(targetCtx);
        Expr value = ctx.testList().size() > 1 ? testList(ctx.testList(1)) : null;
        boolean simple = target instanceof Expr.Name
                && targetCtx.getStart().getType() == MetaModelParser.NAME;
        return new Stmt.AnnAssign(target, test(ctx.test()), value, simple, span(ctx));
    }

    @Override
    public Stmt visitAssignment(MetaModelParser.AssignmentContext ctx) {
        List<MetaModelParser.TestListContext> parts = ctx.testList();
        List<Expr> targets = new ArrayList<>();
        for (int i = 0; i < parts.size() - 1; i++) {
            targets.add(testList(parts.get(i)));
        }
        return new Stmt.Assign(targets, testList(parts.get(parts.size() - 1)), span(ctx));
    }

    @Override
    public Stmt visitAugmentedAssignment(MetaModelParser.AugmentedAssignmentContext ctx) {
        String symbol = ctx.augmentedOperator().getText();
        Expr.BinaryOperator operator = Expr.BinaryOperator.fromSymbol(symbol.substring(0, symbol.length() - 1));
        return new Stmt.AugAssign(testList(ctx.testList(0)), operator, testList(ctx.testList(1)), span(ctx));
    }

    @Override
    public Stmt visitExpressionStatement(MetaModelParser.ExpressionStatementContext ctx) {
        return new Stmt.ExprStmt(testList(ctx.testList()), span(ctx));
    }

    // ------------------------------------------------------------------ Compound statements

    private Stmt compoundStatement(MetaModelParser.CompoundStatementContext ctx) {
        if (ctx.ifStatement() != null) {
            return ifStatement(ctx.ifStatement());
        }
        if (ctx.whileStatement() != null) {
            MetaModelParser.WhileStatementContext whileCtx = ctx.whileStatement();
            List<Stmt> orElse = whileCtx.ELSE() == null ? List.of() : suite(whileCtx.suite(1));
            return new Stmt.While(test(whileCtx.test()), suite(whileCtx.suite(0)), orElse, span(whileCtx));
        }
        if (ctx.forStatement() != null) {
            MetaModelParser.ForStatementContext forCtx = ctx.forStatement();
            List<Stmt> orElse = forCtx.ELSE() == null ? List.of() : suite(forCtx.suite(1));
            return new Stmt.For(exprList(forCtx.exprList()), testList(forCtx.testList()),
                    suite(forCtx.suite(0)), orElse, span(forCtx));
        }

        List<Expr> decorators = new ArrayList<>();
        for (MetaModelParser.DecoratorContext decoratorCtx : ctx.decorator()) {
            decorators.add(test(decoratorCtx.test()));
        }

        if (ctx.functionDefinition() != null) {
            return functionDefinition(ctx.functionDefinition(), decorators, span(ctx));
        }
        return classDefinition(ctx.classDefinition(), decorators, span(ctx));
    }

    private Stmt ifStatement(MetaModelParser.IfStatementContext ctx) {
        List<MetaModelParser.TestContext> tests = ctx.test();
        List<MetaModelParser.SuiteContext> suites = ctx.suite();

        List<Stmt> orElse = ctx.ELSE() == null ? List.of() : suite(suites.get(tests.size()));
        Stmt result = null;
        for (int i = tests.size() - 1; i >= 0; i--) {
            result = new Stmt.If(test(tests.get(i)), suite(suites.get(i)), orElse,
                    i == 0 ? span(ctx) : span(tests.get(i), ctx));
            orElse = List.of(result);
        }
        return result;
    }

    private Stmt functionDefinition(MetaModelParser.FunctionDefinitionContext ctx, List<Expr> decorators,
            SourceSpan span) {
        Arguments arguments = ctx.parameterList() == null
                ? Arguments.empty(span(ctx.OPEN_PAREN().getSymbol(), ctx.CLOSE_PAREN().getSymbol()))
                : parameterList(ctx.parameterList());
        Expr returns = ctx.test() == null ? null : test(ctx.test());
        return new Stmt.FunctionDef(ctx.NAME().getText(), arguments, returns, decorators, suite(ctx.suite()),
                span);
    }

    private Arguments parameterList(MetaModelParser.ParameterListContext ctx) {
        List<Parameter> positionalOnly = new ArrayList<>();
        List<Parameter> args = new ArrayList<>();
        List<Parameter> keywordOnly = new ArrayList<>();
        Parameter varArg = null;
        Parameter kwArg = null;
        boolean afterStar = false;

        for (MetaModelParser.ParameterContext parameterCtx : ctx.parameter()) {
            if (parameterCtx instanceof MetaModelParser.PlainParameterContext plain) {
                Expr annotation = null;
                Expr defaultValue = null;
                if (plain.COLON() != null) {
                    annotation = test(plain.test(0));
                    if (plain.ASSIGN() != null) {
                        defaultValue = test(plain.test(1));
                    }
                } else if (plain.ASSIGN() != null) {
                    defaultValue = test(plain.test(0));
                }
                Parameter parameter = new Parameter(plain.NAME().getText(), annotation, defaultValue, span(plain));
                (afterStar ? keywordOnly : args).add(parameter);
            } else if (parameterCtx instanceof MetaModelParser.StarParameterContext star) {
                if (afterStar) {
                    throw error("Only a single '*' is allowed in a parameter list", star);
                }
                afterStar = true;
                if (star.NAME() != null) {
                    Expr annotation = star.test() == null ? null : test(star.test());
                    varArg = new Parameter(star.NAME().getText(), annotation, null, span(star));
                }
            } else if (parameterCtx instanceof MetaModelParser.DoubleStarParameterContext doubleStar) {
                Expr annotation = doubleStar.test() == null ? null : test(doubleStar.test());
                kwArg = new Parameter(doubleStar.NAME().getText(), annotation, null, span(doubleStar));
            } else if (parameterCtx instanceof MetaModelParser.PositionalOnlyMarkerContext marker) {
                if (afterStar || !positionalOnly.isEmpty()) {
                    throw error("Unexpected '/' in the parameter list", marker);
                }
                positionalOnly.addAll(args);
                args.clear();
            } else {
                throw new IllegalStateException("Unhandled parameter: " + parameterCtx.getClass().getSimpleName());
            }
        }
        return new Arguments(positionalOnly, args, varArg, keywordOnly, kwArg, span(ctx));
    }

    private Stmt classDefinition(MetaModelParser.ClassDefinitionContext ctx, List<Expr> decorators,
            SourceSpan span) {
        List<Expr> bases = new ArrayList<>();
        List<Expr.Keyword> keywords = new ArrayList<>();
        if (ctx.argumentList() != null) {
            argumentList(ctx.argumentList(), bases, keywords);
        }
        return new Stmt.ClassDef(ctx.NAME().getText(), bases, keywords, decorators, suite(ctx.suite()), span);
    }

    // ------------------------------------------------------------------ Expressions

    private Expr testList(MetaModelParser.TestListContext ctx) {
        List<MetaModelParser.TestContext> tests = ctx.test();
        if (tests.size() == 1 && ctx.COMMA().isEmpty()) {
            return test(tests.get(0));
        }
        List<Expr> elements = new ArrayList<>();
        for (MetaModelParser.TestContext testCtx : tests) {
            elements.add(test(testCtx));
        }
        return new Expr.Tuple(elements, span(ctx));
    }

    private Expr exprList(MetaModelParser.ExprListContext ctx) {
        List<MetaModelParser.ExprContext> exprs = ctx.expr();
        if (exprs.size() == 1 && ctx.COMMA().isEmpty()) {
            return expr(exprs.get(0));
        }
        List<Expr> elements = new ArrayList<>();
        for (MetaModelParser.ExprContext exprCtx : exprs) {
            elements.add(expr(exprCtx));
        }
        return new Expr.Tuple(elements, span(ctx));
    }

    private Expr test(MetaModelParser.TestContext ctx) {
        return visitTest(ctx);
    }

    @Override
    public Expr visitTest(MetaModelParser.TestContext ctx) {
        if (ctx.lambdaDefinition() != null) {
            return lambdaDefinition(ctx.lambdaDefinition());
        }
        Expr body = orTest(ctx.orTest(0));
        if (ctx.IF() == null) {
            return body;
        }
        return new Expr.IfExp(orTest(ctx.orTest(1)), body, test(ctx.test()), span(ctx));
    }

    private Expr lambdaDefinition(MetaModelParser.LambdaDefinitionContext ctx) {
        Arguments arguments = ctx.lambdaParameterList() == null
                ? Arguments.empty(span(ctx.LAMBDA().getSymbol(), ctx.COLON().getSymbol()))
                : lambdaParameterList(ctx.lambdaParameterList());
        return new Expr.Lambda(arguments, test(ctx.test()), span(ctx));
    }

    private Arguments lambdaParameterList(MetaModelParser.LambdaParameterListContext ctx) {
        List<Parameter> args = new ArrayList<>();
        List<Parameter> keywordOnly = new ArrayList<>();
        Parameter varArg = null;
        Parameter kwArg = null;
        boolean afterStar = false;

        for (MetaModelParser.LambdaParameterContext parameterCtx : ctx.lambdaParameter()) {
            if (parameterCtx instanceof MetaModelParser.PlainLambdaParameterContext plain) {
                Expr defaultValue = plain.test() == null ? null : test(plain.test());
                Parameter parameter = new Parameter(plain.NAME().getText(), null, defaultValue, span(plain));
                (afterStar ? keywordOnly : args).add(parameter);
            } else if (parameterCtx instanceof MetaModelParser.StarLambdaParameterContext star) {
                afterStar = true;
                if (star.NAME() != null) {
                    varArg = new Parameter(star.NAME().getText(), null, null, span(star));
                }
            } else if (parameterCtx instanceof MetaModelParser.DoubleStarLambdaParameterContext doubleStar) {
                kwArg = new Parameter(doubleStar.NAME().getText(), null, null, span(doubleStar));
            } else {
                throw new IllegalStateException("Unhandled lambda parameter: "
                        + parameterCtx.getClass().getSimpleName());
            }
        }
        return new Arguments(List.of(), args, varArg, keywordOnly, kwArg, span(ctx));
    }

    private Expr namedExpression(MetaModelParser.NamedExpressionContext ctx) {
        if (ctx.WALRUS() != null) {
            Expr.Name target = new Expr.Name(ctx.NAME().getText(), span(ctx.NAME().getSymbol()));
            return new Expr.NamedExpr(target, test(ctx.test()), span(ctx));
        }
        return test(ctx.test());
    }

    private Expr orTest(MetaModelParser.OrTestContext ctx) {
        List<MetaModelParser.AndTestContext> operands = ctx.andTest();
        if (operands.size() == 1) {
            return andTest(operands.get(0));
        }
        List<Expr> values = new ArrayList<>();
        for (MetaModelParser.AndTestContext operand : operands) {
            values.add(andTest(operand));
        }
        return new Expr.BoolOp(Expr.BoolOperator.OR, values, span(ctx));
    }

    private Expr andTest(MetaModelParser.AndTestContext ctx) {
        List<MetaModelParser.NotTestContext> operands = ctx.notTest();
        if (operands.size() == 1) {
            return notTest(operands.get(0));
        }
        List<Expr> values = new ArrayList<>();
        for (MetaModelParser.NotTestContext operand : operands) {
            values.add(notTest(operand));
        }
        return new Expr.BoolOp(Expr.BoolOperator.AND, values, span(ctx));
    }

    private Expr notTest(MetaModelParser.NotTestContext ctx) {
        if (ctx.NOT() != null) {
            return new Expr.UnaryOp(Expr.UnaryOperator.NOT, notTest(ctx.notTest()), span(ctx));
        }
        return comparison(ctx.comparison());
    }

    private Expr comparison(MetaModelParser.ComparisonContext ctx) {
        List<MetaModelParser.ExprContext> operands = ctx.expr();
        Expr left = expr(operands.get(0));
        if (operands.size() == 1) {
            return left;
        }
        List<Expr.CompareOperator> operators = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        for (int i = 1; i < operands.size(); i++) {
            operators.add(comparisonOperator(ctx.comparisonOperator(i - 1)));
            comparators.add(expr(operands.get(i)));
        }
        return new Expr.Compare(left, operators, comparators, span(ctx));
    }

    private static Expr.CompareOperator comparisonOperator(MetaModelParser.ComparisonOperatorContext ctx) {
        if (ctx.NOT() != null && ctx.IN() != null) {
            return Expr.CompareOperator.NOT_IN;
        }
        if (ctx.IS() != null) {
            return ctx.NOT() != null ? Expr.CompareOperator.IS_NOT : Expr.CompareOperator.IS;
        }
        if (ctx.IN() != null) {
            return Expr.CompareOperator.IN;
        }
        return switch (ctx.getStart().getType()) {
            case MetaModelParser.LESS_THAN -> Expr.CompareOperator.LT;
            case MetaModelParser.LT_EQ -> Expr.CompareOperator.LE;
            case MetaModelParser.GREATER_THAN -> Expr.CompareOperator.GT;
            case MetaModelParser.GT_EQ -> Expr.CompareOperator.GE;
            case MetaModelParser.EQUALS -> Expr.CompareOperator.EQ;
            case MetaModelParser.NOT_EQ -> Expr.CompareOperator.NE;
            default -> throw new IllegalStateException("Unhandled comparison operator: " + ctx.getText());
        };
    }

    private Expr expr(MetaModelParser.ExprContext ctx) {
        if (ctx instanceof MetaModelParser.AtomicExprContext atomic) {
            return atomExpression(atomic.atomExpression());
        }
        if (ctx instanceof MetaModelParser.PowerExprContext power) {
            return binary(power, power.expr(0), Expr.BinaryOperator.POW, power.expr(1));
        }
        if (ctx instanceof MetaModelParser.UnaryExprContext unary) {
            Expr.UnaryOperator operator = switch (unary.op.getType()) {
                case MetaModelParser.ADD -> Expr.UnaryOperator.PLUS;
                case MetaModelParser.MINUS -> Expr.UnaryOperator.MINUS;
                default -> Expr.UnaryOperator.INVERT;
            };
            return new Expr.UnaryOp(operator, expr(unary.expr()), span(unary));
        }
        if (ctx instanceof MetaModelParser.MultiplicativeExprContext multiplicative) {
            return binary(multiplicative, multiplicative.expr(0),
                    Expr.BinaryOperator.fromSymbol(multiplicative.op.getText()), multiplicative.expr(1));
        }
        if (ctx instanceof MetaModelParser.AdditiveExprContext additive) {
            return binary(additive, additive.expr(0),
                    Expr.BinaryOperator.fromSymbol(additive.op.getText()), additive.expr(1));
        }
        if (ctx instanceof MetaModelParser.ShiftExprContext shift) {
            return binary(shift, shift.expr(0), Expr.BinaryOperator.fromSymbol(shift.op.getText()), shift.expr(1));
        }
        if (ctx instanceof MetaModelParser.BitAndExprContext bitAnd) {
            return binary(bitAnd, bitAnd.expr(0), Expr.BinaryOperator.BIT_AND, bitAnd.expr(1));
        }
        if (ctx instanceof MetaModelParser.BitXorExprContext bitXor) {
            return binary(bitXor, bitXor.expr(0), Expr.BinaryOperator.BIT_XOR, bitXor.expr(1));
        }
        if (ctx instanceof MetaModelParser.BitOrExprContext bitOr) {
            return binary(bitOr, bitOr.expr(0), Expr.BinaryOperator.BIT_OR, bitOr.expr(1));
        }
        throw new IllegalStateException("Unhandled expression: " + ctx.getClass().getSimpleName());
    }

    private Expr binary(ParserRuleContext ctx, MetaModelParser.ExprContext left, Expr.BinaryOperator operator,
            MetaModelParser.ExprContext right) {
        return new Expr.BinOp(expr(left), operator, expr(right), span(ctx));
    }

    private Expr atomExpression(MetaModelParser.AtomExpressionContext ctx) {
        Expr result = atom(ctx.atom());
        int start = span(ctx).start();

        for (MetaModelParser.TrailerContext trailerCtx : ctx.trailer()) {
            SourceSpan span = new SourceSpan(start, Math.max(start, span(trailerCtx).end()));

            if (trailerCtx instanceof MetaModelParser.CallTrailerContext call) {
                List<Expr> args = new ArrayList<>();
                List<Expr.Keyword> keywords = new ArrayList<>();
                if (call.argumentList() != null) {
                    argumentList(call.argumentList(), args, keywords);
                }
                result = new Expr.Call(result, args, keywords, span);
            } else if (trailerCtx instanceof MetaModelParser.SubscriptTrailerContext subscript) {
                result = new Expr.Subscript(result, subscriptList(subscript.subscriptList()), span);
            } else if (trailerCtx instanceof MetaModelParser.AttributeTrailerContext attribute) {
                result = new Expr.Attribute(result, attribute.NAME().getText(), span);
            } else {
                throw new IllegalStateException("Unhandled trailer: " + trailerCtx.getClass().getSimpleName());
            }
        }
        return result;
    }

    private void argumentList(MetaModelParser.ArgumentListContext ctx, List<Expr> args,
            List<Expr.Keyword> keywords) {
        for (MetaModelParser.ArgumentContext argumentCtx : ctx.argument()) {
            if (argumentCtx instanceof MetaModelParser.GeneratorArgumentContext generator) {
                args.add(comprehension(Expr.ComprehensionKind.GENERATOR, test(generator.test()), null,
                        generator.comprehensionFor(), span(generator)));
            } else if (argumentCtx instanceof MetaModelParser.KeywordArgumentContext keyword) {
                keywords.add(new Expr.Keyword(keyword.NAME().getText(), test(keyword.test()), span(keyword)));
            } else if (argumentCtx instanceof MetaModelParser.StarArgumentContext star) {
                args.add(new Expr.Starred(test(star.test()), span(star)));
            } else if (argumentCtx instanceof MetaModelParser.DoubleStarArgumentContext doubleStar) {
                keywords.add(new Expr.Keyword(null, test(doubleStar.test()), span(doubleStar)));
            } else if (argumentCtx instanceof MetaModelParser.PositionalArgumentContext positional) {
                args.add(namedExpression(positional.namedExpression()));
            } else {
                throw new IllegalStateException("Unhandled argument: " + argumentCtx.getClass().getSimpleName());
            }
        }
    }

    private Expr subscriptList(MetaModelParser.SubscriptListContext ctx) {
        List<MetaModelParser.SubscriptContext> subscripts = ctx.subscript();
        if (subscripts.size() == 1 && ctx.COMMA().isEmpty()) {
            return subscript(subscripts.get(0));
        }
        List<Expr> elements = new ArrayList<>();
        for (MetaModelParser.SubscriptContext subscriptCtx : subscripts) {
            elements.add(subscript(subscriptCtx));
        }
        return new Expr.Tuple(elements, span(ctx));
    }

    private Expr subscript(MetaModelParser.SubscriptContext ctx) {
        if (ctx.COLON().isEmpty()) {
            return test(ctx.test(0));
        }
        Expr lower = ctx.lower == null ? null : test(ctx.lower);
        Expr upper = ctx.upper == null ? null : test(ctx.upper);
        Expr step = ctx.step == null ? null : test(ctx.step);
        return new Expr.Slice(lower, upper, step, span(ctx));
    }

    private Expr atom(MetaModelParser.AtomContext ctx) {
        SourceSpan span = span(ctx);

        if (ctx instanceof MetaModelParser.ParenAtomContext paren) {
            if (paren.testListComprehension() == null) {
                return new Expr.Tuple(List.of(), span);
            }
            MetaModelParser.TestListComprehensionContext inner = paren.testListComprehension();
            if (inner.comprehensionFor() != null) {
                return comprehension(Expr.ComprehensionKind.GENERATOR, firstElement(inner), null,
                        inner.comprehensionFor(), span);
            }
            List<Expr> elements = elements(inner);
            if (elements.size() == 1 && inner.COMMA().isEmpty()) {
                return elements.get(0);
            }
            return new Expr.Tuple(elements, span);
        }
        if (ctx instanceof MetaModelParser.ListAtomContext list) {
            MetaModelParser.TestListComprehensionContext inner = list.testListComprehension();
            if (inner == null) {
                return new Expr.ListDisplay(List.of(), span);
            }
            if (inner.comprehensionFor() != null) {
                return comprehension(Expr.ComprehensionKind.LIST, firstElement(inner), null,
                        inner.comprehensionFor(), span);
            }
            return new Expr.ListDisplay(elements(inner), span);
        }
        if (ctx instanceof MetaModelParser.BraceAtomContext brace) {
            return braceAtom(brace.dictOrSetMaker(), span);
        }
        if (ctx instanceof MetaModelParser.NameAtomContext name) {
            return new Expr.Name(name.NAME().getText(), span);
        }
        if (ctx instanceof MetaModelParser.IntegerAtomContext integer) {
            return new Expr.Constant(parseInteger(integer.INTEGER().getText()), span);
        }
        if (ctx instanceof MetaModelParser.FloatAtomContext floating) {
            return new Expr.Constant(Double.parseDouble(floating.FLOAT_NUMBER().getText().replace("_", "")), span);
        }
        if (ctx instanceof MetaModelParser.StringAtomContext string) {
            StringBuilder value = new StringBuilder();
            for (TerminalNode piece : string.STRING()) {
                value.append(StringLiterals.decode(piece.getText()));
            }
            return new Expr.Constant(value.toString(), span);
        }
        if (ctx instanceof MetaModelParser.EllipsisAtomContext) {
            return new Expr.Ellipsis(span);
        }
        if (ctx instanceof MetaModelParser.NoneAtomContext) {
            return new Expr.Constant(null, span);
        }
        if (ctx instanceof MetaModelParser.TrueAtomContext) {
            return new Expr.Constant(Boolean.TRUE, span);
        }
        if (ctx instanceof MetaModelParser.FalseAtomContext) {
            return new Expr.Constant(Boolean.FALSE, span);
        }
        throw new IllegalStateException("Unhandled atom: " + ctx.getClass().getSimpleName());
    }

    private Expr braceAtom(MetaModelParser.DictOrSetMakerContext ctx, SourceSpan span) {
        if (ctx == null) {
            return new Expr.DictDisplay(List.of(), List.of(), span);
        }
        List<MetaModelParser.DictEntryContext> entries = ctx.dictEntry();
        if (!entries.isEmpty()) {
            if (ctx.comprehensionFor() != null) {
                MetaModelParser.DictEntryContext entry = entries.get(0);
                if (entry.POWER() != null) {
                    throw error("Dict unpacking cannot be used in a dict comprehension", entry);
                }
                return comprehension(Expr.ComprehensionKind.DICT, test(entry.test(0)), test(entry.test(1)),
                        ctx.comprehensionFor(), span);
            }
            List<Expr> keys = new ArrayList<>();
            List<Expr> values = new ArrayList<>();
            for (MetaModelParser.DictEntryContext entry : entries) {
                if (entry.POWER() != null) {
                    keys.add(null);
                    values.add(expr(entry.expr()));
                } else {
                    keys.add(test(entry.test(0)));
                    values.add(test(entry.test(1)));
                }
            }
            return new Expr.DictDisplay(keys, values, span);
        }

        if (ctx.comprehensionFor() != null) {
            return comprehension(Expr.ComprehensionKind.SET, test(ctx.test(0)), null, ctx.comprehensionFor(), span);
        }
        List<Expr> elements = new ArrayList<>();
        for (MetaModelParser.TestContext testCtx : ctx.test()) {
            elements.add(test(testCtx));
        }
        return new Expr.SetDisplay(elements, span);
    }

    private List<Expr> elements(MetaModelParser.TestListComprehensionContext ctx) {
        List<Expr> elements = new ArrayList<>();
        for (ParseTree child : ctx.children) {
            if (child instanceof MetaModelParser.NamedExpressionContext named) {
                elements.add(namedExpression(named));
            } else if (child instanceof MetaModelParser.StarExpressionContext star) {
                elements.add(new Expr.Starred(expr(star.expr()), span(star)));
            }
        }
        return elements;
    }

    private Expr firstElement(MetaModelParser.TestListComprehensionContext ctx) {
        return elements(ctx).get(0);
    }

    private Expr comprehension(Expr.ComprehensionKind kind, Expr element, Expr value,
            MetaModelParser.ComprehensionForContext forCtx, SourceSpan span) {
        List<Expr.ComprehensionClause> clauses = new ArrayList<>();

        MetaModelParser.ComprehensionForContext current = forCtx;
        while (current != null) {
            Expr target = exprList(current.exprList());
            Expr iterable = orTest(current.orTest());
            List<Expr> conditions = new ArrayList<>();
            MetaModelParser.ComprehensionForContext next = null;

            MetaModelParser.ComprehensionIterationContext iteration = current.comprehensionIteration();
            while (iteration != null) {
                if (iteration.comprehensionFor() != null) {
                    next = iteration.comprehensionFor();
                    break;
                }
                conditions.add(orTest(iteration.orTest()));
                iteration = iteration.comprehensionIteration();
            }

            clauses.add(new Expr.ComprehensionClause(target, iterable, conditions, span(current)));
            current = next;
        }
        return new Expr.Comprehension(kind, element, value, clauses, span);
    }

    private static BigInteger parseInteger(String text) {
        String digits = text.replace("_", "");
        if (digits.length() > 2 && digits.charAt(0) == '0') {
            switch (Character.toLowerCase(digits.charAt(1))) {
                case 'x':
                    return new BigInteger(digits.substring(2), 16);
                case 'o':
                    return new BigInteger(digits.substring(2), 8);
                case 'b':
                    return new BigInteger(digits.substring(2), 2);
                default:
                    break;
            }
        }
        return new BigInteger(digits);
    }

    // ------------------------------------------------------------------ Spans

    static SourceSpan span(ParserRuleContext ctx) {
        return span(ctx.getStart(), ctx.getStop());
    }

    private static SourceSpan span(ParserRuleContext from, ParserRuleContext to) {
        return span(from.getStart(), to.getStop());
    }

    private static SourceSpan span(Token token) {
        return span(token, token);
    }

    private static SourceSpan span(Token start, Token stop) {
        int begin = Math.max(0, start.getStartIndex());
        int end = stop == null ? begin : stop.getStopIndex() + 1;
        return new SourceSpan(begin, Math.max(begin, end));
    }

    private static MetaModelParseException error(String message, ParserRuleContext ctx) {
        Token start = ctx.getStart();
        return new MetaModelParseException(message, start.getLine(), start.getCharPositionInLine(),
                start.getStartIndex());
    }
}
