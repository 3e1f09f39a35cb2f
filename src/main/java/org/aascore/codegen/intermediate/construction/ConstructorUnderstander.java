package org.aascore.codegen.intermediate.construction;

import org.aascore.codegen.common.Diagnostic;
import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.LineIndex;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.ArgumentDefinition;
import org.aascore.codegen.parse.ClassDefinition;
import org.aascore.codegen.parse.DefinitionTable;
import org.aascore.codegen.parse.EnumerationDefinition;
import org.aascore.codegen.parse.MethodDefinition;
import org.aascore.codegen.parse.syntax.Expr;
import org.aascore.codegen.parse.syntax.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies the statements of every {@code __init__} as either a call to a
 * parent constructor or an assignment of an argument to a property.
 *
 * <p>Only the forms that can be translated to every target language are
 * understood; anything else is rejected with a diagnostic naming the shape.
 */
public final class ConstructorUnderstander {

    private static final Logger log = LoggerFactory.getLogger(ConstructorUnderstander.class);

    private final DefinitionTable table;
    private final LineIndex source;

    public ConstructorUnderstander(DefinitionTable table, LineIndex source) {
        this.table = table;
        this.source = source;
    }

    /**
     * @return The understood statements of every class, in declaration order
     * @throws MetaModelCompileException with one diagnostic per class whose constructor
     *                                   could not be understood
     */
    public ConstructorTable<ConstructorStatement> understandAll() {
        Map<Identifier, List<ConstructorStatement>> mapping = new LinkedHashMap<>();
        List<Diagnostic> errors = new ArrayList<>();

        for (ClassDefinition cls : table.classes()) {
            try {
                mapping.put(cls.name(), understand(cls));
            } catch (MetaModelCompileException e) {
                errors.addAll(e.getDiagnostics());
            }
        }

        if (!errors.isEmpty()) {
            log.debug("Failed to understand {} constructor(s)", errors.size());
            throw new MetaModelCompileException(errors);
        }
        return new ConstructorTable<>(mapping);
    }

    /**
     * @return The statements of the class' {@code __init__}; empty if it has none
     */
    public List<ConstructorStatement> understand(ClassDefinition cls) {
        MethodDefinition init = cls.constructor();
        if (init == null) {
            return List.of();
        }

        List<Diagnostic> errors = new ArrayList<>();
        List<ConstructorStatement> result = new ArrayList<>();

        for (Stmt stmt : init.body()) {
            try {
                if (stmt instanceof Stmt.Pass) {
                    continue;
                }
                if (stmt instanceof Stmt.ExprStmt exprStmt && exprStmt.value() instanceof Expr.Call call) {
                    result.add(understandSuperCall(call, cls, init));
                } else if (stmt instanceof Stmt.Assign assign) {
                    result.add(understandAssignment(assign, cls, init));
                } else {
                    throw new MetaModelCompileException(stmt.span(),
                            "Unexpected statement in the body of ``__init__``: " + source.text(stmt.span())
                                    + "; only calls to super ``__init__``'s and property assignments expected");
                }
            } catch (MetaModelCompileException e) {
                errors.addAll(e.getDiagnostics());
            }
        }

        if (!errors.isEmpty()) {
            throw new MetaModelCompileException(new Diagnostic(init.span(),
                    "Failed to understand the constructor of the entity " + cls.name(), errors));
        }
        return result;
    }

    private ConstructorStatement.CallSuperConstructor understandSuperCall(
            Expr.Call call, ClassDefinition cls, MethodDefinition init) {

        if (!(call.func() instanceof Expr.Attribute attribute) || !attribute.attr().equals("__init__")) {
            throw new MetaModelCompileException(call.span(),
                    "Unexpected call in the body of ``__init__``: " + source.text(call.func().span())
                            + "; only calls to super ``__init__``'s are expected");
        }

        if (!(attribute.value() instanceof Expr.Name superNameNode)) {
            throw new MetaModelCompileException(attribute.value().span(),
                    "Expected a super class as a name for a call to super ``__init__``, but got: "
                            + source.text(attribute.value().span()));
        }

        Identifier superName = Identifier.of(superNameNode.id());
        if (!cls.inheritances().contains(superName)) {
            throw new MetaModelCompileException(superNameNode.span(),
                    "Expected a super class in the call to a super ``__init__``, but " + cls.name()
                            + " does not inherit from " + superName);
        }

        ClassDefinition superClass = table.findClass(superName);
        MethodDefinition superInit = superClass.constructor();
        if (superInit == null) {
            throw new MetaModelCompileException(attribute.span(),
                    "The super entity " + superName + " does not define a ``__init__``");
        }

        for (Expr.Keyword keyword : call.keywords()) {
            if (keyword.arg() == null) {
                throw new MetaModelCompileException(keyword.span(),
                        "Expected a call to a super ``__init__`` to provide only explicit keyword arguments, "
                                + "but got a double-star keyword argument");
            }
        }

        List<Diagnostic> errors = new ArrayList<>();
        List<Expr> argumentNodes = new ArrayList<>(call.args());
        for (Expr.Keyword keyword : call.keywords()) {
            argumentNodes.add(keyword.value());
        }
        for (Expr argumentNode : argumentNodes) {
            if (!(argumentNode instanceof Expr.Name)) {
                errors.add(new Diagnostic(argumentNode.span(),
                        "Expected only names in the arguments to super ``__init__``, but got: "
                                + source.text(argumentNode.span())));
            }
        }
        failIfAny(call, errors);

        if (call.args().size() > superInit.arguments().size()) {
            throw new MetaModelCompileException(call.span(),
                    "The ``" + superName + ".__init__`` expected " + superInit.arguments().size()
                            + " argument(s), but the call provides " + call.args().size()
                            + " positional argument(s)");
        }

        // Argument of the super constructor -> name passed for it
        Map<Identifier, String> resolved = new LinkedHashMap<>();
        for (int i = 0; i < call.args().size(); i++) {
            resolved.put(superInit.arguments().get(i).name(), ((Expr.Name) call.args().get(i)).id());
        }

        for (Expr.Keyword keyword : call.keywords()) {
            Identifier key = Identifier.of(keyword.arg());
            if (superInit.findArgument(key) == null) {
                errors.add(new Diagnostic(keyword.span(),
                        "The ``" + superName + ".__init__`` does not expect the argument " + keyword.arg()));
            } else {
                resolved.put(key, ((Expr.Name) keyword.value()).id());
            }
        }
        failIfAny(call, errors);

        for (Map.Entry<Identifier, String> entry : resolved.entrySet()) {
            Identifier key = entry.getKey();
            String value = entry.getValue();
            if (init.findArgument(Identifier.of(value)) == null) {
                errors.add(new Diagnostic(call.span(),
                        "Expected all the arguments to ``" + superName + ".__init__`` to be propagation "
                                + "of the original ``__init__`` arguments, but the name " + value
                                + " is not an argument of ``" + cls.name() + ".__init__``"));
            } else if (!key.value().equals(value)) {
                errors.add(new Diagnostic(call.span(),
                        "Expected the arguments to super ``__init__`` to be passed with the same names, "
                                + "but the argument " + key + " is passed as the name " + value));
            }
        }

        List<String> missing = new ArrayList<>();
        for (ArgumentDefinition argument : superInit.arguments()) {
            if (!resolved.containsKey(argument.name())) {
                missing.add(argument.name().value());
            }
        }
        if (!missing.isEmpty()) {
            errors.add(new Diagnostic(call.span(),
                    "The call to ``" + superName + ".__init__`` is missing one or more arguments: "
                            + String.join(", ", missing)));
        }
        failIfAny(call, errors);

        return new ConstructorStatement.CallSuperConstructor(superName, call.span());
    }

    private static void failIfAny(Expr.Call call, List<Diagnostic> errors) {
        if (!errors.isEmpty()) {
            throw new MetaModelCompileException(new Diagnostic(call.span(),
                    "Failed to parse the arguments to the super ``__init__``", errors));
        }
    }

    private ConstructorStatement.AssignArgument understandAssignment(
            Stmt.Assign assign, ClassDefinition cls, MethodDefinition init) {

        if (assign.targets().size() > 1) {
            throw new MetaModelCompileException(assign.span(),
                    "Expected only a single target for property assignment, but got "
                            + assign.targets().size() + " targets");
        }

        Expr target = assign.targets().get(0);
        if (!(target instanceof Expr.Attribute attribute
                && attribute.value() instanceof Expr.Name receiver
                && receiver.id().equals("self"))) {
            throw new MetaModelCompileException(target.span(),
                    "Expected a property as the target of an assignment, but got: " + source.text(target.span()));
        }

        Identifier propertyName = Identifier.of(attribute.attr());
        if (cls.findProperty(propertyName) == null) {
            throw new MetaModelCompileException(target.span(),
                    "The property has not been previously defined in " + cls.name() + ": " + propertyName);
        }

        Expr value = assign.value();

        if (value instanceof Expr.Name name) {
            if (init.findArgument(Identifier.of(name.id())) == null) {
                throw new MetaModelCompileException(value.span(),
                        "Expected the property " + propertyName + " to be assigned to an argument, "
                                + "but it was assigned to a non-argument variable: " + source.text(value.span()));
            }
            if (!propertyName.value().equals(name.id())) {
                throw new MetaModelCompileException(value.span(),
                        "Expected the property " + propertyName + " to be assigned exactly the argument "
                                + "with the same name, but got: " + source.text(value.span()));
            }
            return new ConstructorStatement.AssignArgument(propertyName, propertyName, null, assign.span());
        }

        if (value instanceof Expr.IfExp ifExp) {
            Identifier argument = forwardedArgument(ifExp, init);
            if (argument != null) {
                ConstructorDefault defaultValue = understandDefault(ifExp.orElse(), propertyName);
                return new ConstructorStatement.AssignArgument(propertyName, argument, defaultValue, assign.span());
            }
        }

        throw new MetaModelCompileException(assign.span(),
                "The handling of the constructor statement has not been implemented");
    }

    /**
     * @return The argument of {@code arg if arg is not None else ...}, or null if the
     * conditional has any other shape
     */
    private static Identifier forwardedArgument(Expr.IfExp ifExp, MethodDefinition init) {
        if (ifExp.test() instanceof Expr.Compare test
                && test.left() instanceof Expr.Name tested
                && init.findArgument(Identifier.of(tested.id())) != null
                && test.operators().size() == 1
                && test.operators().get(0) == Expr.CompareOperator.IS_NOT
                && test.comparators().get(0) instanceof Expr.Constant none
                && none.isNone()
                && ifExp.body() instanceof Expr.Name body
                && body.id().equals(tested.id())) {
            return Identifier.of(tested.id());
        }
        return null;
    }

    private ConstructorDefault understandDefault(Expr orElse, Identifier propertyName) {
        if (orElse instanceof Expr.ListDisplay list && list.elements().isEmpty()) {
            return new ConstructorDefault.EmptyList(orElse.span());
        }

        if (orElse instanceof Expr.Attribute attribute && attribute.value() instanceof Expr.Name enumName) {
            EnumerationDefinition enumeration = table.findEnumeration(Identifier.of(enumName.id()));
            Identifier literal = Identifier.of(attribute.attr());
            if (enumeration != null && enumeration.findLiteral(literal) != null) {
                return new ConstructorDefault.EnumLiteral(enumeration.name(), literal, orElse.span());
            }
        }

        throw new MetaModelCompileException(orElse.span(),
                "The handling of this default value for the property " + propertyName + " has not been implemented");
    }
}
