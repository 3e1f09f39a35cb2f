package org.aascore.codegen.parse;

import org.aascore.codegen.common.Diagnostic;
import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.LineIndex;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.rules.ExpressionParser;
import org.aascore.codegen.parse.syntax.Arguments;
import org.aascore.codegen.parse.syntax.Expr;
import org.aascore.codegen.parse.syntax.Module;
import org.aascore.codegen.parse.syntax.Stmt;
import org.aascore.codegen.parse.tree.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Walks the top-level class definitions of a meta-model into syntax-level
 * definitions.
 *
 * <p>Each definition is built independently: the first problem inside a
 * definition aborts that definition, and the errors of all failed definitions
 * are reported together, each wrapped in a diagnostic naming the definition.
 */
public final class ModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(ModelBuilder.class);

    private static final Identifier SELF = Identifier.of("self");
    private static final Identifier OLD = Identifier.of("OLD");
    private static final Identifier RESULT = Identifier.of("result");

    private final LineIndex source;
    private final ExpressionParser expressions;
    private final TypeExpressionParser types;

    public ModelBuilder(LineIndex source) {
        this.source = source;
        this.expressions = new ExpressionParser(source);
        this.types = new TypeExpressionParser(source);
    }

    /**
     * @param module The parsed meta-model; imports are expected to be checked already
     * @return The syntax-level table
     * @throws MetaModelCompileException carrying one diagnostic per failed definition,
     *                                   or the verification errors of the whole table
     */
    public DefinitionTable build(Module module) {
        List<Definition> definitions = new ArrayList<>();
        List<Diagnostic> errors = new ArrayList<>();

        for (Stmt stmt : module.body()) {
            // Module constants and imports are not part of the model
            if (!(stmt instanceof Stmt.ClassDef classDef)) {
                continue;
            }

            try {
                definitions.add(buildDefinition(classDef));
            } catch (MetaModelCompileException e) {
                errors.add(new Diagnostic(classDef.span(),
                        "Failed to parse the class definition: " + classDef.name(), e.getDiagnostics()));
            }
        }

        if (!errors.isEmpty()) {
            log.debug("{} definition(s) failed to parse", errors.size());
            throw new MetaModelCompileException(errors);
        }

        List<Diagnostic> verificationErrors = verify(definitions);
        if (!verificationErrors.isEmpty()) {
            log.debug("Verification of the definitions failed with {} error(s)", verificationErrors.size());
            throw new MetaModelCompileException(verificationErrors);
        }

        log.debug("Built {} definition(s)", definitions.size());
        return new DefinitionTable(definitions);
    }

    // ------------------------------------------------------------ Definitions

    Definition buildDefinition(Stmt.ClassDef node) {
        List<Diagnostic> underlying = new ArrayList<>();

        if (node.name().toLowerCase(Locale.ROOT).equals("verification")) {
            underlying.add(new Diagnostic(node.span(),
                    "The name of the class is reserved for aas-core: '" + node.name() + "'"));
        }

        List<String> baseNames = new ArrayList<>();
        for (Expr base : node.bases()) {
            if (base instanceof Expr.Name name) {
                baseNames.add(name.id());
            } else {
                underlying.add(new Diagnostic(base.span(),
                        "Expected a base as a name, but got: " + source.text(base.span())));
            }
        }

        for (Expr.Keyword keyword : node.keywords()) {
            underlying.add(new Diagnostic(keyword.span(),
                    "Unexpected keyword argument in the class bases: " + source.text(keyword.span())));
        }

        if (!underlying.isEmpty()) {
            throw new MetaModelCompileException(underlying);
        }

        if (baseNames.contains("Enum")) {
            if (baseNames.size() > 1) {
                throw new MetaModelCompileException(node.span(),
                        "Expected an enumeration to only inherit from ``Enum``, but it inherits from: " + baseNames);
            }
            return buildEnumeration(node);
        }

        // DBC only carries the contracts at runtime of the meta-model itself
        List<Identifier> inheritances = new ArrayList<>();
        for (String baseName : baseNames) {
            if (!baseName.equals("DBC")) {
                inheritances.add(Identifier.of(baseName));
            }
        }
        return buildClass(node, inheritances);
    }

    private EnumerationDefinition buildEnumeration(Stmt.ClassDef node) {
        List<Identifier> isSupersetOf = null;

        for (Expr decorator : node.decorators()) {
            String decoratorName = decorator instanceof Expr.Call call && call.func() instanceof Expr.Name name
                    ? name.id()
                    : null;

            if ("is_superset_of".equals(decoratorName)) {
                if (isSupersetOf != null) {
                    throw new MetaModelCompileException(decorator.span(),
                            "Double definitions of ``is_superset_of`` are not allowed");
                }
                isSupersetOf = parseIsSupersetOf((Expr.Call) decorator);
            } else if ("reference_in_the_book".equals(decoratorName)) {
                // References to the book are not carried into the model.
                continue;
            } else {
                throw new MetaModelCompileException(decorator.span(),
                        "We do not know how to handle this decorator for an Enum: " + source.text(decorator.span()));
            }
        }

        Description description = null;
        List<EnumerationLiteralDefinition> literals = new ArrayList<>();

        List<Stmt> body = node.body();
        int cursor = 0;
        while (cursor < body.size()) {
            Stmt stmt = body.get(cursor);

            if (cursor == 0 && docstringOf(stmt) != null) {
                description = DescriptionParser.parse(docstringOf(stmt));
                cursor++;
            } else if (stmt instanceof Stmt.Pass) {
                cursor++;
            } else if (stmt instanceof Stmt.Assign assign) {
                Description literalDescription = null;
                if (cursor + 1 < body.size() && docstringOf(body.get(cursor + 1)) != null) {
                    literalDescription = DescriptionParser.parse(docstringOf(body.get(cursor + 1)));
                    cursor++;
                }
                literals.add(buildLiteral(assign, literalDescription));
                cursor++;
            } else {
                throw new MetaModelCompileException(stmt.span(),
                        "Expected either a docstring or an assignment in an enumeration, but got: "
                                + source.text(stmt.span()));
            }
        }

        return new EnumerationDefinition(
                Identifier.of(node.name()),
                isSupersetOf == null ? List.of() : isSupersetOf,
                literals,
                description,
                node.span());
    }

    private List<Identifier> parseIsSupersetOf(Expr.Call decorator) {
        Expr enumsNode = null;
        if (!decorator.args().isEmpty()) {
            enumsNode = decorator.args().get(0);
        } else {
            for (Expr.Keyword keyword : decorator.keywords()) {
                if ("enums".equals(keyword.arg())) {
                    enumsNode = keyword.value();
                }
            }
        }

        if (enumsNode == null) {
            throw new MetaModelCompileException(decorator.span(),
                    "The ``enums`` argument is missing in the ``is_superset_of`` decorator");
        }

        if (!(enumsNode instanceof Expr.ListDisplay list)) {
            throw new MetaModelCompileException(enumsNode.span(),
                    "Expected the ``enums`` argument of the ``is_superset_of`` to be a list literal, but it is not");
        }

        List<Identifier> names = new ArrayList<>();
        for (Expr element : list.elements()) {
            if (!(element instanceof Expr.Name name)) {
                throw new MetaModelCompileException(element.span(),
                        "Expected all elements of the ``enums`` argument to the ``is_superset_of`` "
                                + "to be enumeration names, but got: " + source.text(element.span()));
            }
            names.add(Identifier.of(name.id()));
        }
        return names;
    }

    private EnumerationLiteralDefinition buildLiteral(Stmt.Assign assign, Description description) {
        if (assign.targets().size() != 1) {
            throw new MetaModelCompileException(assign.span(),
                    "Expected a single target in the assignment, but got: " + assign.targets().size());
        }

        Expr target = assign.targets().get(0);
        if (!(target instanceof Expr.Name name)) {
            throw new MetaModelCompileException(target.span(),
                    "Expected a name as a target of the assignment, but got: " + source.text(target.span()));
        }

        if (!(assign.value() instanceof Expr.Constant constant)) {
            throw new MetaModelCompileException(assign.value().span(),
                    "Expected a constant in the enumeration assignment, but got: "
                            + source.text(assign.value().span()));
        }

        if (!constant.isString()) {
            throw new MetaModelCompileException(constant.span(),
                    "Expected a string literal in the enumeration, but got: " + source.text(constant.span()));
        }

        return new EnumerationLiteralDefinition(
                Identifier.of(name.id()), (String) constant.value(), description, assign.span());
    }

    private ClassDefinition buildClass(Stmt.ClassDef node, List<Identifier> inheritances) {
        List<Diagnostic> underlying = new ArrayList<>();

        boolean isAbstract = false;
        boolean implementationSpecific = false;
        List<InvariantDefinition> invariants = new ArrayList<>();
        JsonSerialization json = null;
        XmlSerialization xml = null;

        for (Expr decorator : node.decorators()) {
            try {
                if (decorator instanceof Expr.Name marker) {
                    if (marker.id().equals("abstract")) {
                        isAbstract = true;
                    } else if (marker.id().equals("implementation_specific")) {
                        implementationSpecific = true;
                    } else {
                        throw new MetaModelCompileException(decorator.span(),
                                "The handling of the marker has not been implemented: '" + marker.id() + "'");
                    }
                } else if (decorator instanceof Expr.Call call && call.func() instanceof Expr.Name function) {
                    switch (function.id()) {
                        case "invariant" -> invariants.add(parseInvariant(call));
                        case "json_serialization" -> {
                            if (json != null) {
                                throw new MetaModelCompileException(decorator.span(),
                                        "Repeated markings for JSON serialization are not allowed");
                            }
                            json = parseJsonSerialization(call);
                        }
                        case "xml_serialization" -> {
                            if (xml != null) {
                                throw new MetaModelCompileException(decorator.span(),
                                        "Repeated markings for XML serialization are not allowed");
                            }
                            xml = parseXmlSerialization(call);
                        }
                        case "reference_in_the_book" -> {
                            // References to the book are not carried into the model.
                        }
                        default -> throw new MetaModelCompileException(decorator.span(),
                                "Handling of a decorator has not been implemented: '" + function.id() + "'");
                    }
                } else {
                    throw new MetaModelCompileException(decorator.span(),
                            "Handling of a decorator has not been implemented: " + source.text(decorator.span()));
                }
            } catch (MetaModelCompileException e) {
                underlying.addAll(e.getDiagnostics());
            }
        }

        if (!underlying.isEmpty()) {
            throw new MetaModelCompileException(underlying);
        }

        if (isAbstract && implementationSpecific) {
            throw new MetaModelCompileException(node.span(),
                    "Abstract classes can not be implementation-specific at the same time "
                            + "(otherwise we can not convert them to interfaces etc.)");
        }

        Description description = null;
        List<PropertyDefinition> properties = new ArrayList<>();
        List<MethodDefinition> methods = new ArrayList<>();

        List<Stmt> body = node.body();
        int cursor = 0;
        while (cursor < body.size()) {
            Stmt stmt = body.get(cursor);

            if (cursor == 0 && docstringOf(stmt) != null) {
                description = DescriptionParser.parse(docstringOf(stmt));
                cursor++;
            } else if (stmt instanceof Stmt.Pass) {
                cursor++;
            } else if (stmt instanceof Stmt.AnnAssign annAssign) {
                Description propertyDescription = null;
                if (cursor + 1 < body.size() && docstringOf(body.get(cursor + 1)) != null) {
                    propertyDescription = DescriptionParser.parse(docstringOf(body.get(cursor + 1)));
                    cursor++;
                }

                try {
                    properties.add(buildProperty(annAssign, propertyDescription));
                } catch (MetaModelCompileException e) {
                    underlying.add(new Diagnostic(stmt.span(), "Failed to parse a property", e.getDiagnostics()));
                }
                cursor++;
            } else if (stmt instanceof Stmt.FunctionDef functionDef) {
                try {
                    methods.add(buildMethod(functionDef));
                } catch (MetaModelCompileException e) {
                    underlying.add(new Diagnostic(stmt.span(),
                            "Failed to parse the method: " + functionDef.name(), e.getDiagnostics()));
                }
                cursor++;
            } else {
                underlying.add(new Diagnostic(stmt.span(),
                        "Expected only either properties explicitly annotated with types or instance methods, "
                                + "but got: " + source.text(stmt.span())));
                cursor++;
            }
        }

        if (!underlying.isEmpty()) {
            throw new MetaModelCompileException(underlying);
        }

        return new ClassDefinition(
                Identifier.of(node.name()),
                isAbstract ? ClassKind.ABSTRACT : ClassKind.CONCRETE,
                implementationSpecific,
                inheritances,
                properties,
                methods,
                invariants,
                json,
                xml,
                description,
                node.span());
    }

    // -------------------------------------------------------- Class decorators

    private InvariantDefinition parseInvariant(Expr.Call decorator) {
        Expr conditionNode = decorator.args().size() >= 1 ? decorator.args().get(0) : null;
        Expr descriptionNode = decorator.args().size() >= 2 ? decorator.args().get(1) : null;

        for (Expr.Keyword keyword : decorator.keywords()) {
            if ("condition".equals(keyword.arg())) {
                conditionNode = keyword.value();
            } else if ("description".equals(keyword.arg())) {
                descriptionNode = keyword.value();
            } else {
                throw new MetaModelCompileException(keyword.span(),
                        "Handling of the keyword argument '" + keyword.arg()
                                + "' for the invariant has not been implemented");
            }
        }

        if (!(conditionNode instanceof Expr.Lambda lambda)) {
            throw new MetaModelCompileException(decorator.span(),
                    "Expected the condition of an invariant to be a lambda, but got: "
                            + source.text(decorator.span()));
        }

        String description = descriptionNode == null ? null : stringLiteral(descriptionNode,
                "Expected the description of an invariant to be a string literal");

        List<Identifier> args = lambdaArguments(lambda);
        if (args.size() != 1 || !args.get(0).equals(SELF)) {
            throw new MetaModelCompileException(decorator.span(),
                    "Expected the invariant to have a single argument, ``self``");
        }

        Expression condition;
        try {
            condition = expressions.parseExpression(lambda.body());
        } catch (MetaModelCompileException e) {
            throw new MetaModelCompileException(
                    new Diagnostic(lambda.body().span(), "Failed to parse the invariant", e.getDiagnostics()));
        }

        return new InvariantDefinition(description, condition, decorator.span());
    }

    private JsonSerialization parseJsonSerialization(Expr.Call decorator) {
        Expr withModelTypeNode = decorator.args().isEmpty() ? null : decorator.args().get(0);

        for (Expr.Keyword keyword : decorator.keywords()) {
            if ("with_model_type".equals(keyword.arg())) {
                withModelTypeNode = keyword.value();
            } else {
                throw new MetaModelCompileException(keyword.span(),
                        "Handling of the keyword argument '" + keyword.arg()
                                + "' for the json_serialization has not been implemented");
            }
        }

        if (withModelTypeNode == null) {
            return new JsonSerialization(false);
        }

        if (!(withModelTypeNode instanceof Expr.Constant constant) || !(constant.value() instanceof Boolean value)) {
            throw new MetaModelCompileException(withModelTypeNode.span(),
                    "Expected the value for ``with_model_type`` parameter to be a boolean, but got: "
                            + source.text(withModelTypeNode.span()));
        }
        return new JsonSerialization(value);
    }

    private XmlSerialization parseXmlSerialization(Expr.Call decorator) {
        Expr propertyAsTextNode = decorator.args().isEmpty() ? null : decorator.args().get(0);

        for (Expr.Keyword keyword : decorator.keywords()) {
            if ("property_as_text".equals(keyword.arg())) {
                propertyAsTextNode = keyword.value();
            } else {
                throw new MetaModelCompileException(keyword.span(),
                        "Handling of the keyword argument '" + keyword.arg()
                                + "' for the xml_serialization has not been implemented");
            }
        }

        if (propertyAsTextNode == null) {
            return new XmlSerialization(null);
        }

        String propertyAsText = stringLiteral(propertyAsTextNode,
                "Expected the value for ``property_as_text`` parameter to be a string");
        if (!Identifier.isValid(propertyAsText)) {
            throw new MetaModelCompileException(propertyAsTextNode.span(),
                    "Expected the value for ``property_as_text`` parameter to be a valid identifier, but got: "
                            + propertyAsText);
        }
        return new XmlSerialization(Identifier.of(propertyAsText));
    }

    // -------------------------------------------------------------- Properties

    private PropertyDefinition buildProperty(Stmt.AnnAssign node, Description description) {
        if (!(node.target() instanceof Expr.Name name)) {
            throw new MetaModelCompileException(node.target().span(),
                    "Expected property target to be a name, but got: " + source.text(node.target().span()));
        }

        if (!node.simple()) {
            throw new MetaModelCompileException(node.target().span(),
                    "Expected a property with a simple target (no parentheses!)");
        }

        TypeExpression type = types.parse(node.annotation());

        if (node.value() != null) {
            throw new MetaModelCompileException(node.value().span(),
                    "Unexpected assignment of a value to a property");
        }

        boolean readOnly = false;
        if (type instanceof TypeExpression.Subscripted subscripted
                && subscripted.identifier().value().equals("Final")) {
            if (subscripted.subscripts().size() != 1) {
                throw new MetaModelCompileException(node.annotation().span(),
                        "Expected a single subscript for Final type, but got " + subscripted.subscripts().size());
            }

            type = subscripted.subscripts().get(0);
            readOnly = true;

            if (containsFinal(type)) {
                throw new MetaModelCompileException(node.annotation().span(),
                        "Unexpected nested Final type qualifier: " + source.text(node.annotation().span()));
            }
        } else if (containsFinal(type)) {
            throw new MetaModelCompileException(node.annotation().span(),
                    "Unexpected nested Final type qualifier: " + source.text(node.annotation().span()));
        }

        return new PropertyDefinition(Identifier.of(name.id()), type, readOnly, description, node.span());
    }

    private static boolean containsFinal(TypeExpression type) {
        if (type instanceof TypeExpression.Atomic atomic) {
            return atomic.identifier().value().equals("Final");
        }
        if (type instanceof TypeExpression.Subscripted subscripted) {
            if (subscripted.identifier().value().equals("Final")) {
                return true;
            }
            for (TypeExpression subscript : subscripted.subscripts()) {
                if (containsFinal(subscript)) {
                    return true;
                }
            }
        }
        return false;
    }

    // ----------------------------------------------------------------- Methods

    MethodDefinition buildMethod(Stmt.FunctionDef node) {
        String name = node.name();

        if (!name.equals("__init__") && name.startsWith("__") && name.endsWith("__")) {
            throw new MetaModelCompileException(node.span(),
                    "Among all dunder methods, only ``__init__`` is expected, but got: " + name);
        }

        List<ContractDefinition> preconditions = new ArrayList<>();
        List<SnapshotDefinition> snapshots = new ArrayList<>();
        List<ContractDefinition> postconditions = new ArrayList<>();
        boolean implementationSpecific = false;

        for (Expr decorator : node.decorators()) {
            if (decorator instanceof Expr.Call call) {
                if (!(call.func() instanceof Expr.Name function)) {
                    throw new MetaModelCompileException(decorator.span(),
                            "Unexpected non-name decorator of a method: " + source.text(call.func().span()));
                }
                switch (function.id()) {
                    case "require" -> preconditions.add(parseContract(call));
                    case "ensure" -> postconditions.add(parseContract(call));
                    case "snapshot" -> snapshots.add(parseSnapshot(call));
                    default -> throw new MetaModelCompileException(decorator.span(),
                            "Unexpected decorator of a method: " + function.id()
                                    + "; expected at most ``require``, ``ensure`` or ``snapshot``");
                }
            } else if (decorator instanceof Expr.Name marker) {
                if (!marker.id().equals("implementation_specific")) {
                    throw new MetaModelCompileException(decorator.span(),
                            "Unexpected simple decorator of a method: " + marker.id()
                                    + "; expected at most ``implementation_specific``");
                }
                implementationSpecific = true;
            } else {
                throw new MetaModelCompileException(decorator.span(),
                        "Expected decorators of a method to be only names and calls, but got: "
                                + source.text(decorator.span()));
            }
        }

        // Decorators apply bottom-up, so the declared order is the reverse of the collected one.
        Collections.reverse(preconditions);
        Collections.reverse(snapshots);
        Collections.reverse(postconditions);

        Description description = null;
        List<Stmt> body = node.body();
        if (!body.isEmpty() && docstringOf(body.get(0)) != null) {
            description = DescriptionParser.parse(docstringOf(body.get(0)));
            body = body.subList(1, body.size());
        }

        List<ArgumentDefinition> arguments;
        try {
            arguments = buildArguments(node.args());
        } catch (MetaModelCompileException e) {
            throw new MetaModelCompileException(new Diagnostic(node.span(),
                    "Failed to parse arguments of the method: " + name, e.getDiagnostics()));
        }

        if (node.returns() == null) {
            throw new MetaModelCompileException(node.span(),
                    "Unexpected method without a type annotation for the result: " + name);
        }

        TypeExpression returns = null;
        if (!(node.returns() instanceof Expr.Constant constant && constant.isNone())) {
            returns = types.parse(node.returns());
        }

        Set<Identifier> argumentNames = new HashSet<>();
        for (ArgumentDefinition argument : arguments) {
            argumentNames.add(argument.name());
        }

        for (ContractDefinition contract : preconditions) {
            for (Identifier arg : contract.args()) {
                if (!argumentNames.contains(arg)) {
                    throw new MetaModelCompileException(contract.span(),
                            "The argument of the precondition is not provided in the method: " + arg);
                }
            }
        }

        for (ContractDefinition contract : postconditions) {
            for (Identifier arg : contract.args()) {
                if (arg.equals(OLD)) {
                    if (snapshots.isEmpty()) {
                        throw new MetaModelCompileException(contract.span(),
                                "The argument OLD of the postcondition is not provided since there were "
                                        + "no snapshots defined for the method: " + name);
                    }
                } else if (!arg.equals(RESULT) && !argumentNames.contains(arg)) {
                    throw new MetaModelCompileException(contract.span(),
                            "The argument of the postcondition is not provided in the method: " + arg);
                }
            }
        }

        for (SnapshotDefinition snapshot : snapshots) {
            for (Identifier arg : snapshot.args()) {
                if (!argumentNames.contains(arg)) {
                    throw new MetaModelCompileException(snapshot.span(),
                            "The argument of the snapshot is not provided in the method: " + arg);
                }
            }
        }

        if (name.equals("__init__") && returns != null) {
            throw new MetaModelCompileException(node.returns().span(),
                    "Expected __init__ to return None, but got: " + source.text(node.returns().span()));
        }

        return new MethodDefinition(
                Identifier.of(name),
                arguments,
                returns,
                description,
                new ContractsDefinition(preconditions, snapshots, postconditions),
                implementationSpecific,
                body,
                node.span());
    }

    private List<ArgumentDefinition> buildArguments(Arguments node) {
        if (!node.positionalOnly().isEmpty()) {
            throw new MetaModelCompileException(node.span(), "Unexpected positional-only arguments");
        }
        if (node.varArg() != null || node.kwArg() != null) {
            throw new MetaModelCompileException(node.span(), "Unexpected variable arguments");
        }
        if (!node.keywordOnly().isEmpty()) {
            throw new MetaModelCompileException(node.span(), "Unexpected keyword-only arguments");
        }
        if (node.args().isEmpty()) {
            throw new MetaModelCompileException(node.span(), "Unexpected no arguments");
        }

        Arguments.Parameter self = node.args().get(0);
        if (!self.name().equals("self")) {
            throw new MetaModelCompileException(node.span(), "Unexpected no ``self`` in arguments");
        }
        if (self.annotation() != null) {
            throw new MetaModelCompileException(self.span(),
                    "Unexpected type annotation for the method argument ``self``");
        }
        if (self.defaultValue() != null) {
            throw new MetaModelCompileException(self.span(),
                    "Unexpected default value for the method argument ``self``");
        }

        List<ArgumentDefinition> arguments = new ArrayList<>();
        arguments.add(new ArgumentDefinition(SELF, new TypeExpression.SelfType(), null, self.span()));

        for (Arguments.Parameter parameter : node.args().subList(1, node.args().size())) {
            if (parameter.annotation() == null) {
                throw new MetaModelCompileException(parameter.span(),
                        "Unexpected method argument without a type annotation: " + parameter.name());
            }

            TypeExpression type;
            try {
                type = types.parse(parameter.annotation());
            } catch (MetaModelCompileException e) {
                throw new MetaModelCompileException(new Diagnostic(parameter.span(),
                        "Failed to parse the type annotation of the method argument " + parameter.name() + ": "
                                + source.text(parameter.annotation().span()),
                        e.getDiagnostics()));
            }

            if (containsFinal(type)) {
                throw new MetaModelCompileException(parameter.span(),
                        "Unexpected ``Final`` in the type annotation of the method argument "
                                + parameter.name() + ": " + source.text(parameter.annotation().span()));
            }

            arguments.add(new ArgumentDefinition(
                    Identifier.of(parameter.name()), type, parameter.defaultValue(), parameter.span()));
        }
        return arguments;
    }

    private ContractDefinition parseContract(Expr.Call decorator) {
        Expr conditionNode = decorator.args().size() >= 1 ? decorator.args().get(0) : null;
        Expr descriptionNode = decorator.args().size() >= 2 ? decorator.args().get(1) : null;

        for (Expr.Keyword keyword : decorator.keywords()) {
            if ("condition".equals(keyword.arg())) {
                conditionNode = keyword.value();
            } else if ("description".equals(keyword.arg())) {
                descriptionNode = keyword.value();
            }
        }

        if (conditionNode == null) {
            throw new MetaModelCompileException(decorator.span(),
                    "Expected the condition to be defined for a contract");
        }

        if (!(conditionNode instanceof Expr.Lambda lambda)) {
            throw new MetaModelCompileException(conditionNode.span(),
                    "Expected a lambda function as a contract condition, but got: "
                            + source.text(conditionNode.span()));
        }

        String description = descriptionNode == null ? null : stringLiteral(descriptionNode,
                "Expected a string literal as a contract description");

        Expression condition;
        try {
            condition = expressions.parseExpression(lambda.body());
        } catch (MetaModelCompileException e) {
            throw new MetaModelCompileException(new Diagnostic(lambda.body().span(),
                    "Failed to parse the contract condition", e.getDiagnostics()));
        }

        return new ContractDefinition(lambdaArguments(lambda), condition, description, decorator.span());
    }

    private SnapshotDefinition parseSnapshot(Expr.Call decorator) {
        Expr captureNode = decorator.args().size() >= 1 ? decorator.args().get(0) : null;
        Expr nameNode = decorator.args().size() >= 2 ? decorator.args().get(1) : null;

        for (Expr.Keyword keyword : decorator.keywords()) {
            if ("capture".equals(keyword.arg())) {
                captureNode = keyword.value();
            } else if ("name".equals(keyword.arg())) {
                nameNode = keyword.value();
            }
        }

        if (captureNode == null) {
            throw new MetaModelCompileException(decorator.span(),
                    "Expected the capture to be defined for a snapshot");
        }

        if (!(captureNode instanceof Expr.Lambda lambda)) {
            throw new MetaModelCompileException(captureNode.span(),
                    "Expected a lambda function as a capture of a snapshot, but got: "
                            + source.text(captureNode.span()));
        }

        List<Identifier> args = lambdaArguments(lambda);

        String name;
        if (nameNode != null) {
            name = stringLiteral(nameNode, "Expected a string literal as a capture name");
        } else if (args.size() == 1) {
            name = args.get(0).value();
        } else {
            throw new MetaModelCompileException(decorator.span(),
                    "Expected the name of the snapshot to be defined, but there was neither "
                            + "the single argument in the capture nor explicit ``name`` given");
        }

        if (!Identifier.isValid(name)) {
            throw new MetaModelCompileException(nameNode != null ? nameNode.span() : decorator.span(),
                    "Expected a capture name to be a valid identifier, but got: '" + name + "'");
        }

        Expression capture;
        try {
            capture = expressions.parseExpression(lambda.body());
        } catch (MetaModelCompileException e) {
            throw new MetaModelCompileException(new Diagnostic(lambda.body().span(),
                    "Failed to parse the snapshot capture", e.getDiagnostics()));
        }

        return new SnapshotDefinition(args, capture, Identifier.of(name), decorator.span());
    }

    // ------------------------------------------------------------ Verification

    private List<Diagnostic> verify(List<Definition> definitions) {
        List<Diagnostic> errors = new ArrayList<>();

        Map<Identifier, Definition> byName = new HashMap<>();
        for (Definition definition : definitions) {
            Definition previous = byName.putIfAbsent(definition.name(), definition);
            if (previous != null) {
                errors.add(new Diagnostic(definition.span(),
                        "The symbol with the name " + definition.name() + " has been already defined"));
            }
        }

        for (Definition definition : definitions) {
            if (!(definition instanceof ClassDefinition cls)) {
                continue;
            }

            for (Identifier inheritance : cls.inheritances()) {
                Definition parent = byName.get(inheritance);
                if (parent == null) {
                    errors.add(new Diagnostic(cls.span(),
                            "The inheritance for class " + cls.name() + " is dangling: " + inheritance));
                } else if (!(parent instanceof ClassDefinition)) {
                    errors.add(new Diagnostic(cls.span(),
                            "Expected the class " + cls.name() + " to inherit from a class, "
                                    + "but it inherits from an enumeration: " + parent.name()));
                }
            }
        }
        return errors;
    }

    // ----------------------------------------------------------------- Helpers

    private static Expr.Constant docstringOf(Stmt stmt) {
        if (stmt instanceof Stmt.ExprStmt exprStmt
                && exprStmt.value() instanceof Expr.Constant constant
                && constant.isString()) {
            return constant;
        }
        return null;
    }

    private String stringLiteral(Expr node, String expectation) {
        if (node instanceof Expr.Constant constant && constant.isString()) {
            return (String) constant.value();
        }
        throw new MetaModelCompileException(node.span(), expectation + ", but got: " + source.text(node.span()));
    }

    private static List<Identifier> lambdaArguments(Expr.Lambda lambda) {
        List<Identifier> args = new ArrayList<>();
        for (Arguments.Parameter parameter : lambda.args().args()) {
            args.add(Identifier.of(parameter.name()));
        }
        return args;
    }
}
