package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Diagnostic;
import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.LineIndex;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.intermediate.construction.ConstructorStatement;
import org.aascore.codegen.intermediate.construction.ConstructorTable;
import org.aascore.codegen.intermediate.hierarchy.Ontology;
import org.aascore.codegen.parse.ArgumentDefinition;
import org.aascore.codegen.parse.ClassDefinition;
import org.aascore.codegen.parse.ContractDefinition;
import org.aascore.codegen.parse.ContractsDefinition;
import org.aascore.codegen.parse.Definition;
import org.aascore.codegen.parse.DefinitionTable;
import org.aascore.codegen.parse.Description;
import org.aascore.codegen.parse.EnumerationDefinition;
import org.aascore.codegen.parse.EnumerationLiteralDefinition;
import org.aascore.codegen.parse.InvariantDefinition;
import org.aascore.codegen.parse.JsonSerialization;
import org.aascore.codegen.parse.MethodDefinition;
import org.aascore.codegen.parse.PropertyDefinition;
import org.aascore.codegen.parse.SnapshotDefinition;
import org.aascore.codegen.parse.TypeExpression;
import org.aascore.codegen.parse.XmlSerialization;
import org.aascore.codegen.parse.syntax.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Translates the syntax-level definitions into the final symbol table.
 *
 * <p>References to classes and enumerations are resolved in two passes. While
 * the symbols are built, every such reference becomes the shared
 * {@link SymbolReference} of its name, so a symbol may refer to one declared
 * later. Once all symbols exist, every reference is bound exactly once.
 *
 * <p>Errors do not stop the translation; all of them are reported together.
 */
public final class Translator {

    private static final Logger log = LoggerFactory.getLogger(Translator.class);

    /**
     * Names taken by infrastructure that generators emit next to the classes, compared in lower case.
     */
    static final Set<String> RESERVED_SYMBOL_NAMES = Set.of(
            "aas", "accept", "context", "class", "error", "errors", "iclass",
            "itransformer_with_context", "ivisitor", "ivisitor_with_context", "jsonization",
            "path", "stringification", "transform", "transformer", "transformer_with_context",
            "verification", "visit", "visitation", "visitor", "visitor_with_context");

    static final Set<String> RESERVED_MEMBER_NAMES = Set.of(
            "descend", "descend_once", "accept", "transform", "model_type",
            "property_name", "type_name", "match");

    /**
     * Number of subscripts expected by each generic type.
     */
    private static final Map<String, Integer> ARITY = Map.of(
            "List", 1,
            "Sequence", 1,
            "Set", 1,
            "Optional", 1,
            "Final", 1,
            "Mapping", 2,
            "MutableMapping", 2);

    private final DefinitionTable table;
    private final Ontology ontology;
    private final ConstructorTable<ConstructorStatement.AssignArgument> constructors;
    private final LineIndex source;

    private final Map<Identifier, SymbolReference> references = new LinkedHashMap<>();
    private final List<Diagnostic> errors = new ArrayList<>();

    private final Map<Identifier, Symbol> built = new LinkedHashMap<>();
    private final Map<Identifier, List<Property>> ownProperties = new LinkedHashMap<>();
    private final Map<Identifier, List<Method>> ownMethods = new LinkedHashMap<>();
    private final Map<Identifier, List<Invariant>> ownInvariants = new LinkedHashMap<>();
    private final Map<Identifier, Contracts> ownConstructorContracts = new LinkedHashMap<>();

    /**
     * Resolved ``with_model_type`` of every translated class; null if neither the class nor an antecedent sets it.
     */
    private final Map<Identifier, ModelTypeSetting> modelTypeSettings = new LinkedHashMap<>();

    /**
     * A ``with_model_type`` value together with the class that declared it.
     */
    private record ModelTypeSetting(boolean value, Identifier source) {
    }

    private Translator(
            DefinitionTable table,
            Ontology ontology,
            ConstructorTable<ConstructorStatement.AssignArgument> constructors,
            LineIndex source) {
        this.table = table;
        this.ontology = ontology;
        this.constructors = constructors;
        this.source = source;
    }

    /**
     * @param table        Syntax-level definitions
     * @param ontology     Classes in topological order with their antecedents
     * @param constructors In-lined constructors of every class
     * @param source       Index of the meta-model text, used in error messages
     * @return The final symbol table
     * @throws MetaModelCompileException with every translation error found
     */
    public static SymbolTable translate(
            DefinitionTable table,
            Ontology ontology,
            ConstructorTable<ConstructorStatement.AssignArgument> constructors,
            LineIndex source) {
        return new Translator(table, ontology, constructors, source).run();
    }

    private SymbolTable run() {
        checkReservedSymbolNames();

        for (EnumerationDefinition enumeration : table.enumerations()) {
            translateEnumeration(enumeration);
        }

        for (ClassDefinition cls : ontology.classes()) {
            translateClass(cls);
        }
        checkModelTypeDiscrimination();

        for (Definition definition : table.definitions()) {
            checkDescriptions(definition);
        }

        if (!errors.isEmpty()) {
            log.debug("Translation failed with {} error(s)", errors.size());
            throw new MetaModelCompileException(errors);
        }

        List<Symbol> symbols = new ArrayList<>();
        for (Definition definition : table.definitions()) {
            symbols.add(built.get(definition.name()));
        }

        // Second pass: every symbol exists now.
        references.forEach((name, reference) -> reference.resolve(built.get(name)));
        log.debug("Resolved {} symbol reference(s)", references.size());

        return new SymbolTable(symbols);
    }

    private SymbolReference reference(Identifier name) {
        return references.computeIfAbsent(name, SymbolReference::new);
    }

    // ------------------------------------------------------------------ Reserved names

    private void checkReservedSymbolNames() {
        for (Definition definition : table.definitions()) {
            if (RESERVED_SYMBOL_NAMES.contains(definition.name().value().toLowerCase(Locale.ROOT))) {
                errors.add(new Diagnostic(definition.span(),
                        "The name of the symbol " + definition.name()
                                + " is reserved for the generated code; please rename it"));
            }
        }
    }

    private void checkReservedMemberName(Identifier cls, Identifier member, SourceSpan span) {
        if (RESERVED_MEMBER_NAMES.contains(member.value())) {
            throw new MetaModelCompileException(span,
                    "The member name " + member + " of the class " + cls
                            + " is reserved for the generated code; please rename it");
        }
    }

    // ------------------------------------------------------------------ Enumerations

    private void translateEnumeration(EnumerationDefinition definition) {
        List<EnumerationLiteral> literals = new ArrayList<>();
        for (EnumerationLiteralDefinition literal : definition.literals()) {
            literals.add(new EnumerationLiteral(literal.name(), literal.value(), literal.description(), literal.span()));
        }

        List<SymbolReference> subsets = new ArrayList<>();
        for (Identifier subsetName : definition.isSupersetOf()) {
            Definition subset = table.find(subsetName);
            if (subset == null) {
                errors.add(new Diagnostic(definition.span(),
                        "The enumeration " + definition.name()
                                + " is marked as a superset of a symbol which does not exist: " + subsetName));
            } else if (!(subset instanceof EnumerationDefinition subsetEnumeration)) {
                errors.add(new Diagnostic(definition.span(),
                        "The enumeration " + definition.name() + " is marked as a superset of "
                                + subsetName + ", but " + subsetName + " is not an enumeration"));
            } else {
                checkSuperset(definition, subsetEnumeration);
                subsets.add(reference(subsetName));
            }
        }

        built.put(definition.name(), new Enumeration(
                definition.name(), literals, subsets, definition.description(), definition.span()));
    }

    private void checkSuperset(EnumerationDefinition superset, EnumerationDefinition subset) {
        for (EnumerationLiteralDefinition literal : subset.literals()) {
            EnumerationLiteralDefinition counterpart = superset.findLiteral(literal.name());
            if (counterpart == null || !counterpart.value().equals(literal.value())) {
                errors.add(new Diagnostic(superset.span(),
                        "The literal " + literal.name() + " with the value " + quote(literal.value())
                                + " of the enumeration " + subset.name()
                                + " is missing in its superset " + superset.name()));
            }
        }
    }

    // ------------------------------------------------------------------ Classes

    private void translateClass(ClassDefinition cls) {
        int errorsBefore = errors.size();

        List<Property> properties = new ArrayList<>();
        for (PropertyDefinition property : cls.properties()) {
            try {
                checkReservedMemberName(cls.name(), property.name(), property.span());
                properties.add(new Property(
                        property.name(),
                        translateType(property.type(), property.span()),
                        property.readOnly(),
                        property.description(),
                        cls.name(),
                        property.span()));
            } catch (MetaModelCompileException e) {
                errors.addAll(e.getDiagnostics());
            }
        }
        ownProperties.put(cls.name(), properties);

        List<Method> methods = new ArrayList<>();
        for (MethodDefinition method : cls.methods()) {
            if (method.isConstructor()) {
                continue;
            }
            try {
                checkReservedMemberName(cls.name(), method.name(), method.span());
                methods.add(new Method(
                        method.name(),
                        translateArguments(method),
                        method.returns() == null ? null : translateType(method.returns(), method.span()),
                        method.description(),
                        translateContracts(method.contracts()),
                        method.implementationSpecific(),
                        cls.name(),
                        method.body(),
                        method.span()));
            } catch (MetaModelCompileException e) {
                errors.addAll(e.getDiagnostics());
            }
        }
        ownMethods.put(cls.name(), methods);

        List<Invariant> invariants = new ArrayList<>();
        for (InvariantDefinition invariant : cls.invariants()) {
            invariants.add(new Invariant(invariant.description(), invariant.condition(), cls.name(), invariant.span()));
        }
        ownInvariants.put(cls.name(), invariants);

        Constructor constructor = null;
        try {
            constructor = translateConstructor(cls);
        } catch (MetaModelCompileException e) {
            errors.addAll(e.getDiagnostics());
        }

        List<ClassDefinition> antecedents = ontology.antecedentsOf(cls.name());

        List<Property> stackedProperties = new ArrayList<>();
        List<Method> stackedMethods = new ArrayList<>();
        List<Invariant> stackedInvariants = new ArrayList<>();
        List<SymbolReference> antecedentReferences = new ArrayList<>();
        for (ClassDefinition antecedent : antecedents) {
            stackedProperties.addAll(ownProperties.getOrDefault(antecedent.name(), List.of()));
            stackedMethods.addAll(ownMethods.getOrDefault(antecedent.name(), List.of()));
            stackedInvariants.addAll(ownInvariants.getOrDefault(antecedent.name(), List.of()));
            antecedentReferences.add(reference(antecedent.name()));
        }
        stackedProperties.addAll(properties);
        stackedMethods.addAll(methods);
        stackedInvariants.addAll(invariants);

        if (constructor != null) {
            checkAssignments(cls, stackedProperties, constructor);
        }

        JsonSerialization jsonSerialization = resolveJsonSerialization(cls);

        if (errors.size() > errorsBefore) {
            return;
        }

        List<SymbolReference> parents = new ArrayList<>();
        for (Identifier parent : cls.inheritances()) {
            parents.add(reference(parent));
        }

        List<SymbolReference> concreteDescendants = new ArrayList<>();
        for (ClassDefinition descendant : ontology.descendantsOf(cls.name())) {
            if (!descendant.isAbstract()) {
                concreteDescendants.add(reference(descendant.name()));
            }
        }

        built.put(cls.name(), new ModelClass(
                cls.name(),
                cls.kind(),
                cls.implementationSpecific(),
                parents,
                antecedentReferences,
                concreteDescendants,
                stackedProperties,
                stackedMethods,
                constructor,
                stackedInvariants,
                jsonSerialization,
                cls.xmlSerialization() == null ? new XmlSerialization(null) : cls.xmlSerialization(),
                cls.description(),
                cls.span()));
    }

    private Constructor translateConstructor(ClassDefinition cls) {
        MethodDefinition init = cls.constructor();

        Contracts own = init == null
                ? new Contracts(List.of(), List.of(), List.of())
                : translateContracts(init.contracts());
        ownConstructorContracts.put(cls.name(), own);

        List<Contract> preconditions = new ArrayList<>();
        List<Snapshot> snapshots = new ArrayList<>();
        List<Contract> postconditions = new ArrayList<>();
        for (ClassDefinition antecedent : ontology.antecedentsOf(cls.name())) {
            Contracts inherited = ownConstructorContracts.get(antecedent.name());
            if (inherited != null) {
                preconditions.addAll(inherited.preconditions());
                snapshots.addAll(inherited.snapshots());
                postconditions.addAll(inherited.postconditions());
            }
        }
        preconditions.addAll(own.preconditions());
        snapshots.addAll(own.snapshots());
        postconditions.addAll(own.postconditions());

        return new Constructor(
                init == null ? List.of() : translateArguments(init),
                new Contracts(preconditions, snapshots, postconditions),
                constructors.mustFind(cls.name()),
                init != null && init.implementationSpecific());
    }

    private void checkAssignments(ClassDefinition cls, List<Property> properties, Constructor constructor) {
        Map<Identifier, Integer> counts = new LinkedHashMap<>();
        for (ConstructorStatement.AssignArgument statement : constructor.statements()) {
            counts.merge(statement.name(), 1, Integer::sum);
        }

        Map<Identifier, Property> propertiesByName = new LinkedHashMap<>();
        for (Property property : properties) {
            propertiesByName.put(property.name(), property);
        }
        Map<Identifier, Argument> argumentsByName = new LinkedHashMap<>();
        for (Argument argument : constructor.arguments()) {
            argumentsByName.put(argument.name(), argument);
        }

        // A mandatory property may only take an optional argument if a default replaces None.
        for (ConstructorStatement.AssignArgument statement : constructor.statements()) {
            Property property = propertiesByName.get(statement.name());
            Argument argument = argumentsByName.get(statement.argument());
            if (property == null || argument == null || property.type() instanceof TypeAnnotation.OptionalType) {
                continue;
            }
            if (argument.type() instanceof TypeAnnotation.OptionalType && statement.defaultValue() == null) {
                errors.add(new Diagnostic(statement.span(),
                        "The property " + property.name() + " of the class " + cls.name()
                                + " is not properly initialized in the constructor: it is mandatory, but the argument "
                                + argument.name() + " is optional and no default value is given"));
            }
        }

        for (Property property : properties) {
            int count = counts.getOrDefault(property.name(), 0);
            if (count == 0) {
                errors.add(new Diagnostic(cls.span(),
                        "The property " + property.name() + " of the class " + cls.name()
                                + " is not initialized in the constructor"));
            } else if (count > 1) {
                errors.add(new Diagnostic(cls.span(),
                        "The property " + property.name() + " of the class " + cls.name()
                                + " is initialized " + count + " times in the constructor"));
            }
        }
    }

    // ------------------------------------------------------------------ Serialization

    /**
     * Takes the class' own ``with_model_type`` or, if it has none, the one of its parents.
     * Parents come before their children in the ontology, so their settings are resolved already.
     */
    private JsonSerialization resolveJsonSerialization(ClassDefinition cls) {
        List<ModelTypeSetting> settings = new ArrayList<>();
        if (cls.jsonSerialization() != null) {
            settings.add(new ModelTypeSetting(cls.jsonSerialization().withModelType(), cls.name()));
        }
        for (Identifier parent : cls.inheritances()) {
            ModelTypeSetting inherited = modelTypeSettings.get(parent);
            if (inherited != null) {
                settings.add(inherited);
            }
        }

        ModelTypeSetting resolved = settings.isEmpty() ? null : settings.get(0);
        modelTypeSettings.put(cls.name(), resolved);

        for (ModelTypeSetting setting : settings) {
            if (setting.value() != resolved.value()) {
                errors.add(new Diagnostic(cls.span(),
                        "The serialization setting ``with_model_type`` between the class " + setting.source()
                                + " and " + resolved.source() + " is inconsistent"));
                break;
            }
        }

        return new JsonSerialization(resolved != null && resolved.value());
    }

    /**
     * A class used as a property type with concrete descendants is de-serialized by
     * dispatching on the model type, so it and all those descendants need ``with_model_type``.
     */
    private void checkModelTypeDiscrimination() {
        Set<Identifier> usedInProperties = new LinkedHashSet<>();
        for (Symbol symbol : built.values()) {
            if (symbol instanceof ModelClass cls) {
                for (Property property : cls.properties()) {
                    collectClassNames(property.type(), usedInProperties);
                }
            }
        }

        for (ClassDefinition definition : table.classes()) {
            if (!usedInProperties.contains(definition.name())
                    || !(built.get(definition.name()) instanceof ModelClass cls)
                    || cls.concreteDescendants().isEmpty()) {
                continue;
            }

            if (!cls.jsonSerialization().withModelType()) {
                errors.add(new Diagnostic(cls.span(),
                        "The class " + cls.name() + " has one or more concrete descendants ("
                                + cls.concreteDescendants().stream()
                                .map(SymbolReference::toString)
                                .collect(Collectors.joining(", "))
                                + "), but its serialization setting ``with_model_type`` has not been set; "
                                + "the model type is needed to discriminate at de-serialization"));
            }

            for (SymbolReference reference : cls.concreteDescendants()) {
                if (built.get(reference.name()) instanceof ModelClass descendant
                        && !descendant.jsonSerialization().withModelType()) {
                    errors.add(new Diagnostic(descendant.span(),
                            "The class " + descendant.name() + " needs the serialization setting "
                                    + "``with_model_type`` since it is a concrete descendant of the class "
                                    + cls.name() + ", which is used as a property type"));
                }
            }
        }
    }

    private void collectClassNames(TypeAnnotation type, Set<Identifier> names) {
        if (type instanceof TypeAnnotation.OurType ourType) {
            if (table.findClass(ourType.reference().name()) != null) {
                names.add(ourType.reference().name());
            }
        } else if (type instanceof TypeAnnotation.ListType list) {
            collectClassNames(list.items(), names);
        } else if (type instanceof TypeAnnotation.OptionalType optional) {
            collectClassNames(optional.value(), names);
        }
    }

    private List<Argument> translateArguments(MethodDefinition method) {
        List<Argument> arguments = new ArrayList<>();
        for (ArgumentDefinition argument : method.arguments()) {
            if (argument.type() instanceof TypeExpression.SelfType) {
                continue;
            }
            arguments.add(new Argument(
                    argument.name(),
                    translateType(argument.type(), argument.span()),
                    argument.defaultValue() == null ? null : translateDefault(argument),
                    argument.span()));
        }
        return arguments;
    }

    private Contracts translateContracts(ContractsDefinition contracts) {
        List<Contract> preconditions = new ArrayList<>();
        for (ContractDefinition contract : contracts.preconditions()) {
            preconditions.add(translateContract(contract));
        }
        List<Snapshot> snapshots = new ArrayList<>();
        for (SnapshotDefinition snapshot : contracts.snapshots()) {
            snapshots.add(new Snapshot(snapshot.args(), snapshot.capture(), snapshot.name(), snapshot.span()));
        }
        List<Contract> postconditions = new ArrayList<>();
        for (ContractDefinition contract : contracts.postconditions()) {
            postconditions.add(translateContract(contract));
        }
        return new Contracts(preconditions, snapshots, postconditions);
    }

    private static Contract translateContract(ContractDefinition contract) {
        return new Contract(contract.args(), contract.condition(), contract.description(), contract.span());
    }

    private Default translateDefault(ArgumentDefinition argument) {
        Expr node = argument.defaultValue();

        if (node instanceof Expr.Constant constant) {
            return new Default.DefaultConstant(constant.value());
        }

        if (node instanceof Expr.UnaryOp unary
                && unary.operator() == Expr.UnaryOperator.MINUS
                && unary.operand() instanceof Expr.Constant constant) {
            if (constant.value() instanceof BigInteger integer) {
                return new Default.DefaultConstant(integer.negate());
            }
            if (constant.value() instanceof Double number) {
                return new Default.DefaultConstant(-number);
            }
        }

        if (node instanceof Expr.Attribute attribute && attribute.value() instanceof Expr.Name enumName) {
            Identifier enumerationName = Identifier.of(enumName.id());
            EnumerationDefinition enumeration = table.findEnumeration(enumerationName);
            Identifier literal = Identifier.of(attribute.attr());
            if (enumeration != null && enumeration.findLiteral(literal) != null) {
                return new Default.DefaultEnumerationLiteral(reference(enumerationName), literal);
            }
        }

        throw new MetaModelCompileException(node.span(),
                "The default value of the argument " + argument.name() + " is not supported: "
                        + source.text(node.span()));
    }

    // ------------------------------------------------------------------ Type annotations

    private TypeAnnotation translateType(TypeExpression expression, SourceSpan span) {
        if (expression instanceof TypeExpression.Atomic atomic) {
            String name = atomic.identifier().value();
            if (PrimitiveType.isPrimitive(name)) {
                return new TypeAnnotation.Primitive(PrimitiveType.fromName(name));
            }
            if (ARITY.containsKey(name)) {
                throw new MetaModelCompileException(span,
                        "Expected the type annotation " + name + " to be subscripted, but it is used bare");
            }
            if (table.find(atomic.identifier()) == null) {
                throw new MetaModelCompileException(span,
                        "The type annotation could not be found in the symbol table: " + name);
            }
            return new TypeAnnotation.OurType(reference(atomic.identifier()));
        }

        if (expression instanceof TypeExpression.Subscripted subscripted) {
            String name = subscripted.identifier().value();
            Integer arity = ARITY.get(name);
            if (arity == null) {
                throw new MetaModelCompileException(span,
                        "Unexpected subscripted type annotation: " + subscripted.print());
            }
            if (subscripted.subscripts().size() != arity) {
                throw new MetaModelCompileException(span,
                        "Expected exactly " + arity + " type argument(s) for " + name + ", but got "
                                + subscripted.subscripts().size() + ": " + subscripted.print());
            }

            switch (name) {
                case "List":
                case "Sequence":
                    return new TypeAnnotation.ListType(translateType(subscripted.subscripts().get(0), span));
                case "Optional":
                    return new TypeAnnotation.OptionalType(translateType(subscripted.subscripts().get(0), span));
                case "Final":
                    throw new MetaModelCompileException(span,
                            "Unexpected ``Final`` outside of a property type: " + subscripted.print());
                default:
                    throw new MetaModelCompileException(span,
                            "The type annotation " + name + " is not supported in the intermediate representation: "
                                    + subscripted.print());
            }
        }

        throw new MetaModelCompileException(span,
                "Unexpected type annotation of ``self`` outside of the receiver argument");
    }

    // ------------------------------------------------------------------ Descriptions

    private void checkDescriptions(Definition definition) {
        checkDescription(definition.description());
        if (definition instanceof ClassDefinition cls) {
            for (PropertyDefinition property : cls.properties()) {
                checkDescription(property.description());
            }
            for (MethodDefinition method : cls.methods()) {
                checkDescription(method.description());
            }
        } else if (definition instanceof EnumerationDefinition enumeration) {
            for (EnumerationLiteralDefinition literal : enumeration.literals()) {
                checkDescription(literal.description());
            }
        }
    }

    private void checkDescription(Description description) {
        if (description == null) {
            return;
        }

        for (String reference : description.classReferences()) {
            if (!reference.startsWith(".")) {
                errors.add(new Diagnostic(description.span(),
                        "Expected the class reference to start with a dot, but got: " + reference));
                continue;
            }
            String name = reference.substring(1);
            if (!Identifier.isValid(name)) {
                errors.add(new Diagnostic(description.span(),
                        "Expected the class reference to be an identifier, but got: " + reference));
            } else if (table.find(Identifier.of(name)) == null) {
                errors.add(new Diagnostic(description.span(),
                        "The class reference could not be found in the symbol table: " + name));
            }
        }

        for (String reference : description.attributeReferences()) {
            if (!Identifier.isValid(reference)) {
                errors.add(new Diagnostic(description.span(),
                        "Expected the attribute reference to be an identifier, but got: " + reference));
            }
        }
    }

    private static String quote(String value) {
        return "\"" + value + "\"";
    }
}
