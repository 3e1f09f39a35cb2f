package org.aascore.codegen.intermediate;

import org.aascore.codegen.intermediate.construction.ConstructorDefault;
import org.aascore.codegen.intermediate.construction.ConstructorStatement;
import org.aascore.codegen.parse.Description;
import org.aascore.codegen.parse.tree.TreeDumper;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a symbol table as indented text. The output depends only on the
 * content of the table, so two compilations of the same meta-model dump
 * identically.
 */
public final class IntermediateDumper {

    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();

    private IntermediateDumper() {
    }

    public static String dump(SymbolTable table) {
        IntermediateDumper dumper = new IntermediateDumper();
        for (Symbol symbol : table.symbols()) {
            if (symbol instanceof Enumeration enumeration) {
                dumper.dumpEnumeration(enumeration);
            } else if (symbol instanceof ModelClass cls) {
                dumper.dumpClass(cls);
            }
        }
        return dumper.out.toString();
    }

    private void dumpEnumeration(Enumeration enumeration) {
        line(0, "Enumeration " + enumeration.name());
        dumpDescription(1, enumeration.description());
        if (!enumeration.isSupersetOf().isEmpty()) {
            line(1, "is superset of: " + names(enumeration.isSupersetOf()));
        }
        for (EnumerationLiteral literal : enumeration.literals()) {
            line(1, "literal " + literal.name() + " = " + quote(literal.value()));
            dumpDescription(2, literal.description());
        }
    }

    private void dumpClass(ModelClass cls) {
        line(0, (cls.isAbstract() ? "AbstractClass " : "ConcreteClass ") + cls.name());
        dumpDescription(1, cls.description());
        line(1, "implementation specific: " + cls.implementationSpecific());
        line(1, "parents: " + names(cls.parents()));
        line(1, "antecedents: " + names(cls.antecedents()));
        line(1, "concrete descendants: " + names(cls.concreteDescendants()));
        line(1, "json serialization: with_model_type=" + cls.jsonSerialization().withModelType());
        line(1, "xml serialization: property_as_text="
                + (cls.xmlSerialization().propertyAsText() == null ? "None" : cls.xmlSerialization().propertyAsText()));

        for (Property property : cls.properties()) {
            line(1, "property " + property.name() + ": " + property.type().print()
                    + (property.readOnly() ? " (read-only)" : "")
                    + " from " + property.specifiedFor());
            dumpDescription(2, property.description());
        }

        dumpConstructor(cls.constructor());

        for (Method method : cls.methods()) {
            line(1, "method " + method.name() + arguments(method.arguments())
                    + " -> " + (method.returns() == null ? "None" : method.returns().print())
                    + " from " + method.specifiedFor()
                    + (method.implementationSpecific() ? " (implementation specific)" : ""));
            dumpDescription(2, method.description());
            dumpContracts(2, method.contracts());
        }

        for (Invariant invariant : cls.invariants()) {
            line(1, "invariant from " + invariant.specifiedFor() + ": " + TreeDumper.dump(invariant.condition())
                    + (invariant.description() == null ? "" : " # " + invariant.description()));
        }
    }

    private void dumpConstructor(Constructor constructor) {
        line(1, "constructor" + arguments(constructor.arguments())
                + (constructor.implementationSpecific() ? " (implementation specific)" : ""));
        dumpContracts(2, constructor.contracts());
        for (ConstructorStatement.AssignArgument statement : constructor.statements()) {
            line(2, "self." + statement.name() + " = " + statement.argument()
                    + (statement.defaultValue() == null ? "" : " or " + constructorDefault(statement.defaultValue())));
        }
    }

    private void dumpContracts(int level, Contracts contracts) {
        for (Contract contract : contracts.preconditions()) {
            line(level, "require " + TreeDumper.dump(contract.condition()));
        }
        for (Snapshot snapshot : contracts.snapshots()) {
            line(level, "snapshot " + snapshot.name() + " = " + TreeDumper.dump(snapshot.capture()));
        }
        for (Contract contract : contracts.postconditions()) {
            line(level, "ensure " + TreeDumper.dump(contract.condition()));
        }
    }

    private void dumpDescription(int level, Description description) {
        if (description == null) {
            return;
        }
        line(level, "summary: " + description.summary().replace("\n", " "));
        for (String remark : description.remarks()) {
            line(level, "remark: " + remark.replace("\n", " "));
        }
        for (Description.Field field : description.fields()) {
            line(level, "field " + field.name() + ": " + field.body().replace("\n", " "));
        }
    }

    private void line(int level, String text) {
        out.append(INDENT.repeat(level)).append(text).append('\n');
    }

    private static String arguments(List<Argument> arguments) {
        return arguments.stream()
                .map(argument -> argument.name() + ": " + argument.type().print()
                        + (argument.defaultValue() == null ? "" : " = " + defaultValue(argument.defaultValue())))
                .collect(Collectors.joining(", ", "(", ")"));
    }

    private static String defaultValue(Default value) {
        if (value instanceof Default.DefaultEnumerationLiteral literal) {
            return literal.enumeration().name() + "." + literal.literal();
        }
        Object constant = ((Default.DefaultConstant) value).value();
        if (constant == null) {
            return "None";
        }
        if (constant instanceof Boolean bool) {
            return bool ? "True" : "False";
        }
        if (constant instanceof String text) {
            return quote(text);
        }
        return constant.toString();
    }

    private static String constructorDefault(ConstructorDefault value) {
        if (value instanceof ConstructorDefault.EnumLiteral literal) {
            return literal.enumeration() + "." + literal.literal();
        }
        return "[]";
    }

    private static String names(List<SymbolReference> references) {
        return references.stream()
                .map(SymbolReference::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
