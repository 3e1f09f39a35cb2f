package org.aascore.codegen;

import org.aascore.codegen.common.Diagnostic;
import org.aascore.codegen.common.LineIndex;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.common.MetaModelParseException;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.intermediate.SymbolTable;
import org.aascore.codegen.intermediate.Translator;
import org.aascore.codegen.intermediate.construction.ConstructorInliner;
import org.aascore.codegen.intermediate.construction.ConstructorStatement;
import org.aascore.codegen.intermediate.construction.ConstructorTable;
import org.aascore.codegen.intermediate.construction.ConstructorUnderstander;
import org.aascore.codegen.intermediate.hierarchy.Ontology;
import org.aascore.codegen.intermediate.hierarchy.OntologyResolver;
import org.aascore.codegen.parse.DefinitionTable;
import org.aascore.codegen.parse.ImportChecker;
import org.aascore.codegen.parse.ModelBuilder;
import org.aascore.codegen.parse.antlr.MetaModelParserAdapter;
import org.aascore.codegen.parse.syntax.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles the text of a meta-model into the symbol table consumed by code
 * generators.
 *
 * The phases run in sequence, each on the complete output of the previous one:
 * <ol>
 *   <li>parsing of the host grammar and the import whitelist,</li>
 *   <li>building the syntax-level definitions,</li>
 *   <li>resolving the inheritance hierarchy,</li>
 *   <li>understanding the constructors,</li>
 *   <li>in-lining the constructors along the hierarchy,</li>
 *   <li>translating into the final symbol table.</li>
 * </ol>
 * A phase that fails reports all errors it found and the later phases do not run.
 */
public final class MetaModelCompiler {

    private static final Logger log = LoggerFactory.getLogger(MetaModelCompiler.class);

    /**
     * @param source The text of the meta-model
     * @return The validated symbol table
     * @throws MetaModelCompileException with the complete, ordered error report
     */
    public SymbolTable compile(String source) {
        LineIndex index = new LineIndex(source);

        Module module = parse(source);
        ImportChecker.verify(module);

        DefinitionTable table = new ModelBuilder(index).build(module);
        log.debug("Built {} definition(s)", table.definitions().size());

        Ontology ontology = OntologyResolver.resolve(table);
        ConstructorTable<ConstructorStatement> understood = new ConstructorUnderstander(table, index).understandAll();
        ConstructorTable<ConstructorStatement.AssignArgument> inlined = ConstructorInliner.inline(understood, ontology);

        SymbolTable symbolTable = Translator.translate(table, ontology, inlined, index);
        log.info("Compiled the meta-model with {} enumeration(s) and {} class(es)",
                symbolTable.enumerations().size(), symbolTable.classes().size());
        return symbolTable;
    }

    /**
     * Formats the errors of a failed compilation, one line per diagnostic,
     * nested diagnostics indented below their parent.
     *
     * @param source    The text that was compiled
     * @param exception The failure raised by {@link #compile(String)}
     */
    public String render(String source, MetaModelCompileException exception) {
        return new LineIndex(source).render(exception.getDiagnostics());
    }

    private static Module parse(String source) {
        try {
            return MetaModelParserAdapter.parse(source);
        } catch (MetaModelParseException e) {
            log.debug("Failed to parse the meta-model: {}", e.getMessage());
            SourceSpan span = e.getOffset() >= 0 ? new SourceSpan(e.getOffset(), e.getOffset()) : null;
            throw new MetaModelCompileException(new Diagnostic(span,
                    "Failed to parse the meta-model: " + e.getDetail()));
        }
    }
}
