package org.aascore.codegen.parse;

import org.aascore.codegen.common.Diagnostic;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.syntax.Module;
import org.aascore.codegen.parse.syntax.Stmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rejects any top-level import of a name the meta-model is not expected to use.
 */
public final class ImportChecker {

    private static final Map<String, String> EXPECTED_IMPORTS = Map.ofEntries(
            Map.entry("Enum", "enum"),
            Map.entry("Final", "typing"),
            Map.entry("List", "typing"),
            Map.entry("Optional", "typing"),
            Map.entry("Sequence", "typing"),
            Map.entry("Set", "typing"),
            Map.entry("Mapping", "typing"),
            Map.entry("MutableMapping", "typing"),
            Map.entry("DBC", "icontract"),
            Map.entry("invariant", "icontract"),
            Map.entry("ensure", "icontract"),
            Map.entry("require", "icontract"),
            Map.entry("snapshot", "icontract"),
            Map.entry("abstract", "aas_core_meta.marker"),
            Map.entry("implementation_specific", "aas_core_meta.marker"),
            Map.entry("reference_in_the_book", "aas_core_meta.marker"),
            Map.entry("is_superset_of", "aas_core_meta.marker"),
            Map.entry("json_serialization", "aas_core_meta.marker"),
            Map.entry("xml_serialization", "aas_core_meta.marker"),
            Map.entry("are_unique", "aas_core_meta.verification"),
            Map.entry("is_IRI", "aas_core_meta.verification"),
            Map.entry("is_IRDI", "aas_core_meta.verification"),
            Map.entry("is_ID_short", "aas_core_meta.verification"));

    private ImportChecker() {
        // Static utility class
    }

    /**
     * @return The import errors in source order; empty if all imports are expected
     */
    public static List<Diagnostic> check(Module module) {
        List<Diagnostic> errors = new ArrayList<>();
        for (Stmt stmt : module.body()) {
            if (stmt instanceof Stmt.Import imp) {
                errors.add(new Diagnostic(imp.span(),
                        "Unexpected ``import ...``. Only ``from ... import...`` statements are expected."));
            } else if (stmt instanceof Stmt.ImportFrom importFrom) {
                checkImportFrom(importFrom, errors);
            }
        }
        return errors;
    }

    /**
     * @throws MetaModelCompileException carrying every import error
     */
    public static void verify(Module module) {
        List<Diagnostic> errors = check(module);
        if (!errors.isEmpty()) {
            throw new MetaModelCompileException(errors);
        }
    }

    private static void checkImportFrom(Stmt.ImportFrom importFrom, List<Diagnostic> errors) {
        String module = ".".repeat(importFrom.level()) + (importFrom.module() == null ? "" : importFrom.module());
        for (Stmt.Alias alias : importFrom.names()) {
            if (alias.asName() != null) {
                errors.add(new Diagnostic(alias.span(),
                        "Unexpected ``from ... import ... as ...``. "
                                + "Only ``from ... import...`` statements are expected."));
                continue;
            }

            String expectedModule = EXPECTED_IMPORTS.get(alias.name());
            if (expectedModule == null) {
                errors.add(new Diagnostic(alias.span(),
                        "Unexpected import of a name '" + alias.name() + "'."));
            } else if (!expectedModule.equals(module)) {
                errors.add(new Diagnostic(alias.span(),
                        "Expected to import '" + alias.name() + "' from the module " + expectedModule
                                + ", but it is imported from " + module + "."));
            }
        }
    }
}
