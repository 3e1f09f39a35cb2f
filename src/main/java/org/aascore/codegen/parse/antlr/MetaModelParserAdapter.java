package org.aascore.codegen.parse.antlr;

import org.aascore.codegen.common.MetaModelParseException;
import org.aascore.codegen.parse.syntax.Module;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Parses meta-model source text into the host syntax tree using the
 * ANTLR-generated MetaModelLexer/MetaModelParser.
 */
public final class MetaModelParserAdapter {

    private MetaModelParserAdapter() {
        // Static utility class
    }

    /**
     * @param source The meta-model source text
     * @return The host syntax tree
     * @throws MetaModelParseException if the source is not valid in the host grammar
     */
    public static Module parse(String source) {
        MetaModelLexer lexer = new MetaModelLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorListener());

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        MetaModelParser parser = new MetaModelParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ErrorListener());

        MetaModelParser.ModuleContext tree = parser.module();
        return new SyntaxTreeBuilder().visitModule(tree);
    }

    /**
     * Error listener that converts ANTLR errors to MetaModelParseException.
     */
    private static class ErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            int offset = offendingSymbol instanceof Token token ? token.getStartIndex() : -1;
            throw new MetaModelParseException(msg, line, charPositionInLine, offset);
        }
    }
}
