package org.aascore.codegen.parse.antlr;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Superclass of the generated {@code MetaModelLexer}.
 *
 * Turns leading whitespace into INDENT/DEDENT tokens, drops newlines inside
 * brackets and blank or comment-only lines, and closes all open blocks at the
 * end of input. Tokens are queued because one newline may produce several of
 * them.
 */
public abstract class MetaModelLexerBase extends Lexer {

    private static final int TAB_SIZE = 8;

    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int openBrackets = 0;
    private int lastEmittedType = -1;
    private boolean endReached = false;

    protected MetaModelLexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        super.setToken(token);
        pending.offer(token);
        if (token.getType() != Token.EOF) {
            lastEmittedType = token.getType();
        }
    }

    @Override
    public Token nextToken() {
        if (_input.LA(1) == EOF && !endReached) {
            endReached = true;
            pending.removeIf(token -> token.getType() == Token.EOF);

            if (lastEmittedType != -1
                    && lastEmittedType != MetaModelLexer.NEWLINE
                    && lastEmittedType != MetaModelLexer.DEDENT) {
                emit(syntheticToken(MetaModelLexer.NEWLINE, "\n"));
            }
            while (!indents.isEmpty()) {
                emit(syntheticToken(MetaModelLexer.DEDENT, ""));
                indents.pop();
            }
            emit(syntheticToken(Token.EOF, "<EOF>"));
        }

        Token next = super.nextToken();
        return pending.isEmpty() ? next : pending.poll();
    }

    @Override
    public void reset() {
        super.reset();
        pending.clear();
        indents.clear();
        openBrackets = 0;
        lastEmittedType = -1;
        endReached = false;
    }

    protected void openBracket() {
        openBrackets++;
    }

    protected void closeBracket() {
        if (openBrackets > 0) {
            openBrackets--;
        }
    }

    /**
     * Called at the end of every NEWLINE token (line break plus the
     * indentation of the following line).
     */
    protected void onNewLine() {
        String text = getText();
        String lineBreak = text.replaceAll("[^\r\n\f]+", "");
        String spaces = text.replaceAll("[\r\n\f]+", "");

        int next = _input.LA(1);
        boolean blankLine = next == '\r' || next == '\n' || next == '\f' || next == '#';

        if (openBrackets > 0 || (next != EOF && blankLine)) {
            skip();
            return;
        }

        if (lastEmittedType == -1 || lastEmittedType == MetaModelLexer.NEWLINE) {
            // Nothing precedes this line break on its logical line.
            skip();
            return;
        }

        emit(syntheticToken(MetaModelLexer.NEWLINE, lineBreak));

        int indent = indentationOf(spaces);
        int previous = indents.isEmpty() ? 0 : indents.peek();
        if (next == EOF) {
            return;
        }
        if (indent > previous) {
            indents.push(indent);
            emit(syntheticToken(MetaModelLexer.INDENT, spaces));
        } else {
            while (!indents.isEmpty() && indents.peek() > indent) {
                emit(syntheticToken(MetaModelLexer.DEDENT, ""));
                indents.pop();
            }
        }
    }

    static int indentationOf(String spaces) {
        int count = 0;
        for (char ch : spaces.toCharArray()) {
            if (ch == '\t') {
                count += TAB_SIZE - (count % TAB_SIZE);
            } else {
                count++;
            }
        }
        return count;
    }

    private CommonToken syntheticToken(int type, String text) {
        int stop = getCharIndex() - 1;
        int start = text.isEmpty() ? stop : stop - text.length() + 1;
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL,
                start, stop);
        token.setText(text);
        return token;
    }
}
