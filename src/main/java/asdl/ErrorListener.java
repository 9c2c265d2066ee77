package asdl;

import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

import asdl.schema.Diagnostic;
import asdl.schema.DiagnosticKind;
import asdl.source.Location;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Collects ANTLR syntax errors as diagnostics instead of printing them.
 */
public class ErrorListener extends BaseErrorListener {
    private final List<Diagnostic> errors = Lists.newArrayList();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer,
            Object offendingSymbol, int line, int charPositionInLine,
            String msg, RecognitionException e) {
        String offending = "<input>";
        int length = 1;
        if (offendingSymbol instanceof Token) {
            Token t = (Token) offendingSymbol;
            offending = t.getType() == Token.EOF ? "<EOF>" : t.getText();
            length = Math.max(1, offending.length());
        }
        Location location = Location.of(line, charPositionInLine + 1, line, charPositionInLine + length);
        errors.add(new Diagnostic(DiagnosticKind.SCHEMA_SYNTAX, offending, location, msg));
    }

    public int getErrCount() {
        return errors.size();
    }

    public List<Diagnostic> getErrors() {
        return ImmutableList.copyOf(errors);
    }

}
