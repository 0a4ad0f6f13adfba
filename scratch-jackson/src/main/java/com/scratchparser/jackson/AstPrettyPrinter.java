package com.scratchparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;

import java.io.IOException;

/**
 * Pretty printer for syntax tree documents: two-space indentation with {@code \n} line
 * breaks, {@code "key": value} entries, one array element per line and {@code []} for empty
 * arrays.
 */
public class AstPrettyPrinter extends DefaultPrettyPrinter {

    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    public AstPrettyPrinter() {
        super(Separators.createDefaultInstance().withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        indentObjectsWith(INDENTER);
        indentArraysWith(INDENTER);
    }

    protected AstPrettyPrinter(AstPrettyPrinter base) {
        super(base);
    }

    @Override
    public AstPrettyPrinter createInstance() {
        return new AstPrettyPrinter(this);
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
        if (!_arrayIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfValues > 0) {
            _arrayIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw(']');
    }
}
