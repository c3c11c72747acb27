package com.tasklens.server.core.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;

import java.io.IOException;

/**
 * Two-space pretty printer producing {@code "key": value} pairs, one array element per line
 * and {@code []} / {@code {}} for empty containers. Matches the layout other tools expect
 * in the dumped {@code index.json} and raw files.
 */
public class IndentedJsonPrinter extends DefaultPrettyPrinter {

    private static final DefaultIndenter LINE_INDENTER = new DefaultIndenter("  ", "\n");

    public IndentedJsonPrinter() {
        indentObjectsWith(LINE_INDENTER);
        indentArraysWith(LINE_INDENTER);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
        return new IndentedJsonPrinter();
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
        g.writeRaw(": ");
    }

    @Override
    public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
        if (!_objectIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfEntries > 0) {
            _objectIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw('}');
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
