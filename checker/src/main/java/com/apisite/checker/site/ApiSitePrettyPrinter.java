package com.apisite.checker.site;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;

import java.io.IOException;

/**
 * Two-space indented output with {@code "key": value} separators, arrays one element per line and
 * empty containers written as {@code {}} and {@code []}.
 */
class ApiSitePrettyPrinter extends DefaultPrettyPrinter {
    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    ApiSitePrettyPrinter() {
        indentObjectsWith(INDENTER);
        indentArraysWith(INDENTER);
    }

    private ApiSitePrettyPrinter(ApiSitePrettyPrinter base) {
        super(base);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
        return new ApiSitePrettyPrinter(this);
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
