/*
 * Copyright (c) 2025, Oracle and/or its affiliates. All rights reserved.
 * DO NOT ALTER OR REMOVE COPYRIGHT NOTICES OR THIS FILE HEADER.
 *
 * This code is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License version 2 only, as
 * published by the Free Software Foundation.  Oracle designates this
 * particular file as subject to the "Classpath" exception as provided
 * by Oracle in the LICENSE file that accompanied this code.
 *
 * This code is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE.  See the GNU General Public License
 * version 2 for more details (a copy is included in the LICENSE file that
 * accompanied this code).
 *
 * You should have received a copy of the GNU General Public License version
 * 2 along with this work; if not, write to the Free Software Foundation,
 * Inc., 51 Franklin St, Fifth Floor, Boston, MA 02110-1301 USA.
 *
 * Please contact Oracle, 500 Oracle Parkway, Redwood Shores, CA 94065 USA
 * or visit www.oracle.com if you need additional information or have any
 * questions.
 */

package lsp.internal.json;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.logging.Logger;

import lsp.json.JsonArray;
import lsp.json.JsonBoolean;
import lsp.json.JsonNull;
import lsp.json.JsonNumber;
import lsp.json.JsonObject;
import lsp.json.JsonParseException;
import lsp.json.JsonString;
import lsp.json.JsonValue;

/// Parses a JSON Document char[] into a tree of JsonValues.
///
/// Single pass, recursive descent, no backtracking within a production. The
/// first error throws a `JsonParseException` carrying the position; nothing
/// built so far escapes. Strings are read one code unit per source `char`, so
/// four-hex-digit unicode escapes are stored individually and surrogate pairs are never
/// combined.
public final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    /// System property holding the maximum array/object nesting depth
    public static final String MAX_DEPTH_PROPERTY = "lsp.json.parser.maxDepth";

    static final int DEFAULT_MAX_DEPTH = 512;

    static final int MAX_DEPTH;

    static {
        final String propertyValue = System.getProperty(MAX_DEPTH_PROPERTY);
        int depth = DEFAULT_MAX_DEPTH;
        if (propertyValue != null) {
            try {
                depth = Integer.parseInt(propertyValue.trim());
                if (depth < 1) {
                    throw new NumberFormatException("not positive");
                }
                final int configured = depth;
                LOG.fine(() -> "JSON parser max depth set to " + configured + " via system property");
            } catch (NumberFormatException e) {
                LOG.warning(() -> "Invalid JSON parser max depth: " + propertyValue +
                                  ". Using default: " + DEFAULT_MAX_DEPTH);
                depth = DEFAULT_MAX_DEPTH;
            }
        }
        MAX_DEPTH = depth;
    }

    // Access to the underlying JSON contents
    private final char[] doc;
    private final int maxDepth;
    // Current offset during parsing
    private int offset;
    // Current array/object nesting
    private int depth;

    public JsonParser(char[] doc) {
        this(doc, MAX_DEPTH);
    }

    JsonParser(char[] doc, int maxDepth) {
        this.doc = doc;
        this.maxDepth = maxDepth;
    }

    /// Parses the whole document as exactly one JSON value.
    ///
    /// @return the root value
    /// @throws JsonParseException on the first grammar violation, duplicate
    ///         member name, excessive nesting or trailing content
    public JsonValue parseRoot() {
        JsonValue root = parseValue();
        if (hasInput()) {
            throw failure("Unexpected content after the root value");
        }
        return root;
    }

    /*
     * Parse any one of the JSON value types: object, array, number, string,
     * true, false, or null. Whitespace around the value is consumed.
     */
    JsonValue parseValue() {
        skipWhitespaces();
        if (!hasInput()) {
            throw failure("Expected a value");
        }
        JsonValue value;
        char c = doc[offset];
        if (matchesLiteral("false")) {
            value = JsonBoolean.of(false);
        } else if (matchesLiteral("true")) {
            value = JsonBoolean.of(true);
        } else if (matchesLiteral("null")) {
            value = JsonNull.of();
        } else if (c == '-' || isDigit(c)) {
            value = parseNumber();
        } else if (c == '{') {
            offset++;
            value = parseObject();
        } else if (c == '[') {
            offset++;
            value = parseArray();
        } else if (c == '"') {
            offset++;
            value = JsonString.of(parseString());
        } else {
            throw failure("Unexpected character '%s'".formatted(c));
        }
        skipWhitespaces();
        return value;
    }

    /*
     * Consumes `literal` if the remaining input starts with it.
     */
    private boolean matchesLiteral(String literal) {
        int len = literal.length();
        if (doc.length - offset < len) {
            return false;
        }
        for (int i = 0; i < len; i++) {
            if (doc[offset + i] != literal.charAt(i)) {
                return false;
            }
        }
        offset += len;
        return true;
    }

    /*
     * The cursor is past the opening '{'. Members are stored in document
     * order; a repeated name fails the parse.
     */
    private JsonObject parseObject() {
        enterContainer();
        var members = new LinkedHashMap<String, JsonValue>();
        skipWhitespaces();
        if (charEquals('}')) {
            depth--;
            return new JsonObjectImpl(members);
        }
        while (true) {
            if (!charEquals('"')) {
                throw failure("Expected a quoted member name");
            }
            int nameOffset = offset - 1;
            String name = parseString();
            skipWhitespaces();
            if (!charEquals(':')) {
                throw failure("Expected ':' after member name");
            }
            JsonValue value = parseValue();
            if (members.putIfAbsent(name, value) != null) {
                throw failure("Duplicate member name \"%s\"".formatted(name), nameOffset);
            }
            if (charEquals(',')) {
                skipWhitespaces();
            } else if (charEquals('}')) {
                depth--;
                return new JsonObjectImpl(members);
            } else {
                throw failure("Expected ',' or '}' in object");
            }
        }
    }

    /*
     * The cursor is past the opening '['.
     */
    private JsonArray parseArray() {
        enterContainer();
        var elements = new ArrayList<JsonValue>();
        skipWhitespaces();
        if (charEquals(']')) {
            depth--;
            return new JsonArrayImpl(elements);
        }
        while (true) {
            elements.add(parseValue());
            if (charEquals(',')) {
                continue;
            }
            if (charEquals(']')) {
                depth--;
                return new JsonArrayImpl(elements);
            }
            throw failure("Expected ',' or ']' in array");
        }
    }

    private void enterContainer() {
        if (++depth > maxDepth) {
            throw failure("Nesting deeper than " + maxDepth);
        }
    }

    /*
     * The cursor is past the opening '"'. Collects code units up to the
     * closing quote, resolving escapes.
     */
    private String parseString() {
        var sb = new StringBuilder();
        while (hasInput()) {
            char c = doc[offset++];
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\') {
                sb.append(parseEscape());
            } else {
                sb.append(c);
            }
        }
        throw failure("Unterminated string");
    }

    /*
     * The cursor is past the '\'.
     */
    private char parseEscape() {
        if (!hasInput()) {
            throw failure("Unterminated escape sequence");
        }
        char c = doc[offset++];
        return switch (c) {
            case '"' -> '"';
            case '\\' -> '\\';
            case '/' -> '/';
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case 'u' -> parseFourHex();
            default -> throw failure("Invalid escape sequence '\\%s'".formatted(c), offset - 2);
        };
    }

    private char parseFourHex() {
        int value = 0;
        for (int i = 0; i < 4; i++) {
            int digit = hasInput() ? hexValue(doc[offset]) : -1;
            if (digit < 0) {
                throw failure("Expected four hex digits in unicode escape");
            }
            value = value << 4 | digit;
            offset++;
        }
        return (char) value;
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    /*
     * Validates the number grammar, then converts the lexeme with the
     * conventional base-10 scale: ((integral + fraction) * 10^exponent),
     * correctly rounded to a double.
     */
    private JsonNumber parseNumber() {
        int start = offset;
        charEquals('-');
        // No leading zeroes: a zero integral part is a single '0'
        if (!charEquals('0')) {
            if (!hasInput() || !isDigit(doc[offset])) {
                throw failure("Expected a digit");
            }
            skipDigits();
        }
        if (charEquals('.')) {
            if (!hasInput() || !isDigit(doc[offset])) {
                throw failure("Expected a digit after the decimal point");
            }
            skipDigits();
        }
        if (charEquals('e') || charEquals('E')) {
            if (!charEquals('-')) {
                charEquals('+');
            }
            if (!hasInput() || !isDigit(doc[offset])) {
                throw failure("Expected a digit in the exponent");
            }
            skipDigits();
        }
        double value = Double.parseDouble(new String(doc, start, offset - start));
        if (!Double.isFinite(value)) {
            throw failure("Number out of range", start);
        }
        return new JsonNumberImpl(value);
    }

    private void skipDigits() {
        while (hasInput() && isDigit(doc[offset])) {
            offset++;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    // Unlike Character.isWhitespace, only the four JSON whitespace characters
    private void skipWhitespaces() {
        while (hasInput()) {
            char c = doc[offset];
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                break;
            }
            offset++;
        }
    }

    /*
     * Consumes the current char if it equals `c`.
     */
    private boolean charEquals(char c) {
        if (hasInput() && doc[offset] == c) {
            offset++;
            return true;
        }
        return false;
    }

    private boolean hasInput() {
        return offset < doc.length;
    }

    private JsonParseException failure(String message) {
        return failure(message, offset);
    }

    // Line and column are only computed once a document is rejected
    private JsonParseException failure(String message, int at) {
        int pos = Math.min(at, doc.length);
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < pos; i++) {
            if (doc[i] == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new JsonParseException(message, pos, line, pos - lineStart + 1);
    }
}
