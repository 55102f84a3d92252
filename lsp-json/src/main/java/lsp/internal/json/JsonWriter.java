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

import java.util.Iterator;
import java.util.Map;

import lsp.json.JsonValue;

/// Renders a `JsonValue` tree as compact JSON text.
///
/// Rendering is total: every tree built through the public API has a JSON
/// text form, since `JsonNumber` never holds a non-finite value.
public final class JsonWriter {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    /// Integral doubles below this magnitude are written without a fraction
    private static final double EXACT_INTEGER_LIMIT = 0x1p53;

    // no instantiation is allowed for this class
    private JsonWriter() {}

    /// {@return the compact JSON text of `value`}
    public static String write(JsonValue value) {
        var out = new StringBuilder();
        write(value, out);
        return out.toString();
    }

    /// Appends the compact JSON text of `value` to `out`.
    public static void write(JsonValue value, StringBuilder out) {
        if (value.isObject()) {
            writeObject(value.asObject().members(), out);
        } else if (value.isArray()) {
            out.append('[');
            Iterator<JsonValue> it = value.asArray().elements().iterator();
            while (it.hasNext()) {
                write(it.next(), out);
                if (it.hasNext()) {
                    out.append(',');
                }
            }
            out.append(']');
        } else if (value.isString()) {
            writeString(value.string(), out);
        } else if (value.isNumber()) {
            out.append(formatNumber(value.number()));
        } else if (value.isBool()) {
            out.append(value.bool() ? "true" : "false");
        } else {
            out.append("null");
        }
    }

    private static void writeObject(Map<String, JsonValue> members, StringBuilder out) {
        out.append('{');
        Iterator<Map.Entry<String, JsonValue>> it = members.entrySet().iterator();
        while (it.hasNext()) {
            var member = it.next();
            writeString(member.getKey(), out);
            out.append(':');
            write(member.getValue(), out);
            if (it.hasNext()) {
                out.append(',');
            }
        }
        out.append('}');
    }

    /// Appends `value` as a quoted JSON string, escaping one code unit at a time.
    static void writeString(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '/' -> out.append("\\/");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (isPrintable(c)) {
                        out.append(c);
                    } else {
                        out.append("\\u")
                                .append(HEX[(c >> 12) & 0xf])
                                .append(HEX[(c >> 8) & 0xf])
                                .append(HEX[(c >> 4) & 0xf])
                                .append(HEX[c & 0xf]);
                    }
                }
            }
        }
        out.append('"');
    }

    /// {@return `true` if the code unit `c` can be written to JSON text as is}
    static boolean isPrintable(char c) {
        if (c < 0x20 || c == 0x7f) {
            return false;
        }
        return switch (Character.getType(c)) {
            case Character.CONTROL, Character.FORMAT, Character.SURROGATE,
                 Character.PRIVATE_USE, Character.UNASSIGNED,
                 Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR -> false;
            default -> true;
        };
    }

    /// {@return the JSON text of a finite `double`}
    ///
    /// Whole numbers that a `double` holds exactly are written as integers,
    /// everything else as {@link Double#toString(double)} does. Both forms are
    /// valid JSON numbers and read back to the same `double`.
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < EXACT_INTEGER_LIMIT
                && !(value == 0 && 1 / value < 0)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
