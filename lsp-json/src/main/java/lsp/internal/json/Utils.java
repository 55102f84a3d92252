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

import lsp.json.JsonAssertionException;
import lsp.json.JsonValue;

/// Shared helpers for the `JsonValue` implementations.
public final class Utils {

    // no instantiation is allowed for this class
    private Utils() {}

    /// {@return the name of the `JsonValue` interface implemented by `jv`}
    public static String kindName(JsonValue jv) {
        if (jv.isObject()) {
            return "JsonObject";
        } else if (jv.isArray()) {
            return "JsonArray";
        } else if (jv.isNumber()) {
            return "JsonNumber";
        } else if (jv.isString()) {
            return "JsonString";
        } else if (jv.isBool()) {
            return "JsonBoolean";
        }
        return "JsonNull";
    }

    /// {@return a `JsonAssertionException` for reading `jv` as `expected`}
    public static JsonAssertionException composeTypeError(JsonValue jv, String expected) {
        return composeError(jv, "%s is not a %s.".formatted(kindName(jv), expected));
    }

    /// {@return a `JsonAssertionException` with `message`, followed by a
    /// short excerpt of `jv`}
    public static JsonAssertionException composeError(JsonValue jv, String message) {
        return new JsonAssertionException(message + " Value: " + excerpt(jv));
    }

    /// {@return `true` if `target` is `tree` or is found anywhere inside it}
    ///
    /// Compares by identity. Used to keep containers from being inserted
    /// into themselves.
    public static boolean reaches(JsonValue tree, JsonValue target) {
        if (tree == target) {
            return true;
        }
        if (tree.isObject()) {
            for (JsonValue member : tree.asObject().members().values()) {
                if (reaches(member, target)) {
                    return true;
                }
            }
        } else if (tree.isArray()) {
            for (JsonValue element : tree.asArray().elements()) {
                if (reaches(element, target)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String excerpt(JsonValue jv) {
        var text = JsonWriter.write(jv);
        return text.length() <= 64 ? text : text.substring(0, 61) + "...";
    }
}
