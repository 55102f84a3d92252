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

package lsp.json;

import lsp.internal.json.Utils;

import java.util.OptionalLong;

/// The interface that represents a JSON value.
///
/// Exactly one of the six kinds is active for any instance: `JsonNull`,
/// `JsonBoolean`, `JsonNumber`, `JsonString`, `JsonArray` or `JsonObject`.
/// Callers test the kind with one of the `isXxx()` predicates and then read it
/// with the matching accessor. Reading a value as the wrong kind is a
/// programming error and throws {@link JsonAssertionException}.
///
/// `JsonArray` and `JsonObject` are mutable containers that exclusively own
/// their elements. They are not thread safe.
///
/// A `JsonValue` can be produced by {@link Json#parse(String)}.
public sealed interface JsonValue
        permits JsonString, JsonNumber, JsonObject, JsonArray, JsonBoolean, JsonNull {

    /// {@return the compact JSON text of this `JsonValue`}
    ///
    /// @see Json#serialize(JsonValue)
    String toString();

    /// {@return `true` if this is a `JsonObject`}
    default boolean isObject() {
        return false;
    }

    /// {@return `true` if this is a `JsonArray`}
    default boolean isArray() {
        return false;
    }

    /// {@return `true` if this is a `JsonNumber`}
    default boolean isNumber() {
        return false;
    }

    /// {@return `true` if this is a `JsonBoolean`}
    default boolean isBool() {
        return false;
    }

    /// {@return `true` if this is a `JsonString`}
    default boolean isString() {
        return false;
    }

    /// {@return `true` if this is `JsonNull`}
    default boolean isNull() {
        return false;
    }

    /// {@return this value as a `JsonObject`}
    ///
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonObject`
    default JsonObject asObject() {
        throw Utils.composeTypeError(this, "JsonObject");
    }

    /// {@return this value as a `JsonArray`}
    ///
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonArray`
    default JsonArray asArray() {
        throw Utils.composeTypeError(this, "JsonArray");
    }

    /// {@return the `double` value represented by a `JsonNumber`}
    ///
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonNumber`
    default double number() {
        throw Utils.composeTypeError(this, "JsonNumber");
    }

    /// {@return the `String` value represented by a `JsonString`}
    ///
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonString`
    default String string() {
        throw Utils.composeTypeError(this, "JsonString");
    }

    /// {@return the `boolean` value represented by a `JsonBoolean`}
    ///
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonBoolean`
    default boolean bool() {
        throw Utils.composeTypeError(this, "JsonBoolean");
    }

    /// Reads this value as a whole number.
    ///
    /// JSON has no integer kind, so protocol fields typed `integer` arrive as
    /// doubles. The value is accepted when its distance from its floor is at
    /// most `tolerance`, and the floor is returned.
    ///
    /// @param tolerance the accepted distance from the floor. Zero or positive.
    /// @return the floor of the number, or an empty `OptionalLong` if this is
    ///         not a `JsonNumber`, the number is not within `tolerance` of a whole
    ///         number, or the whole number does not fit in a `long`
    default OptionalLong tryInteger(double tolerance) {
        return OptionalLong.empty();
    }
}
