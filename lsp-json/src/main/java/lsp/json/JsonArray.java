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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import lsp.internal.json.JsonArrayImpl;

/// The interface that represents a JSON array.
///
/// A `JsonArray` is an ordered, mutable sequence that exclusively owns its
/// elements. It can be produced by {@link Json#parse(String)}.
/// Alternatively, {@link #of()} or {@link #of(List)} can be used to obtain a
/// `JsonArray`.
///
/// ## Example Usage
/// ```java
/// JsonArray arr = JsonArray.of();
/// arr.add(JsonString.of("first"));
/// arr.add(JsonNumber.of(42));
///
/// for (JsonValue value : arr.elements()) {
///     if (value.isString()) {
///         System.out.println("String: " + value.string());
///     } else if (value.isNumber()) {
///         System.out.println("Number: " + value.number());
///     }
/// }
/// ```
public non-sealed interface JsonArray extends JsonValue {

    /// {@return an unmodifiable view of the `JsonValue` elements in
    /// this `JsonArray`}
    List<JsonValue> elements();

    /// Appends a value to the end of this `JsonArray`.
    ///
    /// @param value the value to append. Non-null.
    /// @throws NullPointerException if `value` is `null`
    /// @throws IllegalArgumentException if `value` is this array or contains it
    void add(JsonValue value);

    /// {@return the `JsonValue` at the given index}
    ///
    /// @param index the index of the element
    /// @throws JsonAssertionException if the index is outside the bounds
    JsonValue element(int index);

    /// {@return the number of elements in this `JsonArray`}
    default int size() {
        return elements().size();
    }

    /// {@return `true` if this `JsonArray` has no elements}
    default boolean isEmpty() {
        return elements().isEmpty();
    }

    @Override
    default boolean isArray() {
        return true;
    }

    @Override
    default JsonArray asArray() {
        return this;
    }

    /// {@return a new, empty `JsonArray`}
    static JsonArray of() {
        return new JsonArrayImpl(new ArrayList<>());
    }

    /// {@return a new `JsonArray` holding the given `JsonValue`s in order}
    ///
    /// @param src the list of `JsonValue`s. Non-null.
    /// @throws NullPointerException if `src` is `null`, or contains
    ///         any values that are `null`
    static JsonArray of(List<? extends JsonValue> src) {
        // Careful not to use List::contains on src for null checking which
        // throws NPE for immutable lists
        var copy = new ArrayList<JsonValue>(src.size());
        for (JsonValue value : src) {
            copy.add(Objects.requireNonNull(value));
        }
        return new JsonArrayImpl(copy);
    }

    /// {@return `true` if the given object is also a `JsonArray`
    /// holding equal elements in the same order}
    @Override
    boolean equals(Object obj);

    /// {@return the hash code value for this `JsonArray`} The hash code value
    /// of a `JsonArray` is derived from the hash code of its {@link #elements()}.
    @Override
    int hashCode();
}
