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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import lsp.internal.json.JsonObjectImpl;

/// The interface that represents a JSON object.
///
/// A `JsonObject` is an insertion-ordered, mutable mapping from member name to
/// `JsonValue`. Member names are unique: {@link #set(String, JsonValue)} refuses
/// a name that is already present, and a document with duplicate names fails
/// to parse. The insertion order is the order of re-serialization.
///
/// The three extraction operations mirror how the protocol codec consumes
/// messages:
/// - {@link #hasKey(String)} peeks,
/// - {@link #expect(String)} borrows a member that must exist,
/// - {@link #remove(String)} detaches a member and hands it over.
///
/// ## Example Usage
/// ```java
/// JsonObject obj = JsonObject.of();
/// obj.set("name", JsonString.of("Alice"));
/// obj.set("age", JsonNumber.of(30));
///
/// String name = obj.expect("name").string();   // "Alice"
/// Optional<JsonValue> age = obj.remove("age"); // detached from obj
/// ```
public non-sealed interface JsonObject extends JsonValue {

    /// {@return an unmodifiable, insertion-ordered view of the members in this
    /// `JsonObject`}
    Map<String, JsonValue> members();

    /// Adds a member to the end of this `JsonObject`.
    ///
    /// @param name the member name. Non-null.
    /// @param value the member value. Non-null.
    /// @return `true` if the member was added, `false` if a member with the
    ///         same name already exists, in which case this object is unchanged
    /// @throws NullPointerException if `name` or `value` is `null`
    /// @throws IllegalArgumentException if `value` is this object or contains it
    boolean set(String name, JsonValue value);

    /// {@return `true` if this `JsonObject` has a member with the given name}
    ///
    /// @param name the member name. Non-null.
    boolean hasKey(String name);

    /// {@return the value of the member with the given name, left in place}
    ///
    /// @param name the member name. Non-null.
    /// @throws JsonAssertionException if there is no such member
    JsonValue expect(String name);

    /// Detaches the member with the given name.
    ///
    /// @param name the member name. Non-null.
    /// @return the detached value, or an empty `Optional` if there is no such
    ///         member, in which case this object is unchanged
    Optional<JsonValue> remove(String name);

    /// Detaches the member with the given name, which must exist.
    ///
    /// @param name the member name. Non-null.
    /// @return the detached value
    /// @throws JsonAssertionException if there is no such member
    JsonValue removeExpect(String name);

    /// {@return the number of members in this `JsonObject`}
    default int size() {
        return members().size();
    }

    /// {@return `true` if this `JsonObject` has no members}
    default boolean isEmpty() {
        return members().isEmpty();
    }

    @Override
    default boolean isObject() {
        return true;
    }

    @Override
    default JsonObject asObject() {
        return this;
    }

    /// {@return a new, empty `JsonObject`}
    static JsonObject of() {
        return new JsonObjectImpl(new LinkedHashMap<>());
    }

    /// {@return a new `JsonObject` created from the given map of `String` to
    /// `JsonValue`s}
    ///
    /// The `JsonObject`'s members occur in the same order as the given
    /// map's entries.
    ///
    /// @param map the map of `JsonValue`s. Non-null.
    /// @throws NullPointerException if `map` is `null`, contains
    ///         any keys that are `null`, or contains any values that are `null`.
    static JsonObject of(Map<String, ? extends JsonValue> map) {
        var copy = new LinkedHashMap<String, JsonValue>();
        map.forEach((name, value) -> // Implicit NPE on map
                copy.put(Objects.requireNonNull(name), Objects.requireNonNull(value)));
        return new JsonObjectImpl(copy);
    }

    /// {@return `true` if the given object is also a `JsonObject`
    /// and the two `JsonObject`s represent the same mappings} Two
    /// `JsonObject`s `jo1` and `jo2` represent the same
    /// mappings if `jo1.members().equals(jo2.members())`.
    ///
    /// @see #members()
    @Override
    boolean equals(Object obj);

    /// {@return the hash code value for this `JsonObject`} The hash code value
    /// of a `JsonObject` is derived from the hash code of `JsonObject`'s
    /// {@link #members()}.
    ///
    /// @see #members()
    @Override
    int hashCode();
}
