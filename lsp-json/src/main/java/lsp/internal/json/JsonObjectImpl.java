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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import lsp.json.JsonObject;
import lsp.json.JsonValue;

/// JsonObject implementation class
///
/// Backed by a `LinkedHashMap` so member order is insertion order.
public final class JsonObjectImpl implements JsonObject {

    private final Map<String, JsonValue> theMembers;
    private final Map<String, JsonValue> view;

    /// The given map is adopted, not copied. It must preserve insertion order.
    public JsonObjectImpl(Map<String, JsonValue> members) {
        theMembers = members;
        view = Collections.unmodifiableMap(members);
    }

    @Override
    public Map<String, JsonValue> members() {
        return view;
    }

    @Override
    public boolean set(String name, JsonValue value) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(value);
        if (Utils.reaches(value, this)) {
            throw new IllegalArgumentException("A JsonObject cannot contain itself");
        }
        return theMembers.putIfAbsent(name, value) == null;
    }

    @Override
    public boolean hasKey(String name) {
        return theMembers.containsKey(Objects.requireNonNull(name));
    }

    @Override
    public JsonValue expect(String name) {
        var value = theMembers.get(Objects.requireNonNull(name));
        if (value == null) {
            throw missingMember(name);
        }
        return value;
    }

    @Override
    public Optional<JsonValue> remove(String name) {
        return Optional.ofNullable(theMembers.remove(Objects.requireNonNull(name)));
    }

    @Override
    public JsonValue removeExpect(String name) {
        var value = theMembers.remove(Objects.requireNonNull(name));
        if (value == null) {
            throw missingMember(name);
        }
        return value;
    }

    private RuntimeException missingMember(String name) {
        return Utils.composeError(this,
                "JsonObject member \"%s\" does not exist.".formatted(name));
    }

    @Override
    public boolean equals(Object o) {
        return this == o ||
            o instanceof JsonObject ojo && Objects.equals(theMembers, ojo.members());
    }

    @Override
    public int hashCode() {
        return Objects.hash(theMembers);
    }

    @Override
    public String toString() {
        return JsonWriter.write(this);
    }
}
