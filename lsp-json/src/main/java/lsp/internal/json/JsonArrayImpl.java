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
import java.util.List;
import java.util.Objects;

import lsp.json.JsonArray;
import lsp.json.JsonValue;

/// JsonArray implementation class
public final class JsonArrayImpl implements JsonArray {

    private final List<JsonValue> theValues;
    private final List<JsonValue> view;

    public JsonArrayImpl(List<JsonValue> values) {
        theValues = values;
        view = Collections.unmodifiableList(values);
    }

    @Override
    public List<JsonValue> elements() {
        return view;
    }

    @Override
    public void add(JsonValue value) {
        Objects.requireNonNull(value);
        if (Utils.reaches(value, this)) {
            throw new IllegalArgumentException("A JsonArray cannot contain itself");
        }
        theValues.add(value);
    }

    @Override
    public JsonValue element(int index) {
        if (index < 0 || index >= theValues.size()) {
            throw Utils.composeError(this,
                    "JsonArray index %d out of bounds for length %d."
                            .formatted(index, theValues.size()));
        }
        return theValues.get(index);
    }

    @Override
    public boolean equals(Object o) {
        return this == o ||
            o instanceof JsonArray ja && Objects.equals(theValues, ja.elements());
    }

    @Override
    public int hashCode() {
        return Objects.hash(theValues);
    }

    @Override
    public String toString() {
        return JsonWriter.write(this);
    }
}
