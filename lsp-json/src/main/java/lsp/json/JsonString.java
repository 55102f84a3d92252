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

import java.util.Objects;

import lsp.internal.json.JsonStringImpl;

/// The interface that represents a JSON string.
///
/// The value is a sequence of UTF-16 code units. Code units are kept as they
/// were written: a four-hex-digit unicode escape yields exactly one code unit and surrogate
/// pairs are neither combined nor checked.
///
/// A `JsonString` can be produced by {@link Json#parse(String)}.
/// Alternatively, {@link #of(String)} can be used to obtain a `JsonString`.
public non-sealed interface JsonString extends JsonValue {

    /// {@return the `String` value represented by this `JsonString`}
    /// The returned value is the unescaped content, without surrounding quotes.
    @Override
    String string();

    @Override
    default boolean isString() {
        return true;
    }

    /// {@return the `JsonString` created from the given `String`}
    ///
    /// @param value the given `String`. Non-null.
    /// @throws NullPointerException if `value` is `null`
    static JsonString of(String value) {
        return new JsonStringImpl(Objects.requireNonNull(value));
    }

    /// {@return `true` if the given object is also a `JsonString` holding the
    /// same code units}
    @Override
    boolean equals(Object obj);

    /// {@return the hash code of the code units of this `JsonString`}
    @Override
    int hashCode();
}
