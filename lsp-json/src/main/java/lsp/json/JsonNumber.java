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

import java.util.OptionalLong;

import lsp.internal.json.JsonNumberImpl;

/// The interface that represents a JSON number.
///
/// Every JSON number is held as an IEEE-754 `double`, whether or not the
/// source text had a fraction or exponent. Protocol fields typed `integer`
/// are read through {@link #tryInteger(double)}.
///
/// A `JsonNumber` can be produced by {@link Json#parse(String)}.
/// Alternatively, {@link #of(double)} or {@link #of(long)} can be used to
/// obtain a `JsonNumber`.
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259#section-6 RFC 8259:
///      The JavaScript Object Notation (JSON) Data Interchange Format - Numbers
public non-sealed interface JsonNumber extends JsonValue {

    /// {@return the `double` value of this `JsonNumber`}
    @Override
    double number();

    @Override
    default boolean isNumber() {
        return true;
    }

    @Override
    default OptionalLong tryInteger(double tolerance) {
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("tolerance is negative");
        }
        double value = number();
        double floor = Math.floor(value);
        // Long.MIN_VALUE is exactly representable, Long.MAX_VALUE is not
        if (value - floor > tolerance
                || floor < Long.MIN_VALUE || floor >= 0x1p63) {
            return OptionalLong.empty();
        }
        return OptionalLong.of((long) floor);
    }

    /// Creates a JSON number from the given `double` value.
    ///
    /// @param num the given `double` value.
    /// @return a JSON number created from the `double` value
    /// @throws IllegalArgumentException if the given `double` value
    ///         is not a finite floating-point value.
    static JsonNumber of(double num) {
        if (!Double.isFinite(num)) {
            throw new IllegalArgumentException("Not a valid JSON number");
        }
        return new JsonNumberImpl(num);
    }

    /// Creates a JSON number from the given `long` value.
    /// Magnitudes above 2^53 are rounded to the nearest `double`.
    ///
    /// @param num the given `long` value.
    /// @return a JSON number created from the `long` value
    static JsonNumber of(long num) {
        return new JsonNumberImpl(num);
    }

    /// {@return true if the given `obj` is a `JsonNumber` with the same
    /// `double` value} Comparison follows {@link Double#equals(Object)}, so
    /// `0.0` and `-0.0` differ.
    @Override
    boolean equals(Object obj);

    /// {@return the hash code of the `double` value of this `JsonNumber`}
    @Override
    int hashCode();
}
