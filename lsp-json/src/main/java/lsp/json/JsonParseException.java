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

/// Signals that JSON text does not conform to the JSON grammar, contains an
/// object with duplicate member names, or nests deeper than the parser allows.
///
/// {@link Json#parse(String)} reports such failures as an empty result; this
/// exception is only observed through {@link Json#parseOrThrow(String)}.
public class JsonParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// Zero-indexed code unit offset of the failure in the source
    private final int offset;

    /// One-indexed line of the failure
    private final int line;

    /// One-indexed column of the failure
    private final int column;

    /// Creates a `JsonParseException` with the given reason and position.
    ///
    /// @param reason the reason the text was rejected
    /// @param offset the zero-indexed code unit offset of the failure
    /// @param line the one-indexed line of the failure
    /// @param column the one-indexed column of the failure
    public JsonParseException(String reason, int offset, int line, int column) {
        super(reason + " (line " + line + ", column " + column + ")");
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    /// {@return the zero-indexed code unit offset at which parsing failed}
    public int offset() {
        return offset;
    }

    /// {@return the one-indexed line at which parsing failed}
    public int line() {
        return line;
    }

    /// {@return the one-indexed column at which parsing failed}
    public int column() {
        return column;
    }
}
