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

/// Provides APIs for parsing JSON text, reading and building JSON values, and
/// generating compact JSON text.
///
/// ## Parsing JSON documents
/// Parsing produces a `JsonValue` from JSON text via `Json.parse(String)` or
/// `Json.parse(char[])`. A present result indicates that the JSON text adheres
/// to the RFC 8259 grammar. Objects with duplicate member names are rejected.
/// Parsing never yields a partial tree: the first error aborts it and the
/// result is empty.
///
/// ## Reading JSON values
/// `JsonValue` is a closed set of six kinds. Test the kind with a predicate,
/// then read it with the matching accessor:
/// ```java
/// if (value.isObject() && value.asObject().hasKey("id")) {
///     var id = value.asObject().expect("id").tryInteger(1e-9);
/// }
/// ```
/// Reading a value as the wrong kind throws `JsonAssertionException`.
///
/// ## Generating JSON documents
/// `Json.serialize(JsonValue)`, or equivalently `JsonValue.toString()`,
/// produces the most compact representation that adheres to the JSON grammar.
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259 RFC 8259: The JavaScript
///      Object Notation (JSON) Data Interchange Format

package lsp.json;
