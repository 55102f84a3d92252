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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import lsp.internal.json.JsonParser;
import lsp.internal.json.JsonWriter;

/// This class provides static methods for producing and rendering a {@link JsonValue}.
///
/// {@link #parse(String)} and {@link #parse(char[])} produce a `JsonValue`
/// from JSON text. They bail on the first error and report it only as an
/// empty result; {@link #parseOrThrow(String)} reports the position instead.
///
/// {@link #serialize(JsonValue)} renders compact JSON text.
///
/// {@link #fromUntyped(Object)} and {@link #toUntyped(JsonValue)} provide a conversion
/// between `JsonValue` and plain Java maps, lists and scalars.
///
/// ## Example Usage
/// ```java
/// Optional<JsonValue> json = Json.parse("{\"name\":\"John\",\"age\":30}");
/// json.ifPresent(v -> System.out.println(v.asObject().expect("name").string()));
///
/// String text = Json.serialize(Json.fromUntyped(Map.of("active", true)));
/// ```
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259 RFC 8259: The JavaScript
///       Object Notation (JSON) Data Interchange Format
public final class Json {

    private static final Logger LOG = Logger.getLogger(Json.class.getName());

    /// Parses a `JsonValue` from the given JSON document.
    ///
    /// The document must hold exactly one JSON value, optionally surrounded by
    /// whitespace. Any grammar violation, unterminated construct, invalid
    /// escape, duplicate object member name, excessive nesting or trailing
    /// content aborts the parse; no partial tree is returned.
    ///
    /// `JsonObject`s preserve the order of their members declared in the
    /// JSON document.
    ///
    /// @param in the input JSON document as `String`. Non-null.
    /// @return the parsed `JsonValue`, or an empty `Optional` if the
    ///         document is not valid JSON
    /// @throws NullPointerException if `in` is `null`
    public static Optional<JsonValue> parse(String in) {
        Objects.requireNonNull(in);
        return parseQuietly(in.toCharArray());
    }

    /// Parses a `JsonValue` from the given JSON document.
    ///
    /// @param in the input JSON document as `char[]`. Non-null.
    /// @return the parsed `JsonValue`, or an empty `Optional` if the
    ///         document is not valid JSON
    /// @throws NullPointerException if `in` is `null`
    /// @see #parse(String)
    public static Optional<JsonValue> parse(char[] in) {
        Objects.requireNonNull(in);
        // Source must not change under the cursor
        return parseQuietly(Arrays.copyOf(in, in.length));
    }

    /// Parses a `JsonValue` from the given JSON document, reporting where it
    /// failed.
    ///
    /// @param in the input JSON document as `String`. Non-null.
    /// @return the parsed `JsonValue`
    /// @throws JsonParseException if the document is not valid JSON
    /// @throws NullPointerException if `in` is `null`
    public static JsonValue parseOrThrow(String in) {
        Objects.requireNonNull(in);
        return new JsonParser(in.toCharArray()).parseRoot();
    }

    private static Optional<JsonValue> parseQuietly(char[] source) {
        try {
            return Optional.of(new JsonParser(source).parseRoot());
        } catch (JsonParseException e) {
            LOG.fine(() -> "Rejected JSON document: " + e.getMessage());
            return Optional.empty();
        }
    }

    /// {@return the compact JSON text of the given `JsonValue`}
    ///
    /// Object members are written in insertion order with no whitespace.
    /// Strings are re-escaped, numbers are written in their shortest
    /// form. Parsing the result yields a tree equal to `value`.
    ///
    /// @param value the `JsonValue` to render. Non-null.
    /// @throws NullPointerException if `value` is `null`
    public static String serialize(JsonValue value) {
        Objects.requireNonNull(value);
        return JsonWriter.write(value);
    }

    /// {@return a deep copy of `value`}
    ///
    /// Objects and arrays are copied at every level, so the copy shares no
    /// mutable container with `value`. Scalars are immutable and returned as is.
    ///
    /// @param value the `JsonValue` to copy. Non-null.
    /// @throws NullPointerException if `value` is `null`
    public static JsonValue copy(JsonValue value) {
        Objects.requireNonNull(value);
        if (value.isObject()) {
            var members = new LinkedHashMap<String, JsonValue>();
            value.asObject().members().forEach((name, member) -> members.put(name, copy(member)));
            return JsonObject.of(members);
        } else if (value.isArray()) {
            var elements = new ArrayList<JsonValue>(value.asArray().size());
            for (JsonValue element : value.asArray().elements()) {
                elements.add(copy(element));
            }
            return JsonArray.of(elements);
        }
        return value;
    }

    /// {@return a `JsonValue` created from the given `src` object}
    /// The mapping from an untyped `src` object to a `JsonValue`
    /// follows the table below.
    ///
    /// | Untyped Object | JsonValue |
    /// |----------------|----------|
    /// | `List<Object>` | `JsonArray` |
    /// | `Boolean` | `JsonBoolean` |
    /// | `null` | `JsonNull` |
    /// | `Number*` | `JsonNumber` |
    /// | `Map<String, Object>` | `JsonObject` |
    /// | `String` | `JsonString` |
    ///
    /// *The supported `Number` subclasses are: `Byte`,
    /// `Short`, `Integer`, `Long`, `Float`,
    /// `Double`, `BigInteger`, and `BigDecimal`. All become `double`s.
    ///
    /// If `src` is an instance of `JsonValue`, it is returned as is.
    ///
    /// @param src the data to produce the `JsonValue` from. May be null.
    /// @throws IllegalArgumentException if `src` cannot be converted
    ///         to a `JsonValue`.
    /// @see #toUntyped(JsonValue)
    public static JsonValue fromUntyped(Object src) {
        if (src == null) {
            return JsonNull.of();
        } else if (src instanceof JsonValue jv) {
            return jv;
        } else if (src instanceof Map<?, ?> map) {
            var obj = JsonObject.of();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                            "The key '%s' is not a String".formatted(entry.getKey()));
                }
                obj.set(key, Json.fromUntyped(entry.getValue()));
            }
            return obj;
        } else if (src instanceof List<?> list) {
            var arr = JsonArray.of();
            for (Object o : list) {
                arr.add(Json.fromUntyped(o));
            }
            return arr;
        } else if (src instanceof String str) {
            return JsonString.of(str);
        } else if (src instanceof Boolean bool) {
            return JsonBoolean.of(bool);
        } else if (src instanceof Byte || src instanceof Short
                || src instanceof Integer || src instanceof Long) {
            return JsonNumber.of(((Number) src).longValue());
        } else if (src instanceof Float || src instanceof Double
                || src instanceof BigInteger || src instanceof BigDecimal) {
            return JsonNumber.of(((Number) src).doubleValue());
        }
        throw new IllegalArgumentException(src.getClass().getSimpleName() + " is not a recognized type");
    }

    /// {@return an `Object` created from the given `src` `JsonValue`}
    /// The mapping from a `JsonValue` to an untyped `src` object follows the table below.
    ///
    /// | JsonValue | Untyped Object |
    /// |-----------|----------------|
    /// | `JsonArray` | `List<Object>` (unmodifiable) |
    /// | `JsonBoolean` | `Boolean` |
    /// | `JsonNull` | `null` |
    /// | `JsonNumber` | `Long` if integral and in range, otherwise `Double` |
    /// | `JsonObject` | `Map<String, Object>` (unmodifiable) |
    /// | `JsonString` | `String` |
    ///
    /// A `JsonObject` in `src` is converted to a `Map` whose
    /// entries occur in the same order as the `JsonObject`'s members.
    ///
    /// @param src the `JsonValue` to convert to untyped. Non-null.
    /// @throws NullPointerException if `src` is `null`
    /// @see #fromUntyped(Object)
    public static Object toUntyped(JsonValue src) {
        Objects.requireNonNull(src);
        if (src.isObject()) {
            // Avoid Collectors.toMap, to allow `null` value
            var map = new LinkedHashMap<String, Object>();
            src.asObject().members().forEach((name, value) -> map.put(name, Json.toUntyped(value)));
            return Collections.unmodifiableMap(map);
        } else if (src.isArray()) {
            var list = new ArrayList<Object>(src.asArray().size());
            for (JsonValue value : src.asArray().elements()) {
                list.add(Json.toUntyped(value));
            }
            return Collections.unmodifiableList(list);
        } else if (src.isBool()) {
            return src.bool();
        } else if (src.isNull()) {
            return null;
        } else if (src.isNumber()) {
            var whole = src.tryInteger(0.0);
            return whole.isPresent() ? (Object) whole.getAsLong() : (Object) src.number();
        }
        return src.string();
    }

    // no instantiation is allowed for this class
    private Json() {}
}
