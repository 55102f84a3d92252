package lsp.json;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JsonValueTests extends JsonTestBase {

    @Test
    void exactlyOneKindPredicateHolds() {
        List<JsonValue> values = List.of(
                JsonNull.of(),
                JsonBoolean.of(true),
                JsonNumber.of(1.5),
                JsonString.of("s"),
                JsonArray.of(),
                JsonObject.of());
        for (JsonValue value : values) {
            int kinds = 0;
            for (boolean b : new boolean[]{value.isNull(), value.isBool(), value.isNumber(),
                    value.isString(), value.isArray(), value.isObject()}) {
                kinds += b ? 1 : 0;
            }
            assertThat(kinds).as("kinds of %s", value).isEqualTo(1);
        }
    }

    @Test
    void accessorsReturnTheActiveKind() {
        assertThat(JsonBoolean.of(false).bool()).isFalse();
        assertThat(JsonNumber.of(-2.25).number()).isEqualTo(-2.25);
        assertThat(JsonNumber.of(7L).number()).isEqualTo(7.0);
        assertThat(JsonString.of("héllo").string()).isEqualTo("héllo");
        JsonValue arr = JsonArray.of(List.of(JsonNull.of()));
        assertThat(arr.asArray().size()).isEqualTo(1);
        JsonValue obj = JsonObject.of(Map.of("k", JsonBoolean.of(true)));
        assertThat(obj.asObject().expect("k").bool()).isTrue();
    }

    @Test
    void wrongKindAccessIsAProgrammingError() {
        JsonValue number = JsonNumber.of(3);
        assertThatThrownBy(number::string)
                .isInstanceOf(JsonAssertionException.class)
                .hasMessageContaining("JsonNumber is not a JsonString");
        assertThatThrownBy(number::asObject).isInstanceOf(JsonAssertionException.class);
        assertThatThrownBy(() -> JsonNull.of().bool()).isInstanceOf(JsonAssertionException.class);
        assertThatThrownBy(() -> JsonString.of("x").number()).isInstanceOf(JsonAssertionException.class);
        assertThatThrownBy(() -> JsonObject.of().asArray()).isInstanceOf(JsonAssertionException.class);
    }

    @Test
    void tryIntegerAcceptsValuesWithinToleranceOfTheirFloor() {
        assertThat(JsonNumber.of(5.0000000001).tryInteger(1e-9)).hasValue(5L);
        assertThat(JsonNumber.of(5.1).tryInteger(1e-9)).isEmpty();
        assertThat(JsonNumber.of(42).tryInteger(0.0)).hasValue(42L);
        assertThat(JsonNumber.of(-3).tryInteger(1e-9)).hasValue(-3L);
        assertThat(JsonNumber.of(-2.9999999999).tryInteger(1e-9)).hasValue(-3L);
        assertThat(JsonNumber.of(-3.5).tryInteger(1e-9)).isEmpty();
    }

    @Test
    void tryIntegerIsEmptyForOtherKindsAndOutOfRangeNumbers() {
        assertThat(JsonString.of("5").tryInteger(1e-9)).isEmpty();
        assertThat(JsonNull.of().tryInteger(1e-9)).isEmpty();
        assertThat(JsonNumber.of(1e19).tryInteger(1e-9)).isEmpty();
        assertThat(JsonNumber.of(-0x1p63).tryInteger(1e-9)).hasValue(Long.MIN_VALUE);
    }

    @Test
    void nonFiniteNumbersAreRejected() {
        assertThatThrownBy(() -> JsonNumber.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonNumber.of(Double.POSITIVE_INFINITY)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalityIsStructural() {
        assertThat(JsonNumber.of(1)).isEqualTo(JsonNumber.of(1.0));
        assertThat(JsonNumber.of(0.0)).isNotEqualTo(JsonNumber.of(-0.0));
        assertThat(JsonString.of("a")).isEqualTo(JsonString.of("a")).hasSameHashCodeAs(JsonString.of("a"));
        assertThat(JsonNull.of()).isEqualTo(JsonNull.of());
        assertThat(JsonArray.of(List.of(JsonNumber.of(1), JsonNumber.of(2))))
                .isEqualTo(parseValid("[1, 2]"))
                .isNotEqualTo(parseValid("[2, 1]"));
        assertThat(JsonObject.of(Map.of("a", JsonBoolean.of(true))))
                .isEqualTo(parseValid("{\"a\": true}"));
    }

    @Test
    void toStringIsCompactJson() {
        JsonValue value = parseValid(" { \"a\" : [ 1 , \"two\" , null ] } ");
        assertThat(value.toString()).isEqualTo("{\"a\":[1,\"two\",null]}");
        assertThat(JsonBoolean.of(true).toString()).isEqualTo("true");
    }

    @Test
    void arrayAddAppendsAndIndexesAreChecked() {
        JsonArray arr = JsonArray.of();
        arr.add(JsonNumber.of(1));
        arr.add(JsonString.of("x"));
        assertThat(arr.size()).isEqualTo(2);
        assertThat(arr.element(1)).isEqualTo(JsonString.of("x"));
        assertThatThrownBy(() -> arr.element(2))
                .isInstanceOf(JsonAssertionException.class)
                .hasMessageContaining("out of bounds");
        assertThatThrownBy(() -> arr.elements().add(JsonNull.of()))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> arr.add(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void anArrayCannotBeAddedToItself() {
        JsonArray arr = JsonArray.of();
        assertThatThrownBy(() -> arr.add(arr))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(arr.isEmpty()).isTrue();
        assertThat(Json.serialize(arr)).isEqualTo("[]");
    }

    @Test
    void anEqualButDistinctArrayMayBeAdded() {
        JsonArray arr = JsonArray.of();
        arr.add(JsonArray.of());
        assertThat(Json.serialize(arr)).isEqualTo("[[]]");
    }

    @Test
    void copySharesNoContainerWithTheOriginal() {
        JsonObject original = parseValid("{\"a\":[1,{\"b\":true}],\"s\":\"x\"}").asObject();
        JsonValue copy = Json.copy(original);
        assertThat(copy).isEqualTo(original).isNotSameAs(original);

        copy.asObject().expect("a").asArray().add(JsonNull.of());
        copy.asObject().expect("a").asArray().element(1).asObject().set("c", JsonNull.of());
        assertThat(Json.serialize(original)).isEqualTo("{\"a\":[1,{\"b\":true}],\"s\":\"x\"}");
    }

    @Test
    void copyOfAScalarIsTheScalar() {
        JsonValue s = JsonString.of("x");
        assertThat(Json.copy(s)).isSameAs(s);
    }
}
