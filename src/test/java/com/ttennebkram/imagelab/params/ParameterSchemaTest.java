package com.ttennebkram.imagelab.params;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ttennebkram.imagelab.errors.ErrorKind;
import com.ttennebkram.imagelab.errors.InvalidParameterException;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ParameterSchemaTest {

    private final ParameterSchema schema = ParameterSchema.of(
            ParameterSpec.string("op").defaultValue("blur").oneOf("blur", "sharpen"),
            ParameterSpec.integer("ksize").defaultValue(7).positiveOdd().max(99),
            ParameterSpec.decimal("sigma").defaultValue(1.5).min(0),
            ParameterSpec.bool("crop").defaultValue(false),
            ParameterSpec.string("label"));

    @Test
    void testDefaultsAreFilledIn() {
        OperationParameters params = schema.validate(Collections.emptyMap());

        assertThat(params.getString("op")).isEqualTo("blur");
        assertThat(params.getInt("ksize")).isEqualTo(7);
        assertThat(params.getDouble("sigma")).isEqualTo(1.5);
        assertThat(params.getBoolean("crop")).isFalse();
        assertThat(params.has("label")).isFalse();
        assertThat(params.getString("label", "none")).isEqualTo("none");
    }

    @Test
    void testNullMapMeansNoParameters() {
        assertThat(schema.validate(null).getInt("ksize")).isEqualTo(7);
    }

    @Test
    void testValuesAreCoerced() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("ksize", new BigDecimal("5.0"));
        raw.put("sigma", "2.25");
        raw.put("crop", "true");

        OperationParameters params = schema.validate(raw);

        assertThat(params.getInt("ksize")).isEqualTo(5);
        assertThat(params.getDouble("sigma")).isEqualTo(2.25);
        assertThat(params.getBoolean("crop")).isTrue();
    }

    @Test
    void testUnknownKeyIsRejected() {
        assertThatThrownBy(() -> schema.validate(Collections.singletonMap("radius", 3)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("radius")
                .satisfies(e -> assertThat(((InvalidParameterException) e).getParameterName()).isEqualTo("radius"));
    }

    @Test
    void testEmptySchemaRejectsAnyKey() {
        assertThatThrownBy(() -> ParameterSchema.empty().validate(Collections.singletonMap("x", 1)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("takes no parameters");
    }

    @Test
    void testEvenKernelIsRejected() {
        assertThatThrownBy(() -> schema.validate(Collections.singletonMap("ksize", 4)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("positive odd");
    }

    @Test
    void testOddValueBelowRaisedMinimumReportsBound() {
        ParameterSchema blocks = ParameterSchema.of(
                ParameterSpec.integer("block_size").defaultValue(11).positiveOdd().min(3));

        assertThatThrownBy(() -> blocks.validate(Collections.singletonMap("block_size", 1)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining(">= 3")
                .hasMessageNotContaining("odd");
    }

    @Test
    void testNegativeOddKernelIsRejected() {
        assertThatThrownBy(() -> schema.validate(Collections.singletonMap("ksize", -3)))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void testFractionalIntegerIsRejected() {
        assertThatThrownBy(() -> schema.validate(Collections.singletonMap("ksize", new BigDecimal("5.5"))))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("must be an integer");
    }

    @Test
    void testValueOutsideChoicesIsRejected() {
        assertThatThrownBy(() -> schema.validate(Collections.singletonMap("op", "emboss")))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("one of");
    }

    @Test
    void testStringTypeDoesNotAcceptNumbers() {
        assertThatThrownBy(() -> schema.validate(Collections.singletonMap("label", 42)))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void testMissingRequiredParameter() {
        ParameterSchema required = ParameterSchema.of(ParameterSpec.string("space").required());

        assertThatThrownBy(() -> required.validate(Collections.emptyMap()))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("Missing required parameter 'space'")
                .satisfies(e -> assertThat(((InvalidParameterException) e).getKind())
                        .isEqualTo(ErrorKind.INVALID_PARAMETER));
    }

    @Test
    void testDuplicateDeclarationIsAProgrammingError() {
        assertThatThrownBy(() -> ParameterSchema.of(ParameterSpec.integer("a"), ParameterSpec.decimal("a")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
