package io.rulekit.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

class ExecutionContextTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void nullInputIsEmptyRecord() {
        ExecutionContext context = new ExecutionContext(null);

        assertThat(context.input().isObject()).isTrue();
        assertThat(context.input().size()).isZero();
    }

    @Test
    void rejectsNonObjectInput() {
        assertThatThrownBy(() -> new ExecutionContext(TextNode.valueOf("x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dataExposesOutputsUnderNamespace() throws Exception {
        ExecutionContext context = new ExecutionContext(JSON.readTree("{\"price\": 10}"));
        context.putOutput("subtotal", IntNode.valueOf(30));
        context.putOutput("note", null);

        JsonNode data = context.toData();

        assertThat(data.path("price").intValue()).isEqualTo(10);
        assertThat(data.path(ExecutionContext.OUTPUT_NAMESPACE).path("subtotal").intValue()).isEqualTo(30);
        assertThat(data.path("$").path("note").isNull()).isTrue();
        assertThat(context.input().has("$")).isFalse();
        assertThat(context.outputs()).containsOnlyKeys("subtotal", "note");
        assertThat(context.output("missing")).isEmpty();
    }

    @Test
    void outputsViewIsUnmodifiable() {
        ExecutionContext context = new ExecutionContext(null);

        assertThatThrownBy(() -> context.outputs().put("x", IntNode.valueOf(1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
