package io.rulekit.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.node.IntNode;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class OperatorRegistryTest {

    private static final LogicOperator ONE = args -> IntNode.valueOf(1);
    private static final LogicOperator TWO = args -> IntNode.valueOf(2);

    @Test
    void emptyRegistry() {
        OperatorRegistry registry = OperatorRegistry.empty();

        assertThat(registry.size()).isZero();
        assertThat(registry.find("x")).isEmpty();
    }

    @Test
    void lastRegistrationWins() {
        Logger logger = (Logger) LoggerFactory.getLogger(OperatorRegistry.class);
        logger.setLevel(Level.DEBUG);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            OperatorRegistry registry = OperatorRegistry.builder()
                    .register("op", ONE)
                    .register("op", TWO)
                    .build();

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.find("op")).containsSame(TWO);
            assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                    .contains("Operator replaced: name=op");
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void toBuilderLeavesOriginalUntouched() {
        OperatorRegistry original = OperatorRegistry.builder().register("a", ONE).build();

        OperatorRegistry extended = original.toBuilder().register("b", TWO).build();

        assertThat(original.names()).containsExactly("a");
        assertThat(extended.names()).containsExactly("a", "b");
        assertThat(extended.find("b").orElseThrow().apply(List.of())).isEqualTo(IntNode.valueOf(2));
    }

    @Test
    void rejectsBlankNames() {
        assertThatThrownBy(() -> OperatorRegistry.builder().register("", ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OperatorRegistry.builder().register("x", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void standardRegistryContainsTheFunctionLibrary() {
        OperatorRegistry registry = StandardOperators.registry();

        assertThat(registry.names()).contains(
                "contains", "startsWith", "endsWith", "upper", "lower", "trim", "len", "abs", "round", "count",
                "sum", "avg", "now", "daysSince", "daysBetween", "isEmpty", "coalesce", "between", "collect");
        assertThat(registry.names().stream().filter(name -> registry.find(name).isEmpty())).isEmpty();
        assertThatThrownBy(() -> registry.names().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }
}
