package io.rulekit.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy: an abstract compile tier and a concrete evaluation error under one root, with a phase on each.
 */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void ruleKitExceptionIsAbstractAndRoot() {
        assertThat(RuleKitException.class).isAbstract();
        assertThat(RuleKitException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void compileTierIsAbstractAndEvalIsConcrete() {
        assertThat(LogicCompileException.class).isAbstract();
        assertThat(LogicCompileException.class.getSuperclass()).isEqualTo(RuleKitException.class);
        assertThat(ExpressionEvalException.class).isFinal();
        assertThat(ExpressionEvalException.class.getSuperclass()).isEqualTo(RuleKitException.class);
    }

    // --- Compile-time exceptions ---

    @Test
    void expressionSyntaxExceptionCarriesOffset() {
        var ex = new ExpressionSyntaxException("Unexpected token ')' at offset 4", 4, "pricing", "pricing.yaml");

        assertThat(ex).isInstanceOf(LogicCompileException.class);
        assertThat(ex.offset()).isEqualTo(4);
        assertThat(ex.definitionId()).isEqualTo("pricing");
        assertThat(ex.source()).isEqualTo("pricing.yaml");
        assertThat(ex.phase()).isEqualTo(RuleKitException.Phase.COMPILE);
    }

    @Test
    void cellCompileExceptionWithLocation() {
        var ex = new CellCompileException("Invalid number \"x\"", "total", null, "> x");

        var located = ex.withLocation("r3", "discount");

        assertThat(located.getMessage()).isEqualTo("Invalid number \"x\" (column 'total', row 'r3')");
        assertThat(located.rowId()).isEqualTo("r3");
        assertThat(located.columnId()).isEqualTo("total");
        assertThat(located.cellText()).isEqualTo("> x");
        assertThat(located.definitionId()).isEqualTo("discount");
        assertThat(ex.rowId()).isNull();
    }

    @Test
    void definitionParseExceptionKeepsCause() {
        var cause = new IllegalStateException("yaml");
        var ex = new DefinitionParseException("bad yaml", cause, "t1", "/defs/t1.yaml");

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.describe()).isEqualTo("[COMPILE t1 (/defs/t1.yaml)] bad yaml");
        assertThat(ex.phase()).isEqualTo(RuleKitException.Phase.COMPILE);
    }

    @Test
    void wireFormatExceptionIsCompilePhase() {
        assertThat(new WireFormatException("bad").phase()).isEqualTo(RuleKitException.Phase.COMPILE);
    }

    // --- Evaluation-time exceptions ---

    @Test
    void expressionEvalExceptionCarriesStep() {
        var ex = new ExpressionEvalException("Division by zero", null, "checkout", 2);

        assertThat(ex.phase()).isEqualTo(RuleKitException.Phase.EVALUATION);
        assertThat(ex.stepIndex()).isEqualTo(2);
        assertThat(ex.definitionId()).isEqualTo("checkout");
        assertThat(ex.describe()).isEqualTo("[EVALUATION checkout, step 3] Division by zero");
    }

    @Test
    void expressionEvalExceptionAtStepKeepsOriginalAsCause() {
        var raw = new ExpressionEvalException("Unknown operator 'nope'");

        var located = raw.atStep("checkout", 0);

        assertThat(raw.describe()).isEqualTo("[EVALUATION] Unknown operator 'nope'");
        assertThat(located.getCause()).isSameAs(raw);
        assertThat(located.stepIndex()).isZero();
        assertThat(located.describe()).isEqualTo("[EVALUATION checkout, step 1] Unknown operator 'nope'");
    }
}
