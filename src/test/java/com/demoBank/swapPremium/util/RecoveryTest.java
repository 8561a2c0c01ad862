package com.demoBank.swapPremium.util;

import org.junit.jupiter.api.Test;

import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecoveryTest {

    private static Integer parse(String text) {
        return Integer.valueOf(text);
    }

    @Test
    void wrapsSuccessfulResults() {
        Outcome<Integer> outcome = Recovery.withRecovery(RecoveryTest::parse, Recovery.Policy.DROP, "parse").apply("42");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getValue()).isEqualTo(42);
    }

    @Test
    void dropPolicyTurnsFailuresIntoOutcomes() {
        Function<String, Outcome<Integer>> parser = Recovery.withRecovery(RecoveryTest::parse, Recovery.Policy.DROP, "parse");

        Outcome<Integer> outcome = parser.apply("forty-two");

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.getFailure()).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(outcome::getValue).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void propagatePolicyRethrows() {
        Function<String, Outcome<Integer>> parser = Recovery.withRecovery(RecoveryTest::parse, Recovery.Policy.PROPAGATE, "parse");

        assertThatThrownBy(() -> parser.apply("forty-two")).isInstanceOf(NumberFormatException.class);
    }
}
