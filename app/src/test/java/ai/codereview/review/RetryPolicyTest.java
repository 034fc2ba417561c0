package ai.codereview.review;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    @Test
    void doublesBackoffUntilCapWithoutJitter() {
        RetryPolicy policy = new RetryPolicy(6, Duration.ofSeconds(1), Duration.ofSeconds(5), 0.0);

        assertThat(policy.backoffFor(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoffFor(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoffFor(3)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.backoffFor(62)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void jitterStaysWithinFactor() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 0.3);

        for (int i = 0; i < 200; i++) {
            assertThat(policy.backoffFor(1).toMillis()).isBetween(1400L, 2600L);
        }
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(5), Duration.ofSeconds(1), 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.defaults().backoffFor(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultsMatchDocumentedValues() {
        RetryPolicy defaults = RetryPolicy.defaults();

        assertThat(defaults.maxAttempts()).isEqualTo(3);
        assertThat(defaults.initialBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(defaults.maxBackoff()).isEqualTo(Duration.ofSeconds(30));
        assertThat(RetryPolicy.noRetries().maxAttempts()).isEqualTo(1);
    }
}
