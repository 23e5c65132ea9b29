package express.mvp.controlbridge.client.error;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.controlbridge.client.BridgeError;
import express.mvp.controlbridge.client.BridgeException;
import java.net.ConnectException;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RetryPolicy} and {@link RetryContext}. */
@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Nested
    @DisplayName("Attempt budget")
    class AttemptTests {

        @Test
        @DisplayName("noRetry allows one attempt")
        void noRetry_allowsOneAttempt() {
            RetryPolicy policy = RetryPolicy.noRetry();
            RetryContext context = new RetryContext(policy.getMaxAttempts());

            context.startAttempt();
            context.recordFailure(new ConnectException("refused"));

            assertEquals(1, policy.getMaxAttempts());
            assertFalse(policy.shouldRetry(context));
        }

        @Test
        @DisplayName("zero or negative maxAttempts means unlimited")
        void unlimited() {
            RetryPolicy policy = RetryPolicy.builder().maxAttempts(0).build();
            RetryContext context = new RetryContext(policy.getMaxAttempts());
            for (int i = 0; i < 1_000; i++) {
                context.startAttempt();
                context.recordFailure(new ConnectException("refused"));
            }

            assertEquals(Integer.MAX_VALUE, policy.getMaxAttempts());
            assertTrue(policy.shouldRetry(context));
        }

        @Test
        @DisplayName("stops once the attempts are used up")
        void stopsWhenExhausted() {
            RetryPolicy policy = RetryPolicy.fixedDelay(3, Duration.ofMillis(10));
            RetryContext context = new RetryContext("connect", policy.getMaxAttempts());

            for (int i = 1; i <= 2; i++) {
                context.startAttempt();
                context.recordFailure(new ConnectException("refused"));
                assertTrue(policy.shouldRetry(context), "after attempt " + i);
            }
            context.startAttempt();
            context.recordFailure(new ConnectException("refused"));

            assertTrue(context.isLastAttempt());
            assertFalse(policy.shouldRetry(context));
        }

        @Test
        @DisplayName("reset starts the budget over")
        void resetStartsOver() {
            RetryContext context = new RetryContext(2);
            context.startAttempt();
            context.startAttempt();
            context.recordDelay(500);
            assertFalse(context.hasAttemptsRemaining());

            context.reset();

            assertTrue(context.hasAttemptsRemaining());
            assertEquals(0, context.getAttemptCount());
            assertEquals(0, context.getTotalDelayMillis());
            assertNull(context.getLastError());
        }

        @Test
        @DisplayName("total duration is measured on the supplied clock")
        void totalDuration() {
            long[] now = {10_000};
            RetryPolicy policy =
                    RetryPolicy.builder()
                            .maxAttempts(100)
                            .maxTotalDuration(Duration.ofSeconds(5))
                            .build();
            RetryContext context = new RetryContext("link", 100, () -> now[0]);
            context.startAttempt();
            context.recordFailure(new ConnectException("refused"));

            now[0] += 4_999;
            assertTrue(policy.shouldRetry(context));
            now[0] += 1;
            assertFalse(policy.shouldRetry(context));
            assertEquals(5_000, context.getElapsedMillis());
        }
    }

    @Nested
    @DisplayName("Error categories")
    class CategoryTests {

        private final RetryPolicy policy = RetryPolicy.fixedDelay(5, Duration.ofMillis(10));

        private boolean retriesAfter(Throwable error) {
            RetryContext context = new RetryContext(policy.getMaxAttempts());
            context.startAttempt();
            context.recordFailure(error);
            return policy.shouldRetry(context);
        }

        @Test
        @DisplayName("transport errors and timeouts are retried")
        void transportAndTimeoutRetried() {
            assertTrue(retriesAfter(new BridgeException(BridgeError.TRANSPORT_ERROR, "down")));
            assertTrue(retriesAfter(new BridgeException(BridgeError.IDENTIFY_TIMEOUT, "slow")));
            assertTrue(retriesAfter(new BridgeException(BridgeError.COMMAND_TIMEOUT, "slow")));
        }

        @Test
        @DisplayName("rejections and unknown components are never retried")
        void protocolErrorsNotRetried() {
            assertFalse(retriesAfter(new BridgeException(BridgeError.COMMAND_REJECTED, "no")));
            assertFalse(
                    retriesAfter(new BridgeException(BridgeError.COMPONENT_NOT_FOUND, "who?")));
        }

        @Test
        @DisplayName("shutdown is fatal")
        void shutdownFatal() {
            assertFalse(retriesAfter(new BridgeException(BridgeError.SHUTTING_DOWN, "bye")));
        }

        @Test
        @DisplayName("network retries can be switched off")
        void networkRetriesSwitchable() {
            RetryPolicy strict = RetryPolicy.builder().maxAttempts(5).retryNetwork(false).build();
            RetryContext context = new RetryContext(strict.getMaxAttempts());
            context.startAttempt();
            context.recordFailure(new ConnectException("refused"));

            assertFalse(strict.shouldRetry(context));
        }
    }

    @Nested
    @DisplayName("Delay")
    class DelayTests {

        @Test
        @DisplayName("exponential delay grows up to the cap")
        void exponentialUpToCap() {
            RetryPolicy policy =
                    RetryPolicy.exponentialBackoffWithJitter(
                            10, Duration.ofMillis(100), Duration.ofMillis(1_000), 0);
            RetryContext context = new RetryContext(policy.getMaxAttempts());

            context.startAttempt();
            assertEquals(200, policy.calculateDelay(context));
            context.startAttempt();
            assertEquals(400, policy.calculateDelay(context));
            for (int i = 0; i < 5; i++) {
                context.startAttempt();
            }
            assertEquals(1_000, policy.calculateDelay(context));
            assertEquals(1_000, context.getNextDelayMillis());
        }

        @Test
        @DisplayName("initial delay above max is rejected")
        void initialAboveMaxRejected() {
            RetryPolicy.Builder builder =
                    RetryPolicy.builder()
                            .initialDelay(Duration.ofSeconds(10))
                            .maxDelay(Duration.ofSeconds(1));
            assertThrows(IllegalArgumentException.class, builder::build);
        }
    }
}
