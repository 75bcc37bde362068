package eventqueue.jdbc;

import org.junit.jupiter.api.extension.ConditionEvaluationResult;
import org.junit.jupiter.api.extension.ExecutionCondition;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.testcontainers.DockerClientFactory;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Skips the PostgreSQL and MySQL claim suites on machines without a Docker daemon, so
 * the H2 suite alone still covers the queue semantics there.
 *
 * <p>The daemon is checked once per test JVM.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(DockerAvailable.Condition.class)
@interface DockerAvailable {

    final class Condition implements ExecutionCondition {
        private static volatile ConditionEvaluationResult cached;

        @Override
        public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
            ConditionEvaluationResult result = cached;
            if (result == null) {
                result = check();
                cached = result;
            }
            return result;
        }

        private static ConditionEvaluationResult check() {
            try {
                return DockerClientFactory.instance().isDockerAvailable()
                        ? ConditionEvaluationResult.enabled("Docker available for event queue containers")
                        : ConditionEvaluationResult.disabled("No Docker daemon; database container suites skipped");
            } catch (Throwable t) {
                return ConditionEvaluationResult.disabled("Docker check failed: " + t.getMessage());
            }
        }
    }
}
