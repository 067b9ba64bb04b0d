package io.courier.rabbitmq;

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
 * Runs the annotated broker test only when a Docker daemon can start a RabbitMQ container.
 * Setting {@code -Dcourier.broker-tests.skip=true} skips them regardless.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(DockerAvailable.BrokerContainerCondition.class)
@interface DockerAvailable {

  class BrokerContainerCondition implements ExecutionCondition {
    private static volatile ConditionEvaluationResult cached;

    @Override
    public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
      if (Boolean.getBoolean("courier.broker-tests.skip")) {
        return ConditionEvaluationResult.disabled("Broker tests skipped by courier.broker-tests.skip");
      }
      ConditionEvaluationResult result = cached;
      if (result == null) {
        result = checkDocker();
        cached = result;
      }
      return result;
    }

    private static ConditionEvaluationResult checkDocker() {
      try {
        if (DockerClientFactory.instance().isDockerAvailable()) {
          return ConditionEvaluationResult.enabled("Docker daemon reachable for RabbitMQ container");
        }
        return ConditionEvaluationResult.disabled("No Docker daemon; RabbitMQ container tests skipped");
      } catch (Throwable t) {
        return ConditionEvaluationResult.disabled("Docker check failed: " + t.getMessage());
      }
    }
  }
}
