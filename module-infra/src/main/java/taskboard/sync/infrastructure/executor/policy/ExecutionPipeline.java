package taskboard.sync.infrastructure.executor.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import taskboard.sync.infrastructure.executor.TaskContext;
import taskboard.sync.infrastructure.executor.function.ThrowingSupplier;
import taskboard.sync.util.InterruptUtils;

/**
 * ExecutionPolicy를 순차 실행하는 파이프라인.
 *
 * <ul>
 *   <li>BEFORE는 등록 순서, AFTER는 역순(LIFO)
 *   <li>before() 성공한 정책만 after() 호출 (entered pairing)
 *   <li>elapsedNanos는 task.get() 구간만 측정
 *   <li>task 예외는 원본 그대로 전파, AFTER 예외는 suppressed로만 합류
 *   <li>Error는 관측 훅에서 삼키지 않음
 * </ul>
 */
@Slf4j
public class ExecutionPipeline {

  private final List<ExecutionPolicy> policies;

  public ExecutionPipeline(List<ExecutionPolicy> policies) {
    Objects.requireNonNull(policies, "policies must not be null");
    for (int i = 0; i < policies.size(); i++) {
      Objects.requireNonNull(policies.get(i), "policies[" + i + "] is null");
    }
    this.policies = List.copyOf(policies);
  }

  public <T> T executeRaw(ThrowingSupplier<T> task, TaskContext context) throws Throwable {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(context, "context must not be null");

    List<ExecutionPolicy> entered = new ArrayList<>(policies.size());
    for (ExecutionPolicy policy : policies) {
      if (invokeBefore(policy, context)) {
        entered.add(policy);
      }
    }

    ExecutionOutcome outcome = ExecutionOutcome.FAILURE;
    Throwable primary = null;
    T result = null;
    long start = System.nanoTime();
    long elapsed;

    try {
      result = task.get();
      elapsed = System.nanoTime() - start;
      outcome = ExecutionOutcome.SUCCESS;
      for (ExecutionPolicy policy : entered) {
        invokeOnSuccess(policy, result, elapsed, context);
      }
    } catch (Throwable t) {
      elapsed = System.nanoTime() - start;
      InterruptUtils.restoreInterruptIfNeeded(t);
      primary = t;
      for (ExecutionPolicy policy : entered) {
        invokeOnFailure(policy, t, elapsed, context);
      }
    }

    for (int i = entered.size() - 1; i >= 0; i--) {
      ExecutionPolicy policy = entered.get(i);
      try {
        policy.after(outcome, elapsed, context);
      } catch (Error err) {
        throw err;
      } catch (Throwable afterEx) {
        log.warn("[Policy:AFTER] failed. policy={}, taskName={}", name(policy), context.toTaskName(), afterEx);
        if (policy.failureMode() == FailureMode.PROPAGATE && primary == null) {
          primary = afterEx;
        } else if (primary != null && primary != afterEx) {
          primary.addSuppressed(afterEx);
        }
      }
    }

    if (primary != null) {
      throw primary;
    }
    return result;
  }

  private boolean invokeBefore(ExecutionPolicy policy, TaskContext context) throws Exception {
    try {
      policy.before(context);
      return true;
    } catch (Exception e) {
      log.warn("[Policy:BEFORE] failed. policy={}, taskName={}", name(policy), context.toTaskName(), e);
      if (policy.failureMode() == FailureMode.PROPAGATE) {
        throw e;
      }
      return false;
    }
  }

  private <T> void invokeOnSuccess(
      ExecutionPolicy policy, T result, long elapsedNanos, TaskContext context) {
    try {
      policy.onSuccess(result, elapsedNanos, context);
    } catch (Exception e) {
      log.warn("[Policy:ON_SUCCESS] failed. policy={}, taskName={}", name(policy), context.toTaskName(), e);
    }
  }

  private void invokeOnFailure(
      ExecutionPolicy policy, Throwable cause, long elapsedNanos, TaskContext context) {
    try {
      policy.onFailure(cause, elapsedNanos, context);
    } catch (Exception e) {
      log.warn("[Policy:ON_FAILURE] failed. policy={}, taskName={}", name(policy), context.toTaskName(), e);
      cause.addSuppressed(e);
    }
  }

  private static String name(ExecutionPolicy policy) {
    return policy.getClass().getSimpleName();
  }
}
