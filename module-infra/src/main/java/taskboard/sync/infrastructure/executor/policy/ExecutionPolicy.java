package taskboard.sync.infrastructure.executor.policy;

import taskboard.sync.infrastructure.executor.TaskContext;

/**
 * 실행 전후에 횡단 관심사(로깅, 메트릭)를 주입하는 정책 (Stateless)
 *
 * <pre>
 * 1. before()
 * 2. [task 실행]
 * 3. onSuccess() 또는 onFailure()
 * 4. after()  (before가 성공한 정책만)
 * </pre>
 *
 * <p>onSuccess/onFailure는 관측 훅이며, 이 훅의 실패는 실행 결과에 영향을 주지 않습니다.
 */
public interface ExecutionPolicy {

  default FailureMode failureMode() {
    return FailureMode.SWALLOW;
  }

  default void before(TaskContext context) throws Exception {}

  default <T> void onSuccess(T result, long elapsedNanos, TaskContext context) throws Exception {}

  default void onFailure(Throwable error, long elapsedNanos, TaskContext context)
      throws Exception {}

  default void after(ExecutionOutcome outcome, long elapsedNanos, TaskContext context)
      throws Exception {}
}
