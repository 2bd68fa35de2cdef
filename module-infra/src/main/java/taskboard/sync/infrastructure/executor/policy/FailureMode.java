package taskboard.sync.infrastructure.executor.policy;

/** Lifecycle 훅(before/after) 실패 처리 방식 */
public enum FailureMode {
  /** 훅 실패를 로그로만 남기고 실행을 계속 */
  SWALLOW,
  /** 훅 실패를 즉시 전파 */
  PROPAGATE
}
