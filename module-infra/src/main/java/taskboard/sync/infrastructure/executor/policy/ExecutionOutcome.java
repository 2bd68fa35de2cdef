package taskboard.sync.infrastructure.executor.policy;

/** task 자체의 실행 결과 (정책 훅 실패와 무관) */
public enum ExecutionOutcome {
  SUCCESS,
  FAILURE
}
