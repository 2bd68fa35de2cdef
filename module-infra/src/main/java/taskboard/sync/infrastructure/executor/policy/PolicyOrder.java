package taskboard.sync.infrastructure.executor.policy;

/** ExecutionPolicy 정렬 순서. 낮을수록 before가 먼저, after가 나중에 실행됩니다. */
public final class PolicyOrder {

  public static final int TIMER = 100;
  public static final int LOGGING = 200;

  private PolicyOrder() {}
}
