package taskboard.sync.domain.relay;

/**
 * Relay worker 상태 머신
 *
 * <pre>
 * NOT_STARTED → RUNNING → FAULTED → (새 worker) RUNNING
 *                      ↘ STOPPED (graceful shutdown 전용)
 * </pre>
 */
public enum RelayState {
  NOT_STARTED,
  RUNNING,
  FAULTED,
  STOPPED;

  /** 이 상태의 worker를 새 worker로 교체해야 하는지 */
  public boolean isRestartable() {
    return this != RUNNING;
  }
}
