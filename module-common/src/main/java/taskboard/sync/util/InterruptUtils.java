package taskboard.sync.util;

import java.io.InterruptedIOException;

/**
 * 인터럽트 복원 유틸리티
 *
 * <p>예외 그래프(cause chain + suppressed)에서 InterruptedException 또는 InterruptedIOException이 발견되면 현재
 * 스레드의 interrupt 플래그를 복원합니다.
 */
public final class InterruptUtils {

  /** Throwable 그래프 순회 최대 깊이 (순환 참조 방지) */
  private static final int MAX_GRAPH_DEPTH = 32;

  private InterruptUtils() {}

  public static void restoreInterruptIfNeeded(Throwable t) {
    if (t != null && containsInterrupted(t, 0)) {
      Thread.currentThread().interrupt();
    }
  }

  private static boolean containsInterrupted(Throwable t, int depth) {
    if (t == null || depth >= MAX_GRAPH_DEPTH) return false;
    if (t instanceof InterruptedException || t instanceof InterruptedIOException) return true;

    for (Throwable s : t.getSuppressed()) {
      if (containsInterrupted(s, depth + 1)) return true;
    }
    return containsInterrupted(t.getCause(), depth + 1);
  }
}
