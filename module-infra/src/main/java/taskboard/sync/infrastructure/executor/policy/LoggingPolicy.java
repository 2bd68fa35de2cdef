package taskboard.sync.infrastructure.executor.policy;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import taskboard.sync.infrastructure.executor.TaskContext;

/**
 * 작업 실행 단계별 로깅 정책 (Stateless)
 *
 * <p>- before: [Task:START] -> DEBUG - onSuccess: [Task:SUCCESS] -> DEBUG, 임계치 초과 시 [Task:SLOW] ->
 * INFO - onFailure: [Task:FAILURE] (errorType, message) -> WARN. 스택트레이스는 호출부에서 예외를 처리하는 쪽이 남깁니다.
 */
@Slf4j
@Order(PolicyOrder.LOGGING)
public class LoggingPolicy implements ExecutionPolicy {

  private static final String TAG_START = "[Task:START]";
  private static final String TAG_SUCCESS = "[Task:SUCCESS]";
  private static final String TAG_SLOW = "[Task:SLOW]";
  private static final String TAG_FAILURE = "[Task:FAILURE]";

  private static final long MAX_SLOW_MS = 60_000L;

  private final long slowThresholdMs;
  private final long slowThresholdNanos;

  /**
   * @param slowMs slow 판정 임계치(ms). 0 이하면 SLOW 승격 비활성
   */
  public LoggingPolicy(long slowMs) {
    long clamped = Math.max(0L, Math.min(slowMs, MAX_SLOW_MS));
    this.slowThresholdMs = clamped;
    this.slowThresholdNanos = clamped > 0 ? TimeUnit.MILLISECONDS.toNanos(clamped) : Long.MAX_VALUE;
  }

  @Override
  public void before(TaskContext context) {
    if (!log.isDebugEnabled()) return;
    log.debug("{} {}", TAG_START, context.toTaskName());
  }

  @Override
  public <T> void onSuccess(T ignored, long elapsedNanos, TaskContext context) {
    if (elapsedNanos >= slowThresholdNanos) {
      log.info(
          "{} {}, elapsed={}, threshold={}ms",
          TAG_SLOW,
          context.toTaskName(),
          formatDuration(elapsedNanos),
          slowThresholdMs);
      return;
    }
    if (!log.isDebugEnabled()) return;
    log.debug("{} {}, elapsed={}", TAG_SUCCESS, context.toTaskName(), formatDuration(elapsedNanos));
  }

  @Override
  public void onFailure(Throwable error, long elapsedNanos, TaskContext context) {
    log.warn(
        "{} {}, elapsed={}, errorType={}, message={}",
        TAG_FAILURE,
        context.toTaskName(),
        formatDuration(elapsedNanos),
        error.getClass().getSimpleName(),
        error.getMessage());
  }

  private static String formatDuration(long elapsedNanos) {
    return String.format(Locale.ROOT, "%.3fms", elapsedNanos / 1_000_000d);
  }
}
