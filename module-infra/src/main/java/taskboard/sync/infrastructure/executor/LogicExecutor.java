package taskboard.sync.infrastructure.executor;

import java.util.function.Function;
import taskboard.sync.infrastructure.executor.function.ThrowingRunnable;
import taskboard.sync.infrastructure.executor.function.ThrowingSupplier;
import taskboard.sync.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 비즈니스 로직 실행 템플릿
 *
 * <p>호출부에서 try-catch 없이 예외 번역, 로깅, 메트릭을 일관되게 적용합니다. {@link Error}는 어떤 메서드에서도 복구/번역하지 않고 즉시
 * 전파합니다.
 *
 * <pre>{@code
 * // 실패 시 기본값 (Graceful Degradation)
 * List<TaskView> cached = executor.executeOrDefault(() -> readBucket(key), null, context);
 *
 * // 실패 시 복구 로직
 * return executor.executeOrCatch(() -> append(event), e -> PublishResult.failed(e), context);
 * }</pre>
 */
public interface LogicExecutor {

  /** 실패 시 기본 번역기로 변환된 RuntimeException을 던집니다. */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  /** 실패 시 defaultValue를 반환합니다. */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /** 실패 시 번역된 예외를 recovery에 전달하고 그 결과를 반환합니다. */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  /** task 성공/실패와 무관하게 finallyBlock을 실행합니다. (try-finally 대체) */
  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  /** 호출부가 지정한 번역기로 예외를 변환해 던집니다. */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
