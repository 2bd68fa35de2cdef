package taskboard.sync.infrastructure.executor;

import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import taskboard.sync.infrastructure.executor.function.ThrowingRunnable;
import taskboard.sync.infrastructure.executor.function.ThrowingSupplier;
import taskboard.sync.infrastructure.executor.policy.ExecutionPipeline;
import taskboard.sync.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * ExecutionPipeline 기반 LogicExecutor 구현체
 *
 * <ul>
 *   <li>모든 메서드가 {@link ExecutionPipeline#executeRaw}를 통해 실행
 *   <li>Error 즉시 rethrow
 *   <li>번역기 자체가 실패해도 그 예외를 primary로 삼아 원인을 잃지 않음
 * </ul>
 */
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExecutionPipeline pipeline;
  private final ExceptionTranslator translator;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return pipeline.executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      Throwable translated = translateSafe(translator, t, context);
      if (translated instanceof Error e) {
        throw e;
      }
      return recovery.apply(translated);
    }
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(finallyBlock, "finallyBlock");
    return execute(
        () -> {
          try {
            return task.get();
          } finally {
            finallyBlock.run();
          }
        },
        context);
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    try {
      return pipeline.executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      Throwable primary = translateSafe(customTranslator, t, context);
      if (primary instanceof Error e) {
        throw e;
      }
      throw (RuntimeException) primary;
    }
  }

  /** 번역기가 RuntimeException/Error로 실패하면 그 예외 자체를 primary로 삼는다. */
  private static Throwable translateSafe(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    try {
      RuntimeException translated = customTranslator.translate(t, context);
      return translated != null
          ? translated
          : new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, t);
    } catch (RuntimeException | Error ex) {
      return ex;
    }
  }
}
