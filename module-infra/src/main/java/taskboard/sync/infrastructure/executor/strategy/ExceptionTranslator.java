package taskboard.sync.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.concurrent.TimeoutException;
import taskboard.sync.error.CommonErrorCode;
import taskboard.sync.error.exception.CacheAccessException;
import taskboard.sync.error.exception.DistributedLockException;
import taskboard.sync.error.exception.EventPublishException;
import taskboard.sync.error.exception.EventRelayException;
import taskboard.sync.error.exception.InternalSystemException;
import taskboard.sync.error.exception.base.BaseException;
import taskboard.sync.infrastructure.executor.TaskContext;
import taskboard.sync.util.ExceptionUtils;
import taskboard.sync.util.InterruptUtils;

/** 기술 예외를 프로젝트 예외 계층으로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>이미 BaseException이면 그대로 반환
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /** 이벤트 버스 append 변환기: 타임아웃/브로커 오류/직렬화 실패 → EventPublishException */
  static ExceptionTranslator forEventBus() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          InterruptUtils.restoreInterruptIfNeeded(unwrapped);
          if (unwrapped instanceof InterruptedException) {
            return new EventPublishException("interrupted [" + context.toTaskName() + "]", unwrapped);
          }
          if (unwrapped instanceof TimeoutException) {
            return new EventPublishException("ack timeout [" + context.toTaskName() + "]", unwrapped);
          }
          return new EventPublishException(
              unwrapped.getClass().getSimpleName() + " [" + context.toTaskName() + "]", unwrapped);
        });
  }

  /** JSON 역직렬화 변환기 (relay 소비 경로) */
  static ExceptionTranslator forJson() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof JsonProcessingException
              || unwrapped instanceof IllegalArgumentException) {
            return new EventRelayException(
                CommonErrorCode.EVENT_DECODE_ERROR, unwrapped, context.dynamicValue());
          }
          return new EventRelayException(
              CommonErrorCode.EVENT_CONSUMER_ERROR, unwrapped, context.toTaskName());
        });
  }

  /** Lock 예외 변환기 */
  static ExceptionTranslator forLock() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          InterruptUtils.restoreInterruptIfNeeded(unwrapped);
          return new DistributedLockException(context.dynamicValue(), unwrapped);
        });
  }

  /** 캐시 저장소 접근 변환기 */
  static ExceptionTranslator forCache() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new CacheAccessException(context.toTaskName(), unwrapped));
  }
}
