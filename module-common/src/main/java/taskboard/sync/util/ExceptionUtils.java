package taskboard.sync.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Exception unwrapping utilities. */
public final class ExceptionUtils {

  private ExceptionUtils() {}

  /**
   * CompletionException / ExecutionException 래퍼를 벗겨 원인을 반환합니다.
   *
   * <p>KafkaTemplate.send() future의 실패는 항상 ExecutionException으로 감싸져 오므로 번역 전에 unwrap이 필요합니다.
   *
   * @param throwable 검사할 예외
   * @return 원인 예외, 래퍼가 아니면 원본
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      Throwable next = cause.getCause();
      if (next == null) {
        return cause;
      }
      cause = next;
    }
    return cause;
  }
}
