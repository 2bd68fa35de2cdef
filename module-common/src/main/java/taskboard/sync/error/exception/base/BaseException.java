package taskboard.sync.error.exception.base;

import lombok.Getter;
import taskboard.sync.error.ErrorCode;

/**
 * 프로젝트 예외 계층의 루트
 *
 * <p>모든 도메인/인프라 예외는 {@link ErrorCode}를 가지며, 메시지는 ErrorCode의 템플릿에 인자를 채워 만듭니다.
 */
@Getter
public abstract class BaseException extends RuntimeException {

  private final ErrorCode errorCode;

  protected BaseException(ErrorCode errorCode) {
    super(errorCode.getMessage());
    this.errorCode = errorCode;
  }

  protected BaseException(ErrorCode errorCode, Object... args) {
    super(format(errorCode, args));
    this.errorCode = errorCode;
  }

  protected BaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode.getMessage(), cause);
    this.errorCode = errorCode;
  }

  protected BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(format(errorCode, args), cause);
    this.errorCode = errorCode;
  }

  private static String format(ErrorCode errorCode, Object... args) {
    return String.format(errorCode.getMessage(), args);
  }
}
