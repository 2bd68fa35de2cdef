package taskboard.sync.error.exception.base;

import taskboard.sync.error.ErrorCode;

/**
 * ServerBaseException: 브로커/캐시 장애 등 시스템 내부 오류. 5xx 계열이며, 장애 회고를 위한 상세 로그(cause 포함)를 남기는 것이 주
 * 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
