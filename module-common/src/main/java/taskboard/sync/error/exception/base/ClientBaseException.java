package taskboard.sync.error.exception.base;

import taskboard.sync.error.ErrorCode;

/**
 * ClientBaseException: 요청이 잘못되었을 때 발생하는 '비즈니스 예외'. 4xx 계열이며, 호출자에게 구체적인 실패 원인을 전달하는 것이
 * 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
