package taskboard.sync.error.exception;

import taskboard.sync.error.CommonErrorCode;
import taskboard.sync.error.exception.base.ServerBaseException;

/** 관리되지 않은 예외를 규격화하는 최종 래퍼 */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }
}
