package taskboard.sync.error.exception;

import taskboard.sync.error.ErrorCode;
import taskboard.sync.error.exception.base.ServerBaseException;

/**
 * Relay 소비 루프 실패 (역직렬화, 브로드캐스트, 컨슈머 오류)
 *
 * <p>현재 relay worker 인스턴스에 치명적입니다. worker는 FAULTED로 종료되고, 다음 실시간 연결 시 재시작 대상이 됩니다.
 */
public class EventRelayException extends ServerBaseException {

  public EventRelayException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public EventRelayException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
