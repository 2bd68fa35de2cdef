package taskboard.sync.error.exception;

import taskboard.sync.error.CommonErrorCode;
import taskboard.sync.error.exception.base.ServerBaseException;

/**
 * 이벤트 버스(tasks_topic) append 실패
 *
 * <p>브로커 미응답, ack 타임아웃, 직렬화 실패를 모두 포함합니다. 저장소 쓰기는 이미 커밋된 상태이므로 호출자는 이 예외를 non-fatal 경고로
 * 취급합니다.
 */
public class EventPublishException extends ServerBaseException {

  public EventPublishException(String detail) {
    super(CommonErrorCode.EVENT_PUBLISH_ERROR, detail);
  }

  public EventPublishException(String detail, Throwable cause) {
    super(CommonErrorCode.EVENT_PUBLISH_ERROR, cause, detail);
  }
}
