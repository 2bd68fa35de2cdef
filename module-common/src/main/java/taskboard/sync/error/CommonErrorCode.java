package taskboard.sync.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  TASK_NOT_FOUND("C002", "존재하지 않는 작업입니다 (taskId: %s, groupId: %s)", HttpStatus.NOT_FOUND),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다: %s", HttpStatus.INTERNAL_SERVER_ERROR),
  DISTRIBUTED_LOCK_FAILURE("S002", "분산 락 처리 실패: %s", HttpStatus.INTERNAL_SERVER_ERROR),
  CACHE_ACCESS_ERROR("S003", "캐시 접근 실패 (%s)", HttpStatus.SERVICE_UNAVAILABLE),

  // === Event Bus Errors ===
  EVENT_PUBLISH_ERROR("E001", "이벤트 발행 실패 (%s)", HttpStatus.SERVICE_UNAVAILABLE),
  EVENT_CONSUMER_ERROR("E002", "이벤트 소비 실패 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  EVENT_DECODE_ERROR("E003", "이벤트 역직렬화 실패 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  BROADCAST_ERROR("E004", "실시간 브로드캐스트 실패 (%s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
