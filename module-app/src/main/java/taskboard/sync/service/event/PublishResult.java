package taskboard.sync.service.event;

/**
 * 발행 + 무효화 결과
 *
 * <p>발행 실패는 non-fatal입니다. 저장소 쓰기는 이미 커밋되었으므로 호출자는 warning을 사용자에게 노출하거나 로그로만 남길 수 있습니다.
 *
 * @param published 이벤트 버스 ack 수신 여부
 * @param invalidated 캐시 무효화 성공 여부
 * @param warning 발행 실패 사유 (성공 시 null)
 */
public record PublishResult(boolean published, boolean invalidated, String warning) {

  public boolean hasWarning() {
    return warning != null;
  }
}
