package taskboard.sync.core.port.out;

/** 실시간 연결 1개 (transport 구현에 독립) */
public interface BroadcastClient {

  /** 연결 식별자 (세션 ID) */
  String id();

  /**
   * 이벤트 1건을 이 클라이언트에 전송합니다.
   *
   * @param eventName 서버→클라이언트 이벤트 이름 (예: task_event)
   * @param payload 직렬화 대상 페이로드
   */
  void send(String eventName, Object payload);
}
