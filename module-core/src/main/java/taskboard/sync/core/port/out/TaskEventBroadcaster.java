package taskboard.sync.core.port.out;

/**
 * 채널 단위 실시간 fan-out
 *
 * <p>전달은 best-effort / fire-and-forget입니다. push 시점에 구독 중이 아닌 클라이언트는 해당 메시지를 받지 못합니다.
 */
public interface TaskEventBroadcaster {

  void subscribe(BroadcastClient client, String channel);

  void unsubscribe(BroadcastClient client, String channel);

  /** 연결 종료 시 모든 채널에서 제거 */
  void unsubscribeAll(BroadcastClient client);

  /**
   * 채널의 현재 구독자 전원에게 페이로드를 전송합니다.
   *
   * <p>한 클라이언트의 전송 실패는 다른 클라이언트 전송을 중단시키지 않습니다.
   *
   * @return 전송에 성공한 클라이언트 수
   */
  int push(String channel, Object payload);

  int subscriberCount(String channel);
}
