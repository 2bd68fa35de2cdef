package taskboard.sync.service.task;

import taskboard.sync.domain.task.TaskSnapshot;
import taskboard.sync.service.event.PublishResult;

/**
 * 커밋된 변경 결과
 *
 * @param task 변경 후 스냅샷 (delete는 삭제 직전 값)
 * @param publish 발행/무효화 결과. 발행 실패는 warning으로만 노출
 */
public record MutationResult(TaskSnapshot task, PublishResult publish) {

  public boolean hasWarning() {
    return publish.hasWarning();
  }
}
