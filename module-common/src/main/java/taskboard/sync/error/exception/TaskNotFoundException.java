package taskboard.sync.error.exception;

import taskboard.sync.error.CommonErrorCode;
import taskboard.sync.error.exception.base.ClientBaseException;

/** 작업이 없거나 다른 그룹 소유일 때 (두 경우를 구분하지 않음) */
public class TaskNotFoundException extends ClientBaseException {

  public TaskNotFoundException(long taskId, long groupId) {
    super(CommonErrorCode.TASK_NOT_FOUND, taskId, groupId);
  }
}
