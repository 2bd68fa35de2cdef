package taskboard.sync.error.exception;

import taskboard.sync.error.CommonErrorCode;
import taskboard.sync.error.exception.base.ServerBaseException;

/** 분산 락(Distributed Lock) 획득 실패 시 발생하는 서버 예외 */
public class DistributedLockException extends ServerBaseException {

  public DistributedLockException(String lockKey) {
    super(CommonErrorCode.DISTRIBUTED_LOCK_FAILURE, "락 획득 실패: " + lockKey);
  }

  public DistributedLockException(String lockKey, Throwable cause) {
    super(CommonErrorCode.DISTRIBUTED_LOCK_FAILURE, cause, "락 시도 중 오류: " + lockKey);
  }
}
