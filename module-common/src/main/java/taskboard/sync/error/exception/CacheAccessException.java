package taskboard.sync.error.exception;

import taskboard.sync.error.CommonErrorCode;
import taskboard.sync.error.exception.base.ServerBaseException;

/** 캐시 저장소(Redis/Caffeine) 접근 실패 */
public class CacheAccessException extends ServerBaseException {

  public CacheAccessException(String detail, Throwable cause) {
    super(CommonErrorCode.CACHE_ACCESS_ERROR, cause, detail);
  }
}
