package taskboard.sync.domain.task;

/**
 * 부분 수정 요청. null 필드는 기존 값을 유지합니다.
 *
 * @param title 새 제목 (nullable)
 * @param description 새 설명 (nullable)
 * @param completed 새 완료 여부 (nullable)
 */
public record TaskPatch(String title, String description, Boolean completed) {

  public static TaskPatch completed(boolean completed) {
    return new TaskPatch(null, null, completed);
  }
}
