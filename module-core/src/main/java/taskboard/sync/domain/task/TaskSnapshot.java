package taskboard.sync.domain.task;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 이벤트 페이로드에 실리는 작업 스냅샷 (불변)
 *
 * <p>delete의 경우 행이 사라지기 전에 캡처한 값입니다.
 *
 * @param id 작업 ID
 * @param title 제목
 * @param description 설명
 * @param completed 완료 여부
 * @param groupId 소유 그룹 ID (와이어: group_id)
 */
public record TaskSnapshot(
    long id,
    String title,
    String description,
    boolean completed,
    @JsonProperty("group_id") long groupId) {}
