package taskboard.sync.domain.task;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;

/** 그룹별 캐시에 materialize되는 작업 읽기 모델 */
public record TaskView(
    long id,
    String title,
    String description,
    boolean completed,
    @JsonProperty("created_at") @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
        LocalDateTime createdAt) {}
