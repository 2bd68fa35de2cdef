package taskboard.sync.domain.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** 작업 변경 종류. 와이어 포맷은 소문자 ("create" | "update" | "delete") */
public enum TaskAction {
  CREATE,
  UPDATE,
  DELETE;

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static TaskAction fromWire(String value) {
    if (value == null) {
      throw new IllegalArgumentException("action must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
