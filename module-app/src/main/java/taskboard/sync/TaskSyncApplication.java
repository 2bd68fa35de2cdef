package taskboard.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(TaskSyncApplication.class, args);
  }
}
