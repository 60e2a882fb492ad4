package scriptsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScriptSyncApplication {
  public static void main(String[] args) {
    SpringApplication.run(ScriptSyncApplication.class, args);
  }
}
