package scriptsync.platform.mcp;

import java.util.List;
import org.springframework.stereotype.Component;

/** Tool names exposed to agent clients; each maps onto one HTTP operation. */
@Component
public class McpToolRegistry {
  public List<String> listTools() {
    return List.of("sync", "list_subtrees", "write_file", "delete_file");
  }
}
