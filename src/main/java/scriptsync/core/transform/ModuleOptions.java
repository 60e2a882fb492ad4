package scriptsync.core.transform;

import java.util.List;

/**
 * Module settings that live in the remote shim but not in the local file: the eager-load flag and
 * the top-level bridge functions hoisted out of the module body.
 */
public record ModuleOptions(boolean loadNow, List<String> hoistedFunctions) {
  public static final ModuleOptions NONE = new ModuleOptions(false, List.of());

  public ModuleOptions {
    hoistedFunctions = hoistedFunctions == null ? List.of() : List.copyOf(hoistedFunctions);
  }

  public boolean isDefault() {
    return !loadNow && hoistedFunctions.isEmpty();
  }
}
