package dev.zxul767.pcc.typing;

import dev.zxul767.pcc.Backend;
import dev.zxul767.pcc.ir.ModuleIR;
import java.util.HashMap;
import java.util.Map;

// Output of the type checker: one `ScopeTypes` per function, per method and
// for the main program.
public class ModuleTypes {
  public final ModuleIR module;
  public final Backend backend;
  public final TypeRules rules;

  private ScopeTypes main;
  private final Map<String, ScopeTypes> functions = new HashMap<>();
  private final Map<String, ScopeTypes> methods = new HashMap<>();

  ModuleTypes(ModuleIR module, Backend backend) {
    this.module = module;
    this.backend = backend;
    this.rules = new TypeRules(backend);
  }

  void setMain(ScopeTypes main) { this.main = main; }

  void addFunction(ScopeTypes scope) { functions.put(scope.name, scope); }

  void addMethod(String className, ScopeTypes scope) {
    methods.put(methodKey(className, scope.name), scope);
  }

  public ScopeTypes main() { return main; }

  public ScopeTypes function(String name) { return functions.get(name); }

  public ScopeTypes method(String className, String name) {
    return methods.get(methodKey(className, name));
  }

  private static String methodKey(String className, String name) {
    return className + "." + name;
  }
}
