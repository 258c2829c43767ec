package dev.zxul767.pcc.typing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Final type of every name of one function, method or of the main program.
public class ScopeTypes {
  public final String name;
  public final List<String> params;
  // parameters first, then locals in order of first assignment
  public final Map<String, Type> variables;

  public ScopeTypes(String name, List<String> params, Map<String, Type> variables) {
    this.name = name;
    this.params = List.copyOf(params);
    this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
  }

  public Type typeOf(String variable) { return variables.get(variable); }

  public boolean isParam(String variable) { return params.contains(variable); }
}
