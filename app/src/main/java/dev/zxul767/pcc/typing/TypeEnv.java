package dev.zxul767.pcc.typing;

import dev.zxul767.pcc.Backend;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

// Flow-sensitive mapping from names to types for one function (or the main
// program). Branches work on copies which are merged back afterwards.
//
// In the fast backend a name first inferred as a native int that later
// receives an arbitrary-precision value is "promoted": its whole scope must
// then be inferred again with the name stored as a bigint from the start.
// The promotions (and the final type of every name) are shared by all copies
// of the environment.
public class TypeEnv {
  static class Scope {
    final Backend backend;
    // names whose type can never change (parameters, `self`)
    final Set<String> fixed = new HashSet<>();
    // survives from one inference run of the scope to the next
    final Set<String> promoted;
    // type of every name assigned anywhere in the scope, in order of first
    // assignment
    final Map<String, Type> declared = new LinkedHashMap<>();
    boolean promotedSomething = false;

    Scope(Backend backend, Set<String> promoted) {
      this.backend = backend;
      this.promoted = promoted;
    }
  }

  private final Scope scope;
  private final Map<String, Type> types;

  TypeEnv(Scope scope) {
    this.scope = scope;
    this.types = new LinkedHashMap<>();
  }

  private TypeEnv(Scope scope, Map<String, Type> types) {
    this.scope = scope;
    this.types = new LinkedHashMap<>(types);
  }

  public TypeEnv copy() { return new TypeEnv(scope, types); }

  public Type lookup(String name) { return types.get(name); }

  public Map<String, Type> declared() {
    return Collections.unmodifiableMap(scope.declared);
  }

  void declareFixed(String name, Type type) {
    scope.fixed.add(name);
    types.put(name, type);
    scope.declared.put(name, type);
  }

  public void assign(String name, Type value, int line) throws TypeError {
    Type existing = types.get(name);
    if (existing == null) {
      Type stored = value;
      if (scope.promoted.contains(name) && value.is(Type.Kind.INT))
        stored = Type.BIGINT;
      types.put(name, stored);
      scope.declared.putIfAbsent(name, stored);
      return;
    }
    if (existing.equals(value))
      return;
    // widening at the store is always safe
    if (existing.is(Type.Kind.BIGINT) && value.is(Type.Kind.INT))
      return;
    if (canPromote(name, existing, value)) {
      promote(name);
      return;
    }
    throw new TypeError(
        String.format(
            "variable '%s' reassigned from %s to %s", name, existing, value
        ),
        line
    );
  }

  // Replaces this environment with the union of `branches`, each of which
  // started as a copy of it.
  public void merge(List<TypeEnv> branches, int line) throws TypeError {
    Map<String, Type> merged = new LinkedHashMap<>();
    for (TypeEnv branch : branches) {
      for (Map.Entry<String, Type> entry : branch.types.entrySet()) {
        String name = entry.getKey();
        Type type = entry.getValue();
        Type other = merged.get(name);
        if (other == null || other.equals(type)) {
          merged.put(name, type);
        } else if (canPromote(name, other, type) || canPromote(name, type, other)) {
          promote(name);
          merged.put(name, Type.BIGINT);
        } else {
          throw new TypeError(
              String.format(
                  "variable '%s' assigned incompatible types in branches (%s vs %s)",
                  name, other, type
              ),
              line
          );
        }
      }
    }
    types.clear();
    types.putAll(merged);
  }

  private boolean canPromote(String name, Type existing, Type value) {
    return scope.backend == Backend.FAST && existing.is(Type.Kind.INT) &&
        value.is(Type.Kind.BIGINT) && !scope.fixed.contains(name);
  }

  private void promote(String name) {
    if (scope.promoted.add(name))
      scope.promotedSomething = true;
    types.put(name, Type.BIGINT);
    scope.declared.put(name, Type.BIGINT);
  }
}
