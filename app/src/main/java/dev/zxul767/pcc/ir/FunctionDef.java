package dev.zxul767.pcc.ir;

import java.util.List;
import java.util.Objects;

// A top-level function or a method. Methods keep `self` as their first
// parameter.
public class FunctionDef {
  public FunctionDef(
      String name, List<String> params, List<Stmt> body, int sourceLine
  ) {
    this.name = name;
    this.params = List.copyOf(params);
    this.body = List.copyOf(body);
    this.sourceLine = sourceLine;
  }

  public int arity() { return params.size(); }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof FunctionDef))
      return false;
    FunctionDef that = (FunctionDef)other;
    return name.equals(that.name) && params.equals(that.params) &&
        body.equals(that.body);
  }

  @Override
  public int hashCode() { return Objects.hash(name, params, body); }

  public final String name;
  public final List<String> params;
  public final List<Stmt> body;
  public final int sourceLine;
}
