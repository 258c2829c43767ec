package dev.zxul767.pcc.ir;

import java.util.List;
import java.util.Objects;

public class ClassDef {
  public static final String INITIALIZER = "__init__";

  public ClassDef(
      String name, List<FieldDef> fields, List<FunctionDef> methods,
      int sourceLine
  ) {
    this.name = name;
    this.fields = List.copyOf(fields);
    this.methods = List.copyOf(methods);
    this.sourceLine = sourceLine;
  }

  public FunctionDef method(String name) {
    for (FunctionDef method : methods) {
      if (method.name.equals(name))
        return method;
    }
    return null;
  }

  public FunctionDef initializer() { return method(INITIALIZER); }

  public boolean hasField(String name) {
    for (FieldDef field : fields) {
      if (field.name.equals(name))
        return true;
    }
    return false;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof ClassDef))
      return false;
    ClassDef that = (ClassDef)other;
    return name.equals(that.name) && fields.equals(that.fields) &&
        methods.equals(that.methods);
  }

  @Override
  public int hashCode() { return Objects.hash(name, fields, methods); }

  public final String name;
  public final List<FieldDef> fields;
  public final List<FunctionDef> methods;
  public final int sourceLine;
}
