package dev.zxul767.pcc.ir;

import java.util.List;
import java.util.Objects;

// The root artifact handed to type checking and code generation.
public class ModuleIR {
  public ModuleIR(
      List<FunctionDef> functions, List<ClassDef> classes,
      List<Stmt> mainStatements
  ) {
    this.functions = List.copyOf(functions);
    this.classes = List.copyOf(classes);
    this.mainStatements = List.copyOf(mainStatements);
  }

  public FunctionDef function(String name) {
    for (FunctionDef function : functions) {
      if (function.name.equals(name))
        return function;
    }
    return null;
  }

  public ClassDef classNamed(String name) {
    for (ClassDef classDef : classes) {
      if (classDef.name.equals(name))
        return classDef;
    }
    return null;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof ModuleIR))
      return false;
    ModuleIR that = (ModuleIR)other;
    return functions.equals(that.functions) && classes.equals(that.classes) &&
        mainStatements.equals(that.mainStatements);
  }

  @Override
  public int hashCode() {
    return Objects.hash(functions, classes, mainStatements);
  }

  public final List<FunctionDef> functions;
  public final List<ClassDef> classes;
  public final List<Stmt> mainStatements;
}
