package dev.zxul767.pcc.codegen;

// Raised when the code generator meets IR that earlier stages should have
// rejected. Never a user error.
public class CodegenError extends RuntimeException {
  public CodegenError(String message) { super(message); }

  public CodegenError(String message, Throwable cause) { super(message, cause); }
}
