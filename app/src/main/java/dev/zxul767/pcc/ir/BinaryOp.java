package dev.zxul767.pcc.ir;

public enum BinaryOp {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  FLOOR_DIV("//"),
  MOD("%");

  public final String symbol;

  BinaryOp(String symbol) { this.symbol = symbol; }

  public boolean isDivision() { return this == FLOOR_DIV || this == MOD; }
}
