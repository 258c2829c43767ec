package dev.zxul767.pcc.ir;

public enum UnaryOp {
  NEGATE("-"),
  NOT("not");

  public final String symbol;

  UnaryOp(String symbol) { this.symbol = symbol; }
}
