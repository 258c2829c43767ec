package dev.zxul767.pcc.ir;

public enum LogicalOp {
  AND("and"),
  OR("or");

  public final String symbol;

  LogicalOp(String symbol) { this.symbol = symbol; }
}
