package dev.zxul767.pcc.ir;

// The source and C spellings of every comparison coincide.
public enum CompareOp {
  EQ("=="),
  NE("!="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">=");

  public final String symbol;

  CompareOp(String symbol) { this.symbol = symbol; }
}
