package dev.zxul767.pcc.ir;

import java.math.BigInteger;
import java.util.Objects;

// An integer field and the value every new instance starts with.
public class FieldDef {
  public FieldDef(String name, BigInteger initialValue) {
    this.name = name;
    this.initialValue = initialValue;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof FieldDef))
      return false;
    FieldDef that = (FieldDef)other;
    return name.equals(that.name) && initialValue.equals(that.initialValue);
  }

  @Override
  public int hashCode() { return Objects.hash(name, initialValue); }

  @Override
  public String toString() { return name + "=" + initialValue; }

  public final String name;
  public final BigInteger initialValue;
}
