package dev.zxul767.pcc;

import dev.zxul767.pcc.typing.Type;
import java.math.BigInteger;

// How integers are represented in the generated program.
public enum Backend {
  // native `long long` by default, arbitrary precision only for values that
  // cannot fit (out-of-range literals and anything computed from them)
  FAST {
    @Override
    public Type integerType() {
      return Type.INT;
    }
  },
  // arbitrary precision for every integer
  PRECISE {
    @Override
    public Type integerType() {
      return Type.BIGINT;
    }
  };

  private static final BigInteger MIN_NATIVE = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger MAX_NATIVE = BigInteger.valueOf(Long.MAX_VALUE);

  // type of function parameters and results, fields and loop counters
  public abstract Type integerType();

  public Type literalType(BigInteger value) {
    if (fitsNative(value))
      return integerType();
    return Type.BIGINT;
  }

  public static boolean fitsNative(BigInteger value) {
    return value.compareTo(MIN_NATIVE) >= 0 && value.compareTo(MAX_NATIVE) <= 0;
  }

  public static Backend parse(String name) {
    switch (name.trim().toLowerCase()) {
    case "fast":
      return FAST;
    case "precise":
    case "safe":
      return PRECISE;
    default:
      throw new IllegalArgumentException(
          String.format("Unknown backend: '%s' (expected 'fast' or 'precise')", name)
      );
    }
  }
}
