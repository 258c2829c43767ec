package dev.zxul767.pcc.codegen;

// Counters and flags of a single compilation. Each `CodeGenerator` owns a
// fresh instance, so names are unique within one output file and nothing is
// shared between compilations.
class GeneratorState {
  private int temps = 0;
  private int labels = 0;
  boolean usesFloats = false;

  // pcc_tmp_1, pcc_tmp_2, ...
  String newTemp() { return CNames.temp(++temps); }

  // numbers label groups (`pcc_while_3` / `pcc_while_end_3`)
  int newLabelId() { return ++labels; }

  int tempCount() { return temps; }

  int labelCount() { return labels; }
}
