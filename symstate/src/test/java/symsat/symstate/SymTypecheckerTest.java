package symsat.symstate;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("fast")
class SymTypecheckerTest {
  private static final SymBitVector X8 = SymBitVector.mkVar("x", 8);
  private static final SymBitVector Y8 = SymBitVector.mkVar("y", 8);
  private static final SymBitVector Z16 = SymBitVector.mkVar("z", 16);

  private static String errorOf(SymBool constraint) {
    final SymTypechecker checker = new SymTypechecker();
    assertFalse(checker.check(constraint), constraint.toString());
    assertTrue(checker.hasError());
    return checker.error();
  }

  private static void assertWellTyped(SymBool constraint) {
    final SymTypechecker checker = new SymTypechecker();
    assertTrue(checker.check(constraint), () -> checker.error());
    assertFalse(checker.hasError());
  }

  @Test
  void testWellTyped() {
    final SymArray mem = SymArray.mkVar("mem", 64, 8);
    final SymBitVector addr = SymBitVector.mkVar("addr", 64);
    final SymArray stored = SymArray.mkStore(mem, addr, X8);

    assertWellTyped(SymBool.mkEq(SymBitVector.mkPlus(X8, Y8), SymBitVector.mkConstant(8, 3)));
    assertWellTyped(SymBool.mkEq(SymBitVector.mkConcat(X8, Y8), Z16));
    assertWellTyped(SymBool.mkEq(SymBitVector.mkExtract(Z16, 15, 8), X8));
    assertWellTyped(SymBool.mkEq(SymBitVector.mkSignExtend(X8, 16), Z16));
    assertWellTyped(SymBool.mkEq(SymBitVector.mkLookup(stored, addr), Y8));
    assertWellTyped(SymBool.mkArrayEq(stored, mem));
    assertWellTyped(
        SymBool.mkEq(SymBitVector.mkIte(SymBool.mkVar("b"), X8, Y8), SymBitVector.mkApply(SymFunction.mk("f", 8, 16), Z16)));
  }

  @Test
  void testWidthMismatch() {
    assertTrue(errorOf(SymBool.mkEq(X8, Z16)).startsWith("width mismatch (8 vs 16)"));
    assertTrue(errorOf(SymBool.mkEq(SymBitVector.mkPlus(X8, Z16), Z16)).startsWith("width mismatch"));
    assertTrue(errorOf(SymBool.mkEq(SymBitVector.mkIte(SymBool.mkTrue(), X8, Z16), X8)).startsWith("width mismatch"));
  }

  @Test
  void testExtractOutOfRange() {
    assertTrue(errorOf(SymBool.mkEq(SymBitVector.mkExtract(X8, 8, 1), X8)).contains("out of range"));
    final SymBitVector reversed = SymBitVector.mkExtract(X8, 1, 2);
    assertTrue(errorOf(SymBool.mkEq(reversed, reversed)).contains("out of range"));
  }

  @Test
  void testNarrowingSignExtend() {
    assertTrue(errorOf(SymBool.mkEq(SymBitVector.mkSignExtend(Z16, 8), X8)).contains("narrower"));
  }

  @Test
  void testFunctionSignature() {
    final SymFunction f = SymFunction.mk("f", 8, 8, 8);
    assertTrue(errorOf(SymBool.mkEq(SymBitVector.mkApply(f, X8), X8)).contains("expects 2 arguments"));
    assertTrue(errorOf(SymBool.mkEq(SymBitVector.mkApply(f, X8, Z16), X8)).contains("argument 1"));
  }

  @Test
  void testArraySorts() {
    final SymArray mem = SymArray.mkVar("mem", 64, 8);
    assertTrue(errorOf(SymBool.mkEq(SymBitVector.mkLookup(mem, X8), X8)).startsWith("key of width 8"));
    assertTrue(errorOf(SymBool.mkArrayEq(mem, SymArray.mkStore(mem, X8, Y8))).startsWith("store of"));
    assertTrue(errorOf(SymBool.mkArrayEq(mem, SymArray.mkVar("other", 32, 8))).startsWith("array sorts differ"));
  }

  @Test
  void testVariableSortConflict() {
    final SymBool c =
        SymBool.mkAnd(SymBool.mkEq(X8, Y8), SymBool.mkEq(SymBitVector.mkVar("x", 16), Z16));
    assertTrue(errorOf(c).startsWith("variable x is used as both"));
  }

  @Test
  void testVariableSortsSpanConstraints() {
    final SymTypechecker checker = new SymTypechecker();
    assertTrue(checker.check(SymBool.mkVar("v")));
    assertFalse(checker.check(SymBool.mkEq(SymBitVector.mkVar("v", 8), X8)));
    assertEquals("variable v is used as both Bool and (_ BitVec 8)", checker.error());
  }

  @Test
  void testNonPositiveWidth() {
    final SymBitVector zero = SymBitVector.mkVar("w", 0);
    assertTrue(errorOf(SymBool.mkEq(zero, zero)).startsWith("non-positive width 0"));
  }

  @Test
  void testBoundVarsDistinct() {
    final SymBitVectorVar v = SymBitVector.mkVar("v", 8);
    assertTrue(errorOf(SymBool.mkForAll(List.of(v, v), SymBool.mkEq(v, v))).contains("bound twice"));
  }

  @Test
  void testKeepsFirstError() {
    final SymTypechecker checker = new SymTypechecker();
    assertFalse(checker.check(SymBool.mkEq(X8, Z16)));
    final String first = checker.error();
    assertFalse(checker.check(SymBool.mkEq(SymBitVector.mkExtract(X8, 9, 0), Z16)));
    assertEquals(first, checker.error());
  }
}
