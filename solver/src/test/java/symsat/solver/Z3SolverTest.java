package symsat.solver;

import com.microsoft.z3.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import symsat.common.BitVector;
import symsat.symstate.*;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@Tag("z3")
class Z3SolverTest {
  private static final SymBitVector X = SymBitVector.mkVar("x", 8);
  private static final SymBitVector Y = SymBitVector.mkVar("y", 8);

  private Z3Solver solver;

  @BeforeEach
  void setUp() {
    solver = new Z3Solver();
  }

  @AfterEach
  void tearDown() {
    solver.close();
  }

  private static SymBitVector bv8(int value) {
    return SymBitVector.mkConstant(8, value);
  }

  @Test
  void testSatisfiable() {
    assertTrue(solver.isSat(List.of(SymBool.mkEq(SymBitVector.mkPlus(X, bv8(1)), bv8(5)))));
    assertFalse(solver.hasError());
    assertEquals(BitVector.of(8, 4), solver.getModelBv("x", 8));
  }

  @Test
  void testUnsatisfiable() {
    assertFalse(solver.isSat(List.of(SymBool.mkLt(X, bv8(0)))));
    assertFalse(solver.hasError());
    assertNull(solver.getErrorKind());
    assertThrows(IllegalStateException.class, () -> solver.getModelBv("x", 8));
  }

  @Test
  void testModelIsDroppedByNextQuery() {
    assertTrue(solver.isSat(List.of(SymBool.mkEq(X, bv8(1)))));
    assertFalse(solver.isSat(List.of(SymBool.mkFalse())));
    assertThrows(IllegalStateException.class, () -> solver.getModelBool("b"));
  }

  @Test
  void testEmptyQueryIsSatisfiable() {
    assertTrue(solver.isSat(List.of()));
    assertTrue(solver.isSat(List.of(SymBool.mkAnd(List.of()))));
  }

  @Test
  void testConjunctionsAreSplit() {
    final SymBool c = SymBool.mkAnd(SymBool.mkEq(X, bv8(3)), SymBool.mkEq(Y, SymBitVector.mkMult(X, bv8(2))));
    assertTrue(solver.isSat(List.of(c)));
    assertEquals(6, solver.getModelBv("y", 8).toLong());
  }

  @Test
  void testSignedDivisorIsNeverZero() {
    // with a zero divisor bvsdiv of a non-negative dividend is -1
    final SymBool c = SymBool.mkEq(SymBitVector.mkSignDiv(X, Y), bv8(0xff));
    assertTrue(solver.isSat(List.of(c)));
    assertNotEquals(0, solver.getModelBv("y", 8).toLong());

    assertFalse(solver.isSat(List.of(c, SymBool.mkEq(Y, bv8(0)))));
    assertFalse(solver.hasError());
  }

  @Test
  void testUnsignedDivisionIsUnguarded() {
    final SymBool c = SymBool.mkEq(SymBitVector.mkDiv(X, Y), bv8(0xff));
    assertTrue(solver.isSat(List.of(c, SymBool.mkEq(Y, bv8(0)))));
  }

  @Test
  void testSignExtendAndRotate() {
    final SymBitVector z = SymBitVector.mkVar("z", 16);
    assertTrue(
        solver.isSat(
            List.of(
                SymBool.mkEq(X, bv8(0x80)),
                SymBool.mkEq(z, SymBitVector.mkSignExtend(X, 16)),
                SymBool.mkEq(Y, SymBitVector.mkRotateLeft(bv8(0x81), bv8(1))))));
    assertEquals(0xff80, solver.getModelBv("z", 16).toLong());
    assertEquals(0x03, solver.getModelBv("y", 8).toLong());
  }

  @Test
  void testSignedComparison() {
    assertTrue(solver.isSat(List.of(SymBool.mkSignLt(X, bv8(0)), SymBool.mkGt(X, bv8(0xfd)))));
    final long x = solver.getModelBv("x", 8).toLong();
    assertTrue(x == 0xfe || x == 0xff, Long.toString(x));
  }

  @Test
  void testWideBitVector() {
    final SymBitVector wide = SymBitVector.mkVar("w", 128);
    final BigInteger value = BigInteger.ONE.shiftLeft(100).add(BigInteger.valueOf(0x1234));
    assertTrue(solver.isSat(List.of(SymBool.mkEq(wide, SymBitVector.mkConstant(128, value)))));

    final BitVector model = solver.getModelBv("w", 128);
    assertEquals(value, model.toBigInteger());
    assertEquals(0x34, model.getFixedByte(0));
    assertEquals(0x12, model.getFixedByte(1));
    assertEquals(0x10, model.getFixedByte(12));
  }

  @Test
  void testNarrowWindow() {
    final SymBitVector v = SymBitVector.mkVar("v", 72);
    final BigInteger value = BigInteger.valueOf(0xab).shiftLeft(64).add(BigInteger.valueOf(0x0102));
    assertTrue(solver.isSat(List.of(SymBool.mkEq(v, SymBitVector.mkConstant(72, value)))));
    assertEquals(BitVector.of(72, value), solver.getModelBv("v", 72));
  }

  @Test
  void testBadWidthIsRejected() {
    assertTrue(solver.isSat(List.of(SymBool.mkEq(X, bv8(1)))));
    assertThrows(IllegalArgumentException.class, () -> solver.getModelBv("x", 0));
    assertThrows(IllegalArgumentException.class, () -> solver.getModelBv("x", 12));
  }

  @Test
  void testBoolModel() {
    final SymBool b = SymBool.mkVar("b");
    assertTrue(solver.isSat(List.of(SymBool.mkIff(b, SymBool.mkNot(SymBool.mkVar("c"))), SymBool.mkNot(SymBool.mkVar("c")))));
    assertTrue(solver.getModelBool("b"));
    assertFalse(solver.getModelBool("c"));
  }

  @Test
  void testIndeterminateBool() {
    assertTrue(solver.isSat(List.of(SymBool.mkVar("b"))));
    final SolverException ex =
        assertThrows(
            SolverException.class,
            () -> solver.decodeBool("q", solver.context().mkBoolConst("q")));
    assertEquals(ErrorKind.MODEL_QUERY_ERROR, ex.kind());
    assertEquals(ErrorKind.MODEL_QUERY_ERROR, solver.getErrorKind());
    assertEquals("Z3 returned invalid value 0 for boolean q.", solver.getError());
  }

  @Test
  void testArrayModel() {
    final SymArray mem = SymArray.mkVar("mem", 64, 8);
    final SymBitVector addr = SymBitVector.mkConstant(64, 0x1000);
    final SymBitVector next = SymBitVector.mkConstant(64, 0x1001);
    assertTrue(
        solver.isSat(
            List.of(
                SymBool.mkEq(SymBitVector.mkLookup(mem, addr), bv8(0x2a)),
                SymBool.mkEq(SymBitVector.mkLookup(mem, next), bv8(0x2b)))));

    final DecodedArray array = solver.getModelArray("mem", 64, 8);
    assertEquals(0x2a, array.valueAt(0x1000));
    assertEquals(0x2b, array.valueAt(0x1001));

    // an address no constraint mentions reads as the default, as in the model
    final Context z3 = solver.context();
    final ArrayExpr<BitVecSort, BitVecSort> memExpr =
        z3.mkArrayConst("mem", z3.mkBitVecSort(64), z3.mkBitVecSort(8));
    final Expr<?> unmapped = solver.model().eval(z3.mkSelect(memExpr, z3.mkBV(0x2000, 64)), true);
    assertFalse(array.contents().containsKey(0x2000L));
    assertEquals(((BitVecNum) unmapped).getInt(), array.defaultValue());
    assertEquals(array.defaultValue(), array.valueAt(0x2000));
  }

  @Test
  void testArrayStoreModel() {
    final SymArray mem = SymArray.mkVar("mem", 64, 8);
    final SymArray out = SymArray.mkVar("out", 64, 8);
    final SymBitVector addr = SymBitVector.mkConstant(64, 8);
    assertTrue(
        solver.isSat(
            List.of(
                SymBool.mkArrayEq(out, SymArray.mkStore(mem, addr, bv8(0x77))),
                SymBool.mkEq(SymBitVector.mkLookup(mem, addr), bv8(0x11)))));

    assertEquals(0x77, solver.getModelArray("out", 64, 8).valueAt(8));
    assertEquals(0x11, solver.getModelArray("mem", 64, 8).valueAt(8));
  }

  @Test
  void testTypecheckFailure() {
    assertFalse(solver.isSat(List.of(SymBool.mkEq(X, SymBitVector.mkVar("z", 16)))));
    assertTrue(solver.hasError());
    assertEquals(ErrorKind.TYPECHECK_FAILURE, solver.getErrorKind());
    assertTrue(solver.getError().startsWith("Typechecking failed for constraint: (= x z)\nerror: "));

    // the slot is cleared by the next query
    assertTrue(solver.isSat(List.of(SymBool.mkEq(X, bv8(1)))));
    assertFalse(solver.hasError());
  }

  @Test
  void testDeepConstraintWithTypeError() {
    final SymBitVector z = SymBitVector.mkVar("z", 16);
    final List<SymBool> constraints = new ArrayList<>();
    for (int copy = 0; copy < 2; ++copy) {
      SymBitVector sum = X;
      for (int i = 0; i < 100_000; ++i) sum = SymBitVector.mkPlus(sum, bv8(i));
      constraints.add(SymBool.mkEq(sum, z));
    }
    assertEquals(constraints.get(0), constraints.get(1));

    assertFalse(solver.isSat(constraints));
    assertEquals(ErrorKind.TYPECHECK_FAILURE, solver.getErrorKind());
    assertTrue(solver.getError().startsWith("Typechecking failed for constraint: (= (bvadd (bvadd"));
    assertTrue(solver.getError().contains("width mismatch (8 vs 16)"));
    assertTrue(solver.getError().length() < 3 * SymSupport.DIAGNOSTIC_CHARS, solver.getError());
  }

  @Test
  void testSharedConstraintWithTypeError() {
    SymBitVector doubled = X;
    for (int i = 0; i < 40; ++i) doubled = SymBitVector.mkPlus(doubled, doubled);

    assertFalse(solver.isSat(List.of(SymBool.mkEq(doubled, SymBitVector.mkVar("z", 16)))));
    assertEquals(ErrorKind.TYPECHECK_FAILURE, solver.getErrorKind());
    assertTrue(solver.getError().contains("=(bvadd x x) #"), solver.getError());
  }

  @Test
  void testLoweringFailure() {
    final SymFunction f = SymFunction.mk("f", 8, 8, 8, 8, 8);
    assertFalse(solver.isSat(List.of(SymBool.mkEq(SymBitVector.mkApply(f, X, X, X, X), X))));
    assertEquals(ErrorKind.LOWERING_FAILURE, solver.getErrorKind());
    assertEquals("Function f has too many arguments: 4", solver.getError());
  }

  @Test
  void testUninterpretedFunction() {
    final SymFunction f = SymFunction.mk("f", 8, 8);
    final SymBool c0 = SymBool.mkEq(SymBitVector.mkApply(f, X), bv8(0));
    final SymBool c1 = SymBool.mkEq(SymBitVector.mkApply(f, Y), bv8(1));
    assertTrue(solver.isSat(List.of(c0, c1)));
    assertNotEquals(solver.getModelBv("x", 8), solver.getModelBv("y", 8));

    assertFalse(solver.isSat(List.of(c0, c1, SymBool.mkEq(X, Y))));
    assertFalse(solver.hasError());
  }

  @Test
  void testFunctionAxiomsAreAsserted() {
    final SymFunction raw = SymFunction.mk("succ", 8, 8);
    final SymBitVectorVar q = SymBitVector.mkVar("q", 8);
    final SymBool axiom =
        SymBool.mkForAll(List.of(q), SymBool.mkEq(SymBitVector.mkApply(raw, q), SymBitVector.mkPlus(q, bv8(1))));
    final SymFunction succ = raw.withAxiom(axiom);

    final SymBool bare = SymBool.mkEq(SymBitVector.mkApply(raw, X), bv8(0));
    assertTrue(solver.isSat(List.of(bare, SymBool.mkEq(X, bv8(5)))));

    final SymBool c = SymBool.mkEq(SymBitVector.mkApply(succ, X), bv8(0));
    assertFalse(solver.isSat(List.of(c, SymBool.mkEq(X, bv8(5)))));
    assertFalse(solver.hasError());
  }

  @Test
  void testInterruptIsSticky() {
    final CancellationMonitor monitor = new CancellationMonitor();
    try (Z3Solver interruptible = new Z3Solver(SolverOptions.defaults(), monitor)) {
      interruptible.interrupt();
      assertFalse(interruptible.isSat(List.of(SymBool.mkTrue())));
      assertEquals(ErrorKind.EXTERNAL_INTERRUPT, interruptible.getErrorKind());
      assertEquals("External interrupt.", interruptible.getError());

      assertFalse(interruptible.isSat(List.of(SymBool.mkTrue())));
      assertEquals(ErrorKind.EXTERNAL_INTERRUPT, interruptible.getErrorKind());

      monitor.clear();
      assertTrue(interruptible.isSat(List.of(SymBool.mkTrue())));
      assertFalse(interruptible.hasError());
    }
  }

  @Test
  void testClearInterrupt() {
    solver.interrupt();
    assertFalse(solver.isSat(List.of(SymBool.mkTrue())));
    assertFalse(solver.isSat(List.of(SymBool.mkTrue())));
    assertEquals("External interrupt.", solver.getError());

    solver.clearInterrupt();
    assertTrue(solver.isSat(List.of(SymBool.mkTrue())));
    assertFalse(solver.hasError());
  }

  @Test
  void testMonitorIsShared() {
    final CancellationMonitor monitor = new CancellationMonitor();
    try (Z3Solver s0 = new Z3Solver(SolverOptions.defaults(), monitor);
        Z3Solver s1 = new Z3Solver(SolverOptions.defaults(), monitor)) {
      s0.interrupt();
      assertFalse(s1.isSat(List.of()));
      assertEquals(ErrorKind.EXTERNAL_INTERRUPT, s1.getErrorKind());
    }
  }

  @Test
  void testDumpQueries(@TempDir Path dir) throws IOException {
    final SolverOptions options = SolverOptions.defaults().withDumpQueries(dir).withRecordLastQuery(true);
    try (Z3Solver dumping = new Z3Solver(options)) {
      assertTrue(dumping.isSat(List.of(SymBool.mkEq(X, bv8(9)))));

      final List<Path> files;
      try (Stream<Path> listing = Files.list(dir)) {
        files = listing.collect(Collectors.toList());
      }
      assertEquals(1, files.size());
      assertTrue(files.get(0).getFileName().toString().matches("z3-smtlib-\\d+\\.smt2"));

      final String text = Files.readString(files.get(0));
      assertTrue(text.contains("(declare-fun x () (_ BitVec 8))"), text);
      assertEquals(dumping.lastQueryText() + "\n", text);
      assertEquals(64, dumping.lastQueryHash().length());
    }
  }

  @Test
  void testStatistics() {
    final long queries = SolverStatistics.numQueries();
    final long constraints = SolverStatistics.numConstraints();
    assertTrue(solver.isSat(List.of(SymBool.mkAnd(SymBool.mkEq(X, bv8(1)), SymBool.mkEq(Y, bv8(2))))));
    assertTrue(SolverStatistics.numQueries() >= queries + 1);
    assertTrue(SolverStatistics.numConstraints() >= constraints + 2);
    assertNotNull(SolverStatistics.summary());
  }
}
