package symsat.symstate;

import java.math.BigInteger;
import java.util.List;

import static symsat.symstate.SymKind.*;

/** A bit-vector-sorted term of a fixed width. */
public interface SymBitVector extends SymTerm {

  int width();

  static SymBitVectorConstant mkConstant(int width, long value) {
    final BigInteger v = BigInteger.valueOf(value);
    return mkConstant(width, value >= 0 ? v : v.add(BigInteger.ONE.shiftLeft(64)));
  }

  /** The literal is reduced modulo 2^width. */
  static SymBitVectorConstant mkConstant(int width, BigInteger value) {
    return new SymBitVectorConstant(width, value);
  }

  static SymBitVectorVar mkVar(String name, int width) {
    return new SymBitVectorVar(name, width);
  }

  static SymBitVector mkNot(SymBitVector operand) {
    return new SymBitVectorUnary(BV_NOT, operand);
  }

  static SymBitVector mkUMinus(SymBitVector operand) {
    return new SymBitVectorUnary(BV_UMINUS, operand);
  }

  static SymBitVector mkAnd(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_AND, a, b);
  }

  static SymBitVector mkOr(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_OR, a, b);
  }

  static SymBitVector mkXor(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_XOR, a, b);
  }

  static SymBitVector mkPlus(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_PLUS, a, b);
  }

  static SymBitVector mkMinus(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_MINUS, a, b);
  }

  static SymBitVector mkMult(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_MULT, a, b);
  }

  static SymBitVector mkDiv(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_DIV, a, b);
  }

  static SymBitVector mkMod(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_MOD, a, b);
  }

  static SymBitVector mkSignDiv(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_SIGN_DIV, a, b);
  }

  static SymBitVector mkSignMod(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_SIGN_MOD, a, b);
  }

  static SymBitVector mkShiftLeft(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_SHIFT_LEFT, a, b);
  }

  static SymBitVector mkShiftRight(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_SHIFT_RIGHT, a, b);
  }

  static SymBitVector mkSignShiftRight(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_SIGN_SHIFT_RIGHT, a, b);
  }

  static SymBitVector mkRotateLeft(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_ROTATE_LEFT, a, b);
  }

  static SymBitVector mkRotateRight(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_ROTATE_RIGHT, a, b);
  }

  /** {@code a} supplies the high bits, {@code b} the low bits. */
  static SymBitVector mkConcat(SymBitVector a, SymBitVector b) {
    return new SymBitVectorBinary(BV_CONCAT, a, b);
  }

  static SymBitVector mkExtract(SymBitVector operand, int highBit, int lowBit) {
    return new SymBitVectorExtract(operand, highBit, lowBit);
  }

  /** Sign-extends the operand to {@code size} bits. */
  static SymBitVector mkSignExtend(SymBitVector operand, int size) {
    return new SymBitVectorSignExtend(operand, size);
  }

  static SymBitVector mkIte(SymBool cond, SymBitVector a, SymBitVector b) {
    return new SymBitVectorIte(cond, a, b);
  }

  static SymBitVector mkApply(SymFunction function, List<? extends SymBitVector> args) {
    return new SymBitVectorFunction(function, args);
  }

  static SymBitVector mkApply(SymFunction function, SymBitVector... args) {
    return mkApply(function, List.of(args));
  }

  static SymBitVector mkLookup(SymArray array, SymBitVector key) {
    return new SymBitVectorArrayLookup(array, key);
  }
}
