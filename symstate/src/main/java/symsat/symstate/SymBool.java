package symsat.symstate;

import java.util.List;

import static symsat.symstate.SymKind.*;

/** A boolean-sorted term. Constraints handed to a solver are SymBools. */
public interface SymBool extends SymTerm {

  static SymBool mkTrue() {
    return SymBoolConstant.TRUE_CONST;
  }

  static SymBool mkFalse() {
    return SymBoolConstant.FALSE_CONST;
  }

  static SymBool mkConstant(boolean value) {
    return value ? mkTrue() : mkFalse();
  }

  static SymBoolVar mkVar(String name) {
    return new SymBoolVar(name);
  }

  static SymBool mkNot(SymBool operand) {
    return new SymBoolNot(operand);
  }

  static SymBool mkAnd(SymBool a, SymBool b) {
    return new SymBoolBinary(AND, a, b);
  }

  static SymBool mkOr(SymBool a, SymBool b) {
    return new SymBoolBinary(OR, a, b);
  }

  static SymBool mkXor(SymBool a, SymBool b) {
    return new SymBoolBinary(XOR, a, b);
  }

  static SymBool mkIff(SymBool a, SymBool b) {
    return new SymBoolBinary(IFF, a, b);
  }

  static SymBool mkImplies(SymBool a, SymBool b) {
    return new SymBoolBinary(IMPLIES, a, b);
  }

  /** Right-nested conjunction of all operands; TRUE when empty. */
  static SymBool mkAnd(List<? extends SymBool> operands) {
    if (operands.isEmpty()) return mkTrue();
    SymBool result = operands.get(operands.size() - 1);
    for (int i = operands.size() - 2; i >= 0; --i) result = mkAnd(operands.get(i), result);
    return result;
  }

  static SymBool mkEq(SymBitVector a, SymBitVector b) {
    return new SymBoolCompare(EQ, a, b);
  }

  static SymBool mkNe(SymBitVector a, SymBitVector b) {
    return mkNot(mkEq(a, b));
  }

  static SymBool mkLt(SymBitVector a, SymBitVector b) {
    return new SymBoolCompare(LT, a, b);
  }

  static SymBool mkLe(SymBitVector a, SymBitVector b) {
    return new SymBoolCompare(LE, a, b);
  }

  static SymBool mkGt(SymBitVector a, SymBitVector b) {
    return new SymBoolCompare(GT, a, b);
  }

  static SymBool mkGe(SymBitVector a, SymBitVector b) {
    return new SymBoolCompare(GE, a, b);
  }

  static SymBool mkSignLt(SymBitVector a, SymBitVector b) {
    return new SymBoolCompare(SIGN_LT, a, b);
  }

  static SymBool mkSignLe(SymBitVector a, SymBitVector b) {
    return new SymBoolCompare(SIGN_LE, a, b);
  }

  static SymBool mkSignGt(SymBitVector a, SymBitVector b) {
    return new SymBoolCompare(SIGN_GT, a, b);
  }

  static SymBool mkSignGe(SymBitVector a, SymBitVector b) {
    return new SymBoolCompare(SIGN_GE, a, b);
  }

  static SymBool mkArrayEq(SymArray a, SymArray b) {
    return new SymBoolArrayEq(a, b);
  }

  static SymBool mkForAll(List<SymBitVectorVar> boundVars, SymBool body) {
    return new SymBoolForAll(boundVars, body);
  }
}
