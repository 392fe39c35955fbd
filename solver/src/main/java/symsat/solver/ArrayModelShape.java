package symsat.solver;

import com.microsoft.z3.Expr;

/** How Z3 chose to represent the value of an array in a model. */
enum ArrayModelShape {
  /** {@code (store a k v)}: one point update over another array value. */
  STORE_CHAIN,
  /** {@code ((as const (Array ..)) v)}: v at every address. */
  CONSTANT_ARRAY,
  /** {@code (_ as-array f)}: the array is the graph of a model function. */
  FUNCTION_INTERPRETATION,
  /** {@code ((_ map f) a ..)}: not decoded. */
  ARRAY_MAP,
  UNPARSEABLE;

  static ArrayModelShape of(Expr<?> e) {
    // lambdas and other quantifiers are not applications
    if (!e.isApp()) return UNPARSEABLE;
    if (e.isStore()) return STORE_CHAIN;
    if (e.isConstantArray()) return CONSTANT_ARRAY;
    if (e.isAsArray()) return FUNCTION_INTERPRETATION;
    if (e.isArrayMap()) return ARRAY_MAP;
    return UNPARSEABLE;
  }
}
