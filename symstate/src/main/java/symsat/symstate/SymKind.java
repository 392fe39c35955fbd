package symsat.symstate;

public enum SymKind {
  // boolean
  TRUE("true", Sort.BOOL),
  FALSE("false", Sort.BOOL),
  BOOL_VAR("var", Sort.BOOL),
  NOT("not", Sort.BOOL),
  AND("and", Sort.BOOL),
  OR("or", Sort.BOOL),
  XOR("xor", Sort.BOOL),
  IFF("=", Sort.BOOL),
  IMPLIES("=>", Sort.BOOL),
  EQ("=", Sort.BOOL),
  LT("bvult", Sort.BOOL),
  LE("bvule", Sort.BOOL),
  GT("bvugt", Sort.BOOL),
  GE("bvuge", Sort.BOOL),
  SIGN_LT("bvslt", Sort.BOOL),
  SIGN_LE("bvsle", Sort.BOOL),
  SIGN_GT("bvsgt", Sort.BOOL),
  SIGN_GE("bvsge", Sort.BOOL),
  ARRAY_EQ("=", Sort.BOOL),
  FOR_ALL("forall", Sort.BOOL),

  // bit-vector
  BV_CONSTANT("const", Sort.BIT_VECTOR),
  BV_VAR("var", Sort.BIT_VECTOR),
  BV_NOT("bvnot", Sort.BIT_VECTOR),
  BV_UMINUS("bvneg", Sort.BIT_VECTOR),
  BV_AND("bvand", Sort.BIT_VECTOR),
  BV_OR("bvor", Sort.BIT_VECTOR),
  BV_XOR("bvxor", Sort.BIT_VECTOR),
  BV_PLUS("bvadd", Sort.BIT_VECTOR),
  BV_MINUS("bvsub", Sort.BIT_VECTOR),
  BV_MULT("bvmul", Sort.BIT_VECTOR),
  BV_DIV("bvudiv", Sort.BIT_VECTOR),
  BV_MOD("bvurem", Sort.BIT_VECTOR),
  BV_SIGN_DIV("bvsdiv", Sort.BIT_VECTOR),
  BV_SIGN_MOD("bvsrem", Sort.BIT_VECTOR),
  BV_SHIFT_LEFT("bvshl", Sort.BIT_VECTOR),
  BV_SHIFT_RIGHT("bvlshr", Sort.BIT_VECTOR),
  BV_SIGN_SHIFT_RIGHT("bvashr", Sort.BIT_VECTOR),
  BV_ROTATE_LEFT("ext_rotate_left", Sort.BIT_VECTOR),
  BV_ROTATE_RIGHT("ext_rotate_right", Sort.BIT_VECTOR),
  BV_CONCAT("concat", Sort.BIT_VECTOR),
  BV_EXTRACT("extract", Sort.BIT_VECTOR),
  BV_SIGN_EXTEND("sign_extend", Sort.BIT_VECTOR),
  BV_ITE("ite", Sort.BIT_VECTOR),
  BV_FUNCTION("apply", Sort.BIT_VECTOR),
  BV_ARRAY_LOOKUP("select", Sort.BIT_VECTOR),

  // array
  ARRAY_VAR("var", Sort.ARRAY),
  ARRAY_STORE("store", Sort.ARRAY);

  public enum Sort {
    BOOL,
    BIT_VECTOR,
    ARRAY
  }

  private final String text;
  private final Sort sort;

  SymKind(String text, Sort sort) {
    this.text = text;
    this.sort = sort;
  }

  public String text() {
    return text;
  }

  public Sort sort() {
    return sort;
  }

  public boolean isComparison() {
    return this == EQ || this == LT || this == LE || this == GT || this == GE
        || this == SIGN_LT || this == SIGN_LE || this == SIGN_GT || this == SIGN_GE;
  }

  public boolean isBoolConnective() {
    return this == AND || this == OR || this == XOR || this == IFF || this == IMPLIES;
  }

  public boolean isBinaryBitVectorOp() {
    return switch (this) {
      case BV_AND, BV_OR, BV_XOR, BV_PLUS, BV_MINUS, BV_MULT, BV_DIV, BV_MOD,
          BV_SIGN_DIV, BV_SIGN_MOD, BV_SHIFT_LEFT, BV_SHIFT_RIGHT, BV_SIGN_SHIFT_RIGHT,
          BV_ROTATE_LEFT, BV_ROTATE_RIGHT, BV_CONCAT -> true;
      default -> false;
    };
  }

  public boolean isLeaf() {
    return this == TRUE || this == FALSE || this == BOOL_VAR
        || this == BV_CONSTANT || this == BV_VAR || this == ARRAY_VAR;
  }
}
